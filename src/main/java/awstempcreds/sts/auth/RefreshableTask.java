/*
 * Copyright 2011-2018 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *  http://aws.amazon.com/apache2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package awstempcreds.sts.auth;

import software.amazon.awssdk.annotations.NotThreadSafe;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkServiceException;
import org.apache.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Handles refreshing a value on a fixed schedule. The refresh runs synchronously on the calling
 * thread. A failed refresh keeps the previous value and does not move the schedule, so the next
 * call to {@link #getValue()} tries again.
 * <p>
 * Instances hold no locks and start no threads. Callers sharing one across threads must
 * serialize access themselves.
 */
@NotThreadSafe
class RefreshableTask<T> {

    static final Logger logger = Logger.getLogger(RefreshableTask.class);

    /**
     * Callback to get a new refreshed value.
     */
    private final Callable<T> refreshCallable;

    /**
     * Decides when {@link #getValue()} has to refresh.
     */
    private final RefreshSchedule refreshSchedule;

    private final Clock clock;

    /**
     * Last successfully refreshed value, null until the first success.
     */
    private T refreshableValue;

    private RefreshableTask(Callable<T> refreshCallable, RefreshSchedule refreshSchedule, Clock clock) {
        this.refreshCallable = Objects.requireNonNull(refreshCallable, "refreshCallable");
        this.refreshSchedule = Objects.requireNonNull(refreshSchedule, "refreshSchedule");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static class Builder<T> {
        private Callable<T> refreshCallable;
        private RefreshSchedule refreshSchedule;
        private Clock clock = Clock.systemUTC();

        /**
         * Set the callable that will provide the value when a refresh occurs.
         *
         * @return This object for method chaining.
         */
        public Builder<T> withRefreshCallable(Callable<T> refreshCallable) {
            this.refreshCallable = refreshCallable;
            return this;
        }

        /**
         * Set the schedule that will determine when the task refreshes.
         *
         * @return This object for method chaining.
         */
        public Builder<T> withRefreshSchedule(RefreshSchedule refreshSchedule) {
            this.refreshSchedule = refreshSchedule;
            return this;
        }

        /**
         * @return This object for method chaining.
         */
        public Builder<T> withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @return The configured RefreshableTask
         */
        public RefreshableTask<T> build() {
            return new RefreshableTask<T>(refreshCallable, refreshSchedule, clock);
        }
    }

    /**
     * Return the current value, refreshing first if the schedule says so.
     *
     * @throws SdkClientException If error occurs during refresh.
     * @throws IllegalStateException If value is invalid after refreshing.
     */
    public T getValue() throws SdkClientException, IllegalStateException {
        Instant now = clock.instant();
        if (refreshSchedule.isDue(now)) {
            refreshValue();
            refreshSchedule.advance(now);
            logger.info("Refreshed value, next refresh after " + refreshSchedule.getNextRefresh() + ".");
        }
        return getRefreshedValue();
    }

    /**
     * Forces a refresh of the value. The schedule is left alone.
     *
     * @throws SdkClientException If error occurs during refresh.
     * @throws IllegalStateException If value is invalid after refreshing.
     */
    public T forceGetValue() {
        refreshValue();
        return getRefreshedValue();
    }

    /**
     * @return The instant after which {@link #getValue()} refreshes again.
     */
    Instant getNextRefresh() {
        return refreshSchedule.getNextRefresh();
    }

    /**
     * @return The cached value, or null if no refresh has succeeded yet.
     */
    T peekValue() {
        return refreshableValue;
    }

    /**
     * @return The refreshed value.
     * @throws IllegalStateException If the refreshed value is still invalid.
     */
    private T getRefreshedValue() throws IllegalStateException {
        if (refreshableValue != null) {
            return refreshableValue;
        } else {
            throw new IllegalStateException("Refreshed value should never be null.");
        }
    }

    /**
     * Invokes the callback to get a new value. The old value is only replaced on success.
     */
    private void refreshValue() {
        T newValue;
        try {
            newValue = refreshCallable.call();
        } catch (SdkServiceException sse) {
            // Preserve the original SSE
            throw sse;
        } catch (SdkClientException sce) {
            // Preserve the original SCE
            throw sce;
        } catch (Exception e) {
            throw SdkClientException.builder().message("Unable to refresh the value.").cause(e).build();
        }
        if (newValue == null) {
            throw new IllegalStateException("Refreshed value should never be null.");
        }
        refreshableValue = newValue;
    }
}
