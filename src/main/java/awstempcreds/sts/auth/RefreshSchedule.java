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

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Decides when the cached session must be refreshed. A refresh is due once the clock has passed
 * the scheduled instant. After a successful refresh the next one is scheduled a safety margin
 * before the requested session duration runs out, so callers never hold credentials inside that
 * margin.
 */
@NotThreadSafe
class RefreshSchedule {

    /**
     * Time before expiry at which session credentials are refreshed.
     */
    static final Duration SAFETY_MARGIN = Duration.ofMinutes(5);

    private final Duration sessionDuration;

    /**
     * Null until the first successful refresh, which makes every check due.
     */
    private Instant nextRefresh;

    RefreshSchedule(Duration sessionDuration) {
        this.sessionDuration = Objects.requireNonNull(sessionDuration, "sessionDuration");
        if (sessionDuration.compareTo(SAFETY_MARGIN) <= 0) {
            throw new IllegalArgumentException("Session duration " + sessionDuration
                    + " must be longer than the refresh safety margin " + SAFETY_MARGIN);
        }
    }

    /**
     * @return True if nothing was scheduled yet or the given instant is past the scheduled refresh.
     */
    boolean isDue(Instant now) {
        return nextRefresh == null || now.isAfter(nextRefresh);
    }

    /**
     * Schedules the next refresh for a session obtained at {@code refreshedAt}.
     */
    void advance(Instant refreshedAt) {
        nextRefresh = refreshedAt.plus(sessionDuration).minus(SAFETY_MARGIN);
    }

    /**
     * @return The scheduled refresh, or null before the first successful refresh.
     */
    Instant getNextRefresh() {
        return nextRefresh;
    }
}
