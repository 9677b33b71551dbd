package awstempcreds.sts.auth;

import software.amazon.awssdk.annotations.NotThreadSafe;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;
import software.amazon.awssdk.services.sts.model.AssumeRoleResponse;

import java.io.Closeable;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Properties;
import java.util.concurrent.Callable;
import org.apache.log4j.Logger;
import org.apache.log4j.PropertyConfigurator;

/**
 * Vends temporary credentials for an assumed role and rolls them over before they expire.
 * <p>
 * The first call to {@link #resolveCredentials()} assumes the role. Later calls return the same
 * credentials until the requested session duration, less a five minute safety margin, has passed,
 * then assume the role again. A failed refresh is rethrown to the caller and is retried on the
 * next call rather than after another full session duration.
 * <p>
 * This class is not safe for concurrent use. Refreshes block the calling thread for the length of
 * the STS call.
 */
@NotThreadSafe
public class TempCredentialsProvider implements AwsCredentialsProvider, Closeable {

    static final Logger logger = Logger.getLogger(TempCredentialsProvider.class);

    static final Duration DEFAULT_DURATION = Duration.ofHours(1);

    /**
     * The client for starting STS sessions.
     */
    private final StsClient securityTokenService;

    /**
     * True if the STS client was built here and must be closed with this provider.
     */
    private final boolean ownsStsClient;

    private final String region;

    /**
     * The arn of the role to be assumed.
     */
    private final String roleArn;

    /**
     * Validity requested from STS for every session.
     */
    private final Duration duration;

    private final Clock clock;

    private final RoleSessionNameGenerator sessionNameGenerator;

    private final Callable<SessionCredentialsHolder> refreshCallable = new Callable<SessionCredentialsHolder>() {
        @Override
        public SessionCredentialsHolder call() throws Exception {
            return newSession();
        }
    };

    /**
     * Handles the refreshing of sessions.
     */
    private final RefreshableTask<SessionCredentialsHolder> refreshableTask;

    /**
     * Reads state from the builder and sets the appropriate parameters accordingly.
     *
     * @throws IllegalArgumentException if the requested duration is not a whole number of seconds
     *                                  or does not exceed the refresh safety margin
     */
    private TempCredentialsProvider(Builder builder) {
        if (builder.logPropertiesFile != null) {
            configureLogging(builder.logPropertiesFile);
        }
        if (builder.duration.getNano() != 0) {
            throw new IllegalArgumentException("Session duration must be whole seconds: " + builder.duration);
        }
        if (builder.duration.getSeconds() > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Session duration is too long: " + builder.duration);
        }
        this.region = builder.region;
        this.roleArn = builder.roleArn;
        this.duration = builder.duration;
        this.clock = builder.clock;
        this.sessionNameGenerator = new RoleSessionNameGenerator(builder.hostnameSupplier, clock);
        RefreshSchedule refreshSchedule = new RefreshSchedule(duration);
        this.refreshableTask = new RefreshableTask.Builder<SessionCredentialsHolder>()
                .withRefreshCallable(refreshCallable)
                .withRefreshSchedule(refreshSchedule)
                .withClock(clock)
                .build();
        this.ownsStsClient = builder.sts == null;
        this.securityTokenService = buildStsClient(builder);
        logger.info("Created temporary credentials provider for role " + roleArn + " in region " + region
                + " with session duration " + duration + ".");
    }

    /**
     * Loads a log4j properties file. A missing or unreadable file leaves the current log4j
     * configuration in place.
     */
    private static void configureLogging(String logPropertiesFile) {
        Properties logProperties = new Properties();
        try (InputStream in = new FileInputStream(logPropertiesFile)) {
            logProperties.load(in);
            PropertyConfigurator.configure(logProperties);
            logger.info("Logging initialized from " + logPropertiesFile + ".");
        } catch (IOException e) {
            logger.error("Unable to load logging properties from " + logPropertiesFile + ":", e);
        }
    }

    /**
     * Construct a new STS client from the settings in the builder. The client does not retry:
     * a failed call is retried by the next {@link #resolveCredentials()}.
     *
     * @param builder Configured builder
     * @return New instance of StsClient
     */
    private static StsClient buildStsClient(Builder builder) {
        if (builder.sts != null) {
            return builder.sts;
        }

        AwsCredentialsProvider sourceCredentials = builder.credentialsProvider != null
                ? builder.credentialsProvider
                : DefaultCredentialsProvider.create();

        return StsClient.builder()
                .region(Region.of(builder.region))
                .credentialsProvider(sourceCredentials)
                .overrideConfiguration(c -> c.retryPolicy(RetryPolicy.none()))
                .build();
    }

    /**
     * Returns the cached session credentials, assuming the role first if they are due for a
     * refresh.
     *
     * @throws software.amazon.awssdk.core.exception.SdkServiceException if STS rejects the request
     * @throws SdkClientException if STS cannot be reached
     */
    @Override
    public AwsSessionCredentials resolveCredentials() {
        return refreshableTask.getValue().getSessionCredentials();
    }

    /**
     * Assumes the role now and caches the result, without touching the refresh schedule.
     */
    public void refresh() {
        refreshableTask.forceGetValue();
    }

    /**
     * Starts a new session by sending a request to the AWS Security Token Service (STS) to assume a
     * Role using the long lived AWS credentials. This class then vends the short lived session
     * credentials for the assumed Role sent back from STS.
     */
    private SessionCredentialsHolder newSession() {
        Instant requestedAt = clock.instant();
        String roleSessionName = sessionNameGenerator.newSessionName();
        logger.trace("Refreshing session " + roleSessionName + " ...");

        AssumeRoleRequest request = AssumeRoleRequest.builder()
                .roleArn(roleArn)
                .roleSessionName(roleSessionName)
                .durationSeconds((int) duration.getSeconds())
                .build();

        AssumeRoleResponse assumeRoleResult;
        try {
            assumeRoleResult = securityTokenService.assumeRole(request);
        } catch (RuntimeException e) {
            logger.error("Failed to assume role " + roleArn + " for session " + roleSessionName
                    + ", will retry on next access.", e);
            throw e;
        }

        SessionCredentialsHolder holder = new SessionCredentialsHolder(assumeRoleResult.credentials(), roleSessionName);
        Instant latestSafeRefresh = requestedAt.plus(duration).minus(RefreshSchedule.SAFETY_MARGIN);
        Instant reportedExpiration = holder.getReportedExpiration();
        if (reportedExpiration != null && reportedExpiration.isBefore(latestSafeRefresh)) {
            logger.warn("STS issued session " + roleSessionName + " expiring at " + reportedExpiration
                    + ", earlier than the requested duration allows for (" + latestSafeRefresh
                    + "). Credentials may be served after they expire.");
        }
        logger.info("Assumed role " + roleArn + " as session " + roleSessionName + ".");
        return holder;
    }

    Instant getNextRefresh() {
        return refreshableTask.getNextRefresh();
    }

    /**
     * @return The cached credentials, or null before the first successful refresh.
     */
    AwsSessionCredentials getCachedCredentials() {
        SessionCredentialsHolder holder = refreshableTask.peekValue();
        return holder == null ? null : holder.getSessionCredentials();
    }

    /**
     * Closes the STS client if this provider created it. A client passed in through
     * {@link Builder#withStsClient(StsClient)} is left open.
     */
    @Override
    public void close() {
        if (ownsStsClient) {
            securityTokenService.close();
        }
    }

    /**
     * Provides a builder pattern to avoid combinatorial explosion of the number of parameters that
     * are passed to constructors.
     */
    public static final class Builder {

        private final String region;
        private final String roleArn;
        private Duration duration = DEFAULT_DURATION;
        private StsClient sts;
        private AwsCredentialsProvider credentialsProvider;
        private Clock clock = Clock.systemUTC();
        private HostnameSupplier hostnameSupplier = HostnameSupplier.localHost();
        private String logPropertiesFile;

        public Builder(String region, String roleArn) {
            if (region == null) {
                throw new NullPointerException(
                        "You must specify a value for region");
            }
            if (roleArn == null) {
                throw new NullPointerException(
                        "You must specify a value for roleArn");
            }
            this.region = region;
            this.roleArn = roleArn;
        }

        /**
         * Sets a preconfigured STS client to use for the credentials provider. See
         * {@link StsClient#builder()} for an easy way to configure and create an STS client.
         * The provider does not close a client set here.
         *
         * @param sts Custom STS client to use.
         * @return This object for chained calls.
         */
        public Builder withStsClient(StsClient sts) {
            this.sts = sts;
            return this;
        }

        /**
         * Sets the long lived credentials the default STS client signs AssumeRole calls with.
         * Ignored when {@link #withStsClient(StsClient)} is used.
         */
        public Builder withCredentialsProvider(AwsCredentialsProvider credentialsProvider) {
            this.credentialsProvider = credentialsProvider;
            return this;
        }

        public Builder withDuration(Duration duration) {
            if (duration == null) {
                throw new NullPointerException("You must specify a value for duration");
            }
            this.duration = duration;
            return this;
        }

        public Builder withDurationSeconds(int durationInSeconds) {
            return withDuration(Duration.ofSeconds(durationInSeconds));
        }

        public Builder withClock(Clock clock) {
            if (clock == null) {
                throw new NullPointerException("You must specify a value for clock");
            }
            this.clock = clock;
            return this;
        }

        public Builder withHostnameSupplier(HostnameSupplier hostnameSupplier) {
            if (hostnameSupplier == null) {
                throw new NullPointerException("You must specify a value for hostnameSupplier");
            }
            this.hostnameSupplier = hostnameSupplier;
            return this;
        }

        public Builder withLogPropertiesFile(String logPropertiesFile) {
            this.logPropertiesFile = logPropertiesFile;
            return this;
        }

        /**
         * Build the configured provider
         *
         * @return the configured TempCredentialsProvider
         */
        public TempCredentialsProvider build() {
            return new TempCredentialsProvider(this);
        }
    }
}
