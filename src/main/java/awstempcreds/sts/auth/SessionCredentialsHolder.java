package awstempcreds.sts.auth;

import software.amazon.awssdk.annotations.Immutable;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.services.sts.model.Credentials;

import java.time.Instant;

/**
 * Holder for an assumed-role session: the credential triple handed to callers, the session name
 * it was requested under and the expiration STS reported for it.
 */
@Immutable
final class SessionCredentialsHolder {

    private final AwsSessionCredentials sessionCredentials;
    private final String roleSessionName;
    private final Instant reportedExpiration;

    SessionCredentialsHolder(Credentials credentials, String roleSessionName) {
        this.sessionCredentials = AwsSessionCredentials.create(
                credentials.accessKeyId(),
                credentials.secretAccessKey(),
                credentials.sessionToken());
        this.roleSessionName = roleSessionName;
        this.reportedExpiration = credentials.expiration();
    }

    public AwsSessionCredentials getSessionCredentials() {
        return sessionCredentials;
    }

    public String getRoleSessionName() {
        return roleSessionName;
    }

    /**
     * Informational only. Refreshes are scheduled from the requested duration.
     *
     * @return The expiration STS reported, or null if it sent none.
     */
    public Instant getReportedExpiration() {
        return reportedExpiration;
    }
}
