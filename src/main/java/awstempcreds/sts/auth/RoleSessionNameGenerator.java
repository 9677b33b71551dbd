package awstempcreds.sts.auth;

import org.apache.log4j.Logger;

import java.io.IOException;
import java.time.Clock;
import java.util.Objects;

/**
 * Builds role session names of the form {@code temp-<host>-<unixSeconds>} so sessions assumed
 * repeatedly from one host stay unique and can be traced back to it in CloudTrail.
 */
final class RoleSessionNameGenerator {

    static final Logger logger = Logger.getLogger(RoleSessionNameGenerator.class);

    static final String SESSION_NAME_PREFIX = "temp";
    static final String UNKNOWN_HOST = "unknown";

    private final HostnameSupplier hostnameSupplier;
    private final Clock clock;

    RoleSessionNameGenerator(HostnameSupplier hostnameSupplier, Clock clock) {
        this.hostnameSupplier = Objects.requireNonNull(hostnameSupplier, "hostnameSupplier");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    String newSessionName() {
        return String.format("%s-%s-%d", SESSION_NAME_PREFIX, resolveHostname(),
                clock.instant().getEpochSecond());
    }

    /**
     * Never fails: the host name only makes session names traceable.
     */
    private String resolveHostname() {
        String hostname;
        try {
            hostname = hostnameSupplier.getHostname();
        } catch (IOException | RuntimeException e) {
            logger.warn("Unable to determine host name, using '" + UNKNOWN_HOST + "' in session name.", e);
            return UNKNOWN_HOST;
        }
        if (hostname == null || hostname.isEmpty()) {
            logger.warn("Host name is empty, using '" + UNKNOWN_HOST + "' in session name.");
            return UNKNOWN_HOST;
        }
        return hostname;
    }
}
