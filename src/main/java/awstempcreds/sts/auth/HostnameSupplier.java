package awstempcreds.sts.auth;

import java.io.IOException;
import java.net.InetAddress;

/**
 * Source of the local host name used in role session names.
 */
@FunctionalInterface
public interface HostnameSupplier {

    /**
     * @return The name of this host.
     * @throws IOException If the name cannot be determined.
     */
    String getHostname() throws IOException;

    /**
     * @return A supplier that asks the local network stack for the host name.
     */
    static HostnameSupplier localHost() {
        return () -> InetAddress.getLocalHost().getHostName();
    }
}
