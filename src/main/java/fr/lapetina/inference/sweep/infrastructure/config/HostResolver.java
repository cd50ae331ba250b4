package fr.lapetina.inference.sweep.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Resolves machine names to the address other machines should use to reach them.
 */
@FunctionalInterface
public interface HostResolver {

    String resolve(String hostname);

    /**
     * DNS resolution, falling back to the hostname itself when it does not resolve.
     */
    static HostResolver dns() {
        Logger log = LoggerFactory.getLogger(HostResolver.class);
        return hostname -> {
            try {
                return InetAddress.getByName(hostname).getHostAddress();
            } catch (UnknownHostException e) {
                log.warn("Could not resolve host, using name as address: host={}", hostname);
                return hostname;
            }
        };
    }

    static HostResolver identity() {
        return hostname -> hostname;
    }
}
