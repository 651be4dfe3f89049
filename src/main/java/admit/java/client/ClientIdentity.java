package admit.java.client;

import java.net.InetSocketAddress;
import java.net.SocketAddress;

/**
 * Derives the rate-limit key of a request from its network origin.
 *
 * Order: first hop of X-Forwarded-For, then X-Real-IP, then the direct peer
 * address. Traffic with none of these shares the {@value #UNKNOWN} bucket
 * instead of bypassing the limiter.
 */
public final class ClientIdentity {

    public static final String UNKNOWN = "unknown";

    private ClientIdentity() {
        // Utility class, no instantiation
    }

    /**
     * @param forwardedFor raw X-Forwarded-For header, may be null
     * @param realIp raw X-Real-IP header, may be null
     * @param remoteAddress host of the direct connection, may be null
     * @return a non-blank key
     */
    public static String resolve(String forwardedFor, String realIp, String remoteAddress) {
        if (forwardedFor != null) {
            int comma = forwardedFor.indexOf(',');
            String first = (comma >= 0 ? forwardedFor.substring(0, comma) : forwardedFor).trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        if (remoteAddress != null && !remoteAddress.isBlank()) {
            return remoteAddress.trim();
        }
        return UNKNOWN;
    }

    /**
     * Host part of a transport address, or null when it is not an IP socket.
     */
    public static String hostOf(SocketAddress address) {
        if (address instanceof InetSocketAddress inet) {
            return inet.getAddress() != null ? inet.getAddress().getHostAddress() : inet.getHostString();
        }
        return null;
    }
}
