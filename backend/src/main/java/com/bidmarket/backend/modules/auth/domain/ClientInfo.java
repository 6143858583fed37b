package com.bidmarket.backend.modules.auth.domain;

/**
 * Request metadata supplied by the route layer. Both fields are optional.
 */
public record ClientInfo(String ipAddress, String userAgent) {

    private static final String UNKNOWN = "unknown";
    private static final int USER_AGENT_MAX_LENGTH = 512;

    public static final ClientInfo UNKNOWN_CLIENT = new ClientInfo(null, null);

    public ClientInfo {
        ipAddress = normalize(ipAddress, 64);
        userAgent = normalize(userAgent, USER_AGENT_MAX_LENGTH);
    }

    /**
     * Identity used as the rate-limit key for unauthenticated actions.
     */
    public String identity() {
        return ipAddress != null ? ipAddress : UNKNOWN;
    }

    private static String normalize(String raw, int maxLength) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > maxLength ? trimmed.substring(0, maxLength) : trimmed;
    }
}
