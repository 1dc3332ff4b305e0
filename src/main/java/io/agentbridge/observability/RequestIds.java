package io.agentbridge.observability;

import java.security.SecureRandom;
import java.util.regex.Pattern;

/**
 * Correlation ids for gateway requests.
 */
public final class RequestIds {
    public static final String HEADER = "X-Request-Id";
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final Pattern ACCEPTED = Pattern.compile("^[A-Za-z0-9._:\\-]{8,128}$");

    private RequestIds() {
    }

    public static String newRequestId() {
        return "req_" + randomHex(12); // 12 bytes => 24 hex chars
    }

    /**
     * Keeps a caller-supplied id when it is well formed, otherwise mints one.
     */
    public static String acceptOrCreate(String supplied) {
        if (supplied != null && ACCEPTED.matcher(supplied.trim()).matches()) {
            return supplied.trim();
        }
        return newRequestId();
    }

    private static String randomHex(int bytes) {
        byte[] value = new byte[bytes];
        RANDOM.nextBytes(value);
        StringBuilder sb = new StringBuilder(bytes * 2);
        for (byte b : value) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
