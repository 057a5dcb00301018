package com.clouddeploy.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Utility class for API key generation, hashing and masking.
 */
public final class ApiKeyUtil {

    private static final int DISPLAY_PREFIX_LENGTH = 10;
    private static final int DISPLAY_SUFFIX_LENGTH = 4;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private ApiKeyUtil() {
    }

    /**
     * Generate a new API key.
     *
     * @param prefix      Literal prefix that makes keys recognizable (e.g. cdp_)
     * @param randomBytes Number of random bytes behind the prefix
     * @return Generated API key (e.g., cdp_abc123...)
     */
    public static String generateApiKey(String prefix, int randomBytes) {
        byte[] bytes = new byte[randomBytes];
        SECURE_RANDOM.nextBytes(bytes);
        String encoded = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        return prefix + encoded;
    }

    /**
     * Hash an API key using SHA-256.
     *
     * @param apiKey The API key to hash
     * @return SHA-256 hash of the API key
     */
    public static String hashApiKey(String apiKey) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(apiKey.getBytes(StandardCharsets.UTF_8));
            return bytesToHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not found", e);
        }
    }

    /**
     * Leading characters kept for the masked display form.
     */
    public static String displayPrefix(String apiKey) {
        return apiKey.substring(0, Math.min(DISPLAY_PREFIX_LENGTH, apiKey.length()));
    }

    /**
     * Trailing characters kept for the masked display form.
     */
    public static String displaySuffix(String apiKey) {
        return apiKey.substring(Math.max(0, apiKey.length() - DISPLAY_SUFFIX_LENGTH));
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder result = new StringBuilder();
        for (byte b : bytes) {
            result.append(String.format("%02x", b));
        }
        return result.toString();
    }
}
