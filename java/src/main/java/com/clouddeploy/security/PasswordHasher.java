package com.clouddeploy.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Salted bcrypt hashing and verification of account passwords.
 *
 * Verification always costs one full bcrypt computation, so a malformed
 * stored hash or an unknown account takes as long as a wrong password.
 * Passwords longer than bcrypt's 72-byte input are refused rather than truncated.
 */
@Slf4j
@Component
public class PasswordHasher {

    public static final int MAX_PASSWORD_BYTES = 72;

    private static final Pattern BCRYPT_PATTERN = Pattern.compile("\\A\\$2([ayb])?\\$(\\d\\d)\\$[./0-9A-Za-z]{53}");

    private final BCryptPasswordEncoder encoder;
    private final String dummyHash;

    public PasswordHasher(BCryptPasswordEncoder encoder) {
        this.encoder = encoder;
        this.dummyHash = encoder.encode("dummy-password-for-timing");
    }

    public static boolean fitsBcrypt(String plaintext) {
        return plaintext != null && plaintext.getBytes(StandardCharsets.UTF_8).length <= MAX_PASSWORD_BYTES;
    }

    public String hash(String plaintext) {
        if (!fitsBcrypt(plaintext)) {
            throw new IllegalArgumentException("Password must be at most " + MAX_PASSWORD_BYTES + " bytes");
        }
        return encoder.encode(plaintext);
    }

    public boolean verify(String plaintext, String hash) {
        if (plaintext == null) {
            return false;
        }
        if (!fitsBcrypt(plaintext)) {
            verifyAgainstDummy("");
            return false;
        }
        boolean wellFormed = hash != null && BCRYPT_PATTERN.matcher(hash).matches();
        boolean matches;
        try {
            matches = encoder.matches(plaintext, wellFormed ? hash : dummyHash);
        } catch (IllegalArgumentException e) {
            log.warn("Stored password hash could not be parsed: {}", e.getMessage());
            return false;
        }
        return wellFormed && matches;
    }

    /**
     * Burn one verification for a login attempt against an unknown account.
     */
    public void verifyAgainstDummy(String plaintext) {
        encoder.matches(plaintext == null ? "" : plaintext, dummyHash);
    }
}
