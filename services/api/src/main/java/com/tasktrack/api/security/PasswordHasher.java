package com.tasktrack.api.security;

import com.tasktrack.api.errors.ValidationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Salted one-way password hashing. Each {@link #hash(String)} call draws a fresh salt, which is
 * embedded in the returned artifact so {@link #verify(String, String)} can recompute it.
 */
@Component
public class PasswordHasher {

    /** BCrypt ignores every byte past this many, so longer passwords are refused outright. */
    public static final int MAX_PASSWORD_BYTES = 72;

    private final PasswordEncoder encoder;

    public PasswordHasher(PasswordEncoder encoder) {
        this.encoder = encoder;
    }

    /**
     * @throws ValidationException the password is longer than {@value #MAX_PASSWORD_BYTES} bytes in UTF-8
     */
    public String hash(String plaintext) {
        Objects.requireNonNull(plaintext, "plaintext");
        if (!fitsLimit(plaintext)) {
            throw new ValidationException("Password must be at most " + MAX_PASSWORD_BYTES + " bytes");
        }
        return encoder.encode(plaintext);
    }

    /**
     * Constant-time comparison against a stored artifact. Returns false for a mismatch, a missing
     * input or a malformed artifact; never throws.
     */
    public boolean verify(String plaintext, String hashArtifact) {
        if (plaintext == null || hashArtifact == null || hashArtifact.isEmpty()) {
            return false;
        }
        // nothing over the limit was ever hashed, and BCrypt would compare only its prefix
        if (!fitsLimit(plaintext)) {
            return false;
        }
        try {
            return encoder.matches(plaintext, hashArtifact);
        } catch (IllegalArgumentException e) {
            // corrupt salt or cost factor
            return false;
        }
    }

    public static boolean fitsLimit(String plaintext) {
        return plaintext.getBytes(StandardCharsets.UTF_8).length <= MAX_PASSWORD_BYTES;
    }
}
