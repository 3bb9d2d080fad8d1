package com.tasktrack.api.users;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * A registered user's authoritative record.
 *
 * @param id immutable, assigned by the store at creation
 * @param email unique, always stored normalized (see {@link #normalizeEmail(String)})
 * @param username unique, compared exactly, never contains '@'
 * @param passwordHash salted one-way artifact, never the plaintext
 * @param createdAt when the identity was registered
 */
public record Identity(UUID id, String email, String username, String passwordHash, Instant createdAt) {

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    /** Usernames cannot contain '@', so a login key that does is an email. */
    public static boolean looksLikeEmail(String key) {
        return key.indexOf('@') >= 0;
    }

    @Override
    public String toString() {
        return "Identity[id=" + id + ", username=" + username + "]";
    }
}
