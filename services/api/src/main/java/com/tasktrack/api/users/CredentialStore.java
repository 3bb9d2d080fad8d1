package com.tasktrack.api.users;

import com.tasktrack.api.errors.ConflictException;

import java.util.Optional;
import java.util.UUID;

/**
 * Persists identities. Implementations enforce email and username uniqueness atomically: of two
 * racing registrations for the same email or username, exactly one succeeds and the other gets
 * {@link ConflictException}.
 */
public interface CredentialStore {

    /**
     * Creates an identity. The email is normalized before it is stored. The write is durable when
     * this returns.
     *
     * @throws ConflictException if the email or username is already registered
     */
    Identity create(String email, String username, String passwordHash);

    /**
     * Looks up by email after normalization when {@code key} contains '@', otherwise by exact
     * username. Empty for a null or blank key.
     */
    Optional<Identity> findByUsernameOrEmail(String key);

    Optional<Identity> findById(UUID id);
}
