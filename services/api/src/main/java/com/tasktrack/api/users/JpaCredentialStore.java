package com.tasktrack.api.users;

import com.tasktrack.api.errors.ConflictException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Relational {@link CredentialStore} over the {@code app_user} table.
 */
@Repository
public class JpaCredentialStore implements CredentialStore {

    private final AppUserRepository users;
    private final Clock clock;

    JpaCredentialStore(AppUserRepository users, Clock clock) {
        this.users = users;
        this.clock = clock;
    }

    @Override
    @Transactional
    public Identity create(String email, String username, String passwordHash) {
        var normalized = Identity.normalizeEmail(email);
        if (users.existsByEmail(normalized)) {
            throw new ConflictException("Email already registered");
        }
        if (users.existsByUsername(username)) {
            throw new ConflictException("Username already taken");
        }
        try {
            // flush so a concurrent duplicate trips the unique constraint here, not at commit
            return users.saveAndFlush(new AppUser(normalized, username, passwordHash, clock.instant()))
                    .toIdentity();
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("Email or username already registered", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Identity> findByUsernameOrEmail(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        var user = Identity.looksLikeEmail(key)
                ? users.findByEmail(Identity.normalizeEmail(key))
                : users.findByUsername(key);
        return user.map(AppUser::toIdentity);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Identity> findById(UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        return users.findById(id).map(AppUser::toIdentity);
    }
}
