package com.tasktrack.api.auth;

import com.tasktrack.api.errors.AuthenticationFailedException;
import com.tasktrack.api.errors.ValidationException;
import com.tasktrack.api.security.PasswordHasher;
import com.tasktrack.api.security.TokenService;
import com.tasktrack.api.users.CredentialStore;
import com.tasktrack.api.users.Identity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AuthService {

    static final String TOKEN_TYPE = "bearer";

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final CredentialStore credentials;
    private final PasswordHasher hasher;
    private final TokenService tokens;

    AuthService(CredentialStore credentials, PasswordHasher hasher, TokenService tokens) {
        this.credentials = credentials;
        this.hasher = hasher;
        this.tokens = tokens;
    }

    /**
     * Stores a new identity with a salted hash of {@code password}.
     *
     * @throws ValidationException a required field is missing, the username contains '@', or the
     *     password is longer than BCrypt accepts
     * @throws com.tasktrack.api.errors.ConflictException the email or username is taken
     */
    public Identity register(String email, String username, String password) {
        if (email == null || email.isBlank() || email.indexOf('@') < 0) {
            throw new ValidationException("A valid email is required");
        }
        if (username == null || username.isBlank()) {
            throw new ValidationException("Username is required");
        }
        if (username.indexOf('@') >= 0) {
            throw new ValidationException("Username must not contain '@'");
        }
        if (password == null || password.isEmpty()) {
            throw new ValidationException("Password is required");
        }
        if (!PasswordHasher.fitsLimit(password)) {
            throw new ValidationException(
                    "Password must be at most " + PasswordHasher.MAX_PASSWORD_BYTES + " bytes");
        }
        var identity = credentials.create(email, username, hasher.hash(password));
        log.info("Registered identity {}", identity.id());
        return identity;
    }

    /**
     * Checks the password of the identity named by {@code usernameOrEmail} and issues an access
     * token for it. Unknown users and wrong passwords fail the same way.
     *
     * @throws AuthenticationFailedException the credentials do not match
     */
    public TokenResponse login(String usernameOrEmail, String password) {
        var identity = credentials.findByUsernameOrEmail(usernameOrEmail).orElse(null);
        if (identity == null || !hasher.verify(password, identity.passwordHash())) {
            log.warn("Failed login attempt");
            throw new AuthenticationFailedException("Incorrect username or password");
        }
        var access = tokens.issue(identity.id());
        log.info("Issued access token for identity {}", identity.id());
        return new TokenResponse(access, TOKEN_TYPE, tokens.expiresInSeconds());
    }
}
