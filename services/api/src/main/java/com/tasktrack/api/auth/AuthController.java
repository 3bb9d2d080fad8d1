package com.tasktrack.api.auth;

import com.tasktrack.api.users.Identity;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final AuthService auth;

    AuthController(AuthService auth) {
        this.auth = auth;
    }

    @PostMapping("/register")
    ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterRequest req) {
        var identity = auth.register(req.email(), req.username(), req.password());
        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.of(identity));
    }

    @PostMapping(value = "/login", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<TokenResponse> login(@Valid @RequestBody LoginRequest req) {
        return ResponseEntity.ok(auth.login(req.username(), req.password()));
    }

    // OAuth2 password-grant style form, so generic OAuth2 clients can log in
    @PostMapping(value = "/login", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    ResponseEntity<TokenResponse> loginForm(
            @RequestParam(name = "username", required = false) String username,
            @RequestParam(name = "password", required = false) String password) {
        return ResponseEntity.ok(auth.login(username, password));
    }

    @GetMapping("/me")
    UserResponse me(@AuthenticationPrincipal Identity identity) {
        return UserResponse.of(identity);
    }
}
