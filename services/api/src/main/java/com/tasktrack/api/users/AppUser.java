package com.tasktrack.api.users;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "app_user", uniqueConstraints = {
        @UniqueConstraint(name = "uk_app_user_email", columnNames = "email"),
        @UniqueConstraint(name = "uk_app_user_username", columnNames = "username")
})
class AppUser {

    @Id
    @GeneratedValue
    UUID id;

    @Column(nullable = false, length = 255)
    String email;

    @Column(nullable = false, length = 50)
    String username;

    @Column(nullable = false)
    String passwordHash;

    @Column(nullable = false, updatable = false)
    Instant createdAt;

    protected AppUser() {}

    AppUser(String email, String username, String passwordHash, Instant createdAt) {
        this.email = email;
        this.username = username;
        this.passwordHash = passwordHash;
        this.createdAt = createdAt;
    }

    Identity toIdentity() {
        return new Identity(id, email, username, passwordHash, createdAt);
    }
}
