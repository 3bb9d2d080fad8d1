package com.tasktrack.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

// identities are resolved from bearer tokens, never from a UserDetailsService
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class TaskTrackApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskTrackApiApplication.class, args);
    }
}
