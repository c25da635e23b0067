package com.studyassistant.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Password hashing configuration.
 *
 * Passwords are hashed with BCrypt: a per-password random salt is embedded
 * in the hash, and the work factor makes brute force slow. The hash is the
 * only form in which a password reaches the database.
 *
 * @see com.studyassistant.service.AuthService
 */
@Configuration
public class SecurityConfig {

    private static final int BCRYPT_STRENGTH = 10;

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder(BCRYPT_STRENGTH);
    }
}
