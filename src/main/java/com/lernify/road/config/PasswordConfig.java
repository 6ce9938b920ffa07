package com.lernify.road.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.crypto.password.Pbkdf2PasswordEncoder;
import org.springframework.security.crypto.password.Pbkdf2PasswordEncoder.SecretKeyFactoryAlgorithm;

@Configuration
public class PasswordConfig {
    private static final int SALT_LENGTH = 16;

    @Bean
    public PasswordEncoder passwordEncoder(@Value("${lernify.auth.pbkdf2-iterations:100000}") int iterations) {
        return new Pbkdf2PasswordEncoder("", SALT_LENGTH, iterations, SecretKeyFactoryAlgorithm.PBKDF2WithHmacSHA256);
    }
}
