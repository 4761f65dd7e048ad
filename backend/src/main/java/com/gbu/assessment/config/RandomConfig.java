package com.gbu.assessment.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.util.Random;

@Configuration
public class RandomConfig {

    /** Shared source for question interleaving and option shuffles. */
    @Bean
    public Random shuffleRandom() {
        return new SecureRandom();
    }
}
