package com.todoapi.todo.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Time source for token issue and expiry checks. Tests replace it to
 * simulate elapsed time.
 */
@Configuration
public class ClockConfig {

    /**
     * @return system clock in UTC, read by JwtUtil for iat and exp
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
