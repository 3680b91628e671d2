package com.autolike;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Auto-like service.
 *
 * Follows one account on the filtered stream and, for every post it publishes
 * through the configured client, likes that post on behalf of every registered
 * subscriber.
 *
 * Architecture:
 * - One long-lived stream connection with automatic reconnect
 * - Fan-out per post on bounded executors, failures isolated per subscriber
 * - Just-in-time OAuth2 refresh of expired subscriber credentials
 * - Credentials kept in a single Redis hash shared with the registration front end
 */
@SpringBootApplication
public class AutoLikeApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutoLikeApplication.class, args);
    }
}
