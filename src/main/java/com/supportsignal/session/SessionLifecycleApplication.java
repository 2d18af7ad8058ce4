package com.supportsignal.session;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main application class for the session and impersonation lifecycle service.
 *
 * Issues, validates, refreshes and revokes regular sessions, and layers
 * bounded admin impersonation overlays on top of them. Every request turns
 * its token into an effective user through a single resolver.
 *
 * @version 1.0.0
 */
@SpringBootApplication
@EnableTransactionManagement
public class SessionLifecycleApplication {

    public static void main(String[] args) {
        SpringApplication.run(SessionLifecycleApplication.class, args);
    }
}
