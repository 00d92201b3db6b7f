package com.eventengine.cockpit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Event Engine Cockpit backend entry point.
 *
 * Serves the compiled message schema and read-only aggregate views
 * (state, history, read-model documents) to cockpit clients.
 */
@SpringBootApplication
public class CockpitApplication {

    public static void main(String[] args) {
        SpringApplication.run(CockpitApplication.class, args);
    }
}
