package com.tabletop;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main entry point for the tabletop rules engine.
 *
 * Features:
 * - Rule analysis and archetype detection
 * - Match composition from declarative rules or presets
 * - Serialised turn resolution with domain events
 * - Scheduled eviction of ended matches
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class TabletopEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(TabletopEngineApplication.class, args);
    }
}
