package com.platform.configdrift;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Configuration drift monitor for Meraki dashboard organizations.
 *
 * Stores baseline snapshots of organization, network and device settings and compares
 * live state against them.
 */
@SpringBootApplication
public class ConfigDriftApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConfigDriftApplication.class, args);
    }
}
