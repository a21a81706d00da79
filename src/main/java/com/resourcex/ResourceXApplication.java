package com.resourcex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ResourceX server - site lookup, time-series extraction and SAM export
 * over renewable resource archives
 */
@SpringBootApplication
public class ResourceXApplication {
    public static void main(String[] args) {
        SpringApplication.run(ResourceXApplication.class, args);
    }
}
