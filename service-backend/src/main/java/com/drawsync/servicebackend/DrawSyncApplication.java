package com.drawsync.servicebackend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DrawSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(DrawSyncApplication.class, args);
    }
}
