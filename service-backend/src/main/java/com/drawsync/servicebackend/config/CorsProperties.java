package com.drawsync.servicebackend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "app.cors")
public class CorsProperties {

    /**
     * Allowed origin patterns for the REST API and the room WebSocket endpoint. Supports the
     * wildcard syntax accepted by
     * {@link org.springframework.web.cors.CorsConfiguration#setAllowedOriginPatterns(List)}
     */
    private List<String> allowedOrigins = new ArrayList<>(List.of(
            "http://localhost:3000",
            "http://localhost:5173",
            "http://127.0.0.1:*"
    ));

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    public String[] originPatterns() {
        return allowedOrigins.toArray(String[]::new);
    }
}
