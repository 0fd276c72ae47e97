package com.gateway.config;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One backend service entry of the {@code gateway.services} configuration list.
 */
@Data
@NoArgsConstructor
public class ServiceConfig {

    /**
     * Backend identifier: {@code eda}, {@code gateway}, {@code galaxy} or {@code controller}.
     */
    private String name;

    /**
     * Overrides the default document URL of the backend.
     */
    private String url;

    /**
     * Reads the document from disk instead of fetching it. Takes precedence over {@link #url}.
     */
    private String localPath;

    private boolean enabled = true;

    public ServiceConfig(String name) {
        this.name = name;
    }
}
