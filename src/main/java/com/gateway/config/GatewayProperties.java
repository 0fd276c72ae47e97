package com.gateway.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed view of the {@code gateway.*} configuration tree.
 * <p>
 * Values come from {@code application.yml}; each one can be overridden through the environment
 * variables referenced there (e.g. {@code BASE_URL}, {@code RECORD_API_QUERIES}).
 */
@Data
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    /**
     * Platform base URL every tool path and the identity endpoint are resolved against.
     */
    private String baseUrl = "https://localhost";

    /**
     * Bearer token used for tool calls arriving without a session credential.
     */
    private String fallbackBearerToken;

    /**
     * Publishes every dispatch attempt to the audit sink.
     */
    private boolean recordApiQueries = false;

    /**
     * Disables TLS certificate validation for all outbound calls. Development only.
     */
    private boolean ignoreCertificateErrors = false;

    private List<ServiceConfig> services = new ArrayList<>();

    private Timeouts timeouts = new Timeouts();

    private Tiers tiers = new Tiers();

    @Data
    public static class Timeouts {
        private Duration documentFetch = Duration.ofSeconds(30);
        private Duration identity = Duration.ofSeconds(10);
        private Duration dispatch = Duration.ofSeconds(60);
    }

    @Data
    public static class Tiers {

        /**
         * Tier for anonymous or unresolved callers.
         */
        private String lowest = "anonymous";

        /**
         * Tier for authenticated callers without elevated privilege.
         */
        private String middle = "user";

        /**
         * Tier for callers flagged as superuser.
         */
        private String highest = "admin";

        /**
         * Tier name to allowed tool names. Keys are matched case-insensitively.
         */
        private Map<String, List<String>> allowLists = new LinkedHashMap<>();
    }
}
