package io.uabridge.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.uabridge.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Declarative connection and hosting settings, loaded from a JSON file.
 * Absent or non-positive numeric fields fall back to the defaults below.
 */
public record UaBridgeConfig(
        String endpointUrl,
        String securityPolicy,
        String securityMode,
        String authMode,
        String username,
        String password,
        String userTokenPolicyId,
        String certFile,
        String keyFile,
        String certDir,
        String pkiDir,
        String applicationUri,
        String productUri,
        String sessionName,
        int sessionTimeoutSeconds,
        double connectTimeoutSeconds,
        int retryAttempts,
        double retryDelaySeconds,
        boolean autoGenerateCert,
        boolean autoConnect,
        boolean apiEnabled,
        int apiPort,
        int wsPort,
        boolean disableLog
) {
    public static final String DEFAULT_ENDPOINT_URL = "opc.tcp://localhost:4840";
    public static final String DEFAULT_SECURITY_POLICY = "None";
    public static final String DEFAULT_SECURITY_MODE = "None";
    public static final String DEFAULT_AUTH_MODE = "anonymous";
    public static final String DEFAULT_CERT_DIR = "certs";
    public static final String DEFAULT_PRODUCT_URI = "urn:uabridge:client";
    public static final int DEFAULT_SESSION_TIMEOUT_SECONDS = 60;
    public static final double DEFAULT_CONNECT_TIMEOUT_SECONDS = 10.0;
    public static final int DEFAULT_RETRY_ATTEMPTS = 3;
    public static final double DEFAULT_RETRY_DELAY_SECONDS = 1.0;
    public static final int DEFAULT_API_PORT = 8080;
    public static final int DEFAULT_WS_PORT = 8081;

    public UaBridgeConfig {
        endpointUrl = blankToDefault(endpointUrl, DEFAULT_ENDPOINT_URL);
        securityPolicy = blankToDefault(securityPolicy, DEFAULT_SECURITY_POLICY);
        securityMode = blankToDefault(securityMode, DEFAULT_SECURITY_MODE);
        authMode = blankToDefault(authMode, DEFAULT_AUTH_MODE);
        certDir = blankToDefault(certDir, DEFAULT_CERT_DIR);
        productUri = blankToDefault(productUri, DEFAULT_PRODUCT_URI);
        if (sessionTimeoutSeconds <= 0) {
            sessionTimeoutSeconds = DEFAULT_SESSION_TIMEOUT_SECONDS;
        }
        if (connectTimeoutSeconds <= 0) {
            connectTimeoutSeconds = DEFAULT_CONNECT_TIMEOUT_SECONDS;
        }
        if (retryAttempts <= 0) {
            retryAttempts = DEFAULT_RETRY_ATTEMPTS;
        }
        if (retryDelaySeconds <= 0) {
            retryDelaySeconds = DEFAULT_RETRY_DELAY_SECONDS;
        }
        if (apiPort <= 0) {
            apiPort = DEFAULT_API_PORT;
        }
        if (wsPort <= 0) {
            wsPort = DEFAULT_WS_PORT;
        }
    }

    public static UaBridgeConfig defaults() {
        return Jsons.mapper().convertValue(Jsons.mapper().createObjectNode(), UaBridgeConfig.class);
    }

    public static UaBridgeConfig load(Path path) throws IOException {
        if (path == null || !Files.exists(path)) {
            throw new IOException("Config file not found: " + path);
        }
        return Jsons.readFile(path, UaBridgeConfig.class);
    }

    /**
     * Returns a copy with the non-null entries of {@code overrides} applied, keyed by field name.
     */
    public UaBridgeConfig with(Map<String, ?> overrides) {
        ObjectNode node = Jsons.mapper().valueToTree(this);
        for (Map.Entry<String, ?> entry : overrides.entrySet()) {
            if (entry.getValue() != null) {
                JsonNode value = Jsons.mapper().valueToTree(entry.getValue());
                node.set(entry.getKey(), value);
            }
        }
        return Jsons.mapper().convertValue(node, UaBridgeConfig.class);
    }

    public Duration connectTimeout() {
        return Duration.ofMillis(Math.round(connectTimeoutSeconds * 1000.0));
    }

    public Duration retryDelay() {
        return Duration.ofMillis(Math.round(retryDelaySeconds * 1000.0));
    }

    public Duration sessionTimeout() {
        return Duration.ofSeconds(sessionTimeoutSeconds);
    }

    @Override
    public String toString() {
        return "UaBridgeConfig[endpointUrl=" + endpointUrl
                + ", securityPolicy=" + securityPolicy
                + ", securityMode=" + securityMode
                + ", authMode=" + authMode
                + ", username=" + username
                + ", apiEnabled=" + apiEnabled
                + ", apiPort=" + apiPort
                + ", wsPort=" + wsPort + "]";
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
