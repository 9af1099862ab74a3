package io.uabridge.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Stream;

final class UaBridgeConfigTest {

    @Test
    void defaultsApplyWhenFieldsAreAbsent() {
        UaBridgeConfig config = UaBridgeConfig.defaults();
        Assertions.assertEquals("opc.tcp://localhost:4840", config.endpointUrl());
        Assertions.assertEquals("None", config.securityPolicy());
        Assertions.assertEquals("anonymous", config.authMode());
        Assertions.assertEquals(3, config.retryAttempts());
        Assertions.assertEquals(Duration.ofSeconds(10), config.connectTimeout());
        Assertions.assertEquals(8080, config.apiPort());
        Assertions.assertEquals(8081, config.wsPort());
        Assertions.assertFalse(config.apiEnabled());
    }

    @Test
    void loadsFileAndKeepsDefaultsForMissingFields() throws Exception {
        Path root = Files.createTempDirectory("uabridge-config-");
        try {
            Path file = root.resolve("config.json");
            Files.writeString(file, """
                    {
                      "endpointUrl": "opc.tcp://plc.local:4840",
                      "securityPolicy": "Basic256Sha256",
                      "securityMode": "SignAndEncrypt",
                      "retryAttempts": 0,
                      "retryDelaySeconds": 0.5,
                      "apiEnabled": true,
                      "apiPort": 9000,
                      "unknownField": "ignored"
                    }
                    """);

            UaBridgeConfig config = UaBridgeConfig.load(file);

            Assertions.assertEquals("opc.tcp://plc.local:4840", config.endpointUrl());
            Assertions.assertEquals("SignAndEncrypt", config.securityMode());
            Assertions.assertEquals(3, config.retryAttempts());
            Assertions.assertEquals(Duration.ofMillis(500), config.retryDelay());
            Assertions.assertTrue(config.apiEnabled());
            Assertions.assertEquals(9000, config.apiPort());
            Assertions.assertEquals(8081, config.wsPort());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingFileIsReported() {
        Assertions.assertThrows(IOException.class, () -> UaBridgeConfig.load(Path.of("does-not-exist-uabridge.json")));
    }

    @Test
    void overridesSkipNullEntries() {
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("endpointUrl", "opc.tcp://other:4841");
        overrides.put("username", null);
        overrides.put("apiPort", 7000);

        UaBridgeConfig config = UaBridgeConfig.defaults().with(overrides);

        Assertions.assertEquals("opc.tcp://other:4841", config.endpointUrl());
        Assertions.assertEquals(7000, config.apiPort());
        Assertions.assertNull(config.username());
    }

    @Test
    void toStringHidesPassword() {
        UaBridgeConfig config = UaBridgeConfig.defaults().with(Map.of("username", "op", "password", "s3cret"));
        Assertions.assertFalse(config.toString().contains("s3cret"));
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
