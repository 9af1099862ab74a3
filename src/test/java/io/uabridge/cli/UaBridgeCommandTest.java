package io.uabridge.cli;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UaBridgeCommandTest {
    @Test
    void certIssueThenValidateShouldSucceed() throws Exception {
        Path root = Files.createTempDirectory("uabridge-cli-");
        try {
            int issued = execute("cert-issue", "--dir", root.toString(), "--app-uri", "urn:cli:test", "--dns", "a.local,b.local");
            assertEquals(0, issued);
            assertTrue(Files.exists(root.resolve("ca.crt")));
            assertTrue(Files.exists(root.resolve("client.der")));

            int valid = execute("cert-validate", "--cert", root.resolve("client.der").toString(),
                    "--key", root.resolve("client.key").toString());
            assertEquals(0, valid);
            assertEquals(0, execute("cert-info", "--cert", root.resolve("client.crt").toString()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void certValidateShouldRejectForeignKey() throws Exception {
        Path root = Files.createTempDirectory("uabridge-cli-");
        try {
            assertEquals(0, execute("cert-issue", "--dir", root.resolve("one").toString(), "--self-signed"));
            assertEquals(0, execute("cert-csr", "--dir", root.resolve("two").toString()));
            assertTrue(Files.exists(root.resolve("two").resolve("client.csr")));

            int result = execute("cert-validate", "--cert", root.resolve("one").resolve("selfsigned.der").toString(),
                    "--key", root.resolve("two").resolve("client-request.key").toString());
            assertEquals(1, result);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownOptionShouldFailParsing() {
        assertEquals(2, execute("read", "--bogus"));
    }

    private static int execute(String... args) {
        return new CommandLine(new UaBridgeCommand()).execute(args);
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
