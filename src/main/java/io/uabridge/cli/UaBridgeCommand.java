package io.uabridge.cli;

import io.uabridge.api.ApiHost;
import io.uabridge.api.TagCsv;
import io.uabridge.config.UaBridgeConfig;
import io.uabridge.model.AddressSpaceNode;
import io.uabridge.model.NodeAttributes;
import io.uabridge.protocol.ProtocolException;
import io.uabridge.protocol.milo.MiloProtocolClient;
import io.uabridge.runtime.AddressSpaceCache;
import io.uabridge.runtime.SessionController;
import io.uabridge.runtime.TagCollection;
import io.uabridge.security.CertificateConfig;
import io.uabridge.security.CertificateGenerator;
import io.uabridge.util.Jsons;
import io.uabridge.util.LogControl;
import io.uabridge.write.WriteOutcome;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Command(
        name = "uabridge",
        mixinStandardHelpOptions = true,
        description = "OPC UA client runtime CLI",
        subcommands = {
                UaBridgeCommand.ServeCommand.class,
                UaBridgeCommand.ReadCommand.class,
                UaBridgeCommand.WriteCommand.class,
                UaBridgeCommand.BrowseCommand.class,
                UaBridgeCommand.ExportTagsCommand.class,
                UaBridgeCommand.CertCaCommand.class,
                UaBridgeCommand.CertIssueCommand.class,
                UaBridgeCommand.CertCsrCommand.class,
                UaBridgeCommand.CertInfoCommand.class,
                UaBridgeCommand.CertValidateCommand.class
        }
)
public final class UaBridgeCommand implements Runnable {
    @Option(names = {"--config"}, description = "JSON config file")
    Path config;

    @Option(names = {"--endpoint"}, description = "Server endpoint URL (overrides config)")
    String endpoint;

    @Option(names = {"--policy"}, description = "Security policy, e.g. None or Basic256Sha256 (overrides config)")
    String policy;

    @Option(names = {"--mode"}, description = "Security mode: None, Sign or SignAndEncrypt (overrides config)")
    String mode;

    @Option(names = {"--username"}, description = "Username; switches auth mode to username")
    String username;

    @Option(names = {"--password"}, description = "Password for --username")
    String password;

    @Option(names = {"--quiet"}, description = "Only log errors")
    boolean quiet;

    @Override
    public void run() {
        System.out.println("Use subcommands: serve | read | write | browse | export-tags | cert-ca | cert-issue | cert-csr | cert-info | cert-validate");
    }

    UaBridgeConfig loadConfig() throws Exception {
        UaBridgeConfig base = config == null ? UaBridgeConfig.defaults() : UaBridgeConfig.load(config);
        Map<String, Object> overrides = new LinkedHashMap<>();
        overrides.put("endpointUrl", endpoint);
        overrides.put("securityPolicy", policy);
        overrides.put("securityMode", mode);
        if (username != null) {
            overrides.put("authMode", "username");
            overrides.put("username", username);
            overrides.put("password", password);
        }
        if (quiet) {
            overrides.put("disableLog", true);
        }
        UaBridgeConfig resolved = base.with(overrides);
        LogControl.setQuiet(resolved.disableLog());
        return resolved;
    }

    SessionController connect() throws Exception {
        SessionController controller = new SessionController(new MiloProtocolClient(), loadConfig());
        controller.connect();
        return controller;
    }

    @Command(name = "serve", description = "Connect and host the REST API and WebSocket hub until stopped")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        UaBridgeCommand parent;

        @Option(names = {"--api-port"}, description = "REST port (overrides config)")
        Integer apiPort;

        @Option(names = {"--ws-port"}, description = "WebSocket port (overrides config)")
        Integer wsPort;

        @Override
        public Integer call() throws Exception {
            Map<String, Object> overrides = new LinkedHashMap<>();
            overrides.put("apiEnabled", true);
            overrides.put("apiPort", apiPort);
            overrides.put("wsPort", wsPort);
            UaBridgeConfig cfg = parent.loadConfig().with(overrides);
            SessionController controller = new SessionController(new MiloProtocolClient(), cfg);
            controller.setExternalListener(new ApiHost(controller));
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                controller.shutdown();
                stopped.countDown();
            }, "uabridge-shutdown"));
            try {
                controller.connect();
            } catch (ProtocolException e) {
                System.err.println("Connect failed: " + e.getMessage());
                controller.shutdown();
                return 1;
            }
            controller.updateApiServerState(cfg);
            System.out.println("Serving " + controller.endpointUrl()
                    + " on http://127.0.0.1:" + cfg.apiPort() + "/api/v1 and ws://127.0.0.1:" + cfg.wsPort() + "/ws/subscribe");
            stopped.await();
            return 0;
        }
    }

    @Command(name = "read", description = "Read a node's attributes")
    static final class ReadCommand implements Callable<Integer> {
        @ParentCommand
        UaBridgeCommand parent;

        @Option(names = {"--node"}, required = true, description = "Node id, e.g. ns=2;s=Demo.Counter")
        String node;

        @Override
        public Integer call() throws Exception {
            SessionController controller = parent.connect();
            try {
                NodeAttributes attributes = controller.readNodeAttributes(node);
                System.out.println(Jsons.toJson(attributes));
                return 0;
            } catch (ProtocolException e) {
                System.err.println("Read failed: " + e.getMessage());
                return 1;
            } finally {
                controller.disconnect();
            }
        }
    }

    @Command(name = "write", description = "Write a value, coercing it to the server's type")
    static final class WriteCommand implements Callable<Integer> {
        @ParentCommand
        UaBridgeCommand parent;

        @Option(names = {"--node"}, required = true, description = "Node id")
        String node;

        @Option(names = {"--type"}, defaultValue = "String", description = "Type hint, e.g. Int32, Double, ByteString")
        String type;

        @Option(names = {"--value"}, required = true, description = "Value literal; arrays as [1,2,3]")
        String value;

        @Override
        public Integer call() throws Exception {
            SessionController controller = parent.connect();
            try {
                WriteOutcome outcome = controller.writeValue(node, type, value).get(2, TimeUnit.MINUTES);
                System.out.println(Jsons.toJson(outcome));
                return outcome.success() ? 0 : 1;
            } finally {
                controller.disconnect();
            }
        }
    }

    @Command(name = "browse", description = "List the children of a node")
    static final class BrowseCommand implements Callable<Integer> {
        @ParentCommand
        UaBridgeCommand parent;

        @Option(names = {"--node"}, defaultValue = AddressSpaceCache.OBJECTS_FOLDER, description = "Parent node id (default: Objects folder)")
        String node;

        @Override
        public Integer call() throws Exception {
            SessionController controller = parent.connect();
            try {
                AddressSpaceCache cache = controller.addressSpace();
                if (controller.browse(node) == AddressSpaceCache.BrowseOutcome.ALREADY_IN_FLIGHT) {
                    // The initial Objects browse started by connect may still be running.
                    long deadline = System.nanoTime() + AddressSpaceCache.BROWSE_TIMEOUT.toNanos();
                    while (cache.isBrowsing(node) && System.nanoTime() < deadline) {
                        Thread.sleep(50);
                    }
                }
                if (!cache.hasBrowseBeenPerformed(node)) {
                    System.err.println("Browse failed for " + node);
                    return 1;
                }
                List<AddressSpaceNode> children = new ArrayList<>();
                for (String childId : controller.children(node)) {
                    AddressSpaceNode child = controller.node(childId);
                    if (child != null) {
                        children.add(child);
                    }
                }
                System.out.println(Jsons.toJson(children));
                return 0;
            } finally {
                controller.disconnect();
            }
        }
    }

    @Command(name = "export-tags", description = "Export variable nodes as JSON or CSV")
    static final class ExportTagsCommand implements Callable<Integer> {
        @ParentCommand
        UaBridgeCommand parent;

        @Option(names = {"--node"}, defaultValue = "", description = "Start node (default: Objects folder)")
        String node;

        @Option(names = {"--recursive"}, defaultValue = "true", arity = "1", description = "Descend into sub-folders")
        boolean recursive;

        @Option(names = {"--format"}, defaultValue = "json", description = "json or csv")
        String format;

        @Option(names = {"--out"}, description = "Output file (default: stdout)")
        Path out;

        @Override
        public Integer call() throws Exception {
            String normalized = format.trim().toLowerCase(Locale.ROOT);
            if (!normalized.equals("json") && !normalized.equals("csv")) {
                System.err.println("Unsupported format: " + format);
                return 2;
            }
            SessionController controller = parent.connect();
            try {
                TagCollection collected = controller.collectVariableNodes(node, recursive);
                String rendered = normalized.equals("csv")
                        ? TagCsv.render(collected.tags())
                        : Jsons.toJson(collected.tags());
                if (out == null) {
                    System.out.println(rendered);
                } else {
                    Path parentDir = out.toAbsolutePath().getParent();
                    if (parentDir != null) {
                        Files.createDirectories(parentDir);
                    }
                    Files.writeString(out, rendered, StandardCharsets.UTF_8);
                    System.out.println("Exported " + collected.tags().size() + " tags to " + out);
                }
                if (!collected.complete()) {
                    System.err.println("Export incomplete: " + collected.error());
                    return 1;
                }
                return 0;
            } finally {
                controller.disconnect();
            }
        }
    }

    @Command(name = "cert-ca", description = "Create the local CA (ca.crt/ca.key) if missing")
    static final class CertCaCommand implements Callable<Integer> {
        @Option(names = {"--dir"}, defaultValue = UaBridgeConfig.DEFAULT_CERT_DIR, description = "Certificate directory")
        Path dir;

        @Override
        public Integer call() throws Exception {
            CertificateGenerator.LocalCa ca = CertificateGenerator.ensureLocalCa(dir);
            System.out.println(Jsons.toJson(Map.of(
                    "certificate", ca.certificate().toString(),
                    "privateKey", ca.privateKey().toString()
            )));
            return 0;
        }
    }

    @Command(name = "cert-issue", description = "Issue a client certificate signed by the local CA")
    static final class CertIssueCommand implements Callable<Integer> {
        @Option(names = {"--dir"}, defaultValue = UaBridgeConfig.DEFAULT_CERT_DIR, description = "Certificate directory")
        Path dir;

        @Option(names = {"--self-signed"}, description = "Self-sign instead of using the local CA")
        boolean selfSigned;

        @Option(names = {"--app-uri"}, description = "Application URI placed in the SAN")
        String appUri;

        @Option(names = {"--dns"}, split = ",", description = "Extra DNS names")
        List<String> dns = new ArrayList<>();

        @Option(names = {"--ip"}, split = ",", description = "Extra IP addresses")
        List<String> ips = new ArrayList<>();

        @Option(names = {"--key-size"}, defaultValue = "2048", description = "RSA key size (2048 or 3072)")
        int keySize;

        @Override
        public Integer call() throws Exception {
            CertificateConfig certConfig = CertificateConfig.strict(appUri)
                    .withSans(dns, ips)
                    .withKeySize(keySize);
            CertificateGenerator.GeneratedFiles files = selfSigned
                    ? CertificateGenerator.selfSigned(certConfig, dir)
                    : CertificateGenerator.issueClient(certConfig, dir);
            Map<String, String> payload = new LinkedHashMap<>();
            payload.put("certDer", files.certDer().toString());
            payload.put("certPem", files.certPem().toString());
            payload.put("keyPkcs1", files.keyPkcs1().toString());
            payload.put("keyPkcs8", files.keyPkcs8().toString());
            payload.put("applicationUri", certConfig.applicationUri());
            System.out.println(Jsons.toJson(payload));
            return 0;
        }
    }

    @Command(name = "cert-csr", description = "Generate a certificate request and its PKCS#1 key")
    static final class CertCsrCommand implements Callable<Integer> {
        @Option(names = {"--dir"}, defaultValue = UaBridgeConfig.DEFAULT_CERT_DIR, description = "Output directory")
        Path dir;

        @Option(names = {"--app-uri"}, description = "Application URI placed in the SAN")
        String appUri;

        @Option(names = {"--key-size"}, defaultValue = "2048", description = "RSA key size")
        int keySize;

        @Override
        public Integer call() throws Exception {
            Path csr = dir.resolve("client.csr");
            Path key = dir.resolve("client-request.key");
            CertificateGenerator.generateCsr(CertificateConfig.strict(appUri).withKeySize(keySize), csr, key);
            System.out.println(Jsons.toJson(Map.of("csr", csr.toString(), "key", key.toString())));
            return 0;
        }
    }

    @Command(name = "cert-info", description = "Print a certificate's subject, validity and SANs")
    static final class CertInfoCommand implements Callable<Integer> {
        @Option(names = {"--cert"}, required = true, description = "Certificate file (PEM or DER)")
        Path cert;

        @Override
        public Integer call() throws Exception {
            System.out.println(Jsons.toJson(CertificateGenerator.certificateInfo(cert)));
            return 0;
        }
    }

    @Command(name = "cert-validate", description = "Check a certificate's validity and that the key matches it")
    static final class CertValidateCommand implements Callable<Integer> {
        @Option(names = {"--cert"}, required = true, description = "Certificate file (PEM or DER)")
        Path cert;

        @Option(names = {"--key"}, required = true, description = "Private key file (PEM or DER)")
        Path key;

        @Override
        public Integer call() {
            try {
                CertificateGenerator.validate(cert, key);
            } catch (Exception e) {
                System.err.println("Invalid: " + e.getMessage());
                return 1;
            }
            System.out.println(Jsons.toJson(Map.of("valid", true, "cert", cert.toString(), "key", key.toString())));
            return 0;
        }
    }
}
