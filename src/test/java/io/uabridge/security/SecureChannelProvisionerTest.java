package io.uabridge.security;

import io.uabridge.config.UaBridgeConfig;
import io.uabridge.protocol.SecurityMode;
import io.uabridge.protocol.SessionOptions;
import io.uabridge.protocol.UserIdentity;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.cert.CertificateException;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Stream;

final class SecureChannelProvisionerTest {

    @Test
    void anonymousUnsecuredChannelNeedsNoKeyMaterial() throws Exception {
        SessionOptions options = SecureChannelProvisioner.provision(UaBridgeConfig.defaults());

        Assertions.assertEquals(SecureChannelProvisioner.POLICY_NONE, options.securityPolicyUri());
        Assertions.assertEquals(SecurityMode.NONE, options.securityMode());
        Assertions.assertFalse(options.secured());
        Assertions.assertNull(options.certificate());
        Assertions.assertNull(options.privateKey());
        Assertions.assertEquals(UserIdentity.Type.ANONYMOUS, options.identity().type());
        Assertions.assertFalse(options.applicationUri().isBlank());
    }

    @Test
    void policyNoneWithSigningModeIsRejected() {
        UaBridgeConfig config = config(Map.of("securityPolicy", "None", "securityMode", "Sign"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> SecureChannelProvisioner.provision(config));
    }

    @Test
    void modeNoneWithRealPolicyIsRejected() {
        UaBridgeConfig config = config(Map.of("securityPolicy", "Basic256Sha256", "securityMode", "None"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> SecureChannelProvisioner.provision(config));
    }

    @Test
    void resolvesPolicyAliasesAndUris() {
        Assertions.assertEquals("http://opcfoundation.org/UA/SecurityPolicy#Aes128_Sha256_RsaOaep",
                SecureChannelProvisioner.resolvePolicyUri("Aes128_Sha256_RsaOaep", SecurityMode.SIGN));
        Assertions.assertEquals("http://opcfoundation.org/UA/SecurityPolicy#Basic256Sha256",
                SecureChannelProvisioner.resolvePolicyUri("basic256sha256", SecurityMode.SIGN_AND_ENCRYPT));
        Assertions.assertEquals(SecureChannelProvisioner.POLICY_NONE,
                SecureChannelProvisioner.resolvePolicyUri("auto", SecurityMode.NONE));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> SecureChannelProvisioner.resolvePolicyUri("", SecurityMode.SIGN));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> SecureChannelProvisioner.resolvePolicyUri("Rot13", SecurityMode.SIGN));
    }

    @Test
    void identityFollowsAuthMode() throws Exception {
        SessionOptions options = SecureChannelProvisioner.provision(
                config(Map.of("authMode", "username", "username", "operator", "password", "pw")));
        Assertions.assertEquals(UserIdentity.Type.USERNAME, options.identity().type());
        Assertions.assertEquals("operator", options.identity().username());

        Assertions.assertThrows(IllegalArgumentException.class,
                () -> SecureChannelProvisioner.provision(config(Map.of("authMode", "username"))));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> SecureChannelProvisioner.provision(config(Map.of("authMode", "certificate"))));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> SecureChannelProvisioner.provision(config(Map.of("authMode", "kerberos"))));
    }

    @Test
    void securedChannelLoadsConfiguredCertificate() throws Exception {
        Path root = Files.createTempDirectory("uabridge-provision-");
        try {
            CertificateGenerator.GeneratedFiles files = CertificateGenerator.selfSigned(
                    CertificateConfig.strict("urn:test:uabridge"), root);
            Map<String, Object> overrides = new HashMap<>();
            overrides.put("securityPolicy", "Basic256Sha256");
            overrides.put("securityMode", "SignAndEncrypt");
            overrides.put("certFile", files.certDer().toString());
            overrides.put("keyFile", files.keyPkcs1().toString());

            SessionOptions options = SecureChannelProvisioner.provision(config(overrides));

            Assertions.assertTrue(options.secured());
            Assertions.assertNotNull(options.certificate());
            Assertions.assertNotNull(options.privateKey());
            Assertions.assertEquals("urn:test:uabridge", options.applicationUri());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void chainBundleWithCaFirstSelectsTheMatchingLeaf() throws Exception {
        Path root = Files.createTempDirectory("uabridge-bundle-");
        try {
            CertificateGenerator.GeneratedFiles files = CertificateGenerator.issueClient(
                    CertificateConfig.strict("urn:test:bundle"), root);
            Path bundle = root.resolve("bundle.pem");
            Files.writeString(bundle, Files.readString(root.resolve("ca.crt")) + Files.readString(files.certPem()));
            Map<String, Object> overrides = new HashMap<>();
            overrides.put("securityPolicy", "Basic256Sha256");
            overrides.put("securityMode", "Sign");
            overrides.put("certFile", bundle.toString());
            overrides.put("keyFile", files.keyPkcs1().toString());

            SessionOptions options = SecureChannelProvisioner.provision(config(overrides));

            Assertions.assertEquals(PemFiles.readCertificate(files.certPem()), options.certificate());
            Assertions.assertEquals(2, options.certificateChain().size());
            Assertions.assertEquals(options.certificate(), options.certificateChain().get(0));
            Assertions.assertEquals("urn:test:bundle", options.applicationUri());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void securedChannelWithoutCertificateProceedsWithoutKeyMaterial() throws Exception {
        UaBridgeConfig config = config(Map.of("securityPolicy", "Basic256Sha256", "securityMode", "Sign"));
        SessionOptions options = SecureChannelProvisioner.provision(config);
        Assertions.assertTrue(options.secured());
        Assertions.assertEquals(SecurityMode.SIGN, options.securityMode());
        Assertions.assertNull(options.certificate());
        Assertions.assertNull(options.privateKey());
        Assertions.assertTrue(options.certificateChain().isEmpty());
        Assertions.assertFalse(options.applicationUri().isBlank());
    }

    @Test
    void halfConfiguredCertificatePairIsRejected() {
        UaBridgeConfig halfConfigured = config(Map.of("securityPolicy", "Basic256Sha256", "securityMode", "Sign",
                "certFile", "client.der"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> SecureChannelProvisioner.provision(halfConfigured));
    }

    @Test
    void autoGeneratedCertificateIsIssuedByLocalCa() throws Exception {
        Path root = Files.createTempDirectory("uabridge-autogen-");
        try {
            Map<String, Object> overrides = new HashMap<>();
            overrides.put("securityPolicy", "Basic256Sha256");
            overrides.put("securityMode", "Sign");
            overrides.put("autoGenerateCert", true);
            overrides.put("certDir", root.toString());
            overrides.put("applicationUri", "urn:test:auto");

            SessionOptions options = SecureChannelProvisioner.provision(config(overrides));

            Assertions.assertTrue(Files.exists(root.resolve("ca.crt")));
            Assertions.assertTrue(Files.exists(root.resolve("client.der")));
            Assertions.assertEquals("urn:test:auto", options.applicationUri());
            Assertions.assertNotNull(options.certificate());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void mismatchedKeyIsRejected() throws Exception {
        Path root = Files.createTempDirectory("uabridge-mismatch-");
        try {
            CertificateGenerator.GeneratedFiles first = CertificateGenerator.selfSigned(
                    CertificateConfig.strict("urn:test:one"), root.resolve("one"));
            CertificateGenerator.GeneratedFiles second = CertificateGenerator.selfSigned(
                    CertificateConfig.strict("urn:test:two"), root.resolve("two"));

            CertificateGenerator.validate(first.certPem(), first.keyPkcs8());
            Assertions.assertThrows(CertificateException.class,
                    () -> CertificateGenerator.validate(first.certDer(), second.keyPkcs1()));

            Map<String, Object> overrides = new HashMap<>();
            overrides.put("securityPolicy", "Basic256Sha256");
            overrides.put("securityMode", "SignAndEncrypt");
            overrides.put("certFile", first.certDer().toString());
            overrides.put("keyFile", second.keyPkcs1().toString());
            Assertions.assertThrows(GeneralSecurityException.class,
                    () -> SecureChannelProvisioner.provision(config(overrides)));
        } finally {
            deleteRecursively(root);
        }
    }

    private static UaBridgeConfig config(Map<String, ?> overrides) {
        return UaBridgeConfig.defaults().with(overrides);
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
