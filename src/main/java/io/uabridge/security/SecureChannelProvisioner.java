package io.uabridge.security;

import io.uabridge.config.UaBridgeConfig;
import io.uabridge.protocol.SecurityMode;
import io.uabridge.protocol.SessionOptions;
import io.uabridge.protocol.UserIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.cert.CertificateException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Translates {@link UaBridgeConfig} into {@link SessionOptions}: policy and mode, identity,
 * client key material and the application identity advertised to the server.
 */
public final class SecureChannelProvisioner {
    private static final Logger log = LoggerFactory.getLogger(SecureChannelProvisioner.class);

    public static final String POLICY_NONE = "http://opcfoundation.org/UA/SecurityPolicy#None";
    private static final String POLICY_PREFIX = "http://opcfoundation.org/UA/SecurityPolicy#";

    private static final Map<String, String> POLICY_ALIASES = Map.ofEntries(
            Map.entry("none", POLICY_NONE),
            Map.entry("basic128rsa15", POLICY_PREFIX + "Basic128Rsa15"),
            Map.entry("basic256", POLICY_PREFIX + "Basic256"),
            Map.entry("basic256sha256", POLICY_PREFIX + "Basic256Sha256"),
            Map.entry("aes128_sha256_rsaoaep", POLICY_PREFIX + "Aes128_Sha256_RsaOaep"),
            Map.entry("aes128sha256rsaoaep", POLICY_PREFIX + "Aes128_Sha256_RsaOaep"),
            Map.entry("aes256_sha256_rsapss", POLICY_PREFIX + "Aes256_Sha256_RsaPss"),
            Map.entry("aes256sha256rsapss", POLICY_PREFIX + "Aes256_Sha256_RsaPss")
    );

    private SecureChannelProvisioner() {
    }

    /**
     * Builds session options. Rejected combinations raise {@link IllegalArgumentException};
     * unreadable, expired or mismatched key material raises {@link GeneralSecurityException}.
     */
    public static SessionOptions provision(UaBridgeConfig config) throws IOException, GeneralSecurityException {
        SecurityMode mode = resolveMode(config.securityMode());
        String policyUri = resolvePolicyUri(config.securityPolicy(), mode);
        boolean nonePolicy = POLICY_NONE.equals(policyUri);
        if (nonePolicy && mode != SecurityMode.NONE) {
            throw new IllegalArgumentException("security policy None requires security mode None (got " + mode.displayName() + ")");
        }
        if (!nonePolicy && mode == SecurityMode.NONE) {
            throw new IllegalArgumentException("security mode None requires security policy None (got " + config.securityPolicy() + ")");
        }
        UserIdentity identity = resolveIdentity(config);

        String applicationUri = config.applicationUri() == null ? "" : config.applicationUri().trim();
        KeyMaterial material = null;
        if (mode != SecurityMode.NONE) {
            material = loadKeyMaterial(config, applicationUri);
            if (material != null && applicationUri.isEmpty()) {
                applicationUri = material.applicationUri();
            }
        }
        if (applicationUri.isEmpty()) {
            applicationUri = CertificateConfig.defaultApplicationUri();
        }
        String sessionName = config.sessionName() == null || config.sessionName().isBlank()
                ? applicationUri
                : config.sessionName().trim();
        Path pkiDir = config.pkiDir() == null || config.pkiDir().isBlank() ? null : Path.of(config.pkiDir());

        return new SessionOptions(
                config.endpointUrl(),
                policyUri,
                mode,
                identity,
                applicationUri,
                config.productUri(),
                sessionName,
                config.sessionTimeout(),
                material == null ? null : material.privateKey(),
                material == null ? null : material.certificate(),
                material == null ? List.of() : material.chain(),
                pkiDir
        );
    }

    public static SecurityMode resolveMode(String raw) {
        if (raw != null && "auto".equalsIgnoreCase(raw.trim())) {
            return SecurityMode.NONE;
        }
        return SecurityMode.fromString(raw);
    }

    /**
     * Maps a short policy name or a full policy URI to the policy URI.
     */
    public static String resolvePolicyUri(String raw, SecurityMode mode) {
        String policy = raw == null ? "" : raw.replace(" ", "").trim();
        String key = policy.toLowerCase(Locale.ROOT);
        if (key.isEmpty() || "auto".equals(key)) {
            if (mode == SecurityMode.NONE) {
                return POLICY_NONE;
            }
            throw new IllegalArgumentException("security policy required for mode " + mode.displayName());
        }
        String alias = POLICY_ALIASES.get(key);
        if (alias != null) {
            return alias;
        }
        if (key.startsWith("http")) {
            return policy;
        }
        throw new IllegalArgumentException("unsupported security policy: " + raw);
    }

    static UserIdentity resolveIdentity(UaBridgeConfig config) {
        String policyId = config.userTokenPolicyId() == null || config.userTokenPolicyId().isBlank()
                ? null
                : config.userTokenPolicyId().trim();
        String auth = config.authMode() == null ? "" : config.authMode().trim().toLowerCase(Locale.ROOT);
        return switch (auth) {
            case "", "anonymous" -> UserIdentity.anonymous(policyId);
            case "username" -> {
                if (config.username() == null || config.username().isBlank()) {
                    throw new IllegalArgumentException("username is required for authMode username");
                }
                yield UserIdentity.username(config.username(), config.password() == null ? "" : config.password(), policyId);
            }
            case "certificate" -> throw new IllegalArgumentException(
                    "unsupported authentication mode: certificate (user-certificate tokens are not implemented)");
            default -> throw new IllegalArgumentException("unsupported authentication mode: " + config.authMode());
        };
    }

    private static KeyMaterial loadKeyMaterial(UaBridgeConfig config, String applicationUri)
            throws IOException, GeneralSecurityException {
        boolean hasCert = config.certFile() != null && !config.certFile().isBlank();
        boolean hasKey = config.keyFile() != null && !config.keyFile().isBlank();
        if (hasCert != hasKey) {
            throw new IllegalArgumentException("both certificate and key paths must be set or both empty");
        }
        Path certPath;
        Path keyPath;
        if (hasCert) {
            certPath = Path.of(config.certFile());
            keyPath = Path.of(config.keyFile());
        } else if (config.autoGenerateCert()) {
            CertificateGenerator.GeneratedFiles files = CertificateGenerator.issueClient(
                    CertificateConfig.strict(applicationUri), Path.of(config.certDir()));
            log.info("Generated client certificate {} for secure channel", files.certDer());
            certPath = files.certDer();
            keyPath = files.keyPkcs1();
        } else {
            log.warn("No client certificate configured for security mode {}; opening the channel without one",
                    config.securityMode());
            return null;
        }
        KeyMaterial material = KeyMaterial.load(certPath, keyPath);
        CertificateGenerator.checkValidity(material.certificate());
        if (!KeyMaterial.matches(material.certificate(), material.privateKey())) {
            throw new CertificateException("private key does not match any certificate in " + certPath);
        }
        return material;
    }
}
