package io.uabridge.protocol;

import java.nio.file.Path;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.List;

/**
 * Everything the protocol layer needs to open one session. Built by the secure-channel
 * provisioner; {@code privateKey} and {@code certificate} are null for unsecured channels.
 */
public record SessionOptions(
        String endpointUrl,
        String securityPolicyUri,
        SecurityMode securityMode,
        UserIdentity identity,
        String applicationUri,
        String productUri,
        String sessionName,
        Duration sessionTimeout,
        PrivateKey privateKey,
        X509Certificate certificate,
        List<X509Certificate> certificateChain,
        Path pkiDir
) {
    public SessionOptions {
        certificateChain = certificateChain == null ? List.of() : List.copyOf(certificateChain);
    }

    public boolean secured() {
        return securityMode != SecurityMode.NONE;
    }
}
