package io.uabridge.protocol.milo;

import io.uabridge.protocol.ProtocolClient;
import io.uabridge.protocol.ProtocolException;
import io.uabridge.protocol.ProtocolSession;
import io.uabridge.protocol.SecurityMode;
import io.uabridge.protocol.SessionOptions;
import io.uabridge.protocol.UserIdentity;
import org.eclipse.milo.opcua.sdk.client.OpcUaClient;
import org.eclipse.milo.opcua.sdk.client.api.config.OpcUaClientConfig;
import org.eclipse.milo.opcua.sdk.client.api.config.OpcUaClientConfigBuilder;
import org.eclipse.milo.opcua.sdk.client.api.identity.AnonymousProvider;
import org.eclipse.milo.opcua.sdk.client.api.identity.IdentityProvider;
import org.eclipse.milo.opcua.sdk.client.api.identity.UsernameProvider;
import org.eclipse.milo.opcua.stack.client.DiscoveryClient;
import org.eclipse.milo.opcua.stack.client.security.ClientCertificateValidator;
import org.eclipse.milo.opcua.stack.client.security.DefaultClientCertificateValidator;
import org.eclipse.milo.opcua.stack.core.UaException;
import org.eclipse.milo.opcua.stack.core.security.DefaultTrustListManager;
import org.eclipse.milo.opcua.stack.core.types.builtin.LocalizedText;
import org.eclipse.milo.opcua.stack.core.types.enumerated.MessageSecurityMode;
import org.eclipse.milo.opcua.stack.core.types.enumerated.UserTokenType;
import org.eclipse.milo.opcua.stack.core.types.structured.EndpointDescription;
import org.eclipse.milo.opcua.stack.core.types.structured.UserTokenPolicy;
import org.eclipse.milo.opcua.stack.core.util.EndpointUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.security.KeyPair;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.Unsigned.uint;

/**
 * Opens sessions with the Eclipse Milo client SDK: discovers the server's endpoints, picks the
 * one matching the requested policy and mode, and connects with the provisioned identity.
 */
public final class MiloProtocolClient implements ProtocolClient {
    private static final Logger log = LoggerFactory.getLogger(MiloProtocolClient.class);
    private static final String APPLICATION_NAME = "UaBridge Client";
    private static final long REQUEST_TIMEOUT_MS = 5_000L;

    @Override
    public ProtocolSession open(SessionOptions options, Duration timeout) throws ProtocolException {
        long timeoutMs = Math.max(1L, timeout.toMillis());
        EndpointDescription endpoint = selectEndpoint(options, discover(options.endpointUrl(), timeoutMs));
        OpcUaClient client;
        try {
            client = OpcUaClient.create(buildConfig(options, endpoint));
        } catch (UaException e) {
            throw new ProtocolException(ProtocolException.Kind.FAILURE, "Failed to create client: " + e.getMessage(), e);
        }
        try {
            client.connect().get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            client.disconnect();
            throw new ProtocolException(ProtocolException.Kind.FAILURE, "connect interrupted", e);
        } catch (TimeoutException e) {
            client.disconnect();
            throw new ProtocolException(ProtocolException.Kind.TIMEOUT, "connect timed out after " + timeoutMs + " ms", e);
        } catch (ExecutionException e) {
            client.disconnect();
            throw MiloErrors.translate("connect", e.getCause());
        }
        log.info("Session established with {} ({}, {})", options.endpointUrl(),
                endpoint.getSecurityPolicyUri(), endpoint.getSecurityMode());
        return new MiloProtocolSession(client, options.endpointUrl());
    }

    private static List<EndpointDescription> discover(String endpointUrl, long timeoutMs) throws ProtocolException {
        try {
            return DiscoveryClient.getEndpoints(endpointUrl).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProtocolException(ProtocolException.Kind.FAILURE, "endpoint discovery interrupted", e);
        } catch (TimeoutException e) {
            throw new ProtocolException(ProtocolException.Kind.TIMEOUT, "endpoint discovery timed out after " + timeoutMs + " ms", e);
        } catch (ExecutionException e) {
            throw MiloErrors.translate("endpoint discovery", e.getCause());
        }
    }

    /**
     * Picks the endpoint with the requested policy and mode. When a user token policy id is
     * configured, endpoints advertising it win. The advertised host is replaced by the one the
     * caller dialled, since servers often report an unreachable hostname.
     */
    static EndpointDescription selectEndpoint(SessionOptions options, List<EndpointDescription> endpoints)
            throws ProtocolException {
        MessageSecurityMode mode = toMessageSecurityMode(options.securityMode());
        String policyId = options.identity() == null ? null : options.identity().policyId();
        EndpointDescription fallback = null;
        for (EndpointDescription candidate : endpoints) {
            if (!options.securityPolicyUri().equals(candidate.getSecurityPolicyUri()) || candidate.getSecurityMode() != mode) {
                continue;
            }
            if (policyId == null || advertisesPolicy(candidate, policyId)) {
                return EndpointUtil.updateUrl(candidate, EndpointUtil.getHost(options.endpointUrl()));
            }
            if (fallback == null) {
                fallback = candidate;
            }
        }
        if (fallback != null) {
            log.warn("No endpoint advertises user token policy '{}'; using {}", policyId, fallback.getEndpointUrl());
            return EndpointUtil.updateUrl(fallback, EndpointUtil.getHost(options.endpointUrl()));
        }
        throw new ProtocolException(ProtocolException.Kind.FAILURE, "no endpoint matches policy "
                + options.securityPolicyUri() + " with mode " + options.securityMode().displayName());
    }

    private static boolean advertisesPolicy(EndpointDescription endpoint, String policyId) {
        UserTokenPolicy[] tokens = endpoint.getUserIdentityTokens();
        if (tokens == null) {
            return false;
        }
        for (UserTokenPolicy token : tokens) {
            if (policyId.equals(token.getPolicyId())) {
                return true;
            }
        }
        return false;
    }

    private static OpcUaClientConfig buildConfig(SessionOptions options, EndpointDescription endpoint) throws ProtocolException {
        OpcUaClientConfigBuilder builder = OpcUaClientConfig.builder()
                .setEndpoint(endpoint)
                .setApplicationName(LocalizedText.english(APPLICATION_NAME))
                .setApplicationUri(options.applicationUri())
                .setProductUri(options.productUri())
                .setIdentityProvider(identityProvider(options.identity(), endpoint))
                .setCertificateValidator(certificateValidator(options))
                .setRequestTimeout(uint(REQUEST_TIMEOUT_MS))
                .setSessionName(options::sessionName)
                .setSessionTimeout(uint(options.sessionTimeout().toMillis()));
        X509Certificate certificate = options.certificate();
        if (certificate != null && options.privateKey() != null) {
            builder.setKeyPair(new KeyPair(certificate.getPublicKey(), options.privateKey()))
                    .setCertificate(certificate)
                    .setCertificateChain(options.certificateChain().toArray(new X509Certificate[0]));
        }
        return builder.build();
    }

    private static IdentityProvider identityProvider(UserIdentity identity, EndpointDescription endpoint) {
        if (identity == null || identity.type() == UserIdentity.Type.ANONYMOUS) {
            return AnonymousProvider.INSTANCE;
        }
        if (!supportsToken(endpoint, UserTokenType.UserName)) {
            log.warn("Endpoint {} does not advertise a username token policy", endpoint.getEndpointUrl());
        }
        return new UsernameProvider(identity.username(), identity.password());
    }

    private static boolean supportsToken(EndpointDescription endpoint, UserTokenType type) {
        UserTokenPolicy[] tokens = endpoint.getUserIdentityTokens();
        if (tokens == null) {
            return false;
        }
        for (UserTokenPolicy token : tokens) {
            if (token.getTokenType() == type) {
                return true;
            }
        }
        return false;
    }

    // Without a PKI directory the server certificate is accepted as presented.
    private static ClientCertificateValidator certificateValidator(SessionOptions options) throws ProtocolException {
        if (options.pkiDir() == null) {
            return new ClientCertificateValidator.InsecureValidator();
        }
        try {
            return new DefaultClientCertificateValidator(new DefaultTrustListManager(options.pkiDir().toFile()));
        } catch (IOException e) {
            throw new ProtocolException(ProtocolException.Kind.FAILURE,
                    "Failed to open trust list in " + options.pkiDir() + ": " + e.getMessage(), e);
        }
    }

    static MessageSecurityMode toMessageSecurityMode(SecurityMode mode) {
        return switch (mode) {
            case NONE -> MessageSecurityMode.None;
            case SIGN -> MessageSecurityMode.Sign;
            case SIGN_AND_ENCRYPT -> MessageSecurityMode.SignAndEncrypt;
        };
    }
}
