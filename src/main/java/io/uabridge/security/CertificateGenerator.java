package io.uabridge.security;

import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.ExtensionsGenerator;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.bouncycastle.pkcs.jcajce.JcaPKCS10CertificationRequestBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Local CA bootstrap, client certificate issuance, CSR generation and validation.
 *
 * <p>Every issued client certificate is written as DER ({@code .der}), PEM ({@code .crt}),
 * PKCS#1 PEM key ({@code .key}) and PKCS#8 PEM key ({@code .pem}).
 */
public final class CertificateGenerator {
    private static final Logger log = LoggerFactory.getLogger(CertificateGenerator.class);
    private static final String SIGNATURE_ALGORITHM = "SHA256withRSA";
    private static final String CLIENT_CN = "UaBridge";
    private static final String CA_CN = "UaBridge Local CA";
    private static final Duration BACKDATE = Duration.ofMinutes(5);
    private static final SecureRandom RANDOM = new SecureRandom();

    public record LocalCa(Path certificate, Path privateKey) {
    }

    public record GeneratedFiles(Path certDer, Path certPem, Path keyPkcs1, Path keyPkcs8) {
    }

    private CertificateGenerator() {
    }

    /**
     * Creates {@code ca.crt}/{@code ca.key} under {@code dir} unless both already exist.
     */
    public static LocalCa ensureLocalCa(Path dir) throws IOException, GeneralSecurityException {
        Path crt = dir.resolve("ca.crt");
        Path key = dir.resolve("ca.key");
        if (Files.exists(crt) && Files.exists(key)) {
            return new LocalCa(crt, key);
        }
        Files.createDirectories(dir);
        KeyPair pair = generateKeyPair(CertificateConfig.DEFAULT_KEY_SIZE);
        X500Name subject = new X500NameBuilder(BCStyle.INSTANCE)
                .addRDN(BCStyle.CN, CA_CN)
                .addRDN(BCStyle.O, "UaBridge")
                .addRDN(BCStyle.C, "US")
                .addRDN(BCStyle.ST, "CA")
                .addRDN(BCStyle.L, "San Francisco")
                .build();
        Instant notBefore = Instant.now().minus(BACKDATE);
        Instant notAfter = notBefore.plus(Duration.ofDays(CertificateConfig.DEFAULT_VALIDITY_DAYS));
        JcaX509ExtensionUtils utils = new JcaX509ExtensionUtils();
        try {
            X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
                    subject, serial(), Date.from(notBefore), Date.from(notAfter), subject, pair.getPublic());
            builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(0));
            builder.addExtension(Extension.keyUsage, true, new KeyUsage(KeyUsage.keyCertSign | KeyUsage.cRLSign));
            builder.addExtension(Extension.subjectKeyIdentifier, false, utils.createSubjectKeyIdentifier(pair.getPublic()));
            builder.addExtension(Extension.authorityKeyIdentifier, false, utils.createAuthorityKeyIdentifier(pair.getPublic()));
            X509Certificate certificate = sign(builder, pair.getPrivate());
            PemFiles.writePem(crt, certificate);
            PemFiles.writePkcs1Key(key, pair.getPrivate());
        } catch (OperatorCreationException e) {
            throw new GeneralSecurityException("Failed to sign CA certificate", e);
        }
        log.info("Created local CA in {}", dir);
        return new LocalCa(crt, key);
    }

    /**
     * Issues a client certificate signed by the local CA in {@code dir}, creating the CA first
     * when needed. Writes {@code client.der}, {@code client.crt}, {@code client.key}, {@code client.pem}.
     */
    public static GeneratedFiles issueClient(CertificateConfig config, Path dir) throws IOException, GeneralSecurityException {
        LocalCa ca = ensureLocalCa(dir);
        X509Certificate caCert = PemFiles.readCertificate(ca.certificate());
        PrivateKey caKey = PemFiles.readPrivateKey(ca.privateKey());
        KeyPair pair = generateKeyPair(config.keySize());
        X500Name issuer = X500Name.getInstance(caCert.getSubjectX500Principal().getEncoded());
        JcaX509ExtensionUtils utils = new JcaX509ExtensionUtils();
        try {
            X509v3CertificateBuilder builder = clientBuilder(config, issuer, pair.getPublic());
            builder.addExtension(Extension.authorityKeyIdentifier, false, utils.createAuthorityKeyIdentifier(caCert));
            X509Certificate certificate = sign(builder, caKey);
            GeneratedFiles files = write(dir, "client", certificate, pair.getPrivate());
            log.info("Issued CA-signed client certificate {}", files.certDer());
            return files;
        } catch (OperatorCreationException e) {
            throw new GeneralSecurityException("Failed to sign client certificate", e);
        }
    }

    /**
     * Issues a self-signed client certificate: {@code selfsigned.der/.crt/.key/.pem}.
     */
    public static GeneratedFiles selfSigned(CertificateConfig config, Path dir) throws IOException, GeneralSecurityException {
        Files.createDirectories(dir);
        KeyPair pair = generateKeyPair(config.keySize());
        JcaX509ExtensionUtils utils = new JcaX509ExtensionUtils();
        try {
            X509v3CertificateBuilder builder = clientBuilder(config, subject(config), pair.getPublic());
            builder.addExtension(Extension.authorityKeyIdentifier, false, utils.createAuthorityKeyIdentifier(pair.getPublic()));
            X509Certificate certificate = sign(builder, pair.getPrivate());
            GeneratedFiles files = write(dir, "selfsigned", certificate, pair.getPrivate());
            log.info("Issued self-signed client certificate {}", files.certDer());
            return files;
        } catch (OperatorCreationException e) {
            throw new GeneralSecurityException("Failed to sign self-signed certificate", e);
        }
    }

    /**
     * Writes a PEM certificate request and its PKCS#1 key for signing by an external CA.
     */
    public static void generateCsr(CertificateConfig config, Path csrPath, Path keyPath) throws IOException, GeneralSecurityException {
        createParent(csrPath);
        createParent(keyPath);
        KeyPair pair = generateKeyPair(config.keySize());
        try {
            JcaPKCS10CertificationRequestBuilder builder = new JcaPKCS10CertificationRequestBuilder(subject(config), pair.getPublic());
            GeneralNames names = subjectAltNames(config);
            if (names != null) {
                ExtensionsGenerator extensions = new ExtensionsGenerator();
                extensions.addExtension(Extension.subjectAlternativeName, false, names);
                builder.addAttribute(PKCSObjectIdentifiers.pkcs_9_at_extensionRequest, extensions.generate());
            }
            ContentSigner signer = new JcaContentSignerBuilder(SIGNATURE_ALGORITHM).build(pair.getPrivate());
            PKCS10CertificationRequest request = builder.build(signer);
            PemFiles.writePem(csrPath, request);
            PemFiles.writePkcs1Key(keyPath, pair.getPrivate());
        } catch (OperatorCreationException e) {
            throw new GeneralSecurityException("Failed to sign certificate request", e);
        }
    }

    /**
     * Checks the validity window of {@code certPath} and that {@code keyPath} holds its private key.
     */
    public static void validate(Path certPath, Path keyPath) throws IOException, GeneralSecurityException {
        X509Certificate certificate = PemFiles.readCertificate(certPath);
        checkValidity(certificate);
        PrivateKey key = PemFiles.readPrivateKey(keyPath);
        if (!KeyMaterial.matches(certificate, key)) {
            throw new CertificateException("private key does not match certificate public key");
        }
    }

    public static void checkValidity(X509Certificate certificate) throws CertificateException {
        Date now = new Date();
        if (now.before(certificate.getNotBefore())) {
            throw new CertificateException("certificate is not yet valid (valid from " + certificate.getNotBefore().toInstant() + ")");
        }
        if (now.after(certificate.getNotAfter())) {
            throw new CertificateException("certificate has expired (expired on " + certificate.getNotAfter().toInstant() + ")");
        }
    }

    public static CertificateInfo certificateInfo(Path certPath) throws IOException, GeneralSecurityException {
        return CertificateInfo.of(PemFiles.readCertificate(certPath));
    }

    private static X509v3CertificateBuilder clientBuilder(CertificateConfig config, X500Name issuer, PublicKey publicKey)
            throws IOException, GeneralSecurityException {
        Instant notBefore = Instant.now().minus(BACKDATE);
        Instant notAfter = notBefore.plus(Duration.ofDays(config.validityDays()));
        X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
                issuer, serial(), Date.from(notBefore), Date.from(notAfter), subject(config), publicKey);
        builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(false));
        builder.addExtension(Extension.keyUsage, true,
                new KeyUsage(KeyUsage.digitalSignature | KeyUsage.keyEncipherment | KeyUsage.nonRepudiation | KeyUsage.dataEncipherment));
        builder.addExtension(Extension.extendedKeyUsage, false,
                new ExtendedKeyUsage(new KeyPurposeId[]{KeyPurposeId.id_kp_clientAuth, KeyPurposeId.id_kp_serverAuth}));
        builder.addExtension(Extension.subjectKeyIdentifier, false, new JcaX509ExtensionUtils().createSubjectKeyIdentifier(publicKey));
        GeneralNames names = subjectAltNames(config);
        if (names != null) {
            builder.addExtension(Extension.subjectAlternativeName, false, names);
        }
        return builder;
    }

    private static X500Name subject(CertificateConfig config) {
        X500NameBuilder builder = new X500NameBuilder(BCStyle.INSTANCE);
        builder.addRDN(BCStyle.CN, config.commonName() == null || config.commonName().isBlank() ? CLIENT_CN : config.commonName());
        addIfPresent(builder, BCStyle.O, config.organization());
        addIfPresent(builder, BCStyle.OU, config.organizationalUnit());
        addIfPresent(builder, BCStyle.C, config.country());
        addIfPresent(builder, BCStyle.ST, config.province());
        addIfPresent(builder, BCStyle.L, config.locality());
        return builder.build();
    }

    private static void addIfPresent(X500NameBuilder builder, ASN1ObjectIdentifier attribute, String value) {
        if (value != null && !value.isBlank()) {
            builder.addRDN(attribute, value);
        }
    }

    private static GeneralNames subjectAltNames(CertificateConfig config) {
        List<GeneralName> names = new ArrayList<>();
        if (config.applicationUri() != null && !config.applicationUri().isBlank()) {
            names.add(new GeneralName(GeneralName.uniformResourceIdentifier, config.applicationUri().trim()));
        }
        for (String dns : config.dnsNames()) {
            names.add(new GeneralName(GeneralName.dNSName, dns));
        }
        for (String ip : config.ipAddresses()) {
            names.add(new GeneralName(GeneralName.iPAddress, ip));
        }
        if (names.isEmpty()) {
            return null;
        }
        return new GeneralNames(names.toArray(new GeneralName[0]));
    }

    private static GeneratedFiles write(Path dir, String stem, X509Certificate certificate, PrivateKey key)
            throws IOException, GeneralSecurityException {
        GeneratedFiles files = new GeneratedFiles(
                dir.resolve(stem + ".der"),
                dir.resolve(stem + ".crt"),
                dir.resolve(stem + ".key"),
                dir.resolve(stem + ".pem")
        );
        Files.write(files.certDer(), certificate.getEncoded());
        PemFiles.writePem(files.certPem(), certificate);
        PemFiles.writePkcs1Key(files.keyPkcs1(), key);
        PemFiles.writePkcs8Key(files.keyPkcs8(), key);
        return files;
    }

    private static X509Certificate sign(X509v3CertificateBuilder builder, PrivateKey signingKey)
            throws OperatorCreationException, CertificateException {
        ContentSigner signer = new JcaContentSignerBuilder(SIGNATURE_ALGORITHM).build(signingKey);
        return new JcaX509CertificateConverter().getCertificate(builder.build(signer));
    }

    static KeyPair generateKeyPair(int bits) throws GeneralSecurityException {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(bits, RANDOM);
        return generator.generateKeyPair();
    }

    private static BigInteger serial() {
        return new BigInteger(127, RANDOM);
    }

    private static void createParent(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
