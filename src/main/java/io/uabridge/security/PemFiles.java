package io.uabridge.security;

import org.bouncycastle.asn1.DERNull;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.openssl.jcajce.JcaPKCS8Generator;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.security.interfaces.RSAPrivateKey;
import java.util.ArrayList;
import java.util.List;

/**
 * PEM/DER reading and writing for keys, certificates and requests.
 */
final class PemFiles {
    private static final String PEM_MARKER = "-----BEGIN";

    private PemFiles() {
    }

    /**
     * Reads every certificate in a PEM bundle, or the single certificate of a DER file.
     */
    static List<X509Certificate> readCertificates(Path path) throws IOException, GeneralSecurityException {
        byte[] bytes = Files.readAllBytes(path);
        String text = new String(bytes, StandardCharsets.US_ASCII);
        if (!text.contains(PEM_MARKER)) {
            CertificateFactory factory = CertificateFactory.getInstance("X.509");
            return List.of((X509Certificate) factory.generateCertificate(new ByteArrayInputStream(bytes)));
        }
        JcaX509CertificateConverter converter = new JcaX509CertificateConverter();
        List<X509Certificate> out = new ArrayList<>();
        try (PEMParser parser = new PEMParser(new StringReader(text))) {
            Object item;
            while ((item = parser.readObject()) != null) {
                if (item instanceof X509CertificateHolder holder) {
                    out.add(converter.getCertificate(holder));
                }
            }
        }
        if (out.isEmpty()) {
            throw new CertificateException("no CERTIFICATE block found in PEM: " + path);
        }
        return out;
    }

    static X509Certificate readCertificate(Path path) throws IOException, GeneralSecurityException {
        return readCertificates(path).get(0);
    }

    /**
     * Reads an unencrypted RSA private key: PKCS#1 or PKCS#8, PEM or raw DER.
     */
    static PrivateKey readPrivateKey(Path path) throws IOException, GeneralSecurityException {
        byte[] bytes = Files.readAllBytes(path);
        String text = new String(bytes, StandardCharsets.US_ASCII);
        JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
        PrivateKey key;
        if (text.contains(PEM_MARKER)) {
            Object item;
            try (PEMParser parser = new PEMParser(new StringReader(text))) {
                item = parser.readObject();
            }
            if (item instanceof PEMEncryptedKeyPair || item instanceof PKCS8EncryptedPrivateKeyInfo) {
                throw new GeneralSecurityException("encrypted private key is not supported: " + path);
            } else if (item instanceof PEMKeyPair pair) {
                key = converter.getKeyPair(pair).getPrivate();
            } else if (item instanceof PrivateKeyInfo info) {
                key = converter.getPrivateKey(info);
            } else {
                throw new GeneralSecurityException("no private key found in " + path);
            }
        } else {
            key = converter.getPrivateKey(parseDerKey(bytes, path));
        }
        if (!(key instanceof RSAPrivateKey)) {
            throw new GeneralSecurityException("private key is not RSA: " + key.getAlgorithm());
        }
        return key;
    }

    // PKCS#1 first, then PKCS#8.
    private static PrivateKeyInfo parseDerKey(byte[] der, Path path) throws GeneralSecurityException {
        try {
            org.bouncycastle.asn1.pkcs.RSAPrivateKey rsa = org.bouncycastle.asn1.pkcs.RSAPrivateKey.getInstance(der);
            return new PrivateKeyInfo(new AlgorithmIdentifier(PKCSObjectIdentifiers.rsaEncryption, DERNull.INSTANCE), rsa);
        } catch (IllegalArgumentException | IOException pkcs1Failure) {
            try {
                return PrivateKeyInfo.getInstance(der);
            } catch (IllegalArgumentException pkcs8Failure) {
                throw new GeneralSecurityException(
                        "failed to parse private key as PKCS#1 or PKCS#8 (PEM/DER): " + path, pkcs8Failure);
            }
        }
    }

    static void writePem(Path path, Object object) throws IOException {
        Files.writeString(path, toPem(object), StandardCharsets.US_ASCII);
    }

    // PKCS#1 ("RSA PRIVATE KEY") for RSA keys, as the JCA PEM writer emits them.
    static void writePkcs1Key(Path path, PrivateKey key) throws IOException {
        writePem(path, key);
    }

    static void writePkcs8Key(Path path, PrivateKey key) throws IOException {
        writePem(path, new JcaPKCS8Generator(key, null));
    }

    static String toPem(Object object) throws IOException {
        StringWriter out = new StringWriter();
        try (JcaPEMWriter writer = new JcaPEMWriter(out)) {
            writer.writeObject(object);
        }
        return out.toString();
    }
}
