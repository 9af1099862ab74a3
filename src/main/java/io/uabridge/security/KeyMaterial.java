package io.uabridge.security;

import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x500.style.IETFUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A client private key plus the certificate that carries its public key, and any other
 * certificates bundled with it.
 */
public record KeyMaterial(PrivateKey privateKey, X509Certificate certificate, List<X509Certificate> chain) {
    public KeyMaterial {
        chain = chain == null ? List.of() : List.copyOf(chain);
    }

    /**
     * Loads the key, then picks the certificate whose public key matches it. When none matches,
     * the first certificate in the file is used.
     */
    public static KeyMaterial load(Path certPath, Path keyPath) throws IOException, GeneralSecurityException {
        PrivateKey key = PemFiles.readPrivateKey(keyPath);
        List<X509Certificate> certificates = PemFiles.readCertificates(certPath);
        X509Certificate leaf = certificates.get(0);
        for (X509Certificate candidate : certificates) {
            if (matches(candidate, key)) {
                leaf = candidate;
                break;
            }
        }
        List<X509Certificate> chain = new ArrayList<>(certificates);
        chain.remove(leaf);
        chain.add(0, leaf);
        return new KeyMaterial(key, leaf, chain);
    }

    public static boolean matches(X509Certificate certificate, PrivateKey key) {
        if (!(certificate.getPublicKey() instanceof RSAPublicKey publicKey) || !(key instanceof RSAPrivateKey privateKey)) {
            return false;
        }
        if (!publicKey.getModulus().equals(privateKey.getModulus())) {
            return false;
        }
        if (key instanceof RSAPrivateCrtKey crt) {
            return publicKey.getPublicExponent().equals(crt.getPublicExponent());
        }
        return true;
    }

    /**
     * The application URI the certificate advertises: its first URI SAN, else a URL-like
     * common name. Empty when neither is present.
     */
    public String applicationUri() throws GeneralSecurityException {
        List<String> uris = CertificateInfo.subjectAltNames(certificate, CertificateInfo.SAN_URI);
        if (!uris.isEmpty() && !uris.get(0).isBlank()) {
            return uris.get(0);
        }
        X500Name subject = X500Name.getInstance(certificate.getSubjectX500Principal().getEncoded());
        RDN[] commonNames = subject.getRDNs(BCStyle.CN);
        if (commonNames.length == 0) {
            return "";
        }
        String cn = IETFUtils.valueToString(commonNames[0].getFirst().getValue()).trim();
        String lower = cn.toLowerCase(Locale.ROOT);
        if (lower.startsWith("urn:") || lower.startsWith("http:") || lower.startsWith("https:")) {
            return cn;
        }
        return "";
    }
}
