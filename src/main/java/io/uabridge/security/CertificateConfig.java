package io.uabridge.security;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;

/**
 * Subject and SAN content of a generated client certificate.
 */
public record CertificateConfig(
        String commonName,
        String organization,
        String organizationalUnit,
        String country,
        String province,
        String locality,
        String applicationUri,
        int validityDays,
        int keySize,
        List<String> dnsNames,
        List<String> ipAddresses
) {
    public static final int DEFAULT_VALIDITY_DAYS = 3650;
    public static final int DEFAULT_KEY_SIZE = 2048;

    public CertificateConfig {
        dnsNames = dnsNames == null ? List.of() : List.copyOf(dnsNames);
        ipAddresses = ipAddresses == null ? List.of() : List.copyOf(ipAddresses);
        if (validityDays <= 0) {
            validityDays = DEFAULT_VALIDITY_DAYS;
        }
        if (keySize <= 0) {
            keySize = DEFAULT_KEY_SIZE;
        }
    }

    // Strict client profile: the application URI is the only SAN.
    public static CertificateConfig strict(String applicationUri) {
        String uri = applicationUri == null || applicationUri.isBlank()
                ? defaultApplicationUri()
                : applicationUri.trim();
        return new CertificateConfig(
                "UaBridge",
                "UaBridge",
                "UAClient",
                "US",
                "CA",
                "San Francisco",
                uri,
                DEFAULT_VALIDITY_DAYS,
                DEFAULT_KEY_SIZE,
                List.of(),
                List.of()
        );
    }

    public CertificateConfig withSans(List<String> dns, List<String> ips) {
        return new CertificateConfig(commonName, organization, organizationalUnit, country, province, locality,
                applicationUri, validityDays, keySize, dns, ips);
    }

    public CertificateConfig withKeySize(int bits) {
        return new CertificateConfig(commonName, organization, organizationalUnit, country, province, locality,
                applicationUri, validityDays, bits, dnsNames, ipAddresses);
    }

    public static String defaultApplicationUri() {
        String host = hostname();
        return host.isBlank() ? "urn:uabridge:client" : "urn:" + host + ":uabridge";
    }

    static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName().toLowerCase(Locale.ROOT);
        } catch (UnknownHostException e) {
            return "";
        }
    }
}
