package io.uabridge.security;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.security.cert.CertificateParsingException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public record CertificateInfo(
        @JsonProperty("subject") String subject,
        @JsonProperty("valid_from") String validFrom,
        @JsonProperty("valid_until") String validUntil,
        @JsonProperty("serial_number") String serialNumber,
        @JsonProperty("dns_names") List<String> dnsNames,
        @JsonProperty("uris") List<String> uris
) {
    static final int SAN_DNS = 2;
    static final int SAN_URI = 6;

    static CertificateInfo of(X509Certificate certificate) throws CertificateParsingException {
        return new CertificateInfo(
                certificate.getSubjectX500Principal().getName(),
                certificate.getNotBefore().toInstant().toString(),
                certificate.getNotAfter().toInstant().toString(),
                certificate.getSerialNumber().toString(),
                subjectAltNames(certificate, SAN_DNS),
                subjectAltNames(certificate, SAN_URI)
        );
    }

    static List<String> subjectAltNames(X509Certificate certificate, int type) throws CertificateParsingException {
        Collection<List<?>> entries = certificate.getSubjectAlternativeNames();
        List<String> out = new ArrayList<>();
        if (entries == null) {
            return out;
        }
        for (List<?> entry : entries) {
            if (entry.size() >= 2 && entry.get(0) instanceof Integer kind && kind == type) {
                out.add(String.valueOf(entry.get(1)));
            }
        }
        return out;
    }
}
