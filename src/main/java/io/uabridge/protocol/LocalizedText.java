package io.uabridge.protocol;

public record LocalizedText(String locale, String text) {
    @Override
    public String toString() {
        return text == null ? "" : text;
    }
}
