package io.identityallocator.labels;

import lombok.NonNull;
import lombok.Value;

/**
 * A single security label: {@code source:key=value}.
 */
@Value
public class Label {
    @NonNull String source;
    @NonNull String key;
    @NonNull String value;

    /**
     * Parse {@code [source:]key[=value]}. A missing source becomes {@link LabelSource#UNSPEC},
     * a missing value becomes the empty string.
     */
    public static Label parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("label must not be empty");
        }
        String source = LabelSource.UNSPEC;
        String rest = raw.trim();
        int colon = rest.indexOf(':');
        int equals = rest.indexOf('=');
        if (colon > 0 && (equals < 0 || colon < equals)) {
            source = rest.substring(0, colon);
            rest = rest.substring(colon + 1);
            equals = rest.indexOf('=');
        }
        String key = equals >= 0 ? rest.substring(0, equals) : rest;
        String value = equals >= 0 ? rest.substring(equals + 1) : "";
        if (key.isEmpty()) {
            throw new IllegalArgumentException("label key must not be empty: " + raw);
        }
        // ';' separates labels in the canonical sorted list
        if (raw.contains(Labels.LIST_SEPARATOR)) {
            throw new IllegalArgumentException("label must not contain '" + Labels.LIST_SEPARATOR + "': " + raw);
        }
        return new Label(source, key, value);
    }

    public static Label reserved(String key) {
        return new Label(LabelSource.RESERVED, key, "");
    }

    public boolean hasSource(String candidate) {
        return source.equals(candidate);
    }

    /**
     * Canonical form used inside sorted label lists.
     */
    public String format() {
        return source + ":" + key + "=" + value;
    }

    @Override
    public String toString() {
        return value.isEmpty() ? source + ":" + key : format();
    }
}
