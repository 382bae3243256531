package io.identityallocator.labels;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Encodes canonical label keys so they can be used as a single etcd path segment.
 */
public final class KeyEncoder {

    private KeyEncoder() {
        // Utility class
    }

    public static String encode(String canonicalKey) {
        return Base64.getUrlEncoder().withoutPadding()
            .encodeToString(canonicalKey.getBytes(StandardCharsets.UTF_8));
    }

    public static String decode(String encoded) {
        return new String(Base64.getUrlDecoder().decode(encoded), StandardCharsets.UTF_8);
    }
}
