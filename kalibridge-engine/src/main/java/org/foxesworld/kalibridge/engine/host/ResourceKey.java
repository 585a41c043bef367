package org.foxesworld.kalibridge.engine.host;

import java.util.Objects;
import java.util.regex.Pattern;

/** Native registry key, {@code namespace:path}. */
public record ResourceKey(String namespace, String path) {

    public static final String DEFAULT_NAMESPACE = "kalibridge";

    private static final Pattern NAMESPACE = Pattern.compile("[a-z0-9_.-]+");
    private static final Pattern PATH = Pattern.compile("[a-z0-9_./-]+");

    public ResourceKey {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(path, "path");
        if (!NAMESPACE.matcher(namespace).matches()) {
            throw new IllegalArgumentException("Invalid namespace '" + namespace + "'");
        }
        if (!PATH.matcher(path).matches()) {
            throw new IllegalArgumentException("Invalid path '" + path + "'");
        }
    }

    public static ResourceKey of(String namespace, String path) {
        return new ResourceKey(namespace, path);
    }

    /** {@code "ns:path"}; a bare path gets {@link #DEFAULT_NAMESPACE}. */
    public static ResourceKey parse(String text) {
        Objects.requireNonNull(text, "text");
        int colon = text.indexOf(':');
        if (colon < 0) return new ResourceKey(DEFAULT_NAMESPACE, text);
        return new ResourceKey(text.substring(0, colon), text.substring(colon + 1));
    }

    @Override
    public String toString() {
        return namespace + ":" + path;
    }
}
