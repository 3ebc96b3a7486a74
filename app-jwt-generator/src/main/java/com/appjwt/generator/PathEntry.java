package com.appjwt.generator;

import java.util.*;

/**
 * One ACL path grant. A bare path grants the path with no further restriction,
 * an entry with options carries restrictions such as {@code methods}.
 */
public sealed interface PathEntry {

    String OPTION_METHODS = "methods";

    String path();

    Map<String, Object> options();

    record Bare(String path) implements PathEntry {
        public Bare {
            Objects.requireNonNull(path, "path");
        }

        @Override
        public Map<String, Object> options() {
            return Map.of();
        }
    }

    record WithOptions(String path, Map<String, Object> options) implements PathEntry {
        public WithOptions {
            Objects.requireNonNull(path, "path");
            options = copyOptions(options);
        }
    }

    static PathEntry of(String path) {
        return new Bare(path);
    }

    static PathEntry of(String path, Map<String, ?> options) {
        return new WithOptions(path, copyOptions(options));
    }

    static PathEntry withMethods(String path, String... methods) {
        return of(path, Map.of(OPTION_METHODS, List.of(methods)));
    }

    /**
     * Decodes the mixed list shape accepted by {@link TokenGenerator#setPaths(List)}:
     * each element is a path string, a {@link PathEntry}, or a map of path to options.
     */
    static List<PathEntry> decodeAll(Collection<?> pathData) {
        Objects.requireNonNull(pathData, "pathData");
        List<PathEntry> entries = new ArrayList<>();
        for (Object element : pathData) {
            if (element instanceof String path) {
                entries.add(new Bare(path));
            } else if (element instanceof PathEntry entry) {
                entries.add(entry);
            } else if (element instanceof Map<?, ?> keyed) {
                entries.addAll(decodeKeyed(keyed));
            } else {
                throw new IllegalArgumentException("Unsupported path entry: " + element);
            }
        }
        return entries;
    }

    static List<PathEntry> decodeKeyed(Map<?, ?> keyed) {
        List<PathEntry> entries = new ArrayList<>();
        for (Map.Entry<?, ?> e : keyed.entrySet()) {
            if (!(e.getKey() instanceof String path)) {
                throw new IllegalArgumentException("Path must be a string: " + e.getKey());
            }
            Object value = e.getValue();
            if (value == null) {
                entries.add(new Bare(path));
            } else if (value instanceof Map<?, ?> options) {
                entries.add(new WithOptions(path, copyOptions(options)));
            } else {
                throw new IllegalArgumentException("Options for path " + path + " must be a map");
            }
        }
        return entries;
    }

    private static Map<String, Object> copyOptions(Map<?, ?> options) {
        if (options == null || options.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        options.forEach((k, v) -> {
            if (!(k instanceof String name)) {
                throw new IllegalArgumentException("Option name must be a string: " + k);
            }
            copy.put(name, copyValue(v));
        });
        return Collections.unmodifiableMap(copy);
    }

    // snapshot nested maps and collections
    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, copyValue(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            collection.forEach(v -> copy.add(copyValue(v)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
