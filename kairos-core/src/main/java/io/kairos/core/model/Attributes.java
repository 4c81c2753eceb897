package io.kairos.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable key/value bag used for action parameters, job metadata and execution results.
 *
 * <p>Values are limited to strings, numbers, booleans, lists and nested string-keyed maps of the
 * same kinds. Anything else is rejected on construction.
 */
public final class Attributes {
    private static final Attributes EMPTY = new Attributes(Map.of());

    private final Map<String, Object> values;

    private Attributes(Map<String, Object> values) {
        this.values = values;
    }

    public static Attributes empty() {
        return EMPTY;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Attributes of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new Attributes(copyMap(values, ""));
    }

    public static Attributes of(String key, Object value) {
        Map<String, Object> single = new LinkedHashMap<>();
        single.put(key, value);
        return of(single);
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Object get(String key) {
        return values.get(key);
    }

    public Optional<String> string(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    public String string(String key, String fallback) {
        return string(key).orElse(fallback);
    }

    public Optional<Long> integer(String key) {
        Object value = values.get(key);
        if (value instanceof Number number) {
            return Optional.of(number.longValue());
        }
        if (value instanceof String text) {
            try {
                return Optional.of(Long.parseLong(text.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public boolean bool(String key, boolean fallback) {
        Object value = values.get(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text) {
            return Boolean.parseBoolean(text.trim());
        }
        return fallback;
    }

    public List<Object> list(String key) {
        Object value = values.get(key);
        if (value instanceof List<?> list) {
            return Collections.unmodifiableList(new ArrayList<>(list));
        }
        return List.of();
    }

    @SuppressWarnings("unchecked")
    public Attributes map(String key) {
        Object value = values.get(key);
        if (value instanceof Map<?, ?> map) {
            return new Attributes((Map<String, Object>) map);
        }
        return EMPTY;
    }

    public Attributes with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return of(copy);
    }

    /**
     * Returns a copy where entries of {@code overrides} win; nested maps are merged recursively.
     */
    public Attributes deepMerge(Attributes overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return overrides;
        }
        return new Attributes(Collections.unmodifiableMap(merge(values, overrides.values)));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>(base);
        for (Map.Entry<String, Object> entry : overrides.entrySet()) {
            Object existing = merged.get(entry.getKey());
            Object incoming = entry.getValue();
            if (existing instanceof Map<?, ?> left && incoming instanceof Map<?, ?> right) {
                merged.put(
                    entry.getKey(),
                    Collections.unmodifiableMap(merge((Map<String, Object>) left, (Map<String, Object>) right))
                );
            } else {
                merged.put(entry.getKey(), incoming);
            }
        }
        return merged;
    }

    private static Map<String, Object> copyMap(Map<?, ?> source, String path) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            if (!(entry.getKey() instanceof String key) || key.isBlank()) {
                throw new IllegalArgumentException("attribute keys must be non-blank strings" + at(path));
            }
            if (entry.getValue() == null) {
                continue;
            }
            copy.put(key, copyValue(entry.getValue(), path.isEmpty() ? key : path + "." + key));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object copyValue(Object value, String path) {
        if (value instanceof String || value instanceof Boolean || value instanceof Number) {
            return value;
        }
        if (value instanceof Map<?, ?> map) {
            return copyMap(map, path);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (int i = 0; i < list.size(); i++) {
                Object item = list.get(i);
                if (item == null) {
                    throw new IllegalArgumentException("null list element" + at(path + "[" + i + "]"));
                }
                copy.add(copyValue(item, path + "[" + i + "]"));
            }
            return Collections.unmodifiableList(copy);
        }
        throw new IllegalArgumentException(
            "unsupported attribute value " + value.getClass().getSimpleName() + at(path)
        );
    }

    private static String at(String path) {
        return path.isEmpty() ? "" : " at '" + path + "'";
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof Attributes that && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
