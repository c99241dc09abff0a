package com.smurthy.ai.insights.chat;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parameters extracted by an intent matcher. Values are strings, integers or enum tokens.
 */
public final class MatchResult {

    private static final MatchResult EMPTY = new MatchResult(Map.of());

    private final Map<String, Object> params;

    private MatchResult(Map<String, Object> params) {
        this.params = params;
    }

    public static MatchResult empty() {
        return EMPTY;
    }

    public static MatchResult of(String name, Object value) {
        return builder().put(name, value).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getString(String name) {
        Object value = params.get(name);
        return value != null ? value.toString() : "";
    }

    public int getInt(String name, int defaultValue) {
        return params.get(name) instanceof Integer value ? value : defaultValue;
    }

    public <E extends Enum<E>> E getEnum(String name, Class<E> type) {
        Object value = params.get(name);
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Parameter '" + name + "' is not a " + type.getSimpleName());
        }
        return type.cast(value);
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(params);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MatchResult other && params.equals(other.params);
    }

    @Override
    public int hashCode() {
        return params.hashCode();
    }

    @Override
    public String toString() {
        return "MatchResult" + params;
    }

    public static class Builder {
        private final Map<String, Object> params = new LinkedHashMap<>();

        public Builder put(String name, Object value) {
            params.put(name, value);
            return this;
        }

        public MatchResult build() {
            return new MatchResult(new LinkedHashMap<>(params));
        }
    }
}
