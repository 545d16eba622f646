package com.phonediag.analyzer.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 扁平记录：字段名 -> DiagValue，保持插入顺序，构建后不可变。
 */
@EqualsAndHashCode
public final class FieldRecord {

    private static final FieldRecord EMPTY = new FieldRecord(Map.of());

    private final Map<String, DiagValue> values;

    private FieldRecord(Map<String, DiagValue> values) {
        this.values = values;
    }

    public static FieldRecord empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** 不存在的字段返回 ABSENT，而不是 null */
    public DiagValue get(String key) {
        DiagValue v = values.get(key);
        return v == null ? DiagValue.absent() : v;
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @JsonValue
    public Map<String, DiagValue> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }

    public static final class Builder {

        private final Map<String, DiagValue> values = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * 同名字段后写覆盖先写；ABSENT 直接丢弃，保证记录里只有真实数据。
         */
        public Builder put(String key, DiagValue value) {
            if (key == null || value == null || value.isAbsent()) {
                return this;
            }
            values.put(key, value);
            return this;
        }

        public Builder putLong(String key, long value) {
            return put(key, DiagValue.ofLong(value));
        }

        public Builder putDouble(String key, double value) {
            return put(key, DiagValue.ofDouble(value));
        }

        public Builder putText(String key, String value) {
            return put(key, DiagValue.ofText(value));
        }

        public DiagValue get(String key) {
            DiagValue v = values.get(key);
            return v == null ? DiagValue.absent() : v;
        }

        public boolean isEmpty() {
            return values.isEmpty();
        }

        public FieldRecord build() {
            if (values.isEmpty()) {
                return EMPTY;
            }
            return new FieldRecord(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
