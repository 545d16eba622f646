package com.phonediag.analyzer.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CPU 类别：总负载字段 + 每个核心的频率（MHz）。
 */
@Getter
@ToString
@EqualsAndHashCode
public final class CpuRecord implements CategoryRecord {

    private final FieldRecord fields;

    /** CPU0 -> 1804 */
    private final Map<String, Long> frequencies;

    private CpuRecord(FieldRecord fields, Map<String, Long> frequencies) {
        this.fields = fields;
        this.frequencies = frequencies;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public DiagCategory getCategory() {
        return DiagCategory.CPU_INFO;
    }

    @Override
    public boolean isEmpty() {
        return fields.isEmpty() && frequencies.isEmpty();
    }

    public static final class Builder {

        private final FieldRecord.Builder fields = FieldRecord.builder();
        private final Map<String, Long> frequencies = new LinkedHashMap<>();

        private Builder() {
        }

        public FieldRecord.Builder fields() {
            return fields;
        }

        public Builder frequency(String core, long mhz) {
            frequencies.put(core, mhz);
            return this;
        }

        public CpuRecord build() {
            return new CpuRecord(fields.build(), Collections.unmodifiableMap(new LinkedHashMap<>(frequencies)));
        }
    }
}
