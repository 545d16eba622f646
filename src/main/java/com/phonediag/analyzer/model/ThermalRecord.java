package com.phonediag.analyzer.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 温度类别：传感器名 -> 读数，外加 thermal_status 等扁平字段。
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ThermalRecord implements CategoryRecord {

    private final FieldRecord fields;
    private final Map<String, SensorReading> sensors;

    private ThermalRecord(FieldRecord fields, Map<String, SensorReading> sensors) {
        this.fields = fields;
        this.sensors = sensors;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public DiagCategory getCategory() {
        return DiagCategory.THERMAL;
    }

    public Optional<SensorReading> sensor(String name) {
        return Optional.ofNullable(sensors.get(name));
    }

    @Override
    public boolean isEmpty() {
        return fields.isEmpty() && sensors.isEmpty();
    }

    public static final class Builder {

        private final FieldRecord.Builder fields = FieldRecord.builder();
        private final Map<String, SensorReading> sensors = new LinkedHashMap<>();

        private Builder() {
        }

        public FieldRecord.Builder fields() {
            return fields;
        }

        /** 同名传感器以最后一次出现为准 */
        public Builder sensor(String name, SensorReading reading) {
            sensors.put(name, reading);
            return this;
        }

        public ThermalRecord build() {
            return new ThermalRecord(fields.build(), Collections.unmodifiableMap(new LinkedHashMap<>(sensors)));
        }
    }
}
