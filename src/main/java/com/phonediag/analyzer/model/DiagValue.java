package com.phonediag.analyzer.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Optional;

/**
 * 诊断字段的取值：整数 / 小数 / 布尔 / 文本 / 缺失 五选一。
 * 缺失（ABSENT）表示“未知”，调用方不能把它当成 0 或空串。
 */
@Getter
@EqualsAndHashCode
public final class DiagValue {

    private static final DiagValue ABSENT = new DiagValue(ValueType.ABSENT, null);

    private final ValueType type;

    /** Long / Double / Boolean / String，ABSENT 时为 null */
    private final Object raw;

    private DiagValue(ValueType type, Object raw) {
        this.type = type;
        this.raw = raw;
    }

    public static DiagValue absent() {
        return ABSENT;
    }

    public static DiagValue ofLong(long value) {
        return new DiagValue(ValueType.INTEGER, value);
    }

    public static DiagValue ofDouble(double value) {
        return new DiagValue(ValueType.DECIMAL, value);
    }

    public static DiagValue ofBoolean(boolean value) {
        return new DiagValue(ValueType.BOOLEAN, value);
    }

    /** null 视为缺失 */
    public static DiagValue ofText(String value) {
        return value == null ? ABSENT : new DiagValue(ValueType.TEXT, value);
    }

    public boolean isPresent() {
        return type != ValueType.ABSENT;
    }

    public boolean isAbsent() {
        return type == ValueType.ABSENT;
    }

    public Optional<Long> asLong() {
        return type == ValueType.INTEGER ? Optional.of((Long) raw) : Optional.empty();
    }

    /**
     * 数值视图：INTEGER 和 DECIMAL 都可以读成 double。
     */
    public Optional<Double> asDouble() {
        if (type == ValueType.DECIMAL) {
            return Optional.of((Double) raw);
        }
        if (type == ValueType.INTEGER) {
            return Optional.of(((Long) raw).doubleValue());
        }
        return Optional.empty();
    }

    public Optional<Boolean> asBoolean() {
        return type == ValueType.BOOLEAN ? Optional.of((Boolean) raw) : Optional.empty();
    }

    public Optional<String> asText() {
        return type == ValueType.TEXT ? Optional.of((String) raw) : Optional.empty();
    }

    /** JSON 里直接输出原始标量，缺失输出 null */
    @JsonValue
    public Object toJson() {
        return raw;
    }

    @Override
    public String toString() {
        return type == ValueType.ABSENT ? "<absent>" : String.valueOf(raw);
    }
}
