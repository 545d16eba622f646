package com.phonediag.analyzer.parser;

import com.phonediag.analyzer.model.DiagValue;
import com.phonediag.analyzer.model.ValueType;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 把原始文本 token 转成带类型的值。
 * 规则按优先级：纯数字 -> 整数；true/false（不区分大小写）-> 布尔；其余保留原文本。
 */
public final class ValueCoercer {

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private ValueCoercer() {
    }

    public static DiagValue coerce(String token) {
        if (token == null) {
            return DiagValue.absent();
        }
        String t = token.trim();
        if (DIGITS.matcher(t).matches()) {
            try {
                // "045" -> 45，不对前导零做特殊处理
                return DiagValue.ofLong(Long.parseLong(t));
            } catch (NumberFormatException e) {
                // 超出 long 范围，按文本保存
                return DiagValue.ofText(t);
            }
        }
        String lower = t.toLowerCase(Locale.ROOT);
        if ("true".equals(lower) || "false".equals(lower)) {
            return DiagValue.ofBoolean(Boolean.parseBoolean(lower));
        }
        return DiagValue.ofText(t);
    }

    /**
     * 温度类字段名：名字里包含 temp（不区分大小写）。
     * 只在电池这类带温度的 key/value 块里使用。
     */
    public static boolean isTemperatureKey(String key) {
        return key != null && key.toLowerCase(Locale.ROOT).contains("temp");
    }

    /**
     * 十分之一度换算：整数除以 10 变成小数，其它类型原样返回。
     */
    public static DiagValue scaleTenths(DiagValue value) {
        if (value == null || value.getType() != ValueType.INTEGER) {
            return value;
        }
        return DiagValue.ofDouble(value.asLong().orElseThrow() / 10.0);
    }
}
