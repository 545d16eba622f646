package com.phonediag.analyzer.parser;

import com.phonediag.analyzer.model.DiagValue;
import com.phonediag.analyzer.model.FieldRecord;

import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 在整段文本里按起止标记切出一个子块，并把子块里的 "key : value" 行解析成字段。
 * 同一个文件里并列的多个块用不同前缀区分，避免同名字段互相覆盖。
 */
public final class SectionExtractor {

    /** 空行作为块结束 */
    public static final Pattern BLANK_LINE = Pattern.compile("\\R[ \\t]*\\R");

    private SectionExtractor() {
    }

    /**
     * 返回第一个 start 之后、紧随其后的第一个 end 之前的文本。
     * end 为 null 或找不到时截到文本末尾；start 不存在时返回 empty。
     */
    public static Optional<String> find(String text, Pattern start, Pattern end) {
        if (text == null || start == null) {
            return Optional.empty();
        }
        Matcher sm = start.matcher(text);
        if (!sm.find()) {
            return Optional.empty();
        }
        int from = sm.end();
        int to = text.length();
        if (end != null) {
            Matcher em = end.matcher(text);
            if (em.find(from)) {
                to = em.start();
            }
        }
        return Optional.of(text.substring(from, to));
    }

    /**
     * 逐行解析 "key: value"，只按第一个冒号切分，两边去空白。
     * key 加上 prefix 后写入 target；isTemperature 命中的整数字段按十分之一度换算。
     * 值为空的行跳过。
     */
    public static void parseKeyValues(String block,
                                      String prefix,
                                      Predicate<String> isTemperature,
                                      FieldRecord.Builder target) {
        if (block == null) {
            return;
        }
        for (String line : block.split("\\R")) {
            int idx = line.indexOf(':');
            if (idx < 0) {
                continue;
            }
            String key = line.substring(0, idx).trim();
            String rawValue = line.substring(idx + 1).trim();
            if (key.isEmpty() || rawValue.isEmpty()) {
                continue;
            }
            DiagValue value = ValueCoercer.coerce(rawValue);
            if (isTemperature != null && isTemperature.test(key)) {
                value = ValueCoercer.scaleTenths(value);
            }
            target.put(prefix + key, value);
        }
    }
}
