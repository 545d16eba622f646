package com.phonediag.analyzer.extractor;

import com.phonediag.analyzer.model.DiagValue;
import com.phonediag.analyzer.model.FieldRecord;
import com.phonediag.analyzer.parser.ValueCoercer;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 实体内部一行统计的模板：正则的第 i 个分组写入第 i 个字段。
 * opaque 模板不做类型转换，整段保留成文本（例如 "1h 2m 3s" 这样的时长）。
 */
final class StatTemplate {

    private final Pattern pattern;
    private final List<String> fields;
    private final boolean opaque;

    private StatTemplate(Pattern pattern, List<String> fields, boolean opaque) {
        this.pattern = pattern;
        this.fields = fields;
        this.opaque = opaque;
    }

    static StatTemplate coerced(String regex, String... fields) {
        return new StatTemplate(Pattern.compile(regex), List.of(fields), false);
    }

    static StatTemplate opaque(String regex, String field) {
        return new StatTemplate(Pattern.compile(regex), List.of(field), true);
    }

    /**
     * 命中时写入 stats 并返回 true。
     */
    boolean apply(String line, FieldRecord.Builder stats) {
        Matcher m = pattern.matcher(line);
        if (!m.find()) {
            return false;
        }
        for (int i = 0; i < fields.size() && i < m.groupCount(); i++) {
            String raw = m.group(i + 1);
            if (raw == null) {
                continue;
            }
            DiagValue v = opaque ? DiagValue.ofText(raw.trim()) : ValueCoercer.coerce(raw);
            stats.put(fields.get(i), v);
        }
        return true;
    }

    /** 按顺序尝试，第一个命中的模板生效，没命中的行忽略 */
    static boolean applyFirst(List<StatTemplate> templates, String line, FieldRecord.Builder stats) {
        for (StatTemplate t : templates) {
            if (t.apply(line, stats)) {
                return true;
            }
        }
        return false;
    }
}
