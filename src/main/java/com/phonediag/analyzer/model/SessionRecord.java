package com.phonediag.analyzer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 一次诊断采集（一个会话目录）的解析结果。
 * timestamp 由目录名解析得到，目录名不合规时为 null。
 */
@Getter
@ToString
public final class SessionRecord {

    private final String sessionId;

    private final LocalDateTime timestamp;

    @JsonIgnore
    private final Map<DiagCategory, CategoryRecord> categories;

    private final List<String> filesParsed;

    private final List<ExtractionFailure> failures;

    @Builder
    private SessionRecord(String sessionId,
                          LocalDateTime timestamp,
                          @Singular Map<DiagCategory, CategoryRecord> categories,
                          @Singular("fileParsed") List<String> filesParsed,
                          @Singular List<ExtractionFailure> failures) {
        this.sessionId = sessionId;
        this.timestamp = timestamp;
        Map<DiagCategory, CategoryRecord> copy = new EnumMap<>(DiagCategory.class);
        copy.putAll(categories);
        this.categories = Collections.unmodifiableMap(copy);
        this.filesParsed = filesParsed;
        this.failures = failures;
    }

    public Optional<LocalDateTime> timestamp() {
        return Optional.ofNullable(timestamp);
    }

    public Optional<CategoryRecord> category(DiagCategory category) {
        return Optional.ofNullable(categories.get(category));
    }

    /**
     * 按类别取记录并转换成具体类型；类别缺失或类型不符时返回 empty。
     */
    public <T extends CategoryRecord> Optional<T> category(DiagCategory category, Class<T> type) {
        return category(category).filter(type::isInstance).map(type::cast);
    }

    public boolean has(DiagCategory category) {
        return categories.containsKey(category);
    }

    /** JSON 输出时以 battery_basic / thermal 这样的 key 展开 */
    @JsonProperty("records")
    public Map<String, CategoryRecord> categoriesByKey() {
        Map<String, CategoryRecord> out = new LinkedHashMap<>();
        categories.forEach((k, v) -> out.put(k.getKey(), v));
        return out;
    }
}
