package com.phonediag.analyzer.projection;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.phonediag.analyzer.model.DiagValue;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 汇总表的一行：一个会话。
 */
@Getter
@ToString
public final class SummaryRow {

    @JsonProperty("session")
    private final String sessionId;

    private final LocalDateTime timestamp;

    @JsonProperty("files_parsed")
    private final int filesParsed;

    @JsonIgnore
    private final Map<SummaryColumn, DiagValue> values;

    SummaryRow(String sessionId, LocalDateTime timestamp, int filesParsed, Map<SummaryColumn, DiagValue> values) {
        this.sessionId = sessionId;
        this.timestamp = timestamp;
        this.filesParsed = filesParsed;
        Map<SummaryColumn, DiagValue> copy = new EnumMap<>(SummaryColumn.class);
        copy.putAll(values);
        this.values = Collections.unmodifiableMap(copy);
    }

    /** 没有值的列返回 ABSENT */
    public DiagValue get(SummaryColumn column) {
        DiagValue v = values.get(column);
        return v == null ? DiagValue.absent() : v;
    }

    public Optional<LocalDateTime> timestamp() {
        return Optional.ofNullable(timestamp);
    }

    @JsonAnyGetter
    public Map<String, DiagValue> columns() {
        Map<String, DiagValue> out = new LinkedHashMap<>();
        for (SummaryColumn c : SummaryColumn.values()) {
            out.put(c.getColumnName(), get(c));
        }
        return out;
    }
}
