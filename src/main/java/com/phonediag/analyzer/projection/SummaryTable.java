package com.phonediag.analyzer.projection;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 所有会话的汇总行，按采集时间升序；没有时间的行排在最后。
 */
@Getter
@ToString
public final class SummaryTable {

    public static final String SESSION = "session";
    public static final String TIMESTAMP = "timestamp";
    public static final String FILES_PARSED = "files_parsed";

    private final List<SummaryRow> rows;

    SummaryTable(List<SummaryRow> rows) {
        this.rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public Optional<SummaryRow> findRow(String sessionId) {
        return rows.stream().filter(r -> r.getSessionId().equals(sessionId)).findFirst();
    }

    /** 列名顺序：session, timestamp, files_parsed, 然后是各指标列 */
    @JsonProperty("columns")
    public List<String> columnNames() {
        List<String> names = new ArrayList<>();
        names.add(SESSION);
        names.add(TIMESTAMP);
        names.add(FILES_PARSED);
        for (SummaryColumn c : SummaryColumn.values()) {
            names.add(c.getColumnName());
        }
        return names;
    }
}
