package com.phonediag.analyzer.projection;

import com.phonediag.analyzer.model.DiagValue;
import com.phonediag.analyzer.model.SessionRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 把会话记录压平成汇总表。纯读取，不修改输入，每次调用重新生成。
 */
@Component
@Slf4j
public class SummaryProjector {

    /** 时间升序，没有时间的排最后；同一时间按会话 ID 排，保证结果稳定 */
    static final Comparator<SummaryRow> ROW_ORDER = Comparator
            .comparing((SummaryRow r) -> r.getTimestamp(), Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(SummaryRow::getSessionId, Comparator.nullsLast(Comparator.naturalOrder()));

    public SummaryTable project(List<SessionRecord> sessions) {
        if (sessions == null || sessions.isEmpty()) {
            return new SummaryTable(List.of());
        }

        List<SummaryRow> rows = sessions.stream()
                .map(this::toRow)
                .sorted(ROW_ORDER)
                .toList();

        log.debug("Projected {} sessions into summary table", rows.size());
        return new SummaryTable(rows);
    }

    SummaryRow toRow(SessionRecord session) {
        Map<SummaryColumn, DiagValue> values = new EnumMap<>(SummaryColumn.class);
        for (SummaryColumn column : SummaryColumn.values()) {
            DiagValue v = column.read(session);
            if (v.isPresent()) {
                values.put(column, v);
            }
        }
        int filesParsed = Optional.ofNullable(session.getFilesParsed()).map(List::size).orElse(0);
        return new SummaryRow(session.getSessionId(), session.getTimestamp(), filesParsed, values);
    }
}
