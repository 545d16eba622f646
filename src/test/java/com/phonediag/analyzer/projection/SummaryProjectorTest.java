package com.phonediag.analyzer.projection;

import com.phonediag.analyzer.aggregate.SessionAggregator;
import com.phonediag.analyzer.extractor.ExtractorRegistry;
import com.phonediag.analyzer.model.DiagCategory;
import com.phonediag.analyzer.model.DiagValue;
import com.phonediag.analyzer.model.FieldRecord;
import com.phonediag.analyzer.model.FlatRecord;
import com.phonediag.analyzer.model.SessionRecord;
import com.phonediag.analyzer.util.SessionFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SummaryProjectorTest {

    @TempDir
    Path root;

    private SessionAggregator aggregator;
    private SummaryProjector projector;

    @BeforeEach
    void setUp() {
        aggregator = new SessionAggregator(ExtractorRegistry.defaults(), StandardCharsets.UTF_8);
        projector = new SummaryProjector();
    }

    @Test
    void project_fullSessionFillsEveryColumn() throws IOException {
        SessionFixtures.writeSession(root, "23-Aug-25_03-20-07-44", SessionFixtures.fullSession());

        SummaryTable table = projector.project(aggregator.parseAll(root));
        SummaryRow row = table.findRow("23-Aug-25_03-20-07-44").orElseThrow();

        for (SummaryColumn c : SummaryColumn.values()) {
            assertTrue(row.get(c).isPresent(), "absent column " + c.getColumnName());
        }
        assertEquals(9, row.getFilesParsed());
        assertEquals(DiagValue.ofLong(85), row.get(SummaryColumn.BATTERY_LEVEL));
        assertEquals(23.5, row.get(SummaryColumn.BATTERY_TEMPERATURE).asDouble().orElseThrow(), 1e-9);
        assertEquals(31.2, row.get(SummaryColumn.PHONE_TEMP).asDouble().orElseThrow(), 1e-9);
        assertEquals(DiagValue.ofBoolean(true), row.get(SummaryColumn.USB_POWERED));
        assertEquals(41.2, row.get(SummaryColumn.CPU_TEMP).asDouble().orElseThrow(), 1e-9);
        assertEquals(DiagValue.ofLong(2), row.get(SummaryColumn.TOTAL_PROCESSES));
        assertEquals(50.0, row.get(SummaryColumn.RAM_USAGE_PERCENT).asDouble().orElseThrow(), 1e-9);
        assertEquals(DiagValue.ofLong(90), row.get(SummaryColumn.TOTAL_WAKE_LOCK_MS));
    }

    @Test
    void project_preservesEverySourceValue() throws IOException {
        SessionFixtures.writeSession(root, "23-Aug-25_03-20-07-44", SessionFixtures.fullSession());
        SessionFixtures.writeSession(root, "24-Aug-25_03-20-07-44", Map.of("memory_info.txt", "Total RAM: 2,048K"));

        List<SessionRecord> sessions = aggregator.parseAll(root);
        SummaryTable table = projector.project(sessions);

        for (SessionRecord s : sessions) {
            SummaryRow row = table.findRow(s.getSessionId()).orElseThrow();
            assertEquals(s.getTimestamp(), row.getTimestamp());
            for (SummaryColumn c : SummaryColumn.values()) {
                assertEquals(c.read(s), row.get(c), "column " + c.getColumnName() + " of " + s.getSessionId());
            }
        }
    }

    @Test
    void project_deviceOnlySessionLeavesOtherColumnsAbsent() throws IOException {
        SessionFixtures.writeSession(root, "23-Aug-25_03-20-07-44",
                Map.of("device_info.txt", SessionFixtures.DEVICE_INFO));

        SummaryRow row = projector.project(aggregator.parseAll(root)).getRows().get(0);

        Set<SummaryColumn> device = EnumSet.of(SummaryColumn.MODEL, SummaryColumn.BRAND, SummaryColumn.ANDROID_VERSION);
        for (SummaryColumn c : SummaryColumn.values()) {
            assertEquals(device.contains(c), row.get(c).isPresent(), c.getColumnName());
        }
        assertEquals(DiagValue.ofText("CPH2449"), row.get(SummaryColumn.MODEL));
    }

    @Test
    void project_sortsByTimestampWithUnparseableLast() {
        SummaryTable table = projector.project(List.of(
                session("not-a-timestamp", null),
                session("24-Aug-25_00-00-00-00", LocalDateTime.of(2025, 8, 24, 0, 0)),
                session("23-Aug-25_00-00-00-00", LocalDateTime.of(2025, 8, 23, 0, 0))));

        assertEquals(List.of("23-Aug-25_00-00-00-00", "24-Aug-25_00-00-00-00", "not-a-timestamp"),
                table.getRows().stream().map(SummaryRow::getSessionId).toList());
    }

    @Test
    void project_allTimestampsAbsentFallsBackToSessionId() {
        SummaryTable table = projector.project(List.of(session("b", null), session("a", null)));

        assertEquals(List.of("a", "b"), table.getRows().stream().map(SummaryRow::getSessionId).toList());
        assertTrue(table.getRows().get(0).timestamp().isEmpty());
    }

    @Test
    void project_emptyInputGivesEmptyTable() {
        assertTrue(projector.project(List.of()).isEmpty());
        assertTrue(projector.project(null).isEmpty());
    }

    @Test
    void project_sessionWithoutCategoriesHasOnlyAbsentColumns() {
        SummaryRow row = projector.project(List.of(session("empty", null))).getRows().get(0);

        for (SummaryColumn c : SummaryColumn.values()) {
            assertTrue(row.get(c).isAbsent());
        }
        assertEquals(0, row.getFilesParsed());
    }

    @Test
    void project_missingFieldInPresentCategoryStaysAbsent() {
        SessionRecord s = SessionRecord.builder()
                .sessionId("partial")
                .category(DiagCategory.BATTERY_BASIC, new FlatRecord(DiagCategory.BATTERY_BASIC,
                        FieldRecord.builder().putLong("std_level", 40).build()))
                .fileParsed("battery_basic.txt")
                .build();

        SummaryRow row = projector.project(List.of(s)).getRows().get(0);

        assertEquals(DiagValue.ofLong(40), row.get(SummaryColumn.BATTERY_LEVEL));
        assertTrue(row.get(SummaryColumn.BATTERY_VOLTAGE).isAbsent());
    }

    @Test
    void columnNames_startWithRowIdentity() {
        List<String> names = projector.project(List.of()).columnNames();
        assertEquals(List.of("session", "timestamp", "files_parsed", "battery_level"), names.subList(0, 4));
        assertEquals(3 + SummaryColumn.values().length, names.size());
    }

    private static SessionRecord session(String id, LocalDateTime ts) {
        return SessionRecord.builder().sessionId(id).timestamp(ts).build();
    }
}
