package com.phonediag.analyzer.extractor;

import com.phonediag.analyzer.model.DiagValue;
import com.phonediag.analyzer.model.EntityListRecord;
import com.phonediag.analyzer.model.EntityRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcStatsExtractorTest {

    private final ProcStatsExtractor extractor = new ProcStatsExtractor();

    private EntityListRecord parse(String dump) {
        return (EntityListRecord) extractor.extract("procstats.txt", dump).getRecord();
    }

    @Test
    void extract_keepsEntitiesInOrderAndFlushesLastOneAtEof() {
        String dump = String.join("\n",
                "* pkg.a / u0 / v1:",
                "  TOTAL: 10% (...)",
                "* pkg.b / u0 / v1:",
                "  TOTAL: 20% (...)",
                "* pkg.c / u0 / v1:",
                "  TOTAL: 30% (...)");

        EntityListRecord r = parse(dump);
        List<EntityRecord> procs = r.getEntities();

        assertEquals(3, procs.size());
        assertEquals(List.of("pkg.a", "pkg.b", "pkg.c"), procs.stream().map(EntityRecord::getKey).toList());
        assertEquals(DiagValue.ofLong(10), procs.get(0).getStats().get("total_percent"));
        assertEquals(DiagValue.ofLong(20), procs.get(1).getStats().get("total_percent"));
        assertEquals(DiagValue.ofLong(30), procs.get(2).getStats().get("total_percent"));
        assertEquals(DiagValue.ofLong(3), r.getFields().get("total_processes"));
    }

    @Test
    void extract_readsHeaderAndAllStatTemplates() {
        String dump = String.join("\n",
                "AGGREGATED OVER LAST 3 HOURS:",
                "  * com.android.systemui / u0a123 / v34:",
                "           TOTAL: 100% (12MB-12MB-12MB/1.1MB-2.1MB-3.1MB/41MB-41MB-42MB over 5)",
                "      Persistent: 100% (12MB-12MB-12MB/1.1MB-2.1MB-3.1MB/41MB-41MB-42MB over 5)",
                "         Bnd Fgs: 4%",
                "         Service: 2%",
                "        Unknown: 7%",
                "");

        EntityRecord p = parse(dump).find("com.android.systemui").orElseThrow();

        assertEquals(DiagValue.ofText("u0a123"), p.getAttributes().get("user"));
        assertEquals(DiagValue.ofText("v34"), p.getAttributes().get("version"));
        assertEquals(DiagValue.ofLong(100), p.getStats().get("total_percent"));
        assertEquals(DiagValue.ofText("12MB-12MB-12MB/1.1MB-2.1MB-3.1MB/41MB-41MB-42MB over 5"),
                p.getStats().get("total_memory"));
        assertEquals(DiagValue.ofLong(100), p.getStats().get("persistent_percent"));
        assertEquals(DiagValue.ofLong(4), p.getStats().get("bound_foreground_percent"));
        assertEquals(DiagValue.ofLong(2), p.getStats().get("service_percent"));
        assertEquals(5, p.getStats().size());
    }

    @Test
    void extract_statsBeforeFirstHeaderAreIgnored() {
        String dump = "  TOTAL: 99% (x)\n* pkg.a / u0 / v1:\n";
        EntityListRecord r = parse(dump);
        assertEquals(1, r.getEntities().size());
        assertTrue(r.getEntities().get(0).getStats().isEmpty());
    }

    @Test
    void extract_shortHeaderClosesCurrentEntityWithoutOpeningNew() {
        String dump = String.join("\n",
                "* pkg.a / u0 / v1:",
                "  TOTAL: 10% (x)",
                "* broken / header",
                "  TOTAL: 50% (y)",
                "* pkg.b / u0 / v2:");

        EntityListRecord r = parse(dump);
        assertEquals(List.of("pkg.a", "pkg.b"), r.getEntities().stream().map(EntityRecord::getKey).toList());
        assertEquals(DiagValue.ofLong(10), r.getEntities().get(0).getStats().get("total_percent"));
        assertTrue(r.getEntities().get(1).getStats().isEmpty());
    }

    @Test
    void extract_emptyInputHasZeroProcesses() {
        EntityListRecord r = parse("");
        assertTrue(r.getEntities().isEmpty());
        assertEquals(DiagValue.ofLong(0), r.getFields().get("total_processes"));
    }
}
