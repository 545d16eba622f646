package com.phonediag.analyzer.extractor;

import com.phonediag.analyzer.model.DiagValue;
import com.phonediag.analyzer.model.EntityListRecord;
import com.phonediag.analyzer.model.EntityRecord;
import com.phonediag.analyzer.model.ValueType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UsageStatsExtractorTest {

    private final UsageStatsExtractor extractor = new UsageStatsExtractor();

    private static final String DUMP = String.join("\n",
            "Last 24 hours:",
            "  Package com.whatsapp:",
            "    Total time in foreground: 1h 2m 3s",
            "    Total time visible: 0",
            "    Total time in background: 5m",
            "  Package com.android.chrome:",
            "    Total time in foreground: 10s",
            "    Last time used: 2025-08-23 03:01:00");

    @Test
    void extract_opensOneEntityPerPackage() {
        EntityListRecord r = (EntityListRecord) extractor.extract("usage_stats.txt", DUMP).getRecord();

        assertEquals(List.of("com.whatsapp", "com.android.chrome"),
                r.getEntities().stream().map(EntityRecord::getKey).toList());
        assertEquals(DiagValue.ofLong(2), r.getFields().get("total_apps"));
    }

    @Test
    void extract_durationsStayOpaqueText() {
        EntityListRecord r = (EntityListRecord) extractor.extract("usage_stats.txt", DUMP).getRecord();
        EntityRecord wa = r.find("com.whatsapp").orElseThrow();

        assertEquals(DiagValue.ofText("1h 2m 3s"), wa.getStats().get("foreground_time"));
        assertEquals(ValueType.TEXT, wa.getStats().get("visible_time").getType());
        assertEquals(DiagValue.ofText("5m"), wa.getStats().get("background_time"));

        EntityRecord chrome = r.find("com.android.chrome").orElseThrow();
        assertEquals(1, chrome.getStats().size());
        assertTrue(chrome.getStats().get("background_time").isAbsent());
    }
}
