package com.phonediag.analyzer.extractor;

import com.phonediag.analyzer.model.CategoryRecord;
import com.phonediag.analyzer.model.DiagCategory;
import com.phonediag.analyzer.model.EntityListRecord;
import com.phonediag.analyzer.model.EntityRecord;
import com.phonediag.analyzer.model.ParseState;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * battery_stats_detailed.txt：dumpsys batterystats 的按应用归因部分。
 *
 * <pre>
 * Statistics since last charge:
 *   com.example.app:
 *     Screen: 120000 ms
 *     CPU: 3400 ms
 * </pre>
 *
 * 缩进敏感：两个空格是一级（应用），四个及以上是二级（统计项）。
 */
@Component
public class BatteryAttributionExtractor extends AbstractCategoryExtractor<EntityListRecord.Builder> {

    private static final int LEVEL_WIDTH = 2;

    private static final Pattern PERIOD = Pattern.compile("Statistics since (.+):");

    private static final Pattern APP_HEADER = Pattern.compile("(\\S+):");

    private static final List<StatTemplate> STATS = List.of(
            StatTemplate.coerced("Screen: (\\d+) ms", "screen_time_ms"),
            StatTemplate.coerced("CPU: (\\d+) ms", "cpu_time_ms"),
            StatTemplate.coerced("Wake lock: (\\d+) ms", "wake_lock_ms"),
            StatTemplate.coerced("Mobile network: (\\d+) ms", "mobile_network_ms"),
            StatTemplate.coerced("Wifi: (\\d+) ms", "wifi_time_ms")
    );

    @Override
    public DiagCategory category() {
        return DiagCategory.BATTERY_STATS_DETAILED;
    }

    @Override
    protected EntityListRecord.Builder newDraft() {
        return EntityListRecord.builder(category());
    }

    @Override
    protected void parse(String text, EntityListRecord.Builder draft) {
        for (String rawLine : text.split("\\R")) {
            String line = rawLine.stripTrailing();
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }

            if (trimmed.startsWith("Statistics since ")) {
                draft.closeEntity();
                Matcher pm = PERIOD.matcher(trimmed);
                if (pm.find()) {
                    draft.fields().putText("period", pm.group(1));
                }
                continue;
            }

            int level = indentLevel(line);
            if (level == 0) {
                // 顶层新段落，后面的统计项不属于任何应用
                draft.closeEntity();
            } else if (level == 1) {
                // 一级行：以冒号结尾的是新应用，其它一级行结束当前应用
                Matcher am = APP_HEADER.matcher(trimmed);
                if (am.matches()) {
                    draft.openEntity(am.group(1));
                } else {
                    draft.closeEntity();
                }
            } else if (level >= 2 && draft.state() == ParseState.ENTITY_OPEN) {
                StatTemplate.applyFirst(STATS, trimmed, draft.stats());
            }
        }
    }

    @Override
    protected CategoryRecord build(EntityListRecord.Builder draft) {
        draft.closeEntity();
        List<EntityRecord> apps = draft.closedEntities();
        draft.fields()
                .putLong("total_apps", apps.size())
                .putLong("total_screen_time_ms", sum(apps, "screen_time_ms"))
                .putLong("total_cpu_time_ms", sum(apps, "cpu_time_ms"))
                .putLong("total_wake_lock_ms", sum(apps, "wake_lock_ms"));
        return draft.build();
    }

    /**
     * 0 表示顶层；正好两个空格是 1；四个及以上是 2；奇数缩进不属于任何一级，返回 -1。
     */
    static int indentLevel(String line) {
        int spaces = 0;
        while (spaces < line.length() && line.charAt(spaces) == ' ') {
            spaces++;
        }
        if (spaces == 0) {
            return 0;
        }
        if (spaces == LEVEL_WIDTH) {
            return 1;
        }
        if (spaces >= LEVEL_WIDTH * 2) {
            return 2;
        }
        return -1;
    }

    private static long sum(List<EntityRecord> apps, String field) {
        return apps.stream()
                .mapToLong(a -> a.getStats().get(field).asLong().orElse(0L))
                .sum();
    }
}
