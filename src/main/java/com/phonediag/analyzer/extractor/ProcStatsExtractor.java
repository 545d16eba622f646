package com.phonediag.analyzer.extractor;

import com.phonediag.analyzer.model.CategoryRecord;
import com.phonediag.analyzer.model.DiagCategory;
import com.phonediag.analyzer.model.EntityListRecord;
import com.phonediag.analyzer.model.ParseState;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * procstats.txt：dumpsys procstats。
 * "* 包名 / user / version:" 开启一个进程实体，后面的统计行归属当前实体，直到下一个开头行或文件结束。
 */
@Component
public class ProcStatsExtractor extends AbstractCategoryExtractor<EntityListRecord.Builder> {

    private static final String HEADER_SEPARATOR = " / ";

    // TOTAL: 100% (12MB-12MB-12MB/1.1MB-2.1MB-3.1MB/41MB-41MB-42MB over 5)
    private static final List<StatTemplate> STATS = List.of(
            StatTemplate.coerced("TOTAL: (\\d+)% \\(([^)]+)\\)", "total_percent", "total_memory"),
            StatTemplate.coerced("Persistent: (\\d+)%", "persistent_percent"),
            StatTemplate.coerced("Bnd Fgs: (\\d+)%", "bound_foreground_percent"),
            StatTemplate.coerced("Service: (\\d+)%", "service_percent")
    );

    @Override
    public DiagCategory category() {
        return DiagCategory.PROC_STATS;
    }

    @Override
    protected EntityListRecord.Builder newDraft() {
        return EntityListRecord.builder(category());
    }

    @Override
    protected void parse(String text, EntityListRecord.Builder draft) {
        for (String rawLine : text.split("\\R")) {
            String line = rawLine.trim();

            if (line.startsWith("*") && line.contains(HEADER_SEPARATOR)) {
                openProcess(line, draft);
                continue;
            }

            if (draft.state() == ParseState.ENTITY_OPEN && line.indexOf(':') >= 0) {
                StatTemplate.applyFirst(STATS, line, draft.stats());
            }
        }
    }

    @Override
    protected CategoryRecord build(EntityListRecord.Builder draft) {
        draft.closeEntity();
        draft.fields().putLong("total_processes", draft.closedEntities().size());
        return draft.build();
    }

    /**
     * 头部不足三段时只关闭上一个实体，不开新实体。
     */
    private void openProcess(String line, EntityListRecord.Builder draft) {
        String[] parts = line.split(HEADER_SEPARATOR);
        if (parts.length < 3) {
            draft.closeEntity();
            return;
        }
        String packageName = parts[0].replaceFirst("^\\*\\s*", "").trim();
        draft.openEntity(packageName)
                .putText("user", parts[1].trim())
                .putText("version", parts[2].replace(":", "").trim());
    }
}
