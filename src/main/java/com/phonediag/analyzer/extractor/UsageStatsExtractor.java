package com.phonediag.analyzer.extractor;

import com.phonediag.analyzer.model.CategoryRecord;
import com.phonediag.analyzer.model.DiagCategory;
import com.phonediag.analyzer.model.EntityListRecord;
import com.phonediag.analyzer.model.ParseState;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * usage_stats.txt：dumpsys usagestats。
 * "Package xxx:" 开启一个应用实体；三种时长原样保存为文本，不换算。
 */
@Component
public class UsageStatsExtractor extends AbstractCategoryExtractor<EntityListRecord.Builder> {

    private static final Pattern PACKAGE = Pattern.compile("Package (\\S+)");

    private static final List<StatTemplate> STATS = List.of(
            StatTemplate.opaque("Total time in foreground: (.+)", "foreground_time"),
            StatTemplate.opaque("Total time visible: (.+)", "visible_time"),
            StatTemplate.opaque("Total time in background: (.+)", "background_time")
    );

    @Override
    public DiagCategory category() {
        return DiagCategory.USAGE_STATS;
    }

    @Override
    protected EntityListRecord.Builder newDraft() {
        return EntityListRecord.builder(category());
    }

    @Override
    protected void parse(String text, EntityListRecord.Builder draft) {
        for (String rawLine : text.split("\\R")) {
            String line = rawLine.trim();

            if (line.startsWith("Package ") && line.indexOf(':') >= 0) {
                openApp(line, draft);
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
        draft.fields().putLong("total_apps", draft.closedEntities().size());
        return draft.build();
    }

    private void openApp(String line, EntityListRecord.Builder draft) {
        Matcher m = PACKAGE.matcher(line);
        String packageName = m.find() ? stripTrailingColon(m.group(1)) : "";
        if (packageName.isEmpty()) {
            draft.closeEntity();
            return;
        }
        draft.openEntity(packageName);
    }

    // "Package com.foo:" -> com.foo
    private static String stripTrailingColon(String s) {
        return s.endsWith(":") ? s.substring(0, s.length() - 1) : s;
    }
}
