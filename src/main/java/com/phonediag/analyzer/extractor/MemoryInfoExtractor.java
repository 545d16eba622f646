package com.phonediag.analyzer.extractor;

import com.phonediag.analyzer.model.CategoryRecord;
import com.phonediag.analyzer.model.DiagCategory;
import com.phonediag.analyzer.model.EntityListRecord;
import com.phonediag.analyzer.model.FieldRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * memory_info.txt：dumpsys meminfo 的汇总部分。
 * 按应用的内存明细目前不解析，实体列表始终为空。
 */
@Component
@Slf4j
public class MemoryInfoExtractor extends AbstractCategoryExtractor<EntityListRecord.Builder> {

    // Total RAM: 7,654,321K (status normal)
    private static final Pattern TOTAL_RAM = Pattern.compile("Total RAM: ([\\d,]+)\\s*K");
    private static final Pattern FREE_RAM = Pattern.compile("Free RAM: ([\\d,]+)\\s*K");

    @Override
    public DiagCategory category() {
        return DiagCategory.MEMORY_INFO;
    }

    @Override
    protected EntityListRecord.Builder newDraft() {
        return EntityListRecord.builder(category());
    }

    @Override
    protected void parse(String text, EntityListRecord.Builder draft) {
        FieldRecord.Builder fields = draft.fields();
        OptionalLong totalKb = kilobytes(TOTAL_RAM, text);
        if (totalKb.isPresent()) {
            double totalMb = totalKb.getAsLong() / 1024.0;
            fields.putLong("total_ram_kb", totalKb.getAsLong());
            fields.putDouble("total_ram_mb", totalMb);
            fields.putDouble("total_ram_gb", totalMb / 1024.0);
        }

        OptionalLong freeKb = kilobytes(FREE_RAM, text);
        if (freeKb.isPresent()) {
            double freeMb = freeKb.getAsLong() / 1024.0;
            fields.putLong("free_ram_kb", freeKb.getAsLong());
            fields.putDouble("free_ram_mb", freeMb);

            // 两个都有且总量大于 0 时才推导已用量
            if (totalKb.isPresent() && totalKb.getAsLong() > 0) {
                double totalMb = totalKb.getAsLong() / 1024.0;
                double usedMb = totalMb - freeMb;
                fields.putDouble("used_ram_mb", usedMb);
                fields.putDouble("ram_usage_percent", usedMb / totalMb * 100.0);
            }
        }
    }

    @Override
    protected CategoryRecord build(EntityListRecord.Builder draft) {
        return draft.build();
    }

    /** 去掉千分位逗号再转数字，转不了视为缺失 */
    private static OptionalLong kilobytes(Pattern p, String text) {
        Matcher m = p.matcher(text);
        if (!m.find()) {
            return OptionalLong.empty();
        }
        String digits = m.group(1).replace(",", "");
        if (digits.isEmpty()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(digits));
        } catch (NumberFormatException e) {
            log.debug("Skip malformed memory value: {}", m.group());
            return OptionalLong.empty();
        }
    }
}
