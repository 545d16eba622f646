package com.phonediag.analyzer.extractor;

import com.phonediag.analyzer.model.CategoryRecord;
import com.phonediag.analyzer.model.CpuRecord;
import com.phonediag.analyzer.model.DiagCategory;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * cpuinfo.txt：总负载百分比和每个核心的频率。
 */
@Component
public class CpuInfoExtractor extends AbstractCategoryExtractor<CpuRecord.Builder> {

    private static final Pattern LOAD_TOTAL = Pattern.compile("Total: (\\d+)%");

    // CPU0: 1804MHz
    private static final Pattern CORE_FREQ = Pattern.compile("CPU(\\d+): (\\d+)MHz");

    @Override
    public DiagCategory category() {
        return DiagCategory.CPU_INFO;
    }

    @Override
    protected CpuRecord.Builder newDraft() {
        return CpuRecord.builder();
    }

    @Override
    protected void parse(String text, CpuRecord.Builder draft) {
        Matcher lm = LOAD_TOTAL.matcher(text);
        if (lm.find()) {
            draft.fields().putLong("cpu_load_total", Long.parseLong(lm.group(1)));
        }

        Matcher fm = CORE_FREQ.matcher(text);
        while (fm.find()) {
            draft.frequency("CPU" + fm.group(1), Long.parseLong(fm.group(2)));
        }
    }

    @Override
    protected CategoryRecord build(CpuRecord.Builder draft) {
        return draft.build();
    }
}
