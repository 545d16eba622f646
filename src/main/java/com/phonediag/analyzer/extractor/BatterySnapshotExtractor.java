package com.phonediag.analyzer.extractor;

import com.phonediag.analyzer.model.CategoryRecord;
import com.phonediag.analyzer.model.DiagCategory;
import com.phonediag.analyzer.model.FieldRecord;
import com.phonediag.analyzer.model.FlatRecord;
import com.phonediag.analyzer.parser.SectionExtractor;
import com.phonediag.analyzer.parser.ValueCoercer;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * battery_basic.txt：dumpsys battery 的输出。
 * 厂商扩展块（OPLUS）和标准块字段名有重叠，分别加 oplus_ / std_ 前缀。
 */
@Component
public class BatterySnapshotExtractor extends AbstractCategoryExtractor<FieldRecord.Builder> {

    public static final String VENDOR_PREFIX = "oplus_";
    public static final String STANDARD_PREFIX = "std_";

    private static final Pattern VENDOR_START = Pattern.compile("Current OPLUS Battery Service state:");
    private static final Pattern STANDARD_START = Pattern.compile("Current Battery Service state:");

    @Override
    public DiagCategory category() {
        return DiagCategory.BATTERY_BASIC;
    }

    @Override
    protected FieldRecord.Builder newDraft() {
        return FieldRecord.builder();
    }

    @Override
    protected void parse(String text, FieldRecord.Builder draft) {
        // 厂商块一直到标准块开始为止
        SectionExtractor.find(text, VENDOR_START, STANDARD_START)
                .ifPresent(block -> SectionExtractor.parseKeyValues(
                        block, VENDOR_PREFIX, ValueCoercer::isTemperatureKey, draft));

        // 标准块到第一个空行为止
        SectionExtractor.find(text, STANDARD_START, SectionExtractor.BLANK_LINE)
                .ifPresent(block -> SectionExtractor.parseKeyValues(
                        block, STANDARD_PREFIX, ValueCoercer::isTemperatureKey, draft));
    }

    @Override
    protected CategoryRecord build(FieldRecord.Builder draft) {
        return new FlatRecord(category(), draft.build());
    }
}
