package com.phonediag.analyzer.extractor;

import com.phonediag.analyzer.model.CategoryRecord;
import com.phonediag.analyzer.model.DiagCategory;
import com.phonediag.analyzer.model.FieldRecord;
import com.phonediag.analyzer.model.FlatRecord;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * device_info.txt：型号、品牌、系统版本，加上 getprop 输出的全部 [key]: [value]。
 */
@Component
public class DeviceIdentityExtractor extends AbstractCategoryExtractor<FieldRecord.Builder> {

    public static final String PROP_PREFIX = "prop_";

    private static final Pattern MODEL = Pattern.compile("Model: (.+)");
    private static final Pattern BRAND = Pattern.compile("Brand: (.+)");
    private static final Pattern ANDROID_VERSION = Pattern.compile("Android Version: (.+)");

    // [ro.product.model]: [CPH2449]
    private static final Pattern PROP = Pattern.compile("\\[(.+?)\\]: \\[(.+?)\\]");

    @Override
    public DiagCategory category() {
        return DiagCategory.DEVICE_INFO;
    }

    @Override
    protected FieldRecord.Builder newDraft() {
        return FieldRecord.builder();
    }

    @Override
    protected void parse(String text, FieldRecord.Builder draft) {
        draft.putText("model", firstGroup(MODEL, text));
        draft.putText("brand", firstGroup(BRAND, text));
        draft.putText("android_version", firstGroup(ANDROID_VERSION, text));

        // 属性值保持原文本；同名属性后出现的覆盖先出现的
        Matcher m = PROP.matcher(text);
        while (m.find()) {
            draft.putText(PROP_PREFIX + m.group(1), m.group(2));
        }
    }

    @Override
    protected CategoryRecord build(FieldRecord.Builder draft) {
        return new FlatRecord(category(), draft.build());
    }

    private static String firstGroup(Pattern p, String text) {
        Matcher m = p.matcher(text);
        if (!m.find()) {
            return null;
        }
        String v = m.group(1).trim();
        return v.isEmpty() ? null : v;
    }
}
