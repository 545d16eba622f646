package com.phonediag.analyzer.extractor;

import com.phonediag.analyzer.model.CategoryRecord;
import com.phonediag.analyzer.model.DiagCategory;
import com.phonediag.analyzer.model.FieldRecord;
import com.phonediag.analyzer.model.FlatRecord;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * power.txt：电源状态行和 wake lock 数量。
 */
@Component
public class PowerStateExtractor extends AbstractCategoryExtractor<FieldRecord.Builder> {

    private static final Pattern POWER_STATE = Pattern.compile("Power state: (.+)");
    private static final Pattern WAKE_LOCKS = Pattern.compile("Wake Locks: size=(\\d+)");

    @Override
    public DiagCategory category() {
        return DiagCategory.POWER;
    }

    @Override
    protected FieldRecord.Builder newDraft() {
        return FieldRecord.builder();
    }

    @Override
    protected void parse(String text, FieldRecord.Builder draft) {
        Matcher sm = POWER_STATE.matcher(text);
        if (sm.find()) {
            String state = sm.group(1).trim();
            if (!state.isEmpty()) {
                draft.putText("power_state", state);
            }
        }

        // 只取第一处
        Matcher wm = WAKE_LOCKS.matcher(text);
        if (wm.find()) {
            draft.putLong("wake_locks_count", Long.parseLong(wm.group(1)));
        }
    }

    @Override
    protected CategoryRecord build(FieldRecord.Builder draft) {
        return new FlatRecord(category(), draft.build());
    }
}
