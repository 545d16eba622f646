package com.phonediag.analyzer.extractor;

import com.phonediag.analyzer.model.CategoryRecord;
import com.phonediag.analyzer.model.DiagCategory;
import com.phonediag.analyzer.model.SensorReading;
import com.phonediag.analyzer.model.ThermalRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * thermal.txt：dumpsys thermalservice 的输出。
 */
@Component
@Slf4j
public class ThermalExtractor extends AbstractCategoryExtractor<ThermalRecord.Builder> {

    /**
     * 超过这个值的读数按十分之一度处理。
     * 这是经验判断，不是设备协议：真实温度超过 100 度的读数会被误缩小。
     */
    public static final double TENTHS_THRESHOLD = 100.0;

    // Temperature{mValue=36.5, mType=2, mName=battery, mStatus=0}
    private static final Pattern READING = Pattern.compile(
            "Temperature\\{mValue=([\\d.]+), mType=(\\d+), mName=([^,]+)");

    private static final Pattern STATUS = Pattern.compile("Thermal Status: (\\d+)");

    @Override
    public DiagCategory category() {
        return DiagCategory.THERMAL;
    }

    @Override
    protected ThermalRecord.Builder newDraft() {
        return ThermalRecord.builder();
    }

    @Override
    protected void parse(String text, ThermalRecord.Builder draft) {
        Matcher m = READING.matcher(text);
        while (m.find()) {
            String name = m.group(3).trim();
            double value;
            int type;
            try {
                value = Double.parseDouble(m.group(1));
                type = Integer.parseInt(m.group(2));
            } catch (NumberFormatException e) {
                log.debug("Skip malformed thermal reading: {}", m.group());
                continue;
            }
            draft.sensor(name, new SensorReading(normalize(value), type));
        }

        Matcher sm = STATUS.matcher(text);
        if (sm.find()) {
            draft.fields().putLong("thermal_status", Long.parseLong(sm.group(1)));
        }
    }

    @Override
    protected CategoryRecord build(ThermalRecord.Builder draft) {
        return draft.build();
    }

    static double normalize(double raw) {
        return raw > TENTHS_THRESHOLD ? raw / 10.0 : raw;
    }
}
