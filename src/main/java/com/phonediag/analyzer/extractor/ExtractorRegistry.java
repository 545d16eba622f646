package com.phonediag.analyzer.extractor;

import com.phonediag.analyzer.model.DiagCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 文件名 -> 抽取器。每个类别只能有一个抽取器。
 */
@Component
@Slf4j
public class ExtractorRegistry {

    private final Map<DiagCategory, CategoryExtractor> byCategory;

    public ExtractorRegistry(List<CategoryExtractor> extractors) {
        Map<DiagCategory, CategoryExtractor> map = new EnumMap<>(DiagCategory.class);
        for (CategoryExtractor e : extractors) {
            CategoryExtractor previous = map.put(e.category(), e);
            if (previous != null) {
                throw new IllegalStateException("Duplicate extractor for category " + e.category()
                        + ": " + previous.getClass().getName() + ", " + e.getClass().getName());
            }
        }
        for (DiagCategory c : DiagCategory.values()) {
            if (!map.containsKey(c)) {
                log.warn("No extractor registered for {}", c.getFileName());
            }
        }
        this.byCategory = Collections.unmodifiableMap(map);
    }

    /** 不经过 Spring 时使用的默认组合 */
    public static ExtractorRegistry defaults() {
        return new ExtractorRegistry(List.of(
                new BatterySnapshotExtractor(),
                new DeviceIdentityExtractor(),
                new ThermalExtractor(),
                new PowerStateExtractor(),
                new CpuInfoExtractor(),
                new ProcStatsExtractor(),
                new MemoryInfoExtractor(),
                new UsageStatsExtractor(),
                new BatteryAttributionExtractor()
        ));
    }

    public Optional<CategoryExtractor> forCategory(DiagCategory category) {
        return Optional.ofNullable(byCategory.get(category));
    }

    /** 文件名精确匹配；不认识的文件返回 empty，不算错误 */
    public Optional<CategoryExtractor> forFileName(String fileName) {
        return DiagCategory.fromFileName(fileName).flatMap(this::forCategory);
    }
}
