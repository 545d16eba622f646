package com.phonediag.analyzer.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * 诊断类别。每个类别对应会话目录下一个固定文件名。
 */
@Getter
public enum DiagCategory {
    BATTERY_BASIC("battery_basic", "battery_basic.txt"),
    DEVICE_INFO("device_info", "device_info.txt"),
    THERMAL("thermal", "thermal.txt"),
    POWER("power", "power.txt"),
    CPU_INFO("cpuinfo", "cpuinfo.txt"),
    PROC_STATS("procstats", "procstats.txt"),
    MEMORY_INFO("memory_info", "memory_info.txt"),
    USAGE_STATS("usage_stats", "usage_stats.txt"),
    BATTERY_STATS_DETAILED("battery_stats_detailed", "battery_stats_detailed.txt");

    private final String key;
    private final String fileName;

    DiagCategory(String key, String fileName) {
        this.key = key;
        this.fileName = fileName;
    }

    /** 文件名精确匹配，未识别的文件返回 empty */
    public static Optional<DiagCategory> fromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(c -> c.fileName.equals(fileName))
                .findFirst();
    }

    @JsonValue
    public String jsonKey() {
        return key;
    }
}
