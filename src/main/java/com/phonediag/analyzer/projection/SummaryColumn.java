package com.phonediag.analyzer.projection;

import com.phonediag.analyzer.model.DiagCategory;
import com.phonediag.analyzer.model.DiagValue;
import com.phonediag.analyzer.model.SessionRecord;
import com.phonediag.analyzer.model.ThermalRecord;
import lombok.Getter;

import java.util.function.Function;

/**
 * 汇总表的指标列。来源类别缺失时该列为 ABSENT。
 */
@Getter
public enum SummaryColumn {
    BATTERY_LEVEL("battery_level", field(DiagCategory.BATTERY_BASIC, "std_level")),
    BATTERY_VOLTAGE("battery_voltage", field(DiagCategory.BATTERY_BASIC, "std_voltage")),
    BATTERY_TEMPERATURE("battery_temperature", field(DiagCategory.BATTERY_BASIC, "std_temperature")),
    CHARGING_STATUS("charging_status", field(DiagCategory.BATTERY_BASIC, "std_status")),
    AC_POWERED("ac_powered", field(DiagCategory.BATTERY_BASIC, "std_AC powered")),
    USB_POWERED("usb_powered", field(DiagCategory.BATTERY_BASIC, "std_USB powered")),
    PHONE_TEMP("phone_temp", field(DiagCategory.BATTERY_BASIC, "oplus_PhoneTemp")),

    MODEL("model", field(DiagCategory.DEVICE_INFO, "model")),
    BRAND("brand", field(DiagCategory.DEVICE_INFO, "brand")),
    ANDROID_VERSION("android_version", field(DiagCategory.DEVICE_INFO, "android_version")),

    CPU_TEMP("cpu_temp", sensor("CPU")),
    GPU_TEMP("gpu_temp", sensor("GPU")),
    BATTERY_TEMP_THERMAL("battery_temp_thermal", sensor("BATTERY")),
    SKIN_TEMP("skin_temp", sensor("SKIN")),

    TOTAL_PROCESSES("total_processes", field(DiagCategory.PROC_STATS, "total_processes")),

    TOTAL_RAM_GB("total_ram_gb", field(DiagCategory.MEMORY_INFO, "total_ram_gb")),
    USED_RAM_MB("used_ram_mb", field(DiagCategory.MEMORY_INFO, "used_ram_mb")),
    RAM_USAGE_PERCENT("ram_usage_percent", field(DiagCategory.MEMORY_INFO, "ram_usage_percent")),

    TOTAL_SCREEN_TIME_MS("total_screen_time_ms", field(DiagCategory.BATTERY_STATS_DETAILED, "total_screen_time_ms")),
    TOTAL_CPU_TIME_MS("total_cpu_time_ms", field(DiagCategory.BATTERY_STATS_DETAILED, "total_cpu_time_ms")),
    TOTAL_WAKE_LOCK_MS("total_wake_lock_ms", field(DiagCategory.BATTERY_STATS_DETAILED, "total_wake_lock_ms"));

    private final String columnName;
    private final Function<SessionRecord, DiagValue> source;

    SummaryColumn(String columnName, Function<SessionRecord, DiagValue> source) {
        this.columnName = columnName;
        this.source = source;
    }

    public DiagValue read(SessionRecord session) {
        return source.apply(session);
    }

    private static Function<SessionRecord, DiagValue> field(DiagCategory category, String key) {
        return s -> s.category(category)
                .map(r -> r.getFields().get(key))
                .orElse(DiagValue.absent());
    }

    private static Function<SessionRecord, DiagValue> sensor(String name) {
        return s -> s.category(DiagCategory.THERMAL, ThermalRecord.class)
                .flatMap(t -> t.sensor(name))
                .map(r -> DiagValue.ofDouble(r.getValue()))
                .orElse(DiagValue.absent());
    }
}
