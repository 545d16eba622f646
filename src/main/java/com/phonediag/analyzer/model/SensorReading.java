package com.phonediag.analyzer.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public final class SensorReading {

    /** 摄氏度，已做过十分之一度的换算 */
    private final double value;

    /** 设备上报的传感器类型码 */
    private final int type;
}
