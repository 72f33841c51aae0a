package org.pidstandard.catalog.model;

/**
 * 设备的工艺参数（操作条件 + 设计条件 + 功率/容量），所有字段都可为空。
 */
public record ProcessParameters(
        Quantity operatingPressure,
        Quantity operatingTemperature,
        Quantity flowRate,
        Quantity designPressure,
        Quantity designTemperature,
        Quantity powerOrCapacity
) {

    public static final ProcessParameters NONE = new ProcessParameters(null, null, null, null, null, null);
}
