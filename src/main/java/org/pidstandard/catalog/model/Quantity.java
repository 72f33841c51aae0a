package org.pidstandard.catalog.model;

import java.math.BigDecimal;

/**
 * 带单位的工艺参数值，例如 {@code 12.5 bar}。
 *
 * @param value 数值
 * @param unit  单位（bar、psi、C、m3/h、kW ...）
 */
public record Quantity(BigDecimal value, String unit) {

    public static Quantity of(String value, String unit) {
        return new Quantity(new BigDecimal(value), unit);
    }

    @Override
    public String toString() {
        if (value == null) {
            return "-";
        }
        return unit == null || unit.isBlank() ? value.toPlainString() : value.toPlainString() + " " + unit;
    }
}
