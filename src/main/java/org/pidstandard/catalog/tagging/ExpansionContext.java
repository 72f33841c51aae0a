package org.pidstandard.catalog.tagging;

/**
 * 一次标签展开所需的上下文：已解析好的类型代码与区域。
 *
 * @param typeCode 替换 {@code {TYPE}} 的类型代码
 * @param area     替换 {@code {AREA}} 的区域（为空时为 {@link #DEFAULT_AREA}）
 */
public record ExpansionContext(String typeCode, String area) {

    public static final String DEFAULT_AREA = "00";

    public ExpansionContext {
        if (typeCode == null) {
            typeCode = "";
        }
        if (area == null || area.isEmpty()) {
            area = DEFAULT_AREA;
        }
    }

    public static ExpansionContext of(String equipmentType, String area, TypeCodeLookup lookup) {
        return new ExpansionContext(lookup.codeFor(equipmentType), area);
    }
}
