package org.pidstandard.catalog.hierarchy;

import java.util.Locale;

/**
 * 层级视图模式，互斥。
 */
public enum HierarchyMode {
    /** 区域 -> 类型 -> 设备 */
    BY_AREA,
    /** 类型 -> 设备 */
    BY_TYPE,
    /** 图纸 -> 设备，末尾附 Unassigned */
    BY_DRAWING,
    /** 沿 upstream 指针展开的工艺流程树 */
    PROCESS_FLOW;

    /**
     * 宽松解析：{@code by_area}、{@code ByArea}、{@code process-flow} 都可以。
     *
     * @throws IllegalArgumentException 无法识别
     */
    public static HierarchyMode parse(String text) {
        if (text == null || text.isBlank()) {
            return BY_AREA;
        }
        String normalized = text.trim().replace("-", "").replace("_", "").replace(" ", "").toUpperCase(Locale.ROOT);
        for (HierarchyMode m : values()) {
            if (m.name().replace("_", "").equals(normalized)) {
                return m;
            }
        }
        throw new IllegalArgumentException("未知的层级模式：" + text + "（可选 BY_AREA/BY_TYPE/BY_DRAWING/PROCESS_FLOW）");
    }
}
