package org.pidstandard.catalog.hierarchy;

import java.util.List;

/**
 * 层级树节点（临时投影，每次切换模式都重新构建，没有持久身份）。
 *
 * @param label       展示文本
 * @param kind        节点类型
 * @param equipmentId 设备节点对应的设备 id；分组节点为空
 * @param children    子节点（有序）
 */
public record HierarchyNode(
        String label,
        Kind kind,
        String equipmentId,
        List<HierarchyNode> children
) {

    public enum Kind {
        GROUP,
        EQUIPMENT,
        CIRCULAR_REFERENCE
    }

    public HierarchyNode {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static HierarchyNode group(String label, List<HierarchyNode> children) {
        return new HierarchyNode(label, Kind.GROUP, null, children);
    }

    public static HierarchyNode equipment(String label, String equipmentId, List<HierarchyNode> children) {
        return new HierarchyNode(label, Kind.EQUIPMENT, equipmentId, children);
    }

    public static HierarchyNode circular(String label, String equipmentId) {
        return new HierarchyNode(label, Kind.CIRCULAR_REFERENCE, equipmentId, List.of());
    }

    public int childCount() {
        return children.size();
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }
}
