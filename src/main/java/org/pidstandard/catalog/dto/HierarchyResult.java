package org.pidstandard.catalog.dto;

import org.pidstandard.catalog.hierarchy.HierarchyMode;
import org.pidstandard.catalog.hierarchy.HierarchyNode;

import java.util.List;

/**
 * {@code pid_build_hierarchy} 的返回结果。
 *
 * @param projectId 项目 id
 * @param mode      层级模式
 * @param leafCount 树中设备叶子数
 * @param roots     顶层节点
 */
public record HierarchyResult(
        String projectId,
        HierarchyMode mode,
        int leafCount,
        List<HierarchyNode> roots
) {
}
