package org.pidstandard.catalog.dto;

/**
 * 预览中的一条标签变更。
 *
 * @param equipmentId 设备 id
 * @param currentTag  当前标签
 * @param proposedTag 新标签
 */
public record ProposedTagChange(
        String equipmentId,
        String currentTag,
        String proposedTag
) {
}
