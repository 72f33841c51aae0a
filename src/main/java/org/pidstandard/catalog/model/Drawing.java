package org.pidstandard.catalog.model;

/**
 * P&amp;ID 图纸（只保留层级视图需要的字段，文件存储与版本管理由外部系统负责）。
 *
 * @param id            图纸 id
 * @param projectId     所属项目
 * @param drawingNumber 图号（排序与展示都用它）
 * @param title         图纸标题
 * @param revision      版次
 */
public record Drawing(
        String id,
        String projectId,
        String drawingNumber,
        String title,
        String revision
) {
}
