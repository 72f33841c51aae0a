package org.pidstandard.catalog.model;

/**
 * P&amp;ID 项目。
 *
 * @param id          项目 id
 * @param name        项目名称
 * @param number      项目编号（可为空）
 * @param taggingMode 标签规范
 * @param active      是否有效
 */
public record Project(
        String id,
        String name,
        String number,
        TaggingMode taggingMode,
        boolean active
) {

    public Project {
        if (taggingMode == null) {
            taggingMode = TaggingMode.CUSTOM;
        }
    }
}
