package org.pidstandard.catalog.renumber;

/**
 * 一条已提交的标签变更。
 */
public record TagChange(String equipmentId, String oldTag, String newTag) {
}
