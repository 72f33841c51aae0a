package org.pidstandard.catalog.renumber;

/**
 * 新标签与项目中另一台（不在本批次内的）有效设备的标签相同。
 *
 * @param equipmentId         被重编号的设备
 * @param proposedTag         拟用的新标签
 * @param existingEquipmentId 已占用该标签的设备
 */
public record TagConflict(String equipmentId, String proposedTag, String existingEquipmentId) {
}
