package org.pidstandard.catalog.dto;

import org.pidstandard.catalog.model.Equipment;

import java.util.List;

/**
 * {@code pid_list_equipment} 的返回结果。
 *
 * @param projectId 项目 id
 * @param total     返回条数
 * @param equipment 设备（按标签排序）
 */
public record EquipmentListResult(
        String projectId,
        int total,
        List<Equipment> equipment
) {
}
