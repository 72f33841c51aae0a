package org.pidstandard.catalog;

import org.pidstandard.catalog.model.EquipmentStatus;
import org.pidstandard.catalog.model.ProcessParameters;

/**
 * 新建/编辑设备的输入。编辑时为 null 的字段保持原值。
 */
public record EquipmentDraft(
        String tag,
        String equipmentType,
        String description,
        String service,
        String area,
        EquipmentStatus status,
        String manufacturer,
        String model,
        String drawingId,
        ProcessParameters processParameters
) {

    public static EquipmentDraft of(String tag, String equipmentType, String area) {
        return new EquipmentDraft(tag, equipmentType, null, null, area, null, null, null, null, null);
    }
}
