package org.pidstandard.catalog.hierarchy;

import org.pidstandard.catalog.model.EquipmentStatus;
import org.pidstandard.catalog.model.ProcessParameters;

import java.util.List;

/**
 * 在层级树中选中一台设备时展示的详情：基本信息、所在图纸、上下游设备与相连管线。
 */
public record EquipmentDetails(
        String equipmentId,
        String tag,
        String equipmentType,
        String description,
        String service,
        String area,
        EquipmentStatus status,
        String manufacturer,
        String model,
        String drawingNumber,
        ProcessParameters processParameters,
        List<ConnectedEquipment> connectedEquipment,
        List<ConnectedLine> connectedLines
) {

    /**
     * @param relationship {@code Upstream} 或 {@code Downstream}
     */
    public record ConnectedEquipment(String equipmentId, String tag, String equipmentType, String description, String relationship) {
    }

    /**
     * @param direction 设备是管线起点时为 {@code Outgoing}，是终点时为 {@code Incoming}
     */
    public record ConnectedLine(String lineId, String lineNumber, String service, String nominalSize, String direction) {
    }
}
