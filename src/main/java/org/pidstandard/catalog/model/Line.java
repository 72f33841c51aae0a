package org.pidstandard.catalog.model;

/**
 * 管线。{@code fromEquipmentId}/{@code toEquipmentId} 描述介质从哪台设备流向哪台设备。
 *
 * @param id              管线 id
 * @param projectId       所属项目
 * @param lineNumber      管线号
 * @param service         介质/用途
 * @param fluidType       流体类型
 * @param nominalSize     公称尺寸
 * @param fromEquipmentId 起点设备（可为空）
 * @param toEquipmentId   终点设备（可为空）
 * @param drawingId       所在图纸（可为空）
 */
public record Line(
        String id,
        String projectId,
        String lineNumber,
        String service,
        String fluidType,
        String nominalSize,
        String fromEquipmentId,
        String toEquipmentId,
        String drawingId
) {
}
