package org.pidstandard.catalog.model;

/**
 * 设备在项目生命周期中的状态。
 */
public enum EquipmentStatus {
    PLANNED,
    INSTALLED,
    COMMISSIONED,
    DECOMMISSIONED
}
