package org.pidstandard.catalog.model;

/**
 * 项目级标签规范：自定义格式或 KKS（电厂标识系统）格式。
 * <p>
 * 一旦项目内已有设备分配了标签，就不应再切换模式。
 */
public enum TaggingMode {
    CUSTOM,
    KKS
}
