package org.pidstandard.catalog.store;

/**
 * 设备存储层错误（写入失败、记录不存在、事务状态非法等）。
 * <p>
 * 批量重编号遇到该异常时整批回滚，调用方修正底层问题后可以整批重试。
 */
public class EquipmentStoreException extends RuntimeException {

    public EquipmentStoreException(String message) {
        super(message);
    }

    public EquipmentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
