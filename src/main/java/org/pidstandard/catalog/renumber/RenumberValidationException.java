package org.pidstandard.catalog.renumber;

/**
 * 参数不合法（模式为空、起始号/步长无法解析、步长小于 1、没有选中任何设备……）。
 * 在访问存储之前抛出，不会自动重试。
 */
public class RenumberValidationException extends RenumberException {

    public RenumberValidationException(String message) {
        super(message);
    }
}
