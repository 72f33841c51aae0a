package org.pidstandard.catalog.renumber;

/**
 * 批量重编号的业务错误基类。
 */
public abstract class RenumberException extends RuntimeException {

    protected RenumberException(String message) {
        super(message);
    }
}
