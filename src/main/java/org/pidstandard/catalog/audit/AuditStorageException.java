package org.pidstandard.catalog.audit;

/**
 * 审计存储层写入/查询失败。审计记录从不因业务原因被拒绝，只会因存储问题失败。
 */
public class AuditStorageException extends RuntimeException {

    public AuditStorageException(String message) {
        super(message);
    }

    public AuditStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
