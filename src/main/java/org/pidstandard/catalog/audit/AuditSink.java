package org.pidstandard.catalog.audit;

import java.util.List;

/**
 * 只追加的审计存储。不提供修改与删除；保留期/清理属于外部职责。
 */
public interface AuditSink {

    /**
     * 追加一条记录。
     *
     * @throws AuditStorageException 存储失败
     */
    void record(AuditLogEntry entry);

    /**
     * 追加一批记录。默认实现逐条写入；支持批量写入的实现应保证全部写入或全部不写入。
     *
     * @throws AuditStorageException 存储失败
     */
    default void recordAll(List<AuditLogEntry> batch) {
        for (AuditLogEntry entry : batch) {
            record(entry);
        }
    }

    /**
     * 按条件查询，结果按 {@code timestampUtc} 倒序。
     *
     * @param projectId 为空表示所有项目
     */
    List<AuditLogEntry> query(String projectId, AuditQuery query);
}
