package org.pidstandard.catalog.dto;

import org.pidstandard.catalog.audit.AuditLogEntry;

import java.util.List;

/**
 * {@code pid_query_audit_log} 的返回结果。
 *
 * @param projectId 项目 id（为空表示全部项目）
 * @param count     返回条数
 * @param entries   审计记录（按时间倒序）
 */
public record AuditLogResult(
        String projectId,
        int count,
        List<AuditLogEntry> entries
) {
}
