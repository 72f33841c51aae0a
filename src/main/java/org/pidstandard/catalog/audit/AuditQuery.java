package org.pidstandard.catalog.audit;

import java.time.Instant;

/**
 * 审计查询条件，所有条件之间为 AND；为空的条件不参与过滤。
 *
 * @param entityType 实体类型（不区分大小写）
 * @param action     动作
 * @param since      起始时间（含），为空表示不限
 * @param until      截止时间（含），为空表示不限
 * @param entityId   实体 id
 * @param limit      最大返回条数，&lt;= 0 表示使用默认值
 */
public record AuditQuery(
        String entityType,
        AuditAction action,
        Instant since,
        Instant until,
        String entityId,
        int limit
) {

    public static AuditQuery all() {
        return new AuditQuery(null, null, null, null, null, 0);
    }

    public static AuditQuery of(String entityType, AuditAction action, Instant since) {
        return new AuditQuery(entityType, action, since, null, null, 0);
    }

    public AuditQuery withLimit(int newLimit) {
        return new AuditQuery(entityType, action, since, until, entityId, newLimit);
    }

    public boolean matches(String projectId, AuditLogEntry e) {
        if (projectId != null && !projectId.equals(e.projectId())) {
            return false;
        }
        if (entityType != null && !entityType.isBlank() && !entityType.equalsIgnoreCase(e.entityType())) {
            return false;
        }
        if (action != null && action != e.action()) {
            return false;
        }
        if (entityId != null && !entityId.isBlank() && !entityId.equals(e.entityId())) {
            return false;
        }
        if (since != null && e.timestampUtc().isBefore(since)) {
            return false;
        }
        return until == null || !e.timestampUtc().isAfter(until);
    }
}
