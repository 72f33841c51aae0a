package org.pidstandard.catalog.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 一条审计记录，写入后不可修改。
 * <p>
 * {@code oldSnapshot}/{@code newSnapshot} 是与实体类型无关的键值快照（不同实体记录的字段不同），
 * 构造时做防御性拷贝并包装为只读。
 *
 * @param id            记录 id
 * @param entityType    实体类型（Equipment、Line ...）
 * @param entityId      实体 id；批量类动作可为空
 * @param action        动作
 * @param performedBy   执行人
 * @param timestampUtc  发生时间（UTC）
 * @param changeSummary 人类可读的变更说明
 * @param oldSnapshot   变更前快照（可为空）
 * @param newSnapshot   变更后快照（可为空）
 * @param projectId     所属项目（可为空）
 * @param source        来源（主机名、子系统名等）
 */
public record AuditLogEntry(
        String id,
        String entityType,
        String entityId,
        AuditAction action,
        String performedBy,
        Instant timestampUtc,
        String changeSummary,
        Map<String, Object> oldSnapshot,
        Map<String, Object> newSnapshot,
        String projectId,
        String source
) {

    public AuditLogEntry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(entityType, "entityType");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(timestampUtc, "timestampUtc");
        oldSnapshot = freeze(oldSnapshot);
        newSnapshot = freeze(newSnapshot);
    }

    private static Map<String, Object> freeze(Map<String, Object> snapshot) {
        // Map.copyOf 不允许 null 值，快照里的空字段需要保留
        return snapshot == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(snapshot));
    }
}
