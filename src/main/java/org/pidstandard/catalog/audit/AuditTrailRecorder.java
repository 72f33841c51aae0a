package org.pidstandard.catalog.audit;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.pidstandard.catalog.model.Equipment;
import org.pidstandard.catalog.model.EquipmentStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * 审计记录器：负责构造审计记录（执行人、时间、来源、快照）并写入 {@link AuditSink}。
 * <p>
 * 只追加：不提供修改或删除。快照通过 Jackson 把一个小的值对象转换成有序 Map，
 * 因此不同实体类型可以各自决定记录哪些字段。
 */
public class AuditTrailRecorder {

    private static final Logger log = LoggerFactory.getLogger(AuditTrailRecorder.class);

    public static final String EQUIPMENT = "Equipment";
    public static final String RENUMBER_SOURCE_PREFIX = "Tag Renumbering";

    private static final TypeReference<LinkedHashMap<String, Object>> SNAPSHOT_TYPE = new TypeReference<>() {
    };

    private final AuditSink sink;
    private final IdentitySource identity;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int defaultLimit;
    private final int maxLimit;

    public AuditTrailRecorder(AuditSink sink, IdentitySource identity, ObjectMapper objectMapper, Clock clock, int defaultLimit, int maxLimit) {
        this.sink = sink;
        this.identity = identity;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.defaultLimit = Math.max(1, defaultLimit);
        this.maxLimit = Math.max(this.defaultLimit, maxLimit);
    }

    public IdentitySource identity() {
        return identity;
    }

    public Clock clock() {
        return clock;
    }

    public void record(AuditLogEntry entry) {
        try {
            sink.record(entry);
        } catch (AuditStorageException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AuditStorageException("写入审计记录失败：" + e.getMessage(), e);
        }
        log.debug("审计 {} {} {}：{}", entry.action().label(), entry.entityType(), entry.entityId(), entry.changeSummary());
    }

    /**
     * 批量写入；用于和存储事务一起提交的多条记录（批量重编号、上下游连接）。
     */
    public void recordAll(List<AuditLogEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }
        try {
            sink.recordAll(entries);
        } catch (AuditStorageException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AuditStorageException("写入审计记录失败：" + e.getMessage(), e);
        }
        log.debug("审计批量写入 {} 条", entries.size());
    }

    /**
     * 按条件查询，按时间倒序；limit 未指定时用默认值，并且不超过上限。
     */
    public List<AuditLogEntry> query(String projectId, AuditQuery query) {
        AuditQuery q = query == null ? AuditQuery.all() : query;
        int limit = q.limit() <= 0 ? defaultLimit : Math.min(q.limit(), maxLimit);
        return sink.query(projectId, q.withLimit(limit));
    }

    public AuditLogEntry newEntry(
            String entityType,
            String entityId,
            AuditAction action,
            String changeSummary,
            Object oldValues,
            Object newValues,
            String projectId
    ) {
        return new AuditLogEntry(
                UUID.randomUUID().toString(),
                entityType,
                entityId,
                action,
                identity.performedBy(),
                clock.instant(),
                changeSummary,
                toSnapshot(oldValues),
                toSnapshot(newValues),
                projectId,
                identity.source()
        );
    }

    public AuditLogEntry equipmentCreated(Equipment equipment) {
        AuditLogEntry entry = newEntry(
                EQUIPMENT,
                equipment.id(),
                AuditAction.CREATED,
                "Equipment '" + equipment.tag() + "' created",
                null,
                new CreatedSnapshot(equipment.tag(), equipment.equipmentType(), equipment.description(), equipment.status()),
                equipment.projectId()
        );
        record(entry);
        return entry;
    }

    /**
     * 记录一次编辑；只在标签、描述、状态、用途、制造商或型号确实变化时写入。
     *
     * @return 没有可审计的变化时为空
     */
    public Optional<AuditLogEntry> equipmentUpdated(Equipment before, Equipment after) {
        List<String> changes = describeChanges(before, after);
        if (changes.isEmpty()) {
            return Optional.empty();
        }
        AuditLogEntry entry = newEntry(
                EQUIPMENT,
                after.id(),
                AuditAction.UPDATED,
                String.join(", ", changes),
                UpdatedSnapshot.of(before),
                UpdatedSnapshot.of(after),
                after.projectId()
        );
        record(entry);
        return Optional.of(entry);
    }

    public AuditLogEntry equipmentDeleted(Equipment equipment) {
        AuditLogEntry entry = newEntry(
                EQUIPMENT,
                equipment.id(),
                AuditAction.DELETED,
                "Equipment '" + equipment.tag() + "' deleted",
                new RenumberSnapshot(equipment.tag(), equipment.equipmentType(), equipment.description()),
                null,
                equipment.projectId()
        );
        record(entry);
        return entry;
    }

    /**
     * 构造（但不写入）一条重编号审计记录；批量重编号在同一事务内、提交前统一写入。
     */
    public AuditLogEntry renumberEntry(Equipment before, Equipment after) {
        return newEntry(
                EQUIPMENT,
                after.id(),
                AuditAction.UPDATED,
                RENUMBER_SOURCE_PREFIX + ": " + before.tag() + " → " + after.tag(),
                new RenumberSnapshot(before.tag(), before.equipmentType(), before.description()),
                new RenumberSnapshot(after.tag(), after.equipmentType(), after.description()),
                after.projectId()
        );
    }

    private Map<String, Object> toSnapshot(Object values) {
        if (values == null) {
            return null;
        }
        if (values instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        }
        return objectMapper.convertValue(values, SNAPSHOT_TYPE);
    }

    private static List<String> describeChanges(Equipment before, Equipment after) {
        List<String> changes = new ArrayList<>();
        if (!Objects.equals(before.tag(), after.tag())) {
            changes.add("Tag: " + before.tag() + " → " + after.tag());
        }
        if (!Objects.equals(before.description(), after.description())) {
            changes.add("Description changed");
        }
        if (before.status() != after.status()) {
            changes.add("Status: " + before.status() + " → " + after.status());
        }
        if (!Objects.equals(before.service(), after.service())) {
            changes.add("Service: " + before.service() + " → " + after.service());
        }
        if (!Objects.equals(before.manufacturer(), after.manufacturer())) {
            changes.add("Manufacturer changed");
        }
        if (!Objects.equals(before.model(), after.model())) {
            changes.add("Model changed");
        }
        return changes;
    }

    public record CreatedSnapshot(String tag, String equipmentType, String description, EquipmentStatus status) {
    }

    public record RenumberSnapshot(String tag, String equipmentType, String description) {
    }

    public record UpdatedSnapshot(String tag, String description, EquipmentStatus status, String service, String manufacturer, String model) {
        static UpdatedSnapshot of(Equipment e) {
            return new UpdatedSnapshot(e.tag(), e.description(), e.status(), e.service(), e.manufacturer(), e.model());
        }
    }
}
