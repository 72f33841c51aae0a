package org.pidstandard.catalog;

import org.pidstandard.catalog.audit.AuditAction;
import org.pidstandard.catalog.audit.AuditLogEntry;
import org.pidstandard.catalog.audit.AuditTrailRecorder;
import org.pidstandard.catalog.model.Equipment;
import org.pidstandard.catalog.model.Project;
import org.pidstandard.catalog.store.EquipmentStore;
import org.pidstandard.catalog.store.EquipmentTransaction;
import org.pidstandard.catalog.tagging.TagValidationResult;
import org.pidstandard.catalog.tagging.TagValidationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * 单台设备的维护：新建、编辑、软删除、上下游连接。每次修改都写一条审计记录。
 * <p>
 * 标签在新建/改名时按项目规范校验（格式 + 有效设备内唯一）。
 * 上下游连接不做环检测：指针结构允许出现环，由遍历方负责识别。
 */
public class EquipmentCatalogService {

    private static final Logger log = LoggerFactory.getLogger(EquipmentCatalogService.class);

    private final EquipmentStore store;
    private final TagValidationService tagValidation;
    private final AuditTrailRecorder audit;

    public EquipmentCatalogService(EquipmentStore store, TagValidationService tagValidation, AuditTrailRecorder audit) {
        this.store = store;
        this.tagValidation = tagValidation;
        this.audit = audit;
    }

    public Equipment create(String projectId, EquipmentDraft draft) {
        Project project = store.findProject(projectId)
                .orElseThrow(() -> new NoSuchElementException("项目不存在：" + projectId));
        String tag = draft.tag() == null ? null : draft.tag().trim();
        requireValidTag(project.id(), tag, null);

        Instant now = audit.clock().instant();
        String actor = audit.identity().performedBy();
        Equipment equipment = Equipment.builder(UUID.randomUUID().toString(), project.id())
                .tag(tag)
                .equipmentType(draft.equipmentType())
                .description(draft.description())
                .service(draft.service())
                .area(draft.area())
                .status(draft.status())
                .manufacturer(draft.manufacturer())
                .model(draft.model())
                .drawingId(draft.drawingId())
                .processParameters(draft.processParameters())
                .createdBy(actor)
                .createdAt(now)
                .build();
        store.insert(equipment);
        audit.equipmentCreated(equipment);
        log.info("新建设备 {}（项目 {}）", equipment.tag(), project.id());
        return equipment;
    }

    public Equipment update(String equipmentId, EquipmentDraft changes) {
        Equipment before = requireActive(equipmentId);
        Equipment.Builder b = before.toBuilder();
        if (changes.tag() != null && !changes.tag().trim().equals(before.tag())) {
            String tag = changes.tag().trim();
            requireValidTag(before.projectId(), tag, before.id());
            b.tag(tag);
        }
        if (changes.equipmentType() != null) {
            b.equipmentType(changes.equipmentType());
        }
        if (changes.description() != null) {
            b.description(changes.description());
        }
        if (changes.service() != null) {
            b.service(changes.service());
        }
        if (changes.area() != null) {
            b.area(changes.area());
        }
        if (changes.status() != null) {
            b.status(changes.status());
        }
        if (changes.manufacturer() != null) {
            b.manufacturer(changes.manufacturer());
        }
        if (changes.model() != null) {
            b.model(changes.model());
        }
        if (changes.drawingId() != null) {
            b.drawingId(changes.drawingId().isBlank() ? null : changes.drawingId());
        }
        if (changes.processParameters() != null) {
            b.processParameters(changes.processParameters());
        }
        Equipment after = b.modifiedBy(audit.identity().performedBy()).modifiedAt(audit.clock().instant()).build();
        store.update(after);
        audit.equipmentUpdated(before, after);
        return after;
    }

    /**
     * 软删除：设备标记为无效，不再参与标签唯一性校验与层级视图。
     */
    public Equipment deactivate(String equipmentId) {
        Equipment before = requireActive(equipmentId);
        Equipment after = before.deactivated(audit.identity().performedBy(), audit.clock().instant());
        store.update(after);
        audit.equipmentDeleted(before);
        log.info("软删除设备 {}", before.tag());
        return after;
    }

    /**
     * 建立 upstream -&gt; downstream 连接：下游设备的 upstream 指向上游，上游设备的 downstream 指向下游。
     * <p>
     * 下游原来的上游若仍以 downstream 指向它，该指针一并清空。上游原来的下游保留自己的 upstream 指针：
     * 多台设备可以共用同一个上游（流程树按 upstream 指针分叉），downstream 只是单值的主连接。
     * 所有修改与对应的审计记录在同一事务内完成，每台被修改的设备各写一条 Updated 记录。
     */
    public Equipment link(String upstreamId, String downstreamId) {
        if (Objects.equals(upstreamId, downstreamId)) {
            throw new IllegalArgumentException("设备不能连接到自身：" + upstreamId);
        }
        String actor = audit.identity().performedBy();
        Instant now = audit.clock().instant();
        try (EquipmentTransaction tx = store.beginTransaction()) {
            Equipment upstream = requireActive(tx.getById(upstreamId), upstreamId);
            Equipment downstream = requireActive(tx.getById(downstreamId), downstreamId);
            if (!upstream.projectId().equals(downstream.projectId())) {
                throw new IllegalArgumentException("上下游设备必须属于同一项目");
            }

            List<AuditLogEntry> entries = new ArrayList<>();
            Equipment newDownstream = downstream.withUpstream(upstream.id(), actor, now);
            stage(tx, downstream, newDownstream, entries);
            String previousUpstreamId = downstream.upstreamEquipmentId();
            if (previousUpstreamId != null && !previousUpstreamId.equals(upstream.id())) {
                tx.getById(previousUpstreamId)
                        .filter(previous -> downstream.id().equals(previous.downstreamEquipmentId()))
                        .ifPresent(previous -> stage(tx, previous, previous.withDownstream(null, actor, now), entries));
            }
            stage(tx, upstream, upstream.withDownstream(downstream.id(), actor, now), entries);

            audit.recordAll(entries);
            tx.commit();
            log.info("连接设备 {} -> {}", upstream.tag(), downstream.tag());
            return newDownstream;
        }
    }

    /**
     * 断开设备与其上游的连接；若上游的 downstream 指向该设备，一并清空。
     */
    public Equipment unlink(String equipmentId) {
        String actor = audit.identity().performedBy();
        Instant now = audit.clock().instant();
        try (EquipmentTransaction tx = store.beginTransaction()) {
            Equipment downstream = requireActive(tx.getById(equipmentId), equipmentId);
            if (downstream.upstreamEquipmentId() == null) {
                return downstream;
            }
            List<AuditLogEntry> entries = new ArrayList<>();
            Equipment newDownstream = downstream.withUpstream(null, actor, now);
            stage(tx, downstream, newDownstream, entries);
            tx.getById(downstream.upstreamEquipmentId())
                    .filter(up -> equipmentId.equals(up.downstreamEquipmentId()))
                    .ifPresent(up -> stage(tx, up, up.withDownstream(null, actor, now), entries));

            audit.recordAll(entries);
            tx.commit();
            return newDownstream;
        }
    }

    // 暂存一条指针修改并生成审计记录；指针没有变化时什么都不做
    private void stage(EquipmentTransaction tx, Equipment before, Equipment after, List<AuditLogEntry> entries) {
        List<String> changes = new ArrayList<>(2);
        if (!Objects.equals(before.upstreamEquipmentId(), after.upstreamEquipmentId())) {
            changes.add("Upstream: " + tagOf(tx, before.upstreamEquipmentId()) + " → " + tagOf(tx, after.upstreamEquipmentId()));
        }
        if (!Objects.equals(before.downstreamEquipmentId(), after.downstreamEquipmentId())) {
            changes.add("Downstream: " + tagOf(tx, before.downstreamEquipmentId()) + " → " + tagOf(tx, after.downstreamEquipmentId()));
        }
        if (changes.isEmpty()) {
            return;
        }
        tx.update(after);
        entries.add(audit.newEntry(
                AuditTrailRecorder.EQUIPMENT,
                after.id(),
                AuditAction.UPDATED,
                String.join(", ", changes),
                linkSnapshot(before),
                linkSnapshot(after),
                after.projectId()
        ));
    }

    private static Map<String, Object> linkSnapshot(Equipment e) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("tag", e.tag());
        m.put("upstreamEquipmentId", e.upstreamEquipmentId());
        m.put("downstreamEquipmentId", e.downstreamEquipmentId());
        return m;
    }

    private static String tagOf(EquipmentTransaction tx, String equipmentId) {
        if (equipmentId == null) {
            return "(none)";
        }
        return tx.getById(equipmentId).map(Equipment::tag).orElse(equipmentId);
    }

    private Equipment requireActive(String equipmentId) {
        return requireActive(store.getById(equipmentId), equipmentId);
    }

    private static Equipment requireActive(Optional<Equipment> found, String equipmentId) {
        Equipment e = found.orElseThrow(() -> new NoSuchElementException("设备不存在：" + equipmentId));
        if (!e.active()) {
            throw new IllegalStateException("设备已删除：" + e.tag());
        }
        return e;
    }

    private void requireValidTag(String projectId, String tag, String excludeEquipmentId) {
        TagValidationResult result = tagValidation.validate(projectId, tag, excludeEquipmentId);
        if (!result.valid()) {
            throw new IllegalArgumentException("标签无效：" + String.join("；", result.errors()));
        }
    }
}
