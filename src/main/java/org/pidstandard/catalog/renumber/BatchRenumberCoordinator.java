package org.pidstandard.catalog.renumber;

import org.pidstandard.catalog.audit.AuditLogEntry;
import org.pidstandard.catalog.audit.AuditTrailRecorder;
import org.pidstandard.catalog.model.Equipment;
import org.pidstandard.catalog.store.EquipmentStore;
import org.pidstandard.catalog.store.EquipmentStoreException;
import org.pidstandard.catalog.store.EquipmentTransaction;
import org.pidstandard.catalog.tagging.ExpansionContext;
import org.pidstandard.catalog.tagging.TagPatternEngine;
import org.pidstandard.catalog.tagging.TypeCodeLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 批量重编号协调器：过滤 -> 预览 -> 冲突检查 -> 原子应用。
 * <p>
 * 每一步都返回新的不可变快照，不在原地修改候选列表：
 * <ol>
 *   <li>{@link #filterCandidates}：按类型/区域/标签通配符筛出项目内的有效设备，按标签排序。</li>
 *   <li>{@link #generatePreview}：按当前顺序给已勾选的候选生成新标签，序号按步长递增。</li>
 *   <li>{@link #validate}：批次内重复（硬性阻断）与批次外已有标签冲突（可覆盖）。</li>
 *   <li>{@link #apply}：单个事务内逐条更新；任何一条失败整批回滚，不存在“部分重编号”。</li>
 * </ol>
 * 审计记录与标签修改在同一事务内写入（提交前批量追加）：审计写入失败整批回滚，回滚的批次不会留下审计痕迹。
 */
public class BatchRenumberCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BatchRenumberCoordinator.class);

    private final EquipmentStore store;
    private final AuditTrailRecorder audit;
    private final TypeCodeLookup typeCodes;
    private final int maxBatchSize;

    public BatchRenumberCoordinator(EquipmentStore store, AuditTrailRecorder audit, TypeCodeLookup typeCodes, int maxBatchSize) {
        this.store = store;
        this.audit = audit;
        this.typeCodes = typeCodes;
        this.maxBatchSize = Math.max(1, maxBatchSize);
    }

    public List<RenumberingCandidate> filterCandidates(String projectId, RenumberFilter filter) {
        RenumberFilter f = filter == null ? RenumberFilter.none() : filter;
        return store.findByProject(projectId, f.toPredicate().and(Equipment::active)).stream()
                .sorted(Comparator.comparing(Equipment::tag))
                .map(RenumberingCandidate::from)
                .toList();
    }

    /**
     * 勾选指定 id 的候选，其余取消勾选；顺序不变。
     */
    public static List<RenumberingCandidate> select(List<RenumberingCandidate> candidates, Collection<String> equipmentIds) {
        Set<String> ids = new HashSet<>(equipmentIds);
        return candidates.stream()
                .map(c -> c.withSelected(ids.contains(c.equipmentId())))
                .toList();
    }

    public static List<RenumberingCandidate> selectAll(List<RenumberingCandidate> candidates) {
        return candidates.stream().map(c -> c.withSelected(true)).toList();
    }

    public RenumberPreview generatePreview(List<RenumberingCandidate> candidates, NumberingParameters parameters) {
        Objects.requireNonNull(parameters, "parameters");
        long selected = candidates.stream().filter(RenumberingCandidate::selected).count();
        if (selected > maxBatchSize) {
            throw new RenumberValidationException("单批最多重编号 " + maxBatchSize + " 台设备，当前选中 " + selected);
        }

        List<RenumberingCandidate> out = new ArrayList<>(candidates.size());
        // long 计数：只有真正用到的序号才需要落在 int 范围内
        long current = parameters.startNumber();
        for (RenumberingCandidate c : candidates) {
            if (!c.selected()) {
                out.add(c.withProposedTag(""));
                continue;
            }
            if (current > Integer.MAX_VALUE) {
                throw new RenumberValidationException("序号超出整数范围，请减小起始号或步长");
            }
            ExpansionContext ctx = ExpansionContext.of(c.equipmentType(), c.area(), typeCodes);
            out.add(c.withProposedTag(TagPatternEngine.expand(parameters.pattern(), ctx, (int) current)));
            current += parameters.increment();
        }
        return new RenumberPreview(parameters, out);
    }

    public ConflictReport validate(String projectId, RenumberPreview preview) {
        return detectConflicts(preview.pending(), store.findByProject(projectId, Equipment::active));
    }

    private static ConflictReport detectConflicts(List<RenumberingCandidate> pending, List<Equipment> activeEquipment) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (RenumberingCandidate c : pending) {
            counts.merge(c.proposedTag(), 1, Integer::sum);
        }
        List<String> duplicates = counts.entrySet().stream()
                .filter(e -> e.getValue() > 1)
                .map(Map.Entry::getKey)
                .toList();

        Set<String> batchIds = new HashSet<>();
        for (RenumberingCandidate c : pending) {
            batchIds.add(c.equipmentId());
        }
        // 只有“不在本批次内”的设备才算冲突：批次内设备的旧标签会被改掉
        Map<String, String> holderByTag = new HashMap<>();
        for (Equipment e : activeEquipment) {
            if (!batchIds.contains(e.id())) {
                holderByTag.putIfAbsent(e.tag(), e.id());
            }
        }
        List<TagConflict> conflicts = new ArrayList<>();
        for (RenumberingCandidate c : pending) {
            String holder = holderByTag.get(c.proposedTag());
            if (holder != null) {
                conflicts.add(new TagConflict(c.equipmentId(), c.proposedTag(), holder));
            }
        }
        return new ConflictReport(duplicates, conflicts);
    }

    /**
     * 应用预览。
     *
     * @param overrideConflicts 操作员是否已显式确认忽略“与批次外已有标签冲突”；对批次内重复无效
     * @throws RenumberValidationException 没有可应用的条目
     * @throws DuplicateTagException       批次内存在重复新标签
     * @throws TagConflictException        存在批次外冲突且未确认覆盖
     */
    public RenumberResult apply(String projectId, RenumberPreview preview, boolean overrideConflicts) {
        List<RenumberingCandidate> pending = preview.pending();
        if (pending.isEmpty()) {
            throw new RenumberValidationException("没有选中任何需要重编号的设备");
        }

        String actor = audit.identity().performedBy();
        List<TagChange> changes = new ArrayList<>(pending.size());
        List<AuditLogEntry> auditEntries = new ArrayList<>(pending.size());

        // 冲突检查在事务内进行：检查与写入之间不会有其他写入方插入
        try (EquipmentTransaction tx = store.beginTransaction()) {
            ConflictReport report = detectConflicts(pending, tx.findByProject(projectId, Equipment::active));
            if (report.hasDuplicates()) {
                throw new DuplicateTagException(report.duplicates());
            }
            if (report.hasStoreConflicts()) {
                if (!overrideConflicts) {
                    throw new TagConflictException(report.storeConflicts());
                }
                log.warn("项目 {}：操作员确认覆盖 {} 个标签冲突", projectId, report.storeConflicts().size());
            }

            RenumberingCandidate current = null;
            try {
                for (RenumberingCandidate c : pending) {
                    current = c;
                    Equipment before = tx.getById(c.equipmentId())
                            .orElseThrow(() -> new EquipmentStoreException("设备不存在：" + c.equipmentId()));
                    if (!Objects.equals(before.projectId(), projectId)) {
                        throw new EquipmentStoreException("设备不属于项目 " + projectId + "：" + c.equipmentId());
                    }
                    Instant now = audit.clock().instant();
                    Equipment after = before.withTag(c.proposedTag(), actor, now);
                    tx.update(after);
                    auditEntries.add(audit.renumberEntry(before, after));
                    changes.add(new TagChange(before.id(), before.tag(), after.tag()));
                }
                current = null;
                // 审计与标签修改同生共死：审计写入失败同样整批回滚
                audit.recordAll(auditEntries);
                tx.commit();
            } catch (RuntimeException e) {
                tx.rollback();
                String tag = current == null ? "审计" : current.currentTag();
                log.error("项目 {} 批量重编号失败，已整批回滚（{} 条）：{}: {}", projectId, pending.size(), tag, e.getMessage(), e);
                return RenumberResult.rolledBack(tag + ": " + e.getMessage());
            }
        }

        log.info("项目 {} 批量重编号完成：{} 台设备", projectId, changes.size());
        return RenumberResult.committed(changes, List.of());
    }
}
