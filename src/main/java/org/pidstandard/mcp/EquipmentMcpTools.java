package org.pidstandard.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.pidstandard.catalog.EquipmentCatalogService;
import org.pidstandard.catalog.EquipmentDraft;
import org.pidstandard.catalog.audit.AuditAction;
import org.pidstandard.catalog.audit.AuditLogEntry;
import org.pidstandard.catalog.audit.AuditQuery;
import org.pidstandard.catalog.audit.AuditTrailRecorder;
import org.pidstandard.catalog.dto.AuditLogResult;
import org.pidstandard.catalog.dto.CandidateListResult;
import org.pidstandard.catalog.dto.EquipmentListResult;
import org.pidstandard.catalog.dto.HierarchyResult;
import org.pidstandard.catalog.dto.ProjectListResult;
import org.pidstandard.catalog.dto.ProposedTagChange;
import org.pidstandard.catalog.dto.RenumberConfirmResult;
import org.pidstandard.catalog.dto.RenumberPrepareResult;
import org.pidstandard.catalog.dto.TagPatternExampleResult;
import org.pidstandard.catalog.hierarchy.EquipmentDetails;
import org.pidstandard.catalog.hierarchy.HierarchyMode;
import org.pidstandard.catalog.hierarchy.HierarchyNode;
import org.pidstandard.catalog.hierarchy.RelationshipHierarchyBuilder;
import org.pidstandard.catalog.model.Equipment;
import org.pidstandard.catalog.model.EquipmentStatus;
import org.pidstandard.catalog.model.ProcessParameters;
import org.pidstandard.catalog.model.Project;
import org.pidstandard.catalog.model.TaggingMode;
import org.pidstandard.catalog.renumber.BatchRenumberCoordinator;
import org.pidstandard.catalog.renumber.ConflictReport;
import org.pidstandard.catalog.renumber.NumberingParameters;
import org.pidstandard.catalog.renumber.RenumberFilter;
import org.pidstandard.catalog.renumber.RenumberPreview;
import org.pidstandard.catalog.renumber.RenumberResult;
import org.pidstandard.catalog.renumber.RenumberSessionStore;
import org.pidstandard.catalog.renumber.RenumberingCandidate;
import org.pidstandard.catalog.renumber.TagConflictException;
import org.pidstandard.catalog.store.EquipmentStore;
import org.pidstandard.catalog.tagging.TagPatternEngine;
import org.pidstandard.catalog.tagging.TagValidationResult;
import org.pidstandard.catalog.tagging.TagValidationService;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;

/**
 * P&amp;ID 设备目录 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>项目与设备查询（{@code pid_list_projects}、{@code pid_list_equipment}、{@code pid_get_equipment_details}）。</li>
 *   <li>批量重编号（{@code pid_prepare_renumber} -> {@code pid_confirm_renumber} 两段式确认）。</li>
 *   <li>关系层级视图（{@code pid_build_hierarchy}）。</li>
 *   <li>审计记录查询（{@code pid_query_audit_log}）。</li>
 *   <li>单台设备维护：新建、编辑、软删除、上下游连接。</li>
 * </ul>
 * <p>
 * 安全策略：
 * <ul>
 *   <li>批量重编号必须先预览再确认；批次内重复的新标签永远不能确认。</li>
 *   <li>与批次外已有标签冲突时，确认必须显式传 {@code overrideConflicts=true}。</li>
 *   <li>应用在单个事务内完成：任何一条失败整批回滚。</li>
 * </ul>
 */
@Component
public class EquipmentMcpTools {

    /**
     * processParameters 参数解析用的 JSON 解析器。
     */
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final EquipmentStore store;
    private final BatchRenumberCoordinator coordinator;
    private final RenumberSessionStore sessions;
    private final AuditTrailRecorder audit;
    private final TagValidationService tagValidation;
    private final EquipmentCatalogService catalog;

    public EquipmentMcpTools(
            EquipmentStore store,
            BatchRenumberCoordinator coordinator,
            RenumberSessionStore sessions,
            AuditTrailRecorder audit,
            TagValidationService tagValidation,
            EquipmentCatalogService catalog
    ) {
        this.store = store;
        this.coordinator = coordinator;
        this.sessions = sessions;
        this.audit = audit;
        this.tagValidation = tagValidation;
        this.catalog = catalog;
    }

    @Tool(
            name = "pid_list_projects",
            description = "列出所有项目（id、名称、编号、标签规范 CUSTOM/KKS）。"
    )
    public ProjectListResult listProjects() {
        List<Project> projects = store.findProjects().stream()
                .sorted(Comparator.comparing(Project::name, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
        return new ProjectListResult(projects);
    }

    @Tool(
            name = "pid_list_equipment",
            description = "列出项目下的设备（按标签排序；默认不包含已软删除的设备）。"
    )
    public EquipmentListResult listEquipment(
            @ToolParam(description = "项目 id（可从 pid_list_projects 获取）") String projectId,
            @ToolParam(required = false, description = "是否包含已删除设备（默认 false）") Boolean includeInactive
    ) {
        Project project = requireProject(projectId);
        boolean all = Boolean.TRUE.equals(includeInactive);
        List<Equipment> equipment = store.findByProject(project.id(), e -> all || e.active()).stream()
                .sorted(Comparator.comparing(Equipment::tag))
                .toList();
        return new EquipmentListResult(project.id(), equipment.size(), equipment);
    }

    @Tool(
            name = "pid_list_renumber_candidates",
            description = "按类型/区域/标签通配符（* 匹配任意字符）筛选重编号候选设备，按当前标签排序。"
    )
    public CandidateListResult listRenumberCandidates(
            @ToolParam(description = "项目 id") String projectId,
            @ToolParam(required = false, description = "设备类型（精确匹配；为空或 All 表示不过滤）") String equipmentType,
            @ToolParam(required = false, description = "区域（精确匹配；为空或 All 表示不过滤）") String area,
            @ToolParam(required = false, description = "当前标签通配符，例如 P-*（不区分大小写）") String tagPattern
    ) {
        Project project = requireProject(projectId);
        List<RenumberingCandidate> candidates = coordinator.filterCandidates(project.id(), new RenumberFilter(equipmentType, area, tagPattern));
        return new CandidateListResult(project.id(), candidates.size(), candidates);
    }

    @Tool(
            name = "pid_tag_pattern_example",
            description = "展开标签模式示例（{TYPE}=PMP、{AREA}=A01、序号=1），并返回项目的默认模式。"
    )
    /**
     * 模式占位符：{@code {TYPE}}、{@code {AREA}}、{@code {SEQ}}、{@code {SEQ:000}}（按掩码长度补零）。
     * 未知占位符原样保留。
     */
    public TagPatternExampleResult tagPatternExample(
            @ToolParam(required = false, description = "标签模式，例如 {TYPE}-{SEQ:001}；为空时使用项目默认模式") String pattern,
            @ToolParam(required = false, description = "项目 id（用于确定默认模式；为空按自定义规范）") String projectId
    ) {
        TaggingMode mode = TaggingMode.CUSTOM;
        if (projectId != null && !projectId.isBlank()) {
            mode = requireProject(projectId).taggingMode();
        }
        String defaultPattern = TagPatternEngine.defaultPattern(mode);
        String effective = pattern == null || pattern.isBlank() ? defaultPattern : pattern;
        return new TagPatternExampleResult(effective, TagPatternEngine.example(effective), defaultPattern);
    }

    @Tool(
            name = "pid_prepare_renumber",
            description = "准备批量重编号（只生成预览与冲突报告，不修改设备）；返回 token，需调用 pid_confirm_renumber 确认。"
    )
    /**
     * 生成重编号预览。
     * <p>
     * 规则：
     * <ul>
     *   <li>先按过滤条件筛出候选（按当前标签排序），再按 {@code equipmentIds} 勾选；不传则全选。</li>
     *   <li>选中的候选按顺序展开模式，序号从 {@code startNumber} 起按 {@code increment} 递增。</li>
     *   <li>预览按 token 暂存，确认时使用同一份预览，不会重新计算。</li>
     * </ul>
     */
    public RenumberPrepareResult prepareRenumber(
            @ToolParam(description = "项目 id") String projectId,
            @ToolParam(description = "标签模式，例如 {TYPE}-{SEQ:001} 或 ={AREA}-{TYPE}-{SEQ:000}") String pattern,
            @ToolParam(required = false, description = "起始号（整数，可为 0 或负数；默认 1）") String startNumber,
            @ToolParam(required = false, description = "步长（整数，最小 1；默认 1）") String increment,
            @ToolParam(required = false, description = "要重编号的设备 id 列表；为空表示过滤结果全部选中") List<String> equipmentIds,
            @ToolParam(required = false, description = "设备类型过滤") String equipmentType,
            @ToolParam(required = false, description = "区域过滤") String area,
            @ToolParam(required = false, description = "当前标签通配符过滤") String tagPattern
    ) {
        Project project = requireProject(projectId);
        NumberingParameters parameters = NumberingParameters.parse(
                pattern,
                startNumber == null ? "1" : startNumber,
                increment == null ? "1" : increment
        );

        List<RenumberingCandidate> candidates = coordinator.filterCandidates(project.id(), new RenumberFilter(equipmentType, area, tagPattern));
        List<String> warnings = new ArrayList<>();
        List<RenumberingCandidate> selected;
        if (equipmentIds == null || equipmentIds.isEmpty()) {
            selected = BatchRenumberCoordinator.selectAll(candidates);
        } else {
            selected = BatchRenumberCoordinator.select(candidates, equipmentIds);
            long matched = selected.stream().filter(RenumberingCandidate::selected).count();
            if (matched < equipmentIds.size()) {
                warnings.add((equipmentIds.size() - matched) + " 个设备 id 不在候选范围内，已忽略");
            }
        }

        RenumberPreview preview = coordinator.generatePreview(selected, parameters);
        ConflictReport report = coordinator.validate(project.id(), preview);
        if (report.hasDuplicates()) {
            warnings.add("存在批次内重复的新标签，无法确认：请在模式中加入序号 {SEQ}");
        }
        if (report.hasStoreConflicts()) {
            warnings.add(report.storeConflicts().size() + " 个新标签与现有设备冲突；确认时需要 overrideConflicts=true");
        }
        if (preview.pending().isEmpty()) {
            warnings.add("没有选中任何设备");
        }

        RenumberSessionStore.PendingRenumber pending = sessions.create(project.id(), preview, report);
        List<ProposedTagChange> changes = preview.pending().stream()
                .map(c -> new ProposedTagChange(c.equipmentId(), c.currentTag(), c.proposedTag()))
                .toList();
        return new RenumberPrepareResult(
                pending.token(),
                project.id(),
                parameters.pattern(),
                parameters.startNumber(),
                parameters.increment(),
                preview.selectedCount(),
                changes,
                report.duplicates(),
                report.storeConflicts(),
                report.hasStoreConflicts(),
                pending.expiresAt(),
                warnings
        );
    }

    @Tool(
            name = "pid_confirm_renumber",
            description = "确认或取消 pid_prepare_renumber 生成的批量重编号（confirm=true 才会写入；存在冲突时需 overrideConflicts=true）。"
    )
    /**
     * 确认重编号（第二阶段）。
     * <p>
     * 行为：
     * <ul>
     *   <li>{@code confirm=false}：取消，并立即删除 token。</li>
     *   <li>{@code confirm=true}：重新做冲突检查（设备可能在预览后被修改），通过后整批应用并删除 token。</li>
     *   <li>存在冲突但未传 {@code overrideConflicts=true}：拒绝且保留 token，可带上覆盖参数重试。</li>
     * </ul>
     */
    public RenumberConfirmResult confirmRenumber(
            @ToolParam(description = "pid_prepare_renumber 返回的 token") String token,
            @ToolParam(required = false, description = "是否确认（true 应用 / false 取消；默认 false）") Boolean confirm,
            @ToolParam(required = false, description = "是否覆盖与现有标签的冲突（默认 false；对批次内重复无效）") Boolean overrideConflicts
    ) {
        // 先 peek 一次：confirm=false 时也能返回 token 对应的信息
        RenumberSessionStore.PendingRenumber peek = sessions.get(token);
        if (peek == null) {
            throw new IllegalArgumentException("token 无效或已过期");
        }
        if (!Boolean.TRUE.equals(confirm)) {
            sessions.remove(token);
            return new RenumberConfirmResult(peek.token(), peek.projectId(), false, false, false, 0, 0,
                    List.of(), List.of(), List.of("已取消重编号（confirm=false）"));
        }

        boolean override = Boolean.TRUE.equals(overrideConflicts);
        ConflictReport current = coordinator.validate(peek.projectId(), peek.preview());
        if (current.hasStoreConflicts() && !override && !current.hasDuplicates()) {
            throw new TagConflictException(current.storeConflicts());
        }

        // 取出并删除 token（避免重复确认）
        RenumberSessionStore.PendingRenumber pending = sessions.remove(token);
        if (pending == null) {
            throw new IllegalArgumentException("token 无效或已过期");
        }
        RenumberResult result = coordinator.apply(pending.projectId(), pending.preview(), override);

        List<String> warnings = new ArrayList<>();
        if (override && current.hasStoreConflicts()) {
            warnings.add("已覆盖 " + current.storeConflicts().size() + " 个标签冲突，项目中可能存在重复标签");
        }
        return new RenumberConfirmResult(
                pending.token(),
                pending.projectId(),
                true,
                !result.rolledBack(),
                result.rolledBack(),
                result.successCount(),
                result.errorCount(),
                result.errors(),
                result.changes(),
                warnings
        );
    }

    @Tool(
            name = "pid_build_hierarchy",
            description = "构建设备关系层级树：BY_AREA（区域/类型/设备）、BY_TYPE、BY_DRAWING、PROCESS_FLOW（沿上游指针展开，自动标记循环引用）。"
    )
    public HierarchyResult buildHierarchy(
            @ToolParam(description = "项目 id") String projectId,
            @ToolParam(required = false, description = "层级模式（默认 BY_AREA）") String mode
    ) {
        Project project = requireProject(projectId);
        HierarchyMode hierarchyMode = HierarchyMode.parse(mode);
        List<HierarchyNode> roots = RelationshipHierarchyBuilder.build(
                store.findByProject(project.id(), null),
                store.findLines(project.id()),
                store.findDrawings(project.id()),
                hierarchyMode
        );
        return new HierarchyResult(project.id(), hierarchyMode, RelationshipHierarchyBuilder.countLeaves(roots), roots);
    }

    @Tool(
            name = "pid_get_equipment_details",
            description = "查看设备详情：基本信息、工艺参数、所在图纸、上下游设备、相连管线（Incoming/Outgoing）。"
    )
    public EquipmentDetails getEquipmentDetails(
            @ToolParam(description = "设备 id") String equipmentId
    ) {
        Equipment equipment = store.getById(equipmentId)
                .orElseThrow(() -> new NoSuchElementException("设备不存在：" + equipmentId));
        String projectId = equipment.projectId();
        return RelationshipHierarchyBuilder.describe(
                equipmentId,
                store.findByProject(projectId, null),
                store.findLines(projectId),
                store.findDrawings(projectId)
        ).orElseThrow(() -> new NoSuchElementException("设备不存在：" + equipmentId));
    }

    @Tool(
            name = "pid_query_audit_log",
            description = "查询审计记录（按时间倒序；可按实体类型、动作、时间范围、实体 id 过滤，支持 limit 上限保护）。"
    )
    public AuditLogResult queryAuditLog(
            @ToolParam(required = false, description = "项目 id（为空查询全部项目）") String projectId,
            @ToolParam(required = false, description = "实体类型，例如 Equipment") String entityType,
            @ToolParam(required = false, description = "动作：Created/Updated/Deleted/BatchTagged/Synchronized") String action,
            @ToolParam(required = false, description = "起始时间（ISO-8601，例如 2026-01-01T00:00:00Z）") String since,
            @ToolParam(required = false, description = "截止时间（ISO-8601）") String until,
            @ToolParam(required = false, description = "实体 id") String entityId,
            @ToolParam(required = false, description = "最大返回条数（默认 app.pid.audit-query-default-limit，上限 app.pid.audit-query-max-limit）") Integer limit
    ) {
        AuditAction parsedAction = null;
        if (action != null && !action.isBlank()) {
            parsedAction = AuditAction.parse(action);
            if (parsedAction == null) {
                throw new IllegalArgumentException("未知的审计动作：" + action);
            }
        }
        String project = projectId == null || projectId.isBlank() ? null : projectId;
        AuditQuery query = new AuditQuery(
                entityType,
                parsedAction,
                parseInstant(since, "since"),
                parseInstant(until, "until"),
                entityId,
                limit == null ? 0 : limit
        );
        List<AuditLogEntry> entries = audit.query(project, query);
        return new AuditLogResult(project, entries.size(), entries);
    }

    @Tool(
            name = "pid_validate_tag",
            description = "按项目标签规范（CUSTOM/KKS）校验标签格式，并检查在项目有效设备中是否唯一。"
    )
    public TagValidationResult validateTag(
            @ToolParam(description = "项目 id") String projectId,
            @ToolParam(description = "待校验的标签") String tag,
            @ToolParam(required = false, description = "排除的设备 id（编辑设备时传自身 id）") String excludeEquipmentId
    ) {
        return tagValidation.validate(projectId, tag, excludeEquipmentId);
    }

    @Tool(
            name = "pid_create_equipment",
            description = "新建设备（标签需符合项目规范且唯一），写入 Created 审计记录。"
    )
    public Equipment createEquipment(
            @ToolParam(description = "项目 id") String projectId,
            @ToolParam(description = "设备标签") String tag,
            @ToolParam(required = false, description = "设备类型，例如 Pump、Tank、Valve") String equipmentType,
            @ToolParam(required = false, description = "描述") String description,
            @ToolParam(required = false, description = "用途/介质") String service,
            @ToolParam(required = false, description = "区域") String area,
            @ToolParam(required = false, description = "状态：PLANNED/INSTALLED/COMMISSIONED/DECOMMISSIONED（默认 PLANNED）") String status,
            @ToolParam(required = false, description = "制造商") String manufacturer,
            @ToolParam(required = false, description = "型号") String model,
            @ToolParam(required = false, description = "图纸 id") String drawingId,
            @ToolParam(required = false, description = "工艺参数 JSON，例如 {\"operatingPressure\":{\"value\":10,\"unit\":\"bar\"}}") String processParameters
    ) {
        return catalog.create(projectId, new EquipmentDraft(
                tag,
                equipmentType,
                description,
                service,
                area,
                parseStatus(status),
                manufacturer,
                model,
                drawingId,
                parseProcessParameters(processParameters)
        ));
    }

    @Tool(
            name = "pid_update_equipment",
            description = "编辑设备（只修改传入的字段；改标签时重新校验），有变化时写入 Updated 审计记录。"
    )
    public Equipment updateEquipment(
            @ToolParam(description = "设备 id") String equipmentId,
            @ToolParam(required = false, description = "新标签") String tag,
            @ToolParam(required = false, description = "设备类型") String equipmentType,
            @ToolParam(required = false, description = "描述") String description,
            @ToolParam(required = false, description = "用途/介质") String service,
            @ToolParam(required = false, description = "区域") String area,
            @ToolParam(required = false, description = "状态") String status,
            @ToolParam(required = false, description = "制造商") String manufacturer,
            @ToolParam(required = false, description = "型号") String model,
            @ToolParam(required = false, description = "图纸 id（传空字符串表示移出图纸）") String drawingId,
            @ToolParam(required = false, description = "工艺参数 JSON（整体替换）") String processParameters
    ) {
        return catalog.update(equipmentId, new EquipmentDraft(
                tag,
                equipmentType,
                description,
                service,
                area,
                parseStatus(status),
                manufacturer,
                model,
                drawingId,
                parseProcessParameters(processParameters)
        ));
    }

    @Tool(
            name = "pid_deactivate_equipment",
            description = "软删除设备（标记为无效，不再参与标签唯一性与层级视图），写入 Deleted 审计记录。"
    )
    public Equipment deactivateEquipment(
            @ToolParam(description = "设备 id") String equipmentId
    ) {
        return catalog.deactivate(equipmentId);
    }

    @Tool(
            name = "pid_link_equipment",
            description = "连接上下游设备（下游的 upstream 指向上游，上游的 downstream 指向下游）。"
    )
    public Equipment linkEquipment(
            @ToolParam(description = "上游设备 id") String upstreamEquipmentId,
            @ToolParam(description = "下游设备 id") String downstreamEquipmentId
    ) {
        return catalog.link(upstreamEquipmentId, downstreamEquipmentId);
    }

    @Tool(
            name = "pid_unlink_equipment",
            description = "断开设备与其上游设备的连接。"
    )
    public Equipment unlinkEquipment(
            @ToolParam(description = "设备 id") String equipmentId
    ) {
        return catalog.unlink(equipmentId);
    }

    private Project requireProject(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId 不能为空");
        }
        return store.findProject(projectId.trim())
                .orElseThrow(() -> new NoSuchElementException("项目不存在：" + projectId));
    }

    private static EquipmentStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return EquipmentStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("未知的设备状态：" + status + "（可选 PLANNED/INSTALLED/COMMISSIONED/DECOMMISSIONED）");
        }
    }

    private static ProcessParameters parseProcessParameters(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readValue(json, ProcessParameters.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("processParameters 不是有效 JSON：" + e.getOriginalMessage(), e);
        }
    }

    private static Instant parseInstant(String text, String name) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(name + " 不是有效的 ISO-8601 时间：" + text, e);
        }
    }
}
