package org.pidstandard.catalog.hierarchy;

import org.pidstandard.catalog.model.Drawing;
import org.pidstandard.catalog.model.Equipment;
import org.pidstandard.catalog.model.Line;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * 设备关系层级树构建器。
 * <p>
 * 纯函数：不修改入参、不缓存状态，每次调用都从头构建；只统计有效（{@code active}）设备。
 * 所有模式都是一次排序 + 若干次分组/哈希查找，复杂度 O(n log n)。
 * <p>
 * {@link HierarchyMode#PROCESS_FLOW} 说明：
 * <ul>
 *   <li>根节点：自身 {@code upstreamEquipmentId} 为空的设备，按标签排序。</li>
 *   <li>子节点：{@code upstreamEquipmentId} 指向当前节点的设备，按标签排序。</li>
 *   <li>循环检测：沿当前路径维护 visited 集合（不是全局集合）；下一个节点已在路径上时输出
 *   “(circular reference)” 叶子并停止展开该分支。同一设备可能出现在多个分支上：这是图的树形投影。</li>
 *   <li>从任何根都到达不了的设备（纯循环、上游指向不存在的设备）按标签顺序补充为根，保证每台设备至少出现一次。</li>
 * </ul>
 */
public final class RelationshipHierarchyBuilder {

    public static final String UNASSIGNED = "Unassigned";
    public static final String UNKNOWN = "Unknown";
    public static final String PROCESS_FLOW = "Process Flow";
    public static final String CIRCULAR_SUFFIX = " (circular reference)";

    private static final Comparator<Equipment> BY_TAG = Comparator.comparing(Equipment::tag).thenComparing(Equipment::id);

    private RelationshipHierarchyBuilder() {
    }

    public static List<HierarchyNode> build(List<Equipment> equipment, List<Line> lines, List<Drawing> drawings, HierarchyMode mode) {
        List<Equipment> active = activeSortedByTag(equipment);
        return switch (mode == null ? HierarchyMode.BY_AREA : mode) {
            case BY_AREA -> buildByArea(active);
            case BY_TYPE -> buildByType(active);
            case BY_DRAWING -> buildByDrawing(active, drawings == null ? List.of() : drawings);
            case PROCESS_FLOW -> buildProcessFlow(active);
        };
    }

    /**
     * 统计树中的设备叶子数（循环引用叶子也计入）。
     */
    public static int countLeaves(List<HierarchyNode> roots) {
        int count = 0;
        Deque<HierarchyNode> stack = new ArrayDeque<>(roots);
        while (!stack.isEmpty()) {
            HierarchyNode n = stack.pop();
            if (n.kind() != HierarchyNode.Kind.GROUP && n.isLeaf()) {
                count++;
            } else {
                n.children().forEach(stack::push);
            }
        }
        return count;
    }

    private static List<HierarchyNode> buildByArea(List<Equipment> active) {
        Map<String, List<Equipment>> byArea = groupSorted(active, e -> orDefault(e.area(), UNASSIGNED));
        List<HierarchyNode> result = new ArrayList<>(byArea.size());
        for (Map.Entry<String, List<Equipment>> area : byArea.entrySet()) {
            Map<String, List<Equipment>> byType = groupSorted(area.getValue(), e -> orDefault(e.equipmentType(), UNKNOWN));
            List<HierarchyNode> typeNodes = new ArrayList<>(byType.size());
            for (Map.Entry<String, List<Equipment>> type : byType.entrySet()) {
                typeNodes.add(HierarchyNode.group(type.getKey(), leaves(type.getValue())));
            }
            result.add(HierarchyNode.group(area.getKey(), typeNodes));
        }
        return result;
    }

    private static List<HierarchyNode> buildByType(List<Equipment> active) {
        Map<String, List<Equipment>> byType = groupSorted(active, e -> orDefault(e.equipmentType(), UNKNOWN));
        List<HierarchyNode> result = new ArrayList<>(byType.size());
        for (Map.Entry<String, List<Equipment>> type : byType.entrySet()) {
            result.add(HierarchyNode.group(type.getKey(), leaves(type.getValue())));
        }
        return result;
    }

    private static List<HierarchyNode> buildByDrawing(List<Equipment> active, List<Drawing> drawings) {
        Map<String, Drawing> drawingById = new HashMap<>();
        for (Drawing d : drawings) {
            if (d != null && d.id() != null) {
                drawingById.putIfAbsent(d.id(), d);
            }
        }

        Map<String, List<Equipment>> byDrawing = new HashMap<>();
        List<Equipment> unassigned = new ArrayList<>();
        for (Equipment e : active) {
            // 引用了不在图纸集合里的图纸，同样归入 Unassigned
            if (e.drawingId() == null || !drawingById.containsKey(e.drawingId())) {
                unassigned.add(e);
            } else {
                byDrawing.computeIfAbsent(e.drawingId(), k -> new ArrayList<>()).add(e);
            }
        }

        List<Drawing> used = byDrawing.keySet().stream()
                .map(drawingById::get)
                .sorted(Comparator.comparing((Drawing d) -> orDefault(d.drawingNumber(), ""))
                        .thenComparing(Drawing::id))
                .toList();

        List<HierarchyNode> result = new ArrayList<>(used.size() + 1);
        for (Drawing d : used) {
            result.add(HierarchyNode.group(orDefault(d.drawingNumber(), d.id()), leaves(byDrawing.get(d.id()))));
        }
        if (!unassigned.isEmpty()) {
            result.add(HierarchyNode.group(UNASSIGNED, leaves(unassigned)));
        }
        return result;
    }

    private static List<HierarchyNode> buildProcessFlow(List<Equipment> active) {
        // active 已按标签排序，因此每个 children 列表天然有序
        Map<String, List<Equipment>> childrenByUpstream = new HashMap<>();
        List<Equipment> roots = new ArrayList<>();
        for (Equipment e : active) {
            if (e.upstreamEquipmentId() == null) {
                roots.add(e);
            } else {
                childrenByUpstream.computeIfAbsent(e.upstreamEquipmentId(), k -> new ArrayList<>()).add(e);
            }
        }

        Set<String> reached = new HashSet<>();
        List<HierarchyNode> rootNodes = new ArrayList<>(roots.size());
        for (Equipment root : roots) {
            rootNodes.add(flowTree(root, childrenByUpstream, reached));
        }
        for (Equipment e : active) {
            if (!reached.contains(e.id())) {
                rootNodes.add(flowTree(e, childrenByUpstream, reached));
            }
        }
        if (rootNodes.isEmpty()) {
            return List.of();
        }
        return List.of(HierarchyNode.group(PROCESS_FLOW, rootNodes));
    }

    // 显式栈做深度优先展开：长链不会耗尽调用栈；path 只包含当前路径上的设备
    private static HierarchyNode flowTree(
            Equipment root,
            Map<String, List<Equipment>> childrenByUpstream,
            Set<String> reached
    ) {
        Deque<FlowFrame> stack = new ArrayDeque<>();
        Set<String> path = new HashSet<>();
        stack.push(new FlowFrame(root, childrenByUpstream.getOrDefault(root.id(), List.of())));
        path.add(root.id());
        reached.add(root.id());

        HierarchyNode result = null;
        while (!stack.isEmpty()) {
            FlowFrame top = stack.peek();
            if (top.next < top.downstream.size()) {
                Equipment d = top.downstream.get(top.next++);
                if (path.contains(d.id())) {
                    top.children.add(HierarchyNode.circular(d.tag() + CIRCULAR_SUFFIX, d.id()));
                } else {
                    path.add(d.id());
                    reached.add(d.id());
                    stack.push(new FlowFrame(d, childrenByUpstream.getOrDefault(d.id(), List.of())));
                }
                continue;
            }
            stack.pop();
            path.remove(top.equipment.id());
            HierarchyNode node = HierarchyNode.equipment(top.equipment.tag(), top.equipment.id(), top.children);
            if (stack.isEmpty()) {
                result = node;
            } else {
                stack.peek().children.add(node);
            }
        }
        return result;
    }

    private static final class FlowFrame {

        private final Equipment equipment;
        private final List<Equipment> downstream;
        private final List<HierarchyNode> children = new ArrayList<>();
        private int next;

        private FlowFrame(Equipment equipment, List<Equipment> downstream) {
            this.equipment = equipment;
            this.downstream = downstream;
        }
    }

    /**
     * 设备详情：图纸号、上下游设备、相连管线。
     *
     * @return 设备不存在时为空
     */
    public static Optional<EquipmentDetails> describe(String equipmentId, List<Equipment> equipment, List<Line> lines, List<Drawing> drawings) {
        Map<String, Equipment> byId = new HashMap<>();
        for (Equipment e : equipment) {
            byId.put(e.id(), e);
        }
        Equipment target = byId.get(equipmentId);
        if (target == null) {
            return Optional.empty();
        }

        String drawingNumber = null;
        if (target.drawingId() != null && drawings != null) {
            drawingNumber = drawings.stream()
                    .filter(d -> target.drawingId().equals(d.id()))
                    .map(Drawing::drawingNumber)
                    .findFirst()
                    .orElse(null);
        }

        List<EquipmentDetails.ConnectedEquipment> connected = new ArrayList<>(2);
        Equipment upstream = target.upstreamEquipmentId() == null ? null : byId.get(target.upstreamEquipmentId());
        if (upstream != null) {
            connected.add(new EquipmentDetails.ConnectedEquipment(upstream.id(), upstream.tag(), upstream.equipmentType(), upstream.description(), "Upstream"));
        }
        Equipment downstream = target.downstreamEquipmentId() == null ? null : byId.get(target.downstreamEquipmentId());
        if (downstream != null) {
            connected.add(new EquipmentDetails.ConnectedEquipment(downstream.id(), downstream.tag(), downstream.equipmentType(), downstream.description(), "Downstream"));
        }

        List<EquipmentDetails.ConnectedLine> connectedLines = new ArrayList<>();
        if (lines != null) {
            for (Line l : lines) {
                if (equipmentId.equals(l.fromEquipmentId())) {
                    connectedLines.add(new EquipmentDetails.ConnectedLine(l.id(), l.lineNumber(), l.service(), l.nominalSize(), "Outgoing"));
                } else if (equipmentId.equals(l.toEquipmentId())) {
                    connectedLines.add(new EquipmentDetails.ConnectedLine(l.id(), l.lineNumber(), l.service(), l.nominalSize(), "Incoming"));
                }
            }
        }

        return Optional.of(new EquipmentDetails(
                target.id(),
                target.tag(),
                target.equipmentType(),
                target.description(),
                target.service(),
                target.area(),
                target.status(),
                target.manufacturer(),
                target.model(),
                drawingNumber,
                target.processParameters(),
                connected,
                connectedLines
        ));
    }

    private static List<Equipment> activeSortedByTag(List<Equipment> equipment) {
        if (equipment == null) {
            return List.of();
        }
        return equipment.stream()
                .filter(Objects::nonNull)
                .filter(Equipment::active)
                .sorted(BY_TAG)
                .toList();
    }

    // 输入已按标签排序，分组后各组内部仍保持标签顺序；组名按字典序
    private static Map<String, List<Equipment>> groupSorted(List<Equipment> sorted, Function<Equipment, String> key) {
        Map<String, List<Equipment>> groups = new TreeMap<>();
        for (Equipment e : sorted) {
            groups.computeIfAbsent(key.apply(e), k -> new ArrayList<>()).add(e);
        }
        return new LinkedHashMap<>(groups);
    }

    private static List<HierarchyNode> leaves(List<Equipment> sorted) {
        List<HierarchyNode> out = new ArrayList<>(sorted.size());
        for (Equipment e : sorted) {
            out.add(HierarchyNode.equipment(e.tag(), e.id(), List.of()));
        }
        return out;
    }

    private static String orDefault(String v, String fallback) {
        return v == null || v.isEmpty() ? fallback : v;
    }
}
