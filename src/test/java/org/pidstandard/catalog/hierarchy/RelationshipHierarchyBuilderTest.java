package org.pidstandard.catalog.hierarchy;

import org.junit.jupiter.api.Test;
import org.pidstandard.catalog.model.Drawing;
import org.pidstandard.catalog.model.Equipment;
import org.pidstandard.catalog.model.Line;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class RelationshipHierarchyBuilderTest {

    private static Equipment.Builder eq(String id, String tag) {
        return Equipment.builder(id, "p1").tag(tag);
    }

    private static List<Equipment> plant() {
        return List.of(
                eq("e1", "P-002").equipmentType("Pump").area("A01").drawingId("d2").build(),
                eq("e2", "P-001").equipmentType("Pump").area("A01").drawingId("d1").build(),
                eq("e3", "T-001").equipmentType("Tank").area("A02").drawingId("d1").build(),
                eq("e4", "V-001").equipmentType("Valve").area(null).drawingId("gone").build(),
                eq("e5", "X-001").equipmentType(null).area("A01").build(),
                eq("e6", "P-003").equipmentType("Pump").area("A01").active(false).build()
        );
    }

    private static List<String> labels(List<HierarchyNode> nodes) {
        return nodes.stream().map(HierarchyNode::label).toList();
    }

    @Test
    void byArea_groupsAreaThenTypeThenTag() {
        List<HierarchyNode> roots = RelationshipHierarchyBuilder.build(plant(), List.of(), List.of(), HierarchyMode.BY_AREA);

        assertThat(labels(roots)).containsExactly("A01", "A02", "Unassigned");
        HierarchyNode a01 = roots.get(0);
        assertThat(labels(a01.children())).containsExactly("Pump", "Unknown");
        assertThat(labels(a01.children().get(0).children())).containsExactly("P-001", "P-002");
        assertThat(a01.children().get(0).children().get(0).equipmentId()).isEqualTo("e2");
        assertThat(a01.kind()).isEqualTo(HierarchyNode.Kind.GROUP);
        assertThat(a01.childCount()).isEqualTo(2);
        assertThat(RelationshipHierarchyBuilder.countLeaves(roots)).isEqualTo(5);
    }

    @Test
    void byType_leafCountMatchesActiveEquipment() {
        List<HierarchyNode> roots = RelationshipHierarchyBuilder.build(plant(), List.of(), List.of(), HierarchyMode.BY_TYPE);

        assertThat(labels(roots)).containsExactly("Pump", "Tank", "Unknown", "Valve");
        assertThat(labels(roots.get(0).children())).containsExactly("P-001", "P-002");
        assertThat(RelationshipHierarchyBuilder.countLeaves(roots)).isEqualTo(5);
    }

    @Test
    void byDrawing_ordersByDrawingNumberWithUnassignedLast() {
        List<Drawing> drawings = List.of(
                new Drawing("d1", "p1", "PID-200", "Tanks", "B"),
                new Drawing("d2", "p1", "PID-100", "Pumps", "A"),
                new Drawing("d3", "p1", "PID-050", "Empty", "A"));

        List<HierarchyNode> roots = RelationshipHierarchyBuilder.build(plant(), List.of(), drawings, HierarchyMode.BY_DRAWING);

        assertThat(labels(roots)).containsExactly("PID-100", "PID-200", "Unassigned");
        assertThat(labels(roots.get(1).children())).containsExactly("P-001", "T-001");
        // 没有图纸的设备与引用了未知图纸的设备都归入 Unassigned
        assertThat(labels(roots.get(2).children())).containsExactly("V-001", "X-001");
    }

    @Test
    void processFlow_followsUpstreamPointers() {
        List<Equipment> equipment = List.of(
                eq("tank", "T-001").build(),
                eq("pump", "P-001").upstreamEquipmentId("tank").build(),
                eq("hx", "HX-001").upstreamEquipmentId("pump").build(),
                eq("filter", "F-001").upstreamEquipmentId("tank").build());

        List<HierarchyNode> roots = RelationshipHierarchyBuilder.build(equipment, List.of(), List.of(), HierarchyMode.PROCESS_FLOW);

        assertThat(labels(roots)).containsExactly("Process Flow");
        HierarchyNode tank = roots.get(0).children().get(0);
        assertThat(tank.label()).isEqualTo("T-001");
        assertThat(tank.equipmentId()).isEqualTo("tank");
        assertThat(labels(tank.children())).containsExactly("F-001", "P-001");
        assertThat(labels(tank.children().get(1).children())).containsExactly("HX-001");
    }

    @Test
    void processFlow_terminatesOnCycles() {
        List<Equipment> equipment = List.of(
                eq("a", "A").upstreamEquipmentId("b").build(),
                eq("b", "B").upstreamEquipmentId("a").build());

        List<HierarchyNode> roots = RelationshipHierarchyBuilder.build(equipment, List.of(), List.of(), HierarchyMode.PROCESS_FLOW);

        HierarchyNode a = roots.get(0).children().get(0);
        assertThat(a.label()).isEqualTo("A");
        HierarchyNode b = a.children().get(0);
        assertThat(b.label()).isEqualTo("B");
        HierarchyNode loop = b.children().get(0);
        assertThat(loop.kind()).isEqualTo(HierarchyNode.Kind.CIRCULAR_REFERENCE);
        assertThat(loop.label()).isEqualTo("A (circular reference)");
        assertThat(loop.isLeaf()).isTrue();
        assertThat(roots.get(0).children()).hasSize(1);
    }

    @Test
    void processFlow_selfLoopAndDanglingUpstream() {
        List<Equipment> equipment = List.of(
                eq("s", "S-001").upstreamEquipmentId("s").build(),
                eq("d", "D-001").upstreamEquipmentId("missing").build());

        List<HierarchyNode> roots = RelationshipHierarchyBuilder.build(equipment, List.of(), List.of(), HierarchyMode.PROCESS_FLOW);

        List<HierarchyNode> top = roots.get(0).children();
        assertThat(labels(top)).containsExactly("D-001", "S-001");
        assertThat(top.get(1).children().get(0).label()).isEqualTo("S-001 (circular reference)");
    }

    @Test
    void processFlow_longChainDoesNotExhaustTheStack() {
        int length = 20_000;
        List<Equipment> chain = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            chain.add(eq("c" + i, String.format("C-%05d", i)).upstreamEquipmentId(i == 0 ? null : "c" + (i - 1)).build());
        }

        List<HierarchyNode> roots = RelationshipHierarchyBuilder.build(chain, List.of(), List.of(), HierarchyMode.PROCESS_FLOW);

        assertThat(RelationshipHierarchyBuilder.countLeaves(roots)).isEqualTo(1);
        assertThat(roots.get(0).childCount()).isEqualTo(1);
        HierarchyNode node = roots.get(0).children().get(0);
        int depth = 1;
        while (!node.isLeaf()) {
            assertThat(node.childCount()).isEqualTo(1);
            node = node.children().get(0);
            depth++;
        }
        assertThat(depth).isEqualTo(length);
        assertThat(node.label()).isEqualTo("C-19999");
    }

    @Test
    void processFlow_longCycleEndsInACircularReference() {
        int length = 20_000;
        List<Equipment> ring = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            ring.add(eq("r" + i, String.format("R-%05d", i)).upstreamEquipmentId("r" + ((i + length - 1) % length)).build());
        }

        List<HierarchyNode> roots = RelationshipHierarchyBuilder.build(ring, List.of(), List.of(), HierarchyMode.PROCESS_FLOW);

        HierarchyNode node = roots.get(0).children().get(0);
        assertThat(node.label()).isEqualTo("R-00000");
        while (!node.isLeaf()) {
            node = node.children().get(0);
        }
        assertThat(node.kind()).isEqualTo(HierarchyNode.Kind.CIRCULAR_REFERENCE);
        assertThat(node.label()).isEqualTo("R-00000 (circular reference)");
        assertThat(roots.get(0).childCount()).isEqualTo(1);
    }

    @Test
    void build_emptyInputGivesEmptyForest() {
        for (HierarchyMode mode : HierarchyMode.values()) {
            assertThat(RelationshipHierarchyBuilder.build(List.of(), List.of(), List.of(), mode)).isEmpty();
        }
    }

    @Test
    void describe_collectsDrawingNeighboursAndLines() {
        List<Equipment> equipment = List.of(
                eq("tank", "T-001").equipmentType("Tank").drawingId("d1").downstreamEquipmentId("pump").build(),
                eq("pump", "P-001").equipmentType("Pump").drawingId("d1").upstreamEquipmentId("tank").build());
        List<Line> lines = List.of(
                new Line("l1", "p1", "L-100", "Water", "Liquid", "DN50", "tank", "pump", "d1"),
                new Line("l2", "p1", "L-101", "Water", "Liquid", "DN50", "pump", null, "d1"),
                new Line("l3", "p1", "L-102", "Air", "Gas", "DN25", null, null, "d1"));

        EquipmentDetails details = RelationshipHierarchyBuilder.describe("pump", equipment, lines,
                List.of(new Drawing("d1", "p1", "PID-100", "Main", "A"))).orElseThrow();

        assertThat(details.tag()).isEqualTo("P-001");
        assertThat(details.drawingNumber()).isEqualTo("PID-100");
        assertThat(details.connectedEquipment())
                .containsExactly(new EquipmentDetails.ConnectedEquipment("tank", "T-001", "Tank", null, "Upstream"));
        assertThat(details.connectedLines())
                .extracting(EquipmentDetails.ConnectedLine::lineNumber, EquipmentDetails.ConnectedLine::direction)
                .containsExactly(
                        tuple("L-100", "Incoming"),
                        tuple("L-101", "Outgoing"));
        assertThat(RelationshipHierarchyBuilder.describe("nope", equipment, lines, List.of())).isEmpty();
    }

    @Test
    void mode_parseIsLenient() {
        assertThat(HierarchyMode.parse(null)).isEqualTo(HierarchyMode.BY_AREA);
        assertThat(HierarchyMode.parse("process-flow")).isEqualTo(HierarchyMode.PROCESS_FLOW);
        assertThat(HierarchyMode.parse("ByDrawing")).isEqualTo(HierarchyMode.BY_DRAWING);
        assertThatThrownBy(() -> HierarchyMode.parse("by_color")).isInstanceOf(IllegalArgumentException.class);
    }
}
