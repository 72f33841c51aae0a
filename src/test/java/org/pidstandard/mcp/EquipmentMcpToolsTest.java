package org.pidstandard.mcp;

import org.junit.jupiter.api.Test;
import org.pidstandard.catalog.EquipmentCatalogService;
import org.pidstandard.catalog.TestCatalog;
import org.pidstandard.catalog.audit.AuditAction;
import org.pidstandard.catalog.dto.AuditLogResult;
import org.pidstandard.catalog.dto.HierarchyResult;
import org.pidstandard.catalog.dto.ProposedTagChange;
import org.pidstandard.catalog.dto.RenumberConfirmResult;
import org.pidstandard.catalog.dto.RenumberPrepareResult;
import org.pidstandard.catalog.hierarchy.EquipmentDetails;
import org.pidstandard.catalog.hierarchy.HierarchyMode;
import org.pidstandard.catalog.model.Equipment;
import org.pidstandard.catalog.model.EquipmentStatus;
import org.pidstandard.catalog.model.TaggingMode;
import org.pidstandard.catalog.renumber.BatchRenumberCoordinator;
import org.pidstandard.catalog.renumber.DuplicateTagException;
import org.pidstandard.catalog.renumber.RenumberSessionStore;
import org.pidstandard.catalog.renumber.RenumberValidationException;
import org.pidstandard.catalog.renumber.TagConflictException;
import org.pidstandard.catalog.tagging.TagValidationService;
import org.pidstandard.catalog.tagging.TypeCodeLookup;

import java.time.Duration;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pidstandard.catalog.TestCatalog.PROJECT;

class EquipmentMcpToolsTest {

    private final TestCatalog catalog = new TestCatalog();
    private final RenumberSessionStore sessions = new RenumberSessionStore(Duration.ofMinutes(30), catalog.clock);
    private final EquipmentMcpTools tools = new EquipmentMcpTools(
            catalog.store,
            new BatchRenumberCoordinator(catalog.store, catalog.audit, TypeCodeLookup.defaults(), 100),
            sessions,
            catalog.audit,
            new TagValidationService(catalog.store),
            new EquipmentCatalogService(catalog.store, new TagValidationService(catalog.store), catalog.audit)
    );

    private void pumps() {
        catalog.add("e1", "P-1", "Pump", "A01");
        catalog.add("e2", "P-2", "Pump", "A01");
        catalog.add("v1", "V-1", "Valve", "A02");
    }

    @Test
    void listProjectsAndEquipment() {
        pumps();
        catalog.add(Equipment.builder("old", PROJECT).tag("P-0").active(false).build());

        assertThat(tools.listProjects().projects()).hasSize(2);
        assertThat(tools.listEquipment(PROJECT, null).equipment()).extracting(Equipment::tag).containsExactly("P-1", "P-2", "V-1");
        assertThat(tools.listEquipment(PROJECT, true).total()).isEqualTo(4);
        assertThatThrownBy(() -> tools.listEquipment("nope", null)).isInstanceOf(NoSuchElementException.class);
        assertThatThrownBy(() -> tools.listEquipment(" ", null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void listRenumberCandidates_appliesFilters() {
        pumps();

        assertThat(tools.listRenumberCandidates(PROJECT, "Pump", null, null).total()).isEqualTo(2);
        assertThat(tools.listRenumberCandidates(PROJECT, null, "A02", "v-*").candidates())
                .singleElement()
                .satisfies(c -> assertThat(c.equipmentId()).isEqualTo("v1"));
    }

    @Test
    void tagPatternExample_usesProjectDefaultWhenBlank() {
        TestCatalog kks = new TestCatalog(TaggingMode.KKS);
        EquipmentMcpTools kksTools = new EquipmentMcpTools(kks.store,
                new BatchRenumberCoordinator(kks.store, kks.audit, TypeCodeLookup.defaults(), 100),
                sessions, kks.audit, new TagValidationService(kks.store),
                new EquipmentCatalogService(kks.store, new TagValidationService(kks.store), kks.audit));

        assertThat(kksTools.tagPatternExample(null, PROJECT).example()).isEqualTo("=A01-PMP-001");
        assertThat(tools.tagPatternExample("{TYPE}-{SEQ:000}", null).example()).isEqualTo("PMP-001");
        assertThat(tools.tagPatternExample("", null).defaultPattern()).isEqualTo("{TYPE}-{SEQ:001}");
    }

    @Test
    void prepareThenConfirm_appliesThePreparedPreview() {
        pumps();

        RenumberPrepareResult prepared = tools.prepareRenumber(PROJECT, "P-{SEQ:001}", "10", null,
                null, "Pump", null, null);

        assertThat(prepared.changes()).containsExactly(
                new ProposedTagChange("e1", "P-1", "P-010"),
                new ProposedTagChange("e2", "P-2", "P-011"));
        assertThat(prepared.requiresOverride()).isFalse();
        assertThat(prepared.expiresAt()).isEqualTo(TestCatalog.T0.plus(Duration.ofMinutes(30)));
        assertThat(catalog.tagOf("e1")).isEqualTo("P-1");

        RenumberConfirmResult confirmed = tools.confirmRenumber(prepared.token(), true, null);

        assertThat(confirmed.applied()).isTrue();
        assertThat(confirmed.successCount()).isEqualTo(2);
        assertThat(catalog.tagOf("e1")).isEqualTo("P-010");
        assertThat(catalog.tagOf("v1")).isEqualTo("V-1");
        assertThatThrownBy(() -> tools.confirmRenumber(prepared.token(), true, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void prepare_selectsGivenIdsAndWarnsAboutUnknownOnes() {
        pumps();

        RenumberPrepareResult prepared = tools.prepareRenumber(PROJECT, "X-{SEQ}", null, "5",
                List.of("e2", "ghost"), null, null, null);

        assertThat(prepared.selectedCount()).isEqualTo(1);
        assertThat(prepared.changes()).containsExactly(new ProposedTagChange("e2", "P-2", "X-1"));
        assertThat(prepared.warnings()).anyMatch(w -> w.startsWith("1 个设备 id"));
    }

    @Test
    void prepare_validatesParameters() {
        pumps();

        assertThatThrownBy(() -> tools.prepareRenumber(PROJECT, " ", null, null, null, null, null, null))
                .isInstanceOf(RenumberValidationException.class);
        assertThatThrownBy(() -> tools.prepareRenumber(PROJECT, "P-{SEQ}", "x", null, null, null, null, null))
                .isInstanceOf(RenumberValidationException.class);
    }

    @Test
    void confirm_falseCancelsAndLeavesStoreAlone() {
        pumps();
        RenumberPrepareResult prepared = tools.prepareRenumber(PROJECT, "P-{SEQ:001}", "10", null, null, "Pump", null, null);

        RenumberConfirmResult cancelled = tools.confirmRenumber(prepared.token(), false, null);

        assertThat(cancelled.confirmed()).isFalse();
        assertThat(cancelled.applied()).isFalse();
        assertThat(sessions.size()).isZero();
        assertThat(catalog.tagOf("e1")).isEqualTo("P-1");
    }

    @Test
    void confirm_conflictKeepsTokenUntilOverride() {
        pumps();
        RenumberPrepareResult prepared = tools.prepareRenumber(PROJECT, "V-{SEQ}", null, null, null, "Pump", null, null);
        assertThat(prepared.requiresOverride()).isTrue();
        assertThat(prepared.conflicts()).singleElement().satisfies(c -> assertThat(c.existingEquipmentId()).isEqualTo("v1"));

        assertThatThrownBy(() -> tools.confirmRenumber(prepared.token(), true, false))
                .isInstanceOf(TagConflictException.class);
        assertThat(catalog.tagOf("e1")).isEqualTo("P-1");

        RenumberConfirmResult overridden = tools.confirmRenumber(prepared.token(), true, true);

        assertThat(overridden.applied()).isTrue();
        assertThat(overridden.warnings()).isNotEmpty();
        assertThat(catalog.tagOf("e1")).isEqualTo("V-1");
    }

    @Test
    void confirm_duplicatesAreNeverApplied() {
        pumps();
        RenumberPrepareResult prepared = tools.prepareRenumber(PROJECT, "SAME", null, null, null, "Pump", null, null);
        assertThat(prepared.duplicates()).containsExactly("SAME");

        assertThatThrownBy(() -> tools.confirmRenumber(prepared.token(), true, true))
                .isInstanceOf(DuplicateTagException.class);
        assertThat(catalog.tagOf("e1")).isEqualTo("P-1");
    }

    @Test
    void confirm_expiredToken() {
        pumps();
        RenumberPrepareResult prepared = tools.prepareRenumber(PROJECT, "P-{SEQ:001}", null, null, null, null, null, null);
        catalog.clock.advance(Duration.ofHours(1));

        assertThatThrownBy(() -> tools.confirmRenumber(prepared.token(), true, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("过期");
    }

    @Test
    void buildHierarchyAndDetails() {
        pumps();
        tools.linkEquipment("e1", "e2");

        HierarchyResult byArea = tools.buildHierarchy(PROJECT, null);
        assertThat(byArea.mode()).isEqualTo(HierarchyMode.BY_AREA);
        assertThat(byArea.leafCount()).isEqualTo(3);

        HierarchyResult flow = tools.buildHierarchy(PROJECT, "process_flow");
        assertThat(flow.roots().get(0).children()).extracting(n -> n.label()).containsExactly("P-1", "V-1");

        EquipmentDetails details = tools.getEquipmentDetails("e2");
        assertThat(details.connectedEquipment()).singleElement()
                .satisfies(c -> assertThat(c.relationship()).isEqualTo("Upstream"));
        assertThatThrownBy(() -> tools.getEquipmentDetails("nope")).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void equipmentMaintenanceIsAudited() {
        Equipment created = tools.createEquipment(PROJECT, "P-500", "Pump", "Booster", null, "A03", "installed",
                null, null, null, "{\"operatingPressure\":{\"value\":6,\"unit\":\"bar\"}}");
        assertThat(created.status()).isEqualTo(EquipmentStatus.INSTALLED);
        assertThat(created.processParameters().operatingPressure().unit()).isEqualTo("bar");

        catalog.clock.advance(Duration.ofMinutes(1));
        tools.updateEquipment(created.id(), null, null, "Booster pump", null, null, null, null, null, null, null);
        catalog.clock.advance(Duration.ofMinutes(1));
        tools.deactivateEquipment(created.id());

        AuditLogResult log = tools.queryAuditLog(PROJECT, "Equipment", null, null, null, created.id(), null);
        assertThat(log.entries()).extracting(e -> e.action())
                .containsExactly(AuditAction.DELETED, AuditAction.UPDATED, AuditAction.CREATED);
        assertThat(tools.queryAuditLog(PROJECT, null, "Created", null, null, null, 1).count()).isEqualTo(1);
    }

    @Test
    void invalidArgumentsAreReported() {
        assertThatThrownBy(() -> tools.createEquipment(PROJECT, "P-1", null, null, null, null, "broken",
                null, null, null, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tools.createEquipment(PROJECT, "P-1", null, null, null, null, null,
                null, null, null, "{not json")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tools.queryAuditLog(null, null, "Renamed", null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tools.queryAuditLog(null, null, null, "yesterday", null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(tools.validateTag(PROJECT, "P 1", null).valid()).isFalse();
    }
}
