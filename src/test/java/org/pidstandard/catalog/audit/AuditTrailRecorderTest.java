package org.pidstandard.catalog.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.pidstandard.catalog.TestCatalog;
import org.pidstandard.catalog.model.Equipment;
import org.pidstandard.catalog.model.EquipmentStatus;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuditTrailRecorderTest {

    private final InMemoryAuditSink sink = new InMemoryAuditSink();
    private final AuditTrailRecorder recorder = new AuditTrailRecorder(
            sink,
            new ConfiguredIdentitySource("alice", "ws-01"),
            new ObjectMapper(),
            Clock.fixed(TestCatalog.T0, ZoneOffset.UTC),
            2,
            3
    );

    private static Equipment pump() {
        return Equipment.builder("e1", "p1").tag("P-001").equipmentType("Pump").description("Feed pump").build();
    }

    @Test
    void equipmentCreated_recordsIdentityAndSnapshot() {
        AuditLogEntry entry = recorder.equipmentCreated(pump());

        assertThat(sink.size()).isEqualTo(1);
        assertThat(entry.action()).isEqualTo(AuditAction.CREATED);
        assertThat(entry.performedBy()).isEqualTo("alice");
        assertThat(entry.source()).isEqualTo("ws-01");
        assertThat(entry.timestampUtc()).isEqualTo(TestCatalog.T0);
        assertThat(entry.changeSummary()).isEqualTo("Equipment 'P-001' created");
        assertThat(entry.oldSnapshot()).isNull();
        assertThat(entry.newSnapshot())
                .containsEntry("tag", "P-001")
                .containsEntry("equipmentType", "Pump")
                .containsEntry("status", "PLANNED");
    }

    @Test
    void equipmentUpdated_summarisesChangedFields() {
        Equipment before = pump();
        Equipment after = before.toBuilder().tag("P-010").status(EquipmentStatus.INSTALLED).manufacturer("KSB").build();

        AuditLogEntry entry = recorder.equipmentUpdated(before, after).orElseThrow();

        assertThat(entry.action()).isEqualTo(AuditAction.UPDATED);
        assertThat(entry.changeSummary()).isEqualTo("Tag: P-001 → P-010, Status: PLANNED → INSTALLED, Manufacturer changed");
        assertThat(entry.oldSnapshot()).containsEntry("manufacturer", null);
        assertThat(entry.newSnapshot()).containsEntry("manufacturer", "KSB");
    }

    @Test
    void equipmentUpdated_withoutChangesRecordsNothing() {
        assertThat(recorder.equipmentUpdated(pump(), pump())).isEmpty();
        assertThat(sink.size()).isZero();
    }

    @Test
    void equipmentDeleted_keepsOldSnapshotOnly() {
        AuditLogEntry entry = recorder.equipmentDeleted(pump());

        assertThat(entry.action()).isEqualTo(AuditAction.DELETED);
        assertThat(entry.oldSnapshot()).containsEntry("tag", "P-001");
        assertThat(entry.newSnapshot()).isNull();
    }

    @Test
    void renumberEntry_isBuiltButNotRecorded() {
        Equipment before = pump();
        AuditLogEntry entry = recorder.renumberEntry(before, before.withTag("P-100", "alice", TestCatalog.T0));

        assertThat(entry.changeSummary()).isEqualTo("Tag Renumbering: P-001 → P-100");
        assertThat(sink.size()).isZero();
    }

    @Test
    void newEntry_acceptsPlainMapsAsSnapshots() {
        recorder.record(recorder.newEntry("Line", "l1", AuditAction.SYNCHRONIZED, "synced",
                null, Map.of("lineNumber", "L-100"), "p1"));

        assertThat(recorder.query("p1", AuditQuery.all()))
                .singleElement()
                .satisfies(e -> assertThat(e.newSnapshot()).containsEntry("lineNumber", "L-100"));
    }

    @Test
    void query_appliesDefaultAndMaximumLimit() {
        for (int i = 0; i < 5; i++) {
            recorder.equipmentCreated(pump());
        }

        assertThat(recorder.query(null, AuditQuery.all())).hasSize(2);
        assertThat(recorder.query(null, AuditQuery.all().withLimit(1))).hasSize(1);
        assertThat(recorder.query(null, AuditQuery.all().withLimit(50))).hasSize(3);
    }

    @Test
    void record_wrapsSinkFailures() {
        AuditSink failing = new AuditSink() {
            @Override
            public void record(AuditLogEntry entry) {
                throw new IllegalStateException("connection reset");
            }

            @Override
            public List<AuditLogEntry> query(String projectId, AuditQuery query) {
                return List.of();
            }
        };
        AuditTrailRecorder broken = new AuditTrailRecorder(failing, new ConfiguredIdentitySource(null, null),
                new ObjectMapper(), Clock.systemUTC(), 10, 10);

        assertThatThrownBy(() -> broken.equipmentCreated(pump()))
                .isInstanceOf(AuditStorageException.class)
                .hasMessageContaining("connection reset");
    }

    @Test
    void identity_fallsBackToSystemValues() {
        ConfiguredIdentitySource identity = new ConfiguredIdentitySource(" ", null);

        assertThat(identity.performedBy()).isNotBlank();
        assertThat(identity.source()).isNotBlank();
    }

    @Test
    void action_parseAcceptsNameAndLabel() {
        assertThat(AuditAction.parse("BatchTagged")).isEqualTo(AuditAction.BATCH_TAGGED);
        assertThat(AuditAction.parse("batch_tagged")).isEqualTo(AuditAction.BATCH_TAGGED);
        assertThat(AuditAction.parse("updated")).isEqualTo(AuditAction.UPDATED);
        assertThat(AuditAction.parse("renamed")).isNull();
    }
}
