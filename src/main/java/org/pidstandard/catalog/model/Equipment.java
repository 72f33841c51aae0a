package org.pidstandard.catalog.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 设备记录（泵、阀门、储罐……），自定义与 KKS 两种标签规范通用。
 * <p>
 * 约定：
 * <ul>
 *   <li>{@code tag} 只要求在同一项目的<b>有效</b>设备之间唯一，软删除（{@code active=false}）的设备不参与唯一性校验。</li>
 *   <li>{@code upstreamEquipmentId}/{@code downstreamEquipmentId} 是一对简单的单值指针，不是完整的邻接表；
 *   系统本身不禁止循环，遍历时由调用方检测。</li>
 * </ul>
 * 记录不可变，修改通过 {@code withXxx} 生成新实例。
 */
public record Equipment(
        String id,
        String projectId,
        String tag,
        String equipmentType,
        String description,
        String service,
        String area,
        EquipmentStatus status,
        String manufacturer,
        String model,
        ProcessParameters processParameters,
        String drawingId,
        String upstreamEquipmentId,
        String downstreamEquipmentId,
        boolean active,
        String createdBy,
        Instant createdAt,
        String modifiedBy,
        Instant modifiedAt
) {

    public Equipment {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(projectId, "projectId");
        if (tag == null) {
            tag = "";
        }
        if (status == null) {
            status = EquipmentStatus.PLANNED;
        }
        if (processParameters == null) {
            processParameters = ProcessParameters.NONE;
        }
    }

    public static Builder builder(String id, String projectId) {
        return new Builder(id, projectId);
    }

    public Builder toBuilder() {
        Builder b = new Builder(id, projectId);
        b.tag = tag;
        b.equipmentType = equipmentType;
        b.description = description;
        b.service = service;
        b.area = area;
        b.status = status;
        b.manufacturer = manufacturer;
        b.model = model;
        b.processParameters = processParameters;
        b.drawingId = drawingId;
        b.upstreamEquipmentId = upstreamEquipmentId;
        b.downstreamEquipmentId = downstreamEquipmentId;
        b.active = active;
        b.createdBy = createdBy;
        b.createdAt = createdAt;
        b.modifiedBy = modifiedBy;
        b.modifiedAt = modifiedAt;
        return b;
    }

    public Equipment withTag(String newTag, String by, Instant at) {
        return toBuilder().tag(newTag).modifiedBy(by).modifiedAt(at).build();
    }

    public Equipment withUpstream(String upstreamId, String by, Instant at) {
        return toBuilder().upstreamEquipmentId(upstreamId).modifiedBy(by).modifiedAt(at).build();
    }

    public Equipment withDownstream(String downstreamId, String by, Instant at) {
        return toBuilder().downstreamEquipmentId(downstreamId).modifiedBy(by).modifiedAt(at).build();
    }

    public Equipment deactivated(String by, Instant at) {
        return toBuilder().active(false).modifiedBy(by).modifiedAt(at).build();
    }

    public static final class Builder {
        private final String id;
        private final String projectId;
        private String tag = "";
        private String equipmentType;
        private String description;
        private String service;
        private String area;
        private EquipmentStatus status = EquipmentStatus.PLANNED;
        private String manufacturer;
        private String model;
        private ProcessParameters processParameters = ProcessParameters.NONE;
        private String drawingId;
        private String upstreamEquipmentId;
        private String downstreamEquipmentId;
        private boolean active = true;
        private String createdBy;
        private Instant createdAt;
        private String modifiedBy;
        private Instant modifiedAt;

        private Builder(String id, String projectId) {
            this.id = id;
            this.projectId = projectId;
        }

        public Builder tag(String tag) {
            this.tag = tag;
            return this;
        }

        public Builder equipmentType(String equipmentType) {
            this.equipmentType = equipmentType;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder service(String service) {
            this.service = service;
            return this;
        }

        public Builder area(String area) {
            this.area = area;
            return this;
        }

        public Builder status(EquipmentStatus status) {
            this.status = status;
            return this;
        }

        public Builder manufacturer(String manufacturer) {
            this.manufacturer = manufacturer;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder processParameters(ProcessParameters processParameters) {
            this.processParameters = processParameters;
            return this;
        }

        public Builder drawingId(String drawingId) {
            this.drawingId = drawingId;
            return this;
        }

        public Builder upstreamEquipmentId(String upstreamEquipmentId) {
            this.upstreamEquipmentId = upstreamEquipmentId;
            return this;
        }

        public Builder downstreamEquipmentId(String downstreamEquipmentId) {
            this.downstreamEquipmentId = downstreamEquipmentId;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder modifiedBy(String modifiedBy) {
            this.modifiedBy = modifiedBy;
            return this;
        }

        public Builder modifiedAt(Instant modifiedAt) {
            this.modifiedAt = modifiedAt;
            return this;
        }

        public Equipment build() {
            return new Equipment(
                    id,
                    projectId,
                    tag,
                    equipmentType,
                    description,
                    service,
                    area,
                    status,
                    manufacturer,
                    model,
                    processParameters,
                    drawingId,
                    upstreamEquipmentId,
                    downstreamEquipmentId,
                    active,
                    createdBy,
                    createdAt,
                    modifiedBy,
                    modifiedAt
            );
        }
    }
}
