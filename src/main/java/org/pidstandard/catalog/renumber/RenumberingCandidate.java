package org.pidstandard.catalog.renumber;

import org.pidstandard.catalog.model.Equipment;

/**
 * 重编号会话中的一台设备（临时快照，不持久化，不跨会话共享）。
 * <p>
 * 不可变：勾选与预览都通过 {@code withXxx} 生成新实例。
 */
public record RenumberingCandidate(
        String equipmentId,
        String currentTag,
        String equipmentType,
        String description,
        String area,
        boolean selected,
        String proposedTag
) {

    public RenumberingCandidate {
        if (proposedTag == null) {
            proposedTag = "";
        }
    }

    public static RenumberingCandidate from(Equipment e) {
        return new RenumberingCandidate(e.id(), e.tag(), e.equipmentType(), e.description(), e.area(), false, "");
    }

    public RenumberingCandidate withSelected(boolean value) {
        return new RenumberingCandidate(equipmentId, currentTag, equipmentType, description, area, value, proposedTag);
    }

    public RenumberingCandidate withProposedTag(String tag) {
        return new RenumberingCandidate(equipmentId, currentTag, equipmentType, description, area, selected, tag);
    }

    public boolean hasProposedTag() {
        return !proposedTag.isEmpty();
    }
}
