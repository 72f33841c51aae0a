package org.pidstandard.catalog.tagging;

import org.pidstandard.catalog.model.Equipment;
import org.pidstandard.catalog.model.Project;
import org.pidstandard.catalog.model.TaggingMode;
import org.pidstandard.catalog.store.EquipmentStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 按项目标签规范校验单个标签：格式 + 唯一性。
 * <p>
 * 唯一性只在同一项目的有效设备之间比较；编辑已有设备时通过 {@code excludeEquipmentId} 排除自身。
 */
public class TagValidationService {

    private static final int CUSTOM_MIN_LENGTH = 3;
    private static final int CUSTOM_MAX_LENGTH = 50;

    private final EquipmentStore store;

    public TagValidationService(EquipmentStore store) {
        this.store = store;
    }

    public TagValidationResult validate(String projectId, String tag, String excludeEquipmentId) {
        List<String> errors = new ArrayList<>();
        if (tag == null || tag.isBlank()) {
            errors.add("标签不能为空");
            return new TagValidationResult(tag, false, false, false, errors);
        }

        Optional<Project> project = store.findProject(projectId);
        if (project.isEmpty()) {
            errors.add("项目不存在：" + projectId);
            return new TagValidationResult(tag, false, false, false, errors);
        }

        boolean formatCompliant = project.get().taggingMode() == TaggingMode.KKS
                ? checkKksFormat(tag, errors)
                : checkCustomFormat(tag, errors);

        boolean unique = isUnique(projectId, tag, excludeEquipmentId);
        if (!unique) {
            errors.add("标签 '" + tag + "' 在项目中已存在");
        }

        return new TagValidationResult(tag, formatCompliant && unique && errors.isEmpty(), unique, formatCompliant, List.copyOf(errors));
    }

    public boolean isUnique(String projectId, String tag, String excludeEquipmentId) {
        List<Equipment> same = store.findByProject(projectId, e -> e.active()
                && tag.equals(e.tag())
                && !Objects.equals(e.id(), excludeEquipmentId));
        return same.isEmpty();
    }

    // 自定义格式：[前缀]-[区域]-[类型]-[序号]，例如 P-100-PMP-001；只检查长度与空格
    private static boolean checkCustomFormat(String tag, List<String> errors) {
        if (tag.length() < CUSTOM_MIN_LENGTH || tag.length() > CUSTOM_MAX_LENGTH) {
            errors.add("标签长度必须在 " + CUSTOM_MIN_LENGTH + " 到 " + CUSTOM_MAX_LENGTH + " 个字符之间");
            return false;
        }
        if (tag.indexOf(' ') >= 0) {
            errors.add("自定义格式标签不能包含空格");
            return false;
        }
        return true;
    }

    // KKS 格式：+[功能码] [位置码] [设备码]，例如 +LAA 10 CP001
    private static boolean checkKksFormat(String tag, List<String> errors) {
        if (!tag.startsWith("+")) {
            errors.add("KKS 标签必须以 '+' 开头");
            return false;
        }
        String[] parts = tag.trim().split(" +");
        if (parts.length != 3) {
            errors.add("KKS 标签格式应为：+[功能码] [位置码] [设备码]");
            return false;
        }
        if (parts[0].length() < 3 || parts[0].length() > 4) {
            errors.add("KKS 功能码在 '+' 之后应为 2-3 个字符");
            return false;
        }
        if (!parts[1].matches("\\d{2}")) {
            errors.add("KKS 位置码必须是 2 位数字");
            return false;
        }
        if (parts[2].length() < 5) {
            errors.add("KKS 设备码至少 5 个字符");
            return false;
        }
        return true;
    }
}
