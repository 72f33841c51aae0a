package org.pidstandard.catalog.renumber;

import java.util.List;

/**
 * 一次批量应用的结果。
 *
 * @param successCount 成功重编号的设备数（回滚时恒为 0）
 * @param errorCount   错误数
 * @param errors       错误明细（{@code 标签: 原因}）
 * @param rolledBack   是否整批回滚
 * @param changes      已提交的变更（回滚时为空）
 */
public record RenumberResult(
        int successCount,
        int errorCount,
        List<String> errors,
        boolean rolledBack,
        List<TagChange> changes
) {

    public RenumberResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    public static RenumberResult committed(List<TagChange> changes, List<String> errors) {
        return new RenumberResult(changes.size(), errors.size(), errors, false, changes);
    }

    public static RenumberResult rolledBack(String error) {
        return new RenumberResult(0, 1, List.of(error), true, List.of());
    }
}
