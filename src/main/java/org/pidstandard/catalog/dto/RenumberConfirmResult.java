package org.pidstandard.catalog.dto;

import org.pidstandard.catalog.renumber.TagChange;

import java.util.List;

/**
 * {@code pid_confirm_renumber} 的返回结果（确认/取消）。
 *
 * @param token        token
 * @param projectId    项目 id
 * @param confirmed    是否确认（confirm=true）
 * @param applied      是否已提交
 * @param rolledBack   是否整批回滚
 * @param successCount 成功数
 * @param errorCount   错误数
 * @param errors       错误明细
 * @param changes      已提交的变更
 * @param warnings     非致命提示
 */
public record RenumberConfirmResult(
        String token,
        String projectId,
        boolean confirmed,
        boolean applied,
        boolean rolledBack,
        int successCount,
        int errorCount,
        List<String> errors,
        List<TagChange> changes,
        List<String> warnings
) {
}
