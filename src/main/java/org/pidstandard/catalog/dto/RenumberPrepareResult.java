package org.pidstandard.catalog.dto;

import org.pidstandard.catalog.renumber.TagConflict;

import java.time.Instant;
import java.util.List;

/**
 * {@code pid_prepare_renumber} 的返回结果（仅预览，不会修改任何设备）。
 *
 * @param token            用于后续确认的 token
 * @param projectId        项目 id
 * @param pattern          编号模式
 * @param startNumber      起始号
 * @param increment        步长
 * @param selectedCount    选中的设备数
 * @param changes          预览变更（顺序即编号顺序）
 * @param duplicates       批次内重复的新标签；非空时无法确认
 * @param conflicts        与批次外已有标签的冲突；非空时确认需要 overrideConflicts=true
 * @param requiresOverride 是否需要显式覆盖冲突
 * @param expiresAt        token 过期时间
 * @param warnings         风险提示
 */
public record RenumberPrepareResult(
        String token,
        String projectId,
        String pattern,
        int startNumber,
        int increment,
        int selectedCount,
        List<ProposedTagChange> changes,
        List<String> duplicates,
        List<TagConflict> conflicts,
        boolean requiresOverride,
        Instant expiresAt,
        List<String> warnings
) {
}
