package org.pidstandard.catalog.dto;

import org.pidstandard.catalog.renumber.RenumberingCandidate;

import java.util.List;

/**
 * {@code pid_list_renumber_candidates} 的返回结果。
 *
 * @param projectId  项目 id
 * @param total      候选数量
 * @param candidates 候选设备（按当前标签排序，即默认编号顺序）
 */
public record CandidateListResult(
        String projectId,
        int total,
        List<RenumberingCandidate> candidates
) {
}
