package org.pidstandard.catalog.renumber;

import java.util.List;

/**
 * 预览快照：候选列表（顺序即编号顺序）+ 生成它所用的参数。
 * <p>
 * 预览与应用之间必须保持候选顺序不变，应用时直接使用快照里的 {@code proposedTag}，不会重新计算。
 */
public record RenumberPreview(NumberingParameters parameters, List<RenumberingCandidate> candidates) {

    public RenumberPreview {
        candidates = List.copyOf(candidates);
    }

    /**
     * 已勾选且生成了新标签的候选，即真正会被应用的条目。
     */
    public List<RenumberingCandidate> pending() {
        return candidates.stream()
                .filter(c -> c.selected() && c.hasProposedTag())
                .toList();
    }

    public int selectedCount() {
        return (int) candidates.stream().filter(RenumberingCandidate::selected).count();
    }
}
