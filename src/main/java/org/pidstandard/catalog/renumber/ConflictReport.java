package org.pidstandard.catalog.renumber;

import java.util.List;

/**
 * 提交前的冲突检查结果。
 *
 * @param duplicates     批次内重复的新标签（硬性阻断）
 * @param storeConflicts 与批次外已有标签的冲突（可显式覆盖）
 */
public record ConflictReport(List<String> duplicates, List<TagConflict> storeConflicts) {

    public ConflictReport {
        duplicates = duplicates == null ? List.of() : List.copyOf(duplicates);
        storeConflicts = storeConflicts == null ? List.of() : List.copyOf(storeConflicts);
    }

    public boolean hasDuplicates() {
        return !duplicates.isEmpty();
    }

    public boolean hasStoreConflicts() {
        return !storeConflicts.isEmpty();
    }

    public boolean isClean() {
        return duplicates.isEmpty() && storeConflicts.isEmpty();
    }
}
