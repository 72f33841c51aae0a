package org.pidstandard.catalog.renumber;

import java.util.List;

/**
 * 同一批次内生成了重复的新标签。硬性拒绝，不允许覆盖确认；需要调整过滤条件或模式后重试。
 */
public class DuplicateTagException extends RenumberException {

    private final List<String> duplicates;

    public DuplicateTagException(List<String> duplicates) {
        super("批次内存在重复的新标签：" + String.join(", ", duplicates) + "，请调整模式或过滤条件");
        this.duplicates = List.copyOf(duplicates);
    }

    public List<String> getDuplicates() {
        return duplicates;
    }
}
