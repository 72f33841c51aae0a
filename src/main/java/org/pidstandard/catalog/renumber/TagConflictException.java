package org.pidstandard.catalog.renumber;

import java.util.List;

/**
 * 新标签与本批次之外的已有设备标签冲突。可恢复：操作员显式确认覆盖后可以继续。
 */
public class TagConflictException extends RenumberException {

    private final List<TagConflict> conflicts;

    public TagConflictException(List<TagConflict> conflicts) {
        super("以下新标签已存在于项目中：" + String.join(", ", conflicts.stream().map(TagConflict::proposedTag).toList())
                + "；如确认继续请显式覆盖");
        this.conflicts = List.copyOf(conflicts);
    }

    public List<TagConflict> getConflicts() {
        return conflicts;
    }
}
