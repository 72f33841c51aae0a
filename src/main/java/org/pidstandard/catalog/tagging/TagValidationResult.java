package org.pidstandard.catalog.tagging;

import java.util.List;

/**
 * 标签校验结果。
 *
 * @param tag             被校验的标签
 * @param valid           格式合规且唯一
 * @param unique          在项目有效设备中唯一
 * @param formatCompliant 符合项目标签规范
 * @param errors          错误说明（无错误时为空列表）
 */
public record TagValidationResult(
        String tag,
        boolean valid,
        boolean unique,
        boolean formatCompliant,
        List<String> errors
) {
}
