package org.pidstandard.catalog.dto;

/**
 * {@code pid_tag_pattern_example} 的返回结果。
 *
 * @param pattern        输入的模式
 * @param example        以 PMP / A01 / 序号 1 展开后的示例
 * @param defaultPattern 项目标签规范对应的默认模式（未指定项目时为自定义规范的默认模式）
 */
public record TagPatternExampleResult(
        String pattern,
        String example,
        String defaultPattern
) {
}
