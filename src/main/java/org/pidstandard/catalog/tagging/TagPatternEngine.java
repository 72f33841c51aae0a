package org.pidstandard.catalog.tagging;

import org.pidstandard.catalog.model.TaggingMode;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 标签模式展开器：{@code (pattern, context, sequenceNumber) -> tag}。
 * <p>
 * 支持的占位符：
 * <ul>
 *   <li>{@code {TYPE}}：类型代码（见 {@link TypeCodeLookup}）。</li>
 *   <li>{@code {AREA}}：区域原样输出，为空时输出 {@code 00}。</li>
 *   <li>{@code {SEQ:000}}：序号按掩码长度补零；位数超过掩码时<b>不截断</b>，完整输出。</li>
 *   <li>{@code {SEQ}}：序号原样输出。</li>
 * </ul>
 * <p>
 * 所有占位符在一次从左到右的扫描中替换，替换结果不会被再次展开，因此与占位符顺序无关。
 * 无法识别的占位符（例如 {@code {FOO}}、{@code {SEQ:abc}}）原样保留，不报错，方便调用方通过实时预览发现写错的模式。
 * <p>
 * 本类无状态、无 IO，相同输入永远得到相同输出。
 */
public final class TagPatternEngine {

    public static final String EXAMPLE_TYPE_CODE = "PMP";
    public static final String EXAMPLE_AREA = "A01";

    // 掩码允许数字与 '#'，长度即输出宽度（"001" 与 "000" 等价）
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(TYPE|AREA|SEQ(?::([0-9#]+))?)}");

    private TagPatternEngine() {
    }

    public static String expand(String pattern, ExpansionContext ctx, int sequenceNumber) {
        if (pattern == null || pattern.isEmpty()) {
            return "";
        }
        Matcher m = PLACEHOLDER.matcher(pattern);
        StringBuilder sb = new StringBuilder(pattern.length() + 16);
        while (m.find()) {
            String name = m.group(1);
            String replacement;
            if ("TYPE".equals(name)) {
                replacement = ctx.typeCode();
            } else if ("AREA".equals(name)) {
                replacement = ctx.area();
            } else if (m.group(2) != null) {
                replacement = pad(sequenceNumber, m.group(2).length());
            } else {
                replacement = Integer.toString(sequenceNumber);
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * 实时预览用的示例：类型代码 {@code PMP}、区域 {@code A01}、序号 1。
     */
    public static String example(String pattern) {
        return expand(pattern, new ExpansionContext(EXAMPLE_TYPE_CODE, EXAMPLE_AREA), 1);
    }

    public static String defaultPattern(TaggingMode mode) {
        return mode == TaggingMode.KKS ? "={AREA}-{TYPE}-{SEQ:000}" : "{TYPE}-{SEQ:001}";
    }

    static String pad(int number, int width) {
        long value = number;
        String digits = Long.toString(Math.abs(value));
        StringBuilder sb = new StringBuilder(Math.max(width, digits.length()) + 1);
        if (value < 0) {
            sb.append('-');
        }
        for (int i = digits.length(); i < width; i++) {
            sb.append('0');
        }
        return sb.append(digits).toString();
    }
}
