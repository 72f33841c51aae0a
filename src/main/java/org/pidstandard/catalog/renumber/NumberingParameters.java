package org.pidstandard.catalog.renumber;

/**
 * 编号参数：模式 + 起始号 + 步长。
 * <p>
 * 起始号可以为 0 或负数，只要求能解析；步长必须 &gt;= 1。
 */
public record NumberingParameters(String pattern, int startNumber, int increment) {

    public NumberingParameters {
        if (pattern == null || pattern.trim().isEmpty()) {
            throw new RenumberValidationException("请输入重编号模式");
        }
        pattern = pattern.trim();
        if (increment < 1) {
            throw new RenumberValidationException("步长无效（最小为 1）：" + increment);
        }
    }

    /**
     * 从文本输入解析（对应界面上的文本框）。
     */
    public static NumberingParameters parse(String pattern, String startText, String incrementText) {
        if (pattern == null || pattern.trim().isEmpty()) {
            throw new RenumberValidationException("请输入重编号模式");
        }
        int start = parseInt(startText, "起始号");
        int increment = parseInt(incrementText, "步长");
        return new NumberingParameters(pattern, start, increment);
    }

    private static int parseInt(String text, String what) {
        if (text == null || text.isBlank()) {
            throw new RenumberValidationException(what + "不能为空");
        }
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new RenumberValidationException(what + "不是有效整数：" + text);
        }
    }
}
