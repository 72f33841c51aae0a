package org.pidstandard.catalog.audit;

/**
 * 审计动作类型。
 */
public enum AuditAction {
    CREATED("Created"),
    UPDATED("Updated"),
    DELETED("Deleted"),
    BATCH_TAGGED("BatchTagged"),
    SYNCHRONIZED("Synchronized");

    private final String label;

    AuditAction(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * 宽松解析：同时接受枚举名（{@code BATCH_TAGGED}）与展示名（{@code BatchTagged}），不区分大小写。
     *
     * @return 无法识别时返回 null
     */
    public static AuditAction parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String t = text.trim();
        for (AuditAction a : values()) {
            if (a.name().equalsIgnoreCase(t) || a.label.equalsIgnoreCase(t)) {
                return a;
            }
        }
        return null;
    }
}
