package org.pidstandard.catalog.tagging;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * 设备类型 -> 标签类型代码（例如 {@code Pump -> P}）。
 * <p>
 * 规则：
 * <ul>
 *   <li>查表不区分大小写。</li>
 *   <li>表中没有的类型：取前三个字符并转大写；不足三个字符时整体转大写。</li>
 *   <li>空类型按 {@link #UNKNOWN_TYPE} 处理。</li>
 * </ul>
 */
public final class TypeCodeLookup {

    public static final String UNKNOWN_TYPE = "Unknown";

    private static final Map<String, String> DEFAULT_CODES = defaultCodes();

    private final Map<String, String> codes;

    private TypeCodeLookup(Map<String, String> codes) {
        this.codes = codes;
    }

    public static TypeCodeLookup defaults() {
        return withOverrides(Map.of());
    }

    /**
     * 在默认表基础上叠加配置（{@code app.pid.type-codes}），同名类型以配置为准。
     */
    public static TypeCodeLookup withOverrides(Map<String, String> overrides) {
        TreeMap<String, String> merged = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        merged.putAll(DEFAULT_CODES);
        if (overrides != null) {
            overrides.forEach((type, code) -> {
                if (type != null && !type.isBlank() && code != null && !code.isBlank()) {
                    merged.put(type.trim(), code.trim());
                }
            });
        }
        return new TypeCodeLookup(Collections.unmodifiableMap(merged));
    }

    public String codeFor(String equipmentType) {
        String type = (equipmentType == null || equipmentType.isBlank()) ? UNKNOWN_TYPE : equipmentType.trim();
        String code = codes.get(type);
        if (code != null) {
            return code;
        }
        String upper = type.toUpperCase(Locale.ROOT);
        return upper.length() >= 3 ? upper.substring(0, 3) : upper;
    }

    public Map<String, String> asMap() {
        return codes;
    }

    private static Map<String, String> defaultCodes() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("Pump", "P");
        m.put("Tank", "T");
        m.put("Vessel", "V");
        m.put("Heat Exchanger", "HX");
        m.put("Valve", "VLV");
        m.put("Filter", "F");
        m.put("Compressor", "C");
        m.put("Separator", "S");
        return Collections.unmodifiableMap(m);
    }
}
