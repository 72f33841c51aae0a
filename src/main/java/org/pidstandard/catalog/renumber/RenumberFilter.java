package org.pidstandard.catalog.renumber;

import org.pidstandard.catalog.model.Equipment;

import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * 候选设备过滤条件，三者之间为 AND。空白或 {@code All} 表示不过滤该项。
 *
 * @param equipmentType 设备类型（精确匹配）
 * @param area          区域（精确匹配）
 * @param tagPattern    当前标签通配符：{@code *} 匹配任意字符串，整串匹配，不区分大小写
 */
public record RenumberFilter(String equipmentType, String area, String tagPattern) {

    public static final String ALL = "All";

    public static RenumberFilter none() {
        return new RenumberFilter(null, null, null);
    }

    public Predicate<Equipment> toPredicate() {
        Predicate<Equipment> p = e -> true;
        if (isSet(equipmentType)) {
            String type = equipmentType;
            p = p.and(e -> Objects.equals(e.equipmentType(), type));
        }
        if (isSet(area)) {
            String a = area;
            p = p.and(e -> Objects.equals(e.area(), a));
        }
        if (tagPattern != null && !tagPattern.isBlank()) {
            Pattern regex = compileWildcard(tagPattern.trim());
            p = p.and(e -> regex.matcher(e.tag()).matches());
        }
        return p;
    }

    /**
     * 通配符转正则：除 {@code *} 以外的字符都按字面匹配。
     */
    static Pattern compileWildcard(String wildcard) {
        StringBuilder sb = new StringBuilder("^");
        int start = 0;
        int star;
        while ((star = wildcard.indexOf('*', start)) >= 0) {
            if (star > start) {
                sb.append(Pattern.quote(wildcard.substring(start, star)));
            }
            sb.append(".*");
            start = star + 1;
        }
        if (start < wildcard.length()) {
            sb.append(Pattern.quote(wildcard.substring(start)));
        }
        sb.append('$');
        return Pattern.compile(sb.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    }

    private static boolean isSet(String v) {
        return v != null && !v.isBlank() && !ALL.equals(v);
    }
}
