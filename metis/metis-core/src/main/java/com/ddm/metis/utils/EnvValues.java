package com.ddm.metis.utils;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 环境变量取值的小工具集合。
 *
 * @author liyifei
 */
public final class EnvValues {

    private EnvValues() {
    }

    public static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    public static boolean notBlank(String s) {
        return !isBlank(s);
    }

    public static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    /** 取非空白值，已 trim；缺失或空白返回 null。 */
    public static String get(Map<String, String> env, String key) {
        if (env == null || key == null) return null;
        return trimToNull(env.get(key));
    }

    public static boolean has(Map<String, String> env, String key) {
        return get(env, key) != null;
    }

    /** CI 风格真值：1/true/yes（大小写不敏感）。 */
    public static boolean isTrue(String val) {
        if (val == null) return false;
        switch (val.trim().toLowerCase(Locale.ROOT)) {
            case "true":
            case "1":
            case "yes":
                return true;
            default:
                return false;
        }
    }

    public static Integer toInt(String s) {
        try {
            return (s == null || s.isBlank()) ? null : Integer.valueOf(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static String firstNonBlank(String... vals) {
        if (vals == null) return null;
        for (String v : vals) if (!isBlank(v)) return v;
        return null;
    }

    /** 用逗号分隔，去空白、去重、保持顺序。 */
    public static List<String> splitToUniqueList(String raw) {
        if (isBlank(raw)) return List.of();
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(EnvValues::notBlank)
                .distinct()
                .collect(Collectors.toUnmodifiableList());
    }

    /** kebab-case / camelCase 转 UPPER_SNAKE，如 {@code api-key -> API_KEY}。 */
    public static String toUpperSnake(String name) {
        if (name == null) return null;
        StringBuilder sb = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '-' || c == '.' || c == ' ') {
                sb.append('_');
            } else if (Character.isUpperCase(c) && i > 0 && Character.isLowerCase(name.charAt(i - 1))) {
                sb.append('_').append(c);
            } else {
                sb.append(Character.toUpperCase(c));
            }
        }
        return sb.toString();
    }
}
