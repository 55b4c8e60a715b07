package work.btool.loader;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import work.btool.shared.ConfigurationException;

/**
 * Typed access to the plain map trees produced from YAML, JSON and TOML documents. Every accessor
 * names the offending element when the tree does not have the expected shape.
 */
final class TreeFields {
    private TreeFields() {}

    @SuppressWarnings("unchecked")
    static Map<String, Object> asMap(Object value, String context) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw ConfigurationException.structural(context + " must be a mapping");
    }

    /**
     * Entries under {@code key}: a missing key yields no entries, a single mapping one entry.
     */
    static List<Map<String, Object>> mapList(Map<String, Object> node, String key, String context) {
        Object value = node.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof Map<?, ?>) {
            return List.of(asMap(value, context + "." + key));
        }
        if (!(value instanceof List<?> list)) {
            throw ConfigurationException.structural(context + "." + key + " must be a list");
        }
        var entries = new ArrayList<Map<String, Object>>();
        for (int i = 0; i < list.size(); i++) {
            entries.add(asMap(list.get(i), context + "." + key + "[" + i + "]"));
        }
        return entries;
    }

    static String string(Map<String, Object> node, String key) {
        Object value = node.get(key);
        return value == null ? null : scalar(value);
    }

    static String string(Map<String, Object> node, String key, String fallback) {
        String value = string(node, key);
        return value == null ? fallback : value;
    }

    /** First present key among {@code keys}. */
    static String firstString(Map<String, Object> node, String... keys) {
        for (String key : keys) {
            String value = string(node, key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    static String requireString(Map<String, Object> node, String key, String context) {
        String value = string(node, key);
        if (value == null || value.isBlank()) {
            throw ConfigurationException.structural(context + " is missing '" + key + "'");
        }
        return value.trim();
    }

    static boolean bool(Map<String, Object> node, String key, boolean fallback, String context) {
        Object value = node.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        return switch (scalar(value).trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes" -> true;
            case "false", "no" -> false;
            default -> throw ConfigurationException.structural(context + "." + key + " must be true or false");
        };
    }

    static int integer(Map<String, Object> node, String key, int fallback, String context) {
        Object value = node.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(scalar(value).trim());
        } catch (NumberFormatException ex) {
            throw ConfigurationException.structural(context + "." + key + " must be an integer, got '" + value + "'");
        }
    }

    /**
     * Tags given as a whitespace separated string or as a list; {@code null} when absent.
     */
    static Set<String> tags(Map<String, Object> node, String key) {
        Object value = node.get(key);
        if (value == null) {
            return null;
        }
        var tags = new LinkedHashSet<String>();
        for (String item : stringItems(value)) {
            for (String tag : item.trim().split("\\s+")) {
                if (!tag.isEmpty()) {
                    tags.add(tag);
                }
            }
        }
        return tags;
    }

    /** A scalar or a list of scalars as strings. */
    static List<String> stringItems(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            var items = new ArrayList<String>();
            for (Object item : list) {
                if (item != null) {
                    items.add(scalar(item));
                }
            }
            return items;
        }
        return List.of(scalar(value));
    }

    static String scalar(Object value) {
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            var decimal = new BigDecimal(value.toString());
            return decimal.signum() == 0 ? "0" : decimal.stripTrailingZeros().toPlainString();
        }
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            throw ConfigurationException.structural("expected a scalar value, got " + value);
        }
        return String.valueOf(value);
    }
}
