package work.btool.emit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Substitutes {@code {name}} placeholders. {@code {{} and {@code }}} stand for literal braces, so
 * shell code in templates doubles its braces. Unknown placeholders are an error.
 */
public final class TemplateRenderer {
    private TemplateRenderer() {}

    public static String render(String template, Map<String, ?> values) {
        StringBuilder builder = new StringBuilder();
        List<String> missing = new ArrayList<>();
        for (int i = 0; i < template.length(); i++) {
            char ch = template.charAt(i);
            if (ch == '{') {
                if (i + 1 < template.length() && template.charAt(i + 1) == '{') {
                    builder.append('{');
                    i += 1;
                    continue;
                }
                int close = template.indexOf('}', i + 1);
                if (close == -1) {
                    builder.append(template.substring(i));
                    break;
                }
                String token = template.substring(i + 1, close).trim();
                Object resolved = values.get(token);
                if (resolved == null) {
                    missing.add(token);
                } else {
                    builder.append(resolved);
                }
                i = close;
                continue;
            }
            if (ch == '}' && i + 1 < template.length() && template.charAt(i + 1) == '}') {
                builder.append('}');
                i += 1;
                continue;
            }
            builder.append(ch);
        }
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Unknown template placeholder(s): " + String.join(", ", missing));
        }
        return builder.toString();
    }
}
