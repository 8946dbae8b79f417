package io.mailagenda.internal;

import io.mailagenda.Renderer;
import io.mailagenda.core.RenderException;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Default {@link Renderer}: substitutes {@code {{ name }}} placeholders in literal template text.
 *
 * <p>Names are case-sensitive identifiers. An unclosed <code>{{</code> or a placeholder that is
 * not an identifier is a syntax error.
 */
public class PlaceholderRenderer implements Renderer {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    @Override
    public String render(String template, Map<String, String> variables) {
        if (template == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(template.length() + 32);
        int pos = 0;
        while (true) {
            int open = template.indexOf("{{", pos);
            if (open < 0) {
                out.append(template, pos, template.length());
                return out.toString();
            }
            int close = template.indexOf("}}", open + 2);
            if (close < 0) {
                throw new RenderException(RenderException.Reason.SYNTAX_ERROR,
                        "Unclosed placeholder at offset " + open + ": make sure every {{ is closed with }}");
            }
            String name = placeholderName(template, open, close);
            String value = variables == null ? null : variables.get(name);
            if (value == null) {
                throw new RenderException(RenderException.Reason.MISSING_VARIABLE,
                        "Missing value for template variable '" + name + "'");
            }
            out.append(template, pos, open).append(value);
            pos = close + 2;
        }
    }

    @Override
    public Set<String> requiredVariables(String template) {
        Set<String> names = new LinkedHashSet<>();
        if (template == null) {
            return names;
        }
        int pos = 0;
        while (true) {
            int open = template.indexOf("{{", pos);
            if (open < 0) {
                return names;
            }
            int close = template.indexOf("}}", open + 2);
            if (close < 0) {
                throw new RenderException(RenderException.Reason.SYNTAX_ERROR,
                        "Unclosed placeholder at offset " + open + ": make sure every {{ is closed with }}");
            }
            names.add(placeholderName(template, open, close));
            pos = close + 2;
        }
    }

    private static String placeholderName(String template, int open, int close) {
        String name = template.substring(open + 2, close).trim();
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new RenderException(RenderException.Reason.SYNTAX_ERROR,
                    "Invalid placeholder '{{" + template.substring(open + 2, close) + "}}'");
        }
        return name;
    }
}
