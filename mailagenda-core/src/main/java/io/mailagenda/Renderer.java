package io.mailagenda;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns a template (literal text or a reference the implementation resolves) and a variable
 * mapping into content.
 */
public interface Renderer {

    /**
     * @throws io.mailagenda.core.RenderException on a missing variable or a malformed template
     */
    String render(String template, Map<String, String> variables);

    /**
     * Variable names the template requires. Used to reject a job before it is created.
     *
     * @throws io.mailagenda.core.RenderException if the template is malformed
     */
    Set<String> requiredVariables(String template);

    /**
     * Whether rendered content should be sent as HTML.
     */
    default boolean isHtml(String renderedContent) {
        if (renderedContent == null) {
            return false;
        }
        String s = renderedContent.trim().toLowerCase(Locale.ROOT);
        return s.startsWith("<!doctype html") || s.startsWith("<html") || s.contains("<body")
                || s.contains("<p>") || s.contains("<br");
    }
}
