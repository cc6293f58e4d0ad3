package com.flagship.account_pro.web;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fills classpath templates ({@code templates/<name>.html}) by replacing
 * {@code ${key}} placeholders, then wraps the result in the shared layout.
 *
 * Values are inserted verbatim; callers escape user data with {@link #escapeHtml(String)},
 * which also escapes {@code $} so user text can never form a placeholder.
 */
@Component
public class PageRenderer {

    private static final String TEMPLATE_LOCATION = "templates/%s.html";
    private static final String LAYOUT = "layout";

    private final Map<String, String> templates = new ConcurrentHashMap<>();

    /**
     * Renders {@code template} with {@code values} inside the layout, with
     * the given notices shown above the content.
     */
    public String render(String title, String template, Map<String, String> values, List<Notice> notices) {
        String content = fill(load(template), values);
        return fill(load(LAYOUT), Map.of(
            "title", escapeHtml(title),
            "notices", renderNotices(notices),
            "content", content
        ));
    }

    static String fill(String template, Map<String, String> values) {
        String rendered = template;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            rendered = rendered.replace("${" + entry.getKey() + "}", entry.getValue());
        }
        return rendered;
    }

    private String renderNotices(List<Notice> notices) {
        if (notices == null || notices.isEmpty()) {
            return "";
        }
        StringBuilder builder = new StringBuilder("<div class=\"notices\">");
        for (Notice notice : notices) {
            builder.append("<div class=\"notice notice-")
                    .append(notice.getCategory().name().toLowerCase())
                    .append("\">")
                    .append(escapeHtml(notice.getMessage()))
                    .append("</div>");
        }
        return builder.append("</div>").toString();
    }

    private String load(String name) {
        return templates.computeIfAbsent(name, key -> {
            String path = String.format(TEMPLATE_LOCATION, key);
            try (InputStream stream = new ClassPathResource(path).getInputStream()) {
                return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Template not found: " + path, e);
            }
        });
    }

    public static String escapeHtml(String input) {
        if (input == null) {
            return "";
        }
        return input.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&#39;")
                .replace("$", "&#36;");
    }
}
