package com.flagship.account_pro.web;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.View;

import java.io.PrintWriter;
import java.util.Map;

/**
 * A view whose HTML was rendered up front by {@link PageRenderer}.
 */
public class HtmlView implements View {

    private static final String CONTENT_TYPE = MediaType.TEXT_HTML_VALUE + ";charset=UTF-8";

    private final String html;

    public HtmlView(String html) {
        this.html = html;
    }

    @Override
    public String getContentType() {
        return CONTENT_TYPE;
    }

    @Override
    public void render(Map<String, ?> model, HttpServletRequest request, HttpServletResponse response)
            throws Exception {
        response.setContentType(CONTENT_TYPE);
        try (PrintWriter out = response.getWriter()) {
            out.print(html);
        }
    }
}
