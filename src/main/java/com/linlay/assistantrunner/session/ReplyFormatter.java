package com.linlay.assistantrunner.session;

import com.linlay.assistantrunner.config.ReplyFormatProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.HtmlUtils;

import java.nio.charset.StandardCharsets;

import java.util.regex.Pattern;

/**
 * Post-processes assistant text before it is handed to the chat transport.
 */
@Component
public class ReplyFormatter {

    private static final Pattern ANNOTATION_PATTERN = Pattern.compile("【.*?】");
    private static final Pattern BOLD_PATTERN = Pattern.compile("\\*\\*(.*?)\\*\\*");
    private static final Pattern LINK_PATTERN = Pattern.compile("\\[(.*?)\\]\\((.*?)\\)");

    private final ReplyFormatProperties properties;

    public ReplyFormatter(ReplyFormatProperties properties) {
        this.properties = properties;
    }

    /**
     * @return formatted text, or the configured fallback when there is nothing to show
     */
    public String format(String raw) {
        if (!StringUtils.hasText(raw)) {
            return properties.getFallbackText();
        }
        String text = raw;
        if (properties.isStripAnnotations()) {
            // file-search citation markers
            text = ANNOTATION_PATTERN.matcher(text).replaceAll("");
        }
        if (properties.isHtmlFormat()) {
            text = HtmlUtils.htmlEscape(text, StandardCharsets.UTF_8.name());
            text = BOLD_PATTERN.matcher(text).replaceAll("<b>$1</b>");
            text = LINK_PATTERN.matcher(text).replaceAll("<a href=\"$2\">$1</a>");
        }
        return StringUtils.hasText(text) ? text : properties.getFallbackText();
    }
}
