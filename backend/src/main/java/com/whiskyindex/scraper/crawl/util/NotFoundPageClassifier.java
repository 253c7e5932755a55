package com.whiskyindex.scraper.crawl.util;

import java.util.regex.Pattern;

public final class NotFoundPageClassifier {
    private static final Pattern NOT_FOUND_TEXT = Pattern.compile("404|not found|page not found", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHISKY_IDENTIFIER = Pattern.compile("WB\\d+");

    private NotFoundPageClassifier() {
    }

    public static boolean hasComponentData(String html) {
        return html != null && (html.contains(":whisky=\"") || html.contains(":bottle=\""));
    }

    public static boolean isNotFoundPage(String html) {
        if (html == null || html.isBlank()) {
            return true;
        }
        if (hasComponentData(html)) {
            return false;
        }
        return NOT_FOUND_TEXT.matcher(html).find() || !WHISKY_IDENTIFIER.matcher(html).find();
    }
}
