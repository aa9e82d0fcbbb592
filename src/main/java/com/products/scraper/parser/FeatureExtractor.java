package com.products.scraper.parser;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the first bullet list out of markdown.
 *
 * <p>Accepts {@code -}, {@code *}, {@code +} and numbered items, wherever the list sits.
 * Collection stops at the first blank line, heading or non-list line after the list
 * started, or when the cap is reached. Item text is kept verbatim apart from trimming.</p>
 */
@Component
public class FeatureExtractor {

    public static final int DEFAULT_MAX_ITEMS = 20;

    private static final Pattern LIST_ITEM = Pattern.compile("^\\s*(?:[-*+]|\\d{1,3}[.)])\\s+(.*)$");

    private static final Pattern HEADING = Pattern.compile("^\\s{0,3}#{1,6}(?:\\s|$)");

    public List<String> extract(final String markdown) {
        return extract(markdown, DEFAULT_MAX_ITEMS);
    }

    /**
     * @param markdown page markdown, may be {@code null}
     * @param maxItems upper bound of returned items
     * @return list items in document order; empty when the markdown has no list
     */
    public List<String> extract(final String markdown, final int maxItems) {
        List<String> items = new ArrayList<>();
        if (StringUtils.isBlank(markdown)) {
            return items;
        }
        boolean inList = false;
        for (String line : markdown.split("\\R")) {
            Matcher item = LIST_ITEM.matcher(line);
            boolean isItem = item.matches() && !HEADING.matcher(line).find();
            if (!isItem) {
                if (inList) {
                    break;
                }
                continue;
            }
            inList = true;
            String text = item.group(1).trim();
            if (!text.isEmpty()) {
                items.add(text);
                if (items.size() >= maxItems) {
                    break;
                }
            }
        }
        return items;
    }
}
