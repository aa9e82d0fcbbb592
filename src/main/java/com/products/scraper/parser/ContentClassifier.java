package com.products.scraper.parser;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword based product category detection and tag extraction.
 */
@Component
public class ContentClassifier {

    public static final int MAX_TAGS = 15;

    private static final int MAX_FREQUENT_WORDS = 10;

    private static final Map<String, List<String>> CATEGORY_KEYWORDS = new LinkedHashMap<>();

    static {
        CATEGORY_KEYWORDS.put("template", List.of("template", "design", "layout"));
        CATEGORY_KEYWORDS.put("course", List.of("course", "tutorial", "lesson", "learn"));
        CATEGORY_KEYWORDS.put("ebook", List.of("ebook", "book", "pdf", "guide"));
        CATEGORY_KEYWORDS.put("software", List.of("software", "app", "tool", "program"));
        CATEGORY_KEYWORDS.put("graphics", List.of("graphic", "image", "vector", "illustration"));
        CATEGORY_KEYWORDS.put("font", List.of("font", "typeface", "typography"));
        CATEGORY_KEYWORDS.put("music", List.of("music", "audio", "sound", "track"));
        CATEGORY_KEYWORDS.put("video", List.of("video", "movie", "film", "animation"));
    }

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "but", "for", "with", "are", "was", "were", "been", "have",
            "has", "had", "does", "did", "will", "would", "could", "should", "this",
            "that", "these", "those", "you", "your", "our", "they", "from", "into",
            "more", "than", "then", "them", "what", "when", "which", "about", "also", "just");

    private static final Pattern HASHTAG = Pattern.compile("(?<![\\w#])#(\\w{2,})");

    private static final Pattern WORD = Pattern.compile("\\b[a-z]{4,}\\b");

    /**
     * First keyword group found in the text, in declaration order.
     *
     * @param text     page text
     * @param fallback returned when no group matches, typically the source's default category
     */
    public String detectCategory(final String text, final String fallback) {
        if (StringUtils.isNotBlank(text)) {
            String lower = text.toLowerCase(Locale.ROOT);
            for (Map.Entry<String, List<String>> group : CATEGORY_KEYWORDS.entrySet()) {
                if (group.getValue().stream().anyMatch(lower::contains)) {
                    return group.getKey();
                }
            }
        }
        return fallback != null ? fallback : "digital-product";
    }

    /**
     * Hashtags in order of appearance followed by the most frequent meaningful words.
     */
    public List<String> extractTags(final String text) {
        Set<String> tags = new LinkedHashSet<>();
        if (StringUtils.isBlank(text)) {
            return new ArrayList<>(tags);
        }
        Matcher hashtags = HASHTAG.matcher(text);
        while (hashtags.find()) {
            tags.add(hashtags.group(1));
        }

        Map<String, Integer> frequency = new HashMap<>();
        Matcher words = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (words.find()) {
            String word = words.group();
            if (!STOP_WORDS.contains(word)) {
                frequency.merge(word, 1, Integer::sum);
            }
        }
        frequency.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(MAX_FREQUENT_WORDS)
                .forEach(e -> tags.add(e.getKey()));

        return tags.stream().limit(MAX_TAGS).toList();
    }
}
