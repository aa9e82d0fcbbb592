package com.products.scraper.parser;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads fields out of fetched HTML with <a href="https://jsoup.org/">JSoup</a> CSS selectors.
 *
 * <p>Selectors come from the source table and may list alternatives separated by commas;
 * the first alternative yielding non-blank text wins. A selector JSoup cannot parse is
 * logged and treated as matching nothing.</p>
 */
@Slf4j
@Component
public class HtmlSelectorParser {

    private static final Pattern MARKDOWN_IMAGE = Pattern.compile("!\\[[^\\]]*]\\(\\s*([^)\\s]+)");

    private static final List<String> IMAGE_NOISE = List.of("icon", "logo", "avatar", "sprite", "pixel");

    /**
     * @param html    fetched HTML, may be empty
     * @param baseUrl URL of the page, used to resolve relative links
     */
    public Document parse(final String html, final String baseUrl) {
        return Jsoup.parse(html == null ? "" : html, baseUrl);
    }

    /**
     * Text of the first element matched by any of the comma separated alternatives.
     */
    public Optional<String> selectText(final Document doc, final String selector) {
        if (StringUtils.isBlank(selector)) {
            return Optional.empty();
        }
        for (String alternative : selector.split(",")) {
            for (Element el : safeSelect(doc, alternative.trim())) {
                String text = normalize(el.text());
                if (!text.isEmpty()) {
                    return Optional.of(text);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Texts of all elements matched by the first alternative that matches anything.
     */
    public List<String> selectTexts(final Document doc, final String selector, final int max) {
        List<String> texts = new ArrayList<>();
        if (StringUtils.isBlank(selector)) {
            return texts;
        }
        for (String alternative : selector.split(",")) {
            for (Element el : safeSelect(doc, alternative.trim())) {
                String text = normalize(el.text());
                if (!text.isEmpty() && texts.size() < max) {
                    texts.add(text);
                }
            }
            if (!texts.isEmpty()) {
                break;
            }
        }
        return texts;
    }

    /**
     * Number of elements the selector matches, used for review counts.
     */
    public int count(final Document doc, final String selector) {
        if (StringUtils.isBlank(selector)) {
            return 0;
        }
        return safeSelect(doc, selector).size();
    }

    /**
     * Absolute image URLs: the source's image selector first, every {@code <img>} when it
     * finds nothing, then images referenced from the markdown. Icons and logos are
     * skipped, duplicates removed.
     */
    public List<String> images(final Document doc, final String selector, final String markdown, final int max) {
        Set<String> urls = new LinkedHashSet<>();
        if (StringUtils.isNotBlank(selector)) {
            collectImages(safeSelect(doc, imageSelector(selector)), urls, false);
        }
        if (urls.isEmpty()) {
            collectImages(safeSelect(doc, "img[src]"), urls, true);
        }
        if (StringUtils.isNotBlank(markdown)) {
            Matcher m = MARKDOWN_IMAGE.matcher(markdown);
            while (m.find()) {
                String resolved = resolve(doc.location(), m.group(1));
                if (resolved != null && !isNoise(resolved)) {
                    urls.add(resolved);
                }
            }
        }
        return urls.stream().limit(max).toList();
    }

    /** Visible text of the whole document with whitespace collapsed. */
    public String visibleText(final Document doc) {
        return normalize(doc.text());
    }

    private static void collectImages(final Elements elements, final Set<String> urls, final boolean skipNoise) {
        for (Element img : elements) {
            String src = img.absUrl("src");
            if (src.isEmpty()) {
                src = img.attr("src");
            }
            if (StringUtils.isNotBlank(src) && !(skipNoise && isNoise(src))) {
                urls.add(src);
            }
        }
    }

    /** Selectors such as {@code .gallery img} already point at images; others get a descendant img. */
    private static String imageSelector(final String selector) {
        List<String> parts = new ArrayList<>();
        for (String alternative : selector.split(",")) {
            String trimmed = alternative.trim();
            parts.add(trimmed.endsWith("img") || trimmed.contains("img[") ? trimmed : trimmed + " img");
        }
        return String.join(", ", parts);
    }

    private static boolean isNoise(final String src) {
        String lower = src.toLowerCase(Locale.ROOT);
        return IMAGE_NOISE.stream().anyMatch(lower::contains) || lower.startsWith("data:");
    }

    private static String resolve(final String base, final String href) {
        try {
            if (StringUtils.isBlank(base)) {
                return href.startsWith("http") ? href : null;
            }
            return URI.create(base).resolve(href).toString();
        } catch (IllegalArgumentException ex) {
            return href.startsWith("http") ? href : null;
        }
    }

    private Elements safeSelect(final Document doc, final String selector) {
        try {
            return doc.select(selector);
        } catch (Selector.SelectorParseException | IllegalArgumentException ex) {
            log.warn("Ignoring unparsable selector '{}': {}", selector, ex.getMessage());
            return new Elements();
        }
    }

    private static String normalize(final String text) {
        return StringUtils.normalizeSpace(text);
    }
}
