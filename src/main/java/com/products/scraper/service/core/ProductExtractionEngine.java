package com.products.scraper.service.core;

import com.products.scraper.config.ScraperProperties;
import com.products.scraper.model.FetchedContent;
import com.products.scraper.model.PageMetadata;
import com.products.scraper.model.Pricing;
import com.products.scraper.model.ProductExtract;
import com.products.scraper.model.ProductMetadata;
import com.products.scraper.model.ReviewInfo;
import com.products.scraper.model.ScrapingOptions;
import com.products.scraper.model.SourceDescriptor;
import com.products.scraper.parser.ContentClassifier;
import com.products.scraper.parser.FeatureExtractor;
import com.products.scraper.parser.HtmlSelectorParser;
import com.products.scraper.parser.PricingParser;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <h2>ProductExtractionEngine</h2>
 *
 * <p>Turns fetched page content of a known source into a {@link ProductExtract}.</p>
 *
 * <ul>
 *   <li><b>title</b>: page metadata, then the first level-one markdown heading, then the
 *       source's title selector.</li>
 *   <li><b>description</b>: page metadata, then the first plain markdown paragraph, then
 *       the source's description selector.</li>
 *   <li><b>pricing</b>: markdown, then the price selector's text, then the page text.</li>
 *   <li><b>features</b>: first markdown list, then the features selector.</li>
 * </ul>
 *
 * <p>Extraction never fails a scrape: missing fields stay empty and an unexpected
 * parsing error degrades to a minimal record.</p>
 */
@Slf4j
@Component
public class ProductExtractionEngine {

    static final String UNTITLED = "Untitled Product";

    static final String NO_DESCRIPTION = "No description available";

    static final String DEFAULT_LANGUAGE = "en";

    private static final Pattern H1 = Pattern.compile("(?m)^\\s{0,3}#\\s+(.+?)\\s*#*\\s*$");

    private static final Pattern BLOCK_SEPARATOR = Pattern.compile("\\R\\s*\\R");

    private static final Pattern NON_PARAGRAPH = Pattern.compile(
            "^(?:\\s{0,3}#|\\s*(?:[-*+]|\\d{1,3}[.)])\\s|\\s*!\\[|\\s*>|\\s*\\||\\s*(?:-{3,}|\\*{3,}|_{3,})\\s*$)");

    private static final Pattern CONTINUATION = Pattern.compile("^\\s+\\S");

    private static final Pattern RATING = Pattern.compile("(\\d+(?:\\.\\d+)?)");

    private final PricingParser pricingParser;

    private final FeatureExtractor featureExtractor;

    private final HtmlSelectorParser htmlParser;

    private final ContentClassifier classifier;

    private final ScraperProperties.Extraction limits;

    private final Clock clock;

    public ProductExtractionEngine(final PricingParser pricingParser,
                                   final FeatureExtractor featureExtractor,
                                   final HtmlSelectorParser htmlParser,
                                   final ContentClassifier classifier,
                                   final ScraperProperties props) {
        this(pricingParser, featureExtractor, htmlParser, classifier, props.getExtraction(), Clock.systemUTC());
    }

    ProductExtractionEngine(final PricingParser pricingParser,
                            final FeatureExtractor featureExtractor,
                            final HtmlSelectorParser htmlParser,
                            final ContentClassifier classifier,
                            final ScraperProperties.Extraction limits,
                            final Clock clock) {
        this.pricingParser = pricingParser;
        this.featureExtractor = featureExtractor;
        this.htmlParser = htmlParser;
        this.classifier = classifier;
        this.limits = limits;
        this.clock = clock;
    }

    /**
     * Builds the product record.
     *
     * @param content fetched page content
     * @param source  the source the URL was classified as
     * @param url     the scraped URL
     * @param options request switches deciding which optional parts are filled
     * @return the record; never {@code null}
     */
    public ProductExtract extract(final FetchedContent content,
                                  final SourceDescriptor source,
                                  final String url,
                                  final ScrapingOptions options) {
        try {
            return doExtract(content, source, url, options);
        } catch (RuntimeException ex) {
            log.warn("Extraction degraded for {}: {}", url, ex.toString());
            return fallback(content, source, url);
        }
    }

    private ProductExtract doExtract(final FetchedContent content,
                                     final SourceDescriptor source,
                                     final String url,
                                     final ScrapingOptions options) {
        String markdown = content.markdown();
        PageMetadata meta = content.metadata();
        Document doc = htmlParser.parse(content.html(), url);

        String title = firstPresent(
                clean(meta.title()),
                firstHeading(markdown),
                htmlParser.selectText(doc, source.selector("title")))
                .orElse(UNTITLED);

        String description = firstPresent(
                clean(meta.description()),
                firstParagraph(markdown),
                htmlParser.selectText(doc, source.selector("description")))
                .orElse(NO_DESCRIPTION);

        Pricing pricing = pricingParser.parse(markdown)
                .or(() -> htmlParser.selectText(doc, source.selector("price")).flatMap(pricingParser::parse))
                .or(() -> pricingParser.parse(htmlParser.visibleText(doc)))
                .orElseGet(Pricing::unknown);

        List<String> features = featureExtractor.extract(markdown, limits.getMaxFeatures());
        if (features.isEmpty()) {
            features = htmlParser.selectTexts(doc, source.selector("features"), limits.getMaxFeatures());
        }

        List<String> images = options.imagesWanted()
                ? htmlParser.images(doc, source.selector("images"), markdown, limits.getMaxImages())
                : null;

        String corpus = StringUtils.isNotBlank(markdown) ? markdown : htmlParser.visibleText(doc);
        String category = classifier.detectCategory(title + "\n" + description + "\n" + corpus,
                source.defaultCategory());

        ProductMetadata metadata = options.metadataWanted()
                ? new ProductMetadata(
                        StringUtils.defaultIfBlank(meta.language(), DEFAULT_LANGUAGE),
                        meta.title(),
                        meta.description(),
                        meta.ogImage(),
                        classifier.extractTags(corpus))
                : null;

        return ProductExtract.builder()
                .id(newProductId())
                .url(url)
                .source(source.displayName())
                .title(title)
                .description(description)
                .pricing(pricing)
                .features(features)
                .images(images)
                .category(category)
                .seller(htmlParser.selectText(doc, source.selector("seller")).orElse(null))
                .reviews(reviews(doc, source))
                .metadata(metadata)
                .content(options.contentWanted() ? corpus : null)
                .scrapedAt(Instant.now(clock))
                .build();
    }

    /** Mirrors the original degraded record: metadata or heading title, first long lines. */
    private ProductExtract fallback(final FetchedContent content, final SourceDescriptor source, final String url) {
        String title = clean(content.metadata().title())
                .or(() -> firstHeading(content.markdown()))
                .orElse(UNTITLED);
        String description = firstParagraph(content.markdown()).orElse(NO_DESCRIPTION);
        return ProductExtract.builder()
                .id(newProductId())
                .url(url)
                .source(source.displayName())
                .title(title)
                .description(description)
                .pricing(Pricing.unknown())
                .features(List.of())
                .category(source.defaultCategory())
                .scrapedAt(Instant.now(clock))
                .build();
    }

    private ReviewInfo reviews(final Document doc, final SourceDescriptor source) {
        Double rating = htmlParser.selectText(doc, source.selector("rating"))
                .map(RATING::matcher)
                .filter(Matcher::find)
                .map(m -> Double.valueOf(m.group(1)))
                .orElse(null);
        Integer total = source.selector("reviews") == null ? null
                : htmlParser.count(doc, source.selector("reviews"));
        if (rating == null && total == null) {
            return null;
        }
        return new ReviewInfo(rating, total);
    }

    static Optional<String> firstHeading(final String markdown) {
        if (StringUtils.isBlank(markdown)) {
            return Optional.empty();
        }
        Matcher m = H1.matcher(markdown);
        return m.find() ? clean(m.group(1)) : Optional.empty();
    }

    /**
     * First run of plain text lines. Headings, list items with their indented continuations,
     * quotes, tables, images and rules are dropped line by line, so a paragraph directly under
     * a heading still counts.
     */
    static Optional<String> firstParagraph(final String markdown) {
        if (StringUtils.isBlank(markdown)) {
            return Optional.empty();
        }
        for (String block : BLOCK_SEPARATOR.split(markdown.strip())) {
            Optional<String> text = clean(String.join(" ", plainLines(block)));
            if (text.isPresent()) {
                return text;
            }
        }
        return Optional.empty();
    }

    private static List<String> plainLines(final String block) {
        List<String> kept = new ArrayList<>();
        boolean afterStructure = false;
        for (String line : block.split("\\R")) {
            if (NON_PARAGRAPH.matcher(line).find()) {
                afterStructure = true;
                if (!kept.isEmpty()) {
                    break;
                }
                continue;
            }
            if (afterStructure && kept.isEmpty() && CONTINUATION.matcher(line).find()) {
                continue;
            }
            afterStructure = false;
            kept.add(line);
        }
        return kept;
    }

    private static Optional<String> clean(final String text) {
        String normalized = StringUtils.normalizeSpace(text);
        return StringUtils.isBlank(normalized) ? Optional.empty() : Optional.of(normalized);
    }

    @SafeVarargs
    private static Optional<String> firstPresent(final Optional<String>... candidates) {
        for (Optional<String> candidate : candidates) {
            if (candidate.isPresent()) {
                return candidate;
            }
        }
        return Optional.empty();
    }

    private static String newProductId() {
        return "prod_" + UUID.randomUUID();
    }
}
