package com.products.scraper.service.core;

import com.products.scraper.exception.ScrapingException;
import com.products.scraper.model.SourceDescriptor;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Validates URL strings and matches them against the {@link SourceRegistry}.
 */
@RequiredArgsConstructor
public class UrlClassifier {

    private static final Set<String> SCHEMES = Set.of("http", "https");

    private final SourceRegistry registry;

    /**
     * Parses a URL string. Only absolute http(s) URLs with a host are accepted.
     * <p>
     * Parsing is lenient about characters browsers tolerate, such as unencoded spaces in the
     * path or query and underscores in subdomains; the host itself must not contain whitespace.
     * </p>
     *
     * @param url raw input, may be {@code null}
     * @return the lower-cased host, empty when the input is not a usable URL
     */
    public Optional<String> parseHost(final String url) {
        if (StringUtils.isBlank(url)) {
            return Optional.empty();
        }
        try {
            UriComponents uri = UriComponentsBuilder.fromUriString(url.trim()).build();
            String scheme = uri.getScheme();
            String host = uri.getHost();
            if (scheme == null || !SCHEMES.contains(scheme.toLowerCase(Locale.ROOT))
                    || StringUtils.isBlank(host) || StringUtils.containsWhitespace(host)) {
                return Optional.empty();
            }
            return Optional.of(host.toLowerCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    /**
     * Never throws; malformed input is simply unsupported.
     */
    public boolean isSupported(final String url) {
        return parseHost(url).flatMap(registry::findByHost).isPresent();
    }

    /**
     * Resolves the source of a URL.
     *
     * @throws ScrapingException with {@code INVALID_URL} or {@code UNSUPPORTED_DOMAIN}
     */
    public SourceDescriptor classify(final String url) {
        String host = parseHost(url).orElseThrow(ScrapingException::invalidUrl);
        return registry.findByHost(host)
                .orElseThrow(() -> ScrapingException.unsupportedDomain(host));
    }
}
