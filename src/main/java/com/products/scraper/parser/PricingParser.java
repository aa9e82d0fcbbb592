package com.products.scraper.parser;

import com.products.scraper.model.BillingInterval;
import com.products.scraper.model.Pricing;
import com.products.scraper.model.PricingType;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic price reader for free text.
 *
 * <p>Looks for a currency symbol or ISO code next to a number, or for the word
 * "free", and commits to whichever comes first in the text. Pages listing several
 * plans therefore report the first plan only.</p>
 *
 * <p>Separators: the last {@code .} or {@code ,} counts as the decimal point when exactly
 * two digits follow it, every other separator groups thousands. {@code 1.299,00} and
 * {@code 1,299.00} both read as 1299.00, {@code 49,99} as 49.99.</p>
 */
@Component
public class PricingParser {

    /** Currency symbols and their ISO codes. Add entries here to support more symbols. */
    private static final Map<String, String> SYMBOLS = new LinkedHashMap<>();

    static {
        SYMBOLS.put("$", "USD");
        SYMBOLS.put("€", "EUR");
        SYMBOLS.put("£", "GBP");
        SYMBOLS.put("¥", "JPY");
        SYMBOLS.put("₹", "INR");
    }

    private static final String CODES = "USD|EUR|GBP|JPY|INR|CAD|AUD|CHF|CNY|SEK|NOK|DKK|PLN|BRL|MXN";

    private static final String NUMBER = "\\d+(?:[.,]\\d+)*";

    private static final String SYMBOL_CLASS = "[$€£¥₹]";

    private static final Pattern PRICE = Pattern.compile(
            "(?<sym>" + SYMBOL_CLASS + ")\\s?(?<n1>" + NUMBER + ")"
                    + "|\\b(?<pre>" + CODES + ")\\s?(?<n2>" + NUMBER + ")"
                    + "|(?<n3>" + NUMBER + ")\\s?(?:(?<post>" + CODES + ")\\b|(?<sym2>" + SYMBOL_CLASS + ")(?!\\s?\\d))");

    private static final Pattern FREE = Pattern.compile("\\bfree\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern MONTHLY = Pattern.compile(
            "/\\s*(?:mo|mth|month)\\b|\\bper\\s+(?:mo|month)\\b|\\ba\\s+month\\b|\\bmonthly\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern YEARLY = Pattern.compile(
            "/\\s*(?:yr|year|annum)\\b|\\bper\\s+(?:yr|year|annum)\\b|\\ba\\s+year\\b|\\byearly\\b|\\bannually\\b",
            Pattern.CASE_INSENSITIVE);

    /** how far past the amount an interval marker may appear */
    private static final int INTERVAL_WINDOW = 40;

    /**
     * Reads the first price-like token of the text.
     *
     * @param text markdown, HTML text or a selector's text; may be {@code null}
     * @return the parsed pricing, empty when the text holds no price and no "free"
     */
    public Optional<Pricing> parse(final String text) {
        if (StringUtils.isBlank(text)) {
            return Optional.empty();
        }
        Matcher price = PRICE.matcher(text);
        boolean hasPrice = price.find();
        Matcher free = FREE.matcher(text);
        boolean hasFree = free.find();

        if (hasFree && (!hasPrice || free.start() < price.start())) {
            return Optional.of(Pricing.free());
        }
        if (!hasPrice) {
            return Optional.empty();
        }

        String number = firstNonNull(price.group("n1"), price.group("n2"), price.group("n3"));
        String currency = currencyOf(price);
        BigDecimal amount = parseAmount(number);
        int start = price.start();
        int end = price.end();
        int nextPrice = price.find() ? price.start() : text.length();
        BillingInterval interval = detectInterval(text, start, end, nextPrice);

        if (interval == null) {
            return Optional.of(new Pricing(amount, currency, PricingType.ONE_TIME, null));
        }
        return Optional.of(new Pricing(amount, currency, PricingType.SUBSCRIPTION, interval));
    }

    /**
     * Applies the separator rule to a digit string such as {@code 1,299.99}.
     */
    static BigDecimal parseAmount(final String raw) {
        String[] groups = raw.split("[.,]");
        if (groups.length > 1 && groups[groups.length - 1].length() == 2) {
            StringBuilder integer = new StringBuilder();
            for (int i = 0; i < groups.length - 1; i++) {
                integer.append(groups[i]);
            }
            return new BigDecimal(integer + "." + groups[groups.length - 1]);
        }
        return new BigDecimal(String.join("", groups));
    }

    private static String currencyOf(final Matcher m) {
        String symbol = firstNonNull(m.group("sym"), m.group("sym2"));
        if (symbol != null) {
            return SYMBOLS.get(symbol);
        }
        return firstNonNull(m.group("pre"), m.group("post")).toUpperCase(Locale.ROOT);
    }

    /**
     * Looks for an interval marker right after the amount, then anywhere on the same line.
     * Neither search reaches past the next price token, whose markers belong to that price.
     */
    private static BillingInterval detectInterval(final String text, final int start, final int end,
                                                  final int nextPrice) {
        int lineEnd = text.indexOf('\n', end);
        lineEnd = Math.min(lineEnd < 0 ? text.length() : lineEnd, nextPrice);
        String after = text.substring(end, Math.min(lineEnd, end + INTERVAL_WINDOW));
        BillingInterval interval = earliestInterval(after);
        if (interval != null) {
            return interval;
        }
        int lineStart = text.lastIndexOf('\n', start) + 1;
        return earliestInterval(text.substring(lineStart, lineEnd));
    }

    private static BillingInterval earliestInterval(final String window) {
        Matcher monthly = MONTHLY.matcher(window);
        Matcher yearly = YEARLY.matcher(window);
        int m = monthly.find() ? monthly.start() : Integer.MAX_VALUE;
        int y = yearly.find() ? yearly.start() : Integer.MAX_VALUE;
        if (m == Integer.MAX_VALUE && y == Integer.MAX_VALUE) {
            return null;
        }
        return m <= y ? BillingInterval.MONTHLY : BillingInterval.YEARLY;
    }

    private static String firstNonNull(final String... values) {
        for (String v : values) {
            if (v != null) {
                return v;
            }
        }
        return null;
    }
}
