package com.products.scraper.model;

/**
 * Raw content returned by the fetch service for one URL. Never retained after extraction.
 *
 * @param markdown main content rendered as markdown, may be empty
 * @param html     main content as HTML, may be empty
 * @param metadata page metadata, never {@code null}
 */
public record FetchedContent(String markdown, String html, PageMetadata metadata) {

    public FetchedContent {
        markdown = markdown == null ? "" : markdown;
        html = html == null ? "" : html;
        metadata = metadata == null ? PageMetadata.empty() : metadata;
    }
}
