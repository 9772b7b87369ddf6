package com.okazje.scanner.scan.model;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

public record PageContext(
    String url,
    Document document,
    String text
) {
    public static PageContext parse(String url, String html) {
        Document document = Jsoup.parse(html == null ? "" : html, url == null ? "" : url);
        return new PageContext(url, document, document.text());
    }
}
