package com.paxkun.magpie.service.discovery;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

import java.net.MalformedURLException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Recovers the page image URLs of a rendered chapter view.
 * <p>
 * Strategies run in order and the first one yielding anything wins. Each candidate is
 * cut at its query string, percent-decoded, made absolute against the page URL and
 * deduplicated keeping first occurrence. An empty result is not an error here.
 * <p>
 * Author: Pax
 */
@Slf4j
@Component
public class ImageUrlExtractor {

    public static final List<ExtractionStrategy> DEFAULT_CHAIN = List.of(
            ExtractionStrategy.attribute("div#comics-pics img[src]", "src"),
            ExtractionStrategy.attribute("img[data-src]", "data-src"),
            ExtractionStrategy.srcset("source[srcset]"));

    private static final Pattern ABSOLUTE_URL = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://.*");

    public List<String> extract(String markup, String baseUrl, List<ExtractionStrategy> chain) {
        Document document = Jsoup.parse(markup == null ? "" : markup, baseUrl == null ? "" : baseUrl);

        for (ExtractionStrategy strategy : chain) {
            List<String> candidates;
            try {
                candidates = strategy.candidates(document);
            } catch (RuntimeException e) {
                log.warn("Image extraction failed with {}: {}", strategy.description(), e.getMessage());
                continue;
            }

            Set<String> unique = new LinkedHashSet<>();
            for (String candidate : candidates) {
                String normalized = normalize(candidate, baseUrl);
                if (normalized != null) {
                    unique.add(normalized);
                }
            }

            if (!unique.isEmpty()) {
                log.info("Extracted {} image URLs with {}", unique.size(), strategy.description());
                return new ArrayList<>(unique);
            }
            log.debug("No images matched {}", strategy.description());
        }
        return List.of();
    }

    /**
     * @return the absolute, query-free, decoded URL, or null when the candidate is unusable
     */
    static String normalize(String candidate, String baseUrl) {
        if (candidate == null) {
            return null;
        }
        String url = candidate.strip();
        int query = url.indexOf('?');
        if (query >= 0) {
            url = url.substring(0, query);
        }
        if (url.isEmpty() || url.toLowerCase(Locale.ROOT).startsWith("data:")) {
            return null;
        }

        try {
            url = UriUtils.decode(url, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.debug("Keeping undecodable URL as-is: {}", url);
        }

        if (url.startsWith("//")) {
            return schemeOf(baseUrl) + ":" + url;
        }
        if (ABSOLUTE_URL.matcher(url).matches()) {
            return url;
        }
        try {
            return new URL(new URL(baseUrl), url).toString();
        } catch (MalformedURLException e) {
            log.warn("Dropping image URL {} that cannot be resolved against {}", url, baseUrl);
            return null;
        }
    }

    private static String schemeOf(String baseUrl) {
        try {
            return new URL(baseUrl).getProtocol();
        } catch (MalformedURLException e) {
            return "https";
        }
    }
}
