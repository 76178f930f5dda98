package com.paxkun.magpie.service.discovery;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * One way of pulling raw image URL candidates out of a rendered chapter view.
 * Strategies are pure: same document in, same candidates out.
 *
 * @param description shown in logs
 * @param extractor   candidate URLs in document order, not yet normalized
 */
public record ExtractionStrategy(String description, Function<Document, List<String>> extractor) {

    public List<String> candidates(Document document) {
        return extractor.apply(document);
    }

    /**
     * Reads {@code attribute} from every element matching {@code selector}.
     */
    public static ExtractionStrategy attribute(String selector, String attribute) {
        return new ExtractionStrategy(selector + " @" + attribute, document -> {
            List<String> values = new ArrayList<>();
            for (Element element : document.select(selector)) {
                String value = element.attr(attribute);
                if (!value.isBlank()) {
                    values.add(value);
                }
            }
            return values;
        });
    }

    /**
     * Takes the first URL of every {@code srcset} list on matching elements.
     */
    public static ExtractionStrategy srcset(String selector) {
        return new ExtractionStrategy(selector + " @srcset", document -> {
            List<String> values = new ArrayList<>();
            for (Element element : document.select(selector)) {
                String srcset = element.attr("srcset").strip();
                if (srcset.isEmpty()) {
                    continue;
                }
                String firstCandidate = srcset.split(",")[0].strip();
                String url = firstCandidate.split("\\s+")[0];
                if (!url.isEmpty()) {
                    values.add(url);
                }
            }
            return values;
        });
    }

    /**
     * Like {@link #attribute} for sites that store the image URL percent-encoded in a data attribute.
     */
    public static ExtractionStrategy encodedAttribute(String selector, String attribute) {
        ExtractionStrategy raw = attribute(selector, attribute);
        return new ExtractionStrategy(raw.description() + " (encoded)", document -> {
            List<String> decoded = new ArrayList<>();
            for (String value : raw.candidates(document)) {
                try {
                    decoded.add(UriUtils.decode(value, StandardCharsets.UTF_8));
                } catch (IllegalArgumentException e) {
                    decoded.add(value);
                }
            }
            return decoded;
        });
    }
}
