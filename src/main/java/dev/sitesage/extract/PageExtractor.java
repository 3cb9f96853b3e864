package dev.sitesage.extract;

import dev.sitesage.fetch.FetchedPage;
import dev.sitesage.model.AccessibilityInfo;
import dev.sitesage.model.ImageInfo;
import dev.sitesage.model.PageSignals;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns raw markup into {@link PageSignals}. Pure function of its input: the jsoup parser repairs
 * malformed HTML and missing elements are reported as absent, never as errors.
 */
@Slf4j
@Component
public class PageExtractor {

    private static final Set<String> SELF_NAMED_INPUT_TYPES = Set.of("submit", "reset");

    /**
     * Extract signals from a fetched page, keeping its timing and byte size.
     */
    public ExtractedPage extract(FetchedPage page) {
        return extract(page.html(), page.url(), page.loadTimeSeconds(), page.htmlBytes());
    }

    /**
     * Extract signals from markup without fetch timing. The load time is reported as unknown.
     */
    public ExtractedPage extract(String html, String baseUrl) {
        String markup = html != null ? html : "";
        return extract(markup, baseUrl, null, (long) markup.getBytes(StandardCharsets.UTF_8).length);
    }

    private ExtractedPage extract(String html, String baseUrl, Double loadTimeSeconds, Long htmlBytes) {
        String base = baseUrl != null ? baseUrl : "";
        Document doc = Jsoup.parse(html != null ? html : "", base);

        List<Element> anchors = doc.select("a[href]");

        PageSignals signals = PageSignals.builder()
                .url(baseUrl)
                .title(extractTitle(doc))
                .metaDescription(extractMetaDescription(doc))
                .h1Tags(headingTexts(doc, "h1"))
                .h2Tags(headingTexts(doc, "h2"))
                .images(extractImages(doc))
                .brokenLinksCount(countBrokenFragments(doc, anchors, base))
                .accessibility(extractAccessibility(doc))
                .loadTimeSeconds(loadTimeSeconds)
                .htmlBytes(htmlBytes)
                .wordCount(countWords(doc))
                .linkCount(anchors.size())
                .build();

        List<String> externalLinks = externalLinks(anchors, base);

        log.debug("Extracted {}: {} h1, {} images ({} missing alt), {} external links",
                baseUrl, signals.h1Count(), signals.imageCount(), signals.missingAltTags(), externalLinks.size());

        return new ExtractedPage(signals, externalLinks);
    }

    private String extractTitle(Document doc) {
        Element title = doc.selectFirst("title");
        if (title == null) {
            return null;
        }
        String text = title.text().trim();
        return text.isEmpty() ? null : text;
    }

    private String extractMetaDescription(Document doc) {
        for (Element meta : doc.select("meta[name]")) {
            if (!"description".equalsIgnoreCase(meta.attr("name").trim())) {
                continue;
            }
            if (!meta.hasAttr("content")) {
                return null;
            }
            String content = meta.attr("content").trim();
            return content.isEmpty() ? null : content;
        }
        return null;
    }

    private List<String> headingTexts(Document doc, String tag) {
        // empty headings are kept: they are a content-quality signal
        return doc.select(tag).stream()
                .map(heading -> heading.text().trim())
                .toList();
    }

    private List<ImageInfo> extractImages(Document doc) {
        return doc.select("img").stream()
                .map(img -> {
                    String src = img.absUrl("src");
                    if (src.isEmpty()) {
                        src = img.attr("src").trim();
                    }
                    String alt = img.hasAttr("alt") ? img.attr("alt") : null;
                    return ImageInfo.of(src, alt);
                })
                .toList();
    }

    private AccessibilityInfo extractAccessibility(Document doc) {
        Element root = doc.selectFirst("html");
        String lang = root != null ? root.attr("lang").trim() : "";
        boolean hasLang = !lang.isEmpty();
        return new AccessibilityInfo(hasLang, hasLang ? lang : null, countMissingLabels(doc));
    }

    /**
     * Count form controls that have no accessible name.
     */
    private int countMissingLabels(Document doc) {
        Set<String> labelledIds = doc.select("label[for]").stream()
                .map(label -> label.attr("for").trim())
                .filter(id -> !id.isEmpty())
                .collect(Collectors.toSet());

        int missing = 0;
        for (Element control : doc.select("input, select, textarea, button")) {
            String type = control.attr("type").trim().toLowerCase(Locale.ROOT);
            if ("input".equals(control.normalName()) && "hidden".equals(type)) {
                continue;
            }
            if (!hasAccessibleName(control, type, labelledIds)) {
                missing++;
            }
        }
        return missing;
    }

    private boolean hasAccessibleName(Element control, String type, Set<String> labelledIds) {
        if (notBlank(control.attr("aria-label"))
                || notBlank(control.attr("aria-labelledby"))
                || notBlank(control.attr("title"))) {
            return true;
        }
        String id = control.id().trim();
        if (!id.isEmpty() && labelledIds.contains(id)) {
            return true;
        }
        if (isInsideLabel(control)) {
            return true;
        }

        if ("button".equals(control.normalName())) {
            return notBlank(control.text()) || control.select("img[alt]").stream()
                    .anyMatch(img -> notBlank(img.attr("alt")));
        }
        if ("input".equals(control.normalName())) {
            if (SELF_NAMED_INPUT_TYPES.contains(type)) {
                return true;
            }
            if ("button".equals(type)) {
                return notBlank(control.attr("value"));
            }
            if ("image".equals(type)) {
                return notBlank(control.attr("alt"));
            }
        }
        return false;
    }

    private boolean isInsideLabel(Element control) {
        for (Element parent : control.parents()) {
            if ("label".equals(parent.normalName())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Count same-document anchors whose fragment matches no element id or named anchor.
     */
    private int countBrokenFragments(Document doc, List<Element> anchors, String baseUrl) {
        Set<String> targets = new HashSet<>();
        doc.select("[id]").forEach(element -> targets.add(element.id()));
        doc.select("a[name]").forEach(element -> targets.add(element.attr("name")));

        String pageWithoutFragment = stripFragment(baseUrl);
        int broken = 0;
        for (Element anchor : anchors) {
            String fragment = sameDocumentFragment(anchor, pageWithoutFragment);
            if (fragment == null || fragment.isEmpty() || "top".equalsIgnoreCase(fragment)) {
                continue;
            }
            if (!targets.contains(fragment) && !targets.contains(decode(fragment))) {
                broken++;
            }
        }
        return broken;
    }

    private String sameDocumentFragment(Element anchor, String pageWithoutFragment) {
        String href = anchor.attr("href").trim();
        if (href.startsWith("#")) {
            return href.substring(1);
        }
        int hash = href.indexOf('#');
        if (hash < 0 || pageWithoutFragment.isEmpty()) {
            return null;
        }
        String absolute = anchor.absUrl("href");
        int absoluteHash = absolute.indexOf('#');
        if (absoluteHash < 0 || !absolute.substring(0, absoluteHash).equals(pageWithoutFragment)) {
            return null;
        }
        return absolute.substring(absoluteHash + 1);
    }

    /**
     * Distinct absolute http(s) links pointing at another host, in document order.
     */
    private List<String> externalLinks(List<Element> anchors, String baseUrl) {
        String pageHost = hostOf(baseUrl);
        Set<String> links = new LinkedHashSet<>();
        for (Element anchor : anchors) {
            String absolute = stripFragment(anchor.absUrl("href"));
            if (!absolute.startsWith("http://") && !absolute.startsWith("https://")) {
                continue;
            }
            String host = hostOf(absolute);
            if (host != null && !host.equalsIgnoreCase(pageHost)) {
                links.add(absolute);
            }
        }
        return List.copyOf(links);
    }

    private int countWords(Document doc) {
        Element body = doc.body();
        String text = body != null ? body.text().trim() : "";
        return text.isEmpty() ? 0 : text.split("\\s+").length;
    }

    private static String hostOf(String url) {
        try {
            return url == null || url.isEmpty() ? null : URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String stripFragment(String url) {
        int hash = url.indexOf('#');
        return hash < 0 ? url : url.substring(0, hash);
    }

    private static String decode(String fragment) {
        try {
            return URLDecoder.decode(fragment, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return fragment;
        }
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
