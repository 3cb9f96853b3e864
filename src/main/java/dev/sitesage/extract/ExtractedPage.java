package dev.sitesage.extract;

import dev.sitesage.model.PageSignals;

import java.util.List;

/**
 * Extraction output: the page signals plus the external links that are candidates for probing.
 */
public record ExtractedPage(PageSignals signals, List<String> externalLinks) {

    public ExtractedPage {
        externalLinks = externalLinks == null ? List.of() : List.copyOf(externalLinks);
    }
}
