package dev.sitesage.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;

/**
 * Structured facts extracted from a page's markup, before scoring.
 * Counts are always derived from the underlying sequences.
 */
@Builder(toBuilder = true)
public record PageSignals(
        String url,
        String title,
        String metaDescription,
        List<String> h1Tags,
        List<String> h2Tags,
        List<ImageInfo> images,
        int brokenLinksCount,
        AccessibilityInfo accessibility,
        Double loadTimeSeconds,
        Long htmlBytes,
        int wordCount,
        int linkCount) {

    public PageSignals {
        h1Tags = h1Tags == null ? List.of() : List.copyOf(h1Tags);
        h2Tags = h2Tags == null ? List.of() : List.copyOf(h2Tags);
        images = images == null ? List.of() : List.copyOf(images);
        accessibility = accessibility == null ? new AccessibilityInfo(false, null, 0) : accessibility;
        brokenLinksCount = Math.max(0, brokenLinksCount);
    }

    @JsonProperty
    public int missingAltTags() {
        return (int) images.stream().filter(image -> !image.hasAlt()).count();
    }

    @JsonProperty
    public int h1Count() {
        return h1Tags.size();
    }

    @JsonProperty
    public int h2Count() {
        return h2Tags.size();
    }

    @JsonProperty
    public int imageCount() {
        return images.size();
    }

    /**
     * True when both the load time and the byte size of the fetch are known.
     */
    public boolean hasTiming() {
        return loadTimeSeconds != null && htmlBytes != null;
    }

    public PageSignals withAdditionalBrokenLinks(int extra) {
        if (extra <= 0) {
            return this;
        }
        return toBuilder().brokenLinksCount(brokenLinksCount + extra).build();
    }
}
