package dev.sitesage.model;

/**
 * One image element found on a page.
 *
 * @param src    resolved source URL, or the raw attribute when it cannot be resolved
 * @param alt    raw alt attribute, null when absent
 * @param hasAlt true when alt is present and not blank
 */
public record ImageInfo(String src, String alt, boolean hasAlt) {

    public static ImageInfo of(String src, String alt) {
        return new ImageInfo(src, alt, alt != null && !alt.isBlank());
    }
}
