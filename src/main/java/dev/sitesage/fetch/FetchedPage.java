package dev.sitesage.fetch;

/**
 * Raw markup of one page together with how long it took to download.
 *
 * @param url             the requested URL
 * @param statusCode      final HTTP status
 * @param html            decoded body
 * @param loadTimeSeconds request start to full body receipt, two decimals
 * @param htmlBytes       raw body size in bytes
 */
public record FetchedPage(String url, int statusCode, String html, double loadTimeSeconds, long htmlBytes) {
}
