package dev.sitesage.web;

/**
 * Body of {@code POST /api/v1/seo/analyze}.
 */
public record AnalyzeRequest(String url) {
}
