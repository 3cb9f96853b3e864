package dev.sitesage.web;

import java.util.List;

/**
 * Body of {@code POST /api/v1/seo/analyze/batch}.
 */
public record BatchAnalyzeRequest(List<String> urls) {
}
