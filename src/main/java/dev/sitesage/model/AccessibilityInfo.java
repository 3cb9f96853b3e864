package dev.sitesage.model;

public record AccessibilityInfo(boolean hasLang, String lang, int missingLabelsCount) {
}
