package dev.sitesage.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageSignalsTest {

    @Test
    @DisplayName("Should derive counts from the underlying sequences")
    void shouldDeriveCounts() {
        PageSignals signals = PageSignals.builder()
                .url("https://example.com")
                .h1Tags(List.of("One", "Two"))
                .images(List.of(ImageInfo.of("a.png", "A"), ImageInfo.of("b.png", null), ImageInfo.of("c.png", " ")))
                .build();

        assertThat(signals.h1Count()).isEqualTo(2);
        assertThat(signals.h2Count()).isZero();
        assertThat(signals.imageCount()).isEqualTo(3);
        assertThat(signals.missingAltTags()).isEqualTo(2);
        assertThat(signals.accessibility().hasLang()).isFalse();
        assertThat(signals.hasTiming()).isFalse();
    }

    @Test
    @DisplayName("Should add broken links without mutating the original")
    void shouldAddBrokenLinks() {
        PageSignals signals = PageSignals.builder().url("https://example.com").brokenLinksCount(1).build();

        PageSignals updated = signals.withAdditionalBrokenLinks(2);

        assertThat(updated.brokenLinksCount()).isEqualTo(3);
        assertThat(signals.brokenLinksCount()).isEqualTo(1);
        assertThat(signals.withAdditionalBrokenLinks(0)).isSameAs(signals);
    }

    @Test
    @DisplayName("Should reject scores outside [0,100]")
    void shouldRejectOutOfRangeScores() {
        assertThatThrownBy(() -> new ScoreBreakdown(101, null, null, null, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ScoreBreakdown(50, Double.NaN, null, null, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Insights(" ", List.of(), Insights.InsightSource.RULES))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
