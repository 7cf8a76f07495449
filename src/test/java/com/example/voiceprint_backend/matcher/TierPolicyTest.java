package com.example.voiceprint_backend.matcher;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TierPolicyTest {

    private final TierPolicy policy = TierPolicy.defaults();

    @ParameterizedTest
    @CsvSource({
            "0.49, LOW",
            "0.4999, LOW",
            "0.50, MEDIUM",
            "0.74, MEDIUM",
            "0.7499, MEDIUM",
            "0.75, HIGH",
            "1.0, HIGH",
            "0.0, LOW"
    })
    void thresholdsAreInclusiveAtTheLowerBound(double score, ConfidenceTier expected) {
        assertThat(policy.classify(score)).isEqualTo(expected);
    }

    @Test
    void customThresholdsAreHonoured() {
        TierPolicy strict = new TierPolicy(0.9, 0.6);

        assertThat(strict.classify(0.89)).isEqualTo(ConfidenceTier.MEDIUM);
        assertThat(strict.classify(0.9)).isEqualTo(ConfidenceTier.HIGH);
        assertThat(strict.classify(0.59)).isEqualTo(ConfidenceTier.LOW);
    }

    @Test
    void rejectsMediumAboveHigh() {
        assertThatThrownBy(() -> new TierPolicy(0.5, 0.75))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
