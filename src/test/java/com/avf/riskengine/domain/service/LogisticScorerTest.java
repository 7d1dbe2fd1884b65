package com.avf.riskengine.domain.service;

import com.avf.riskengine.domain.exception.FeatureShapeException;
import com.avf.riskengine.domain.model.ModelParams;
import com.avf.riskengine.domain.model.ScaledFeatureVector;
import com.avf.riskengine.support.TestArtifacts;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LogisticScorerTest {

    private final LogisticScorer scorer = new LogisticScorer();

    @Test
    void sigmoidOfZeroIsOneHalf() {
        assertThat(LogisticScorer.sigmoid(0.0)).isEqualTo(0.5);
    }

    @Test
    void sigmoidStaysFiniteForExtremeScores() {
        assertThat(LogisticScorer.sigmoid(1000.0)).isEqualTo(1.0);
        assertThat(LogisticScorer.sigmoid(-1000.0)).isEqualTo(0.0);
        assertThat(LogisticScorer.sigmoid(-745.0)).isBetween(0.0, 1e-300);
    }

    @Test
    void sigmoidIsSymmetric() {
        for (double z : new double[]{0.1, 1.0, 3.7, 12.0}) {
            assertThat(LogisticScorer.sigmoid(z) + LogisticScorer.sigmoid(-z)).isCloseTo(1.0, within(1e-12));
        }
    }

    @Test
    void linearPredictorIsInterceptPlusDotProduct() {
        double[] values = new double[21];
        values[0] = 2.0;
        values[4] = -1.0;
        ScaledFeatureVector scaled = new ScaledFeatureVector(TestArtifacts.identityScaler().getFeatureNames(), values);

        double z = scorer.linearPredictor(scaled, TestArtifacts.uniformModel(0.5, -0.25));

        assertThat(z).isCloseTo(-0.25 + 0.5 * 2.0 - 0.5 * 1.0, within(1e-12));
        assertThat(scorer.score(scaled, TestArtifacts.uniformModel(0.5, -0.25)))
                .isCloseTo(LogisticScorer.sigmoid(z), within(1e-15));
    }

    @Test
    void probabilityNeverDecreasesWhenPositiveCoefficientFeatureGrows() {
        double[] coefficients = new double[21];
        coefficients[0] = 0.8;
        coefficients[3] = -0.4;
        ModelParams model = new ModelParams(TestArtifacts.identityScaler().getFeatureNames(), coefficients, -1.0);

        double previous = -1.0;
        for (double x = -6.0; x <= 6.0; x += 0.25) {
            double[] values = new double[21];
            values[0] = x;
            values[3] = 1.3;
            double p = scorer.score(new ScaledFeatureVector(model.getFeatureNames(), values), model);
            assertThat(p).isBetween(0.0, 1.0).isGreaterThanOrEqualTo(previous);
            previous = p;
        }
    }

    @Test
    void mismatchedModelLengthIsRejected() {
        ScaledFeatureVector shortVector = new ScaledFeatureVector(List.of("log_MLR", "log_CRP"), new double[]{1.0, 2.0});

        assertThatThrownBy(() -> scorer.score(shortVector, TestArtifacts.uniformModel(0.1, 0.0)))
                .isInstanceOf(FeatureShapeException.class);
    }
}
