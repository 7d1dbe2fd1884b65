package com.avf.riskengine.domain.service;

import com.avf.riskengine.domain.exception.FeatureShapeException;
import com.avf.riskengine.domain.model.FeatureVector;
import com.avf.riskengine.domain.model.ScaledFeatureVector;
import com.avf.riskengine.domain.model.ScalerParams;
import com.avf.riskengine.domain.model.TransformedInput;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FeatureScalerTest {

    private final FeatureScaler scaler = new FeatureScaler();
    private final FeatureVector features = new FeatureExpander().expand(new TransformedInput(0.3, 1.7, 0.9, 1.4, 2, 1));

    @Test
    void standardizesEachFeatureWithItsOwnMeanAndScale() {
        double[] mean = new double[21];
        double[] scale = new double[21];
        for (int i = 0; i < 21; i++) {
            mean[i] = 0.1 * i;
            scale[i] = 0.5 + i;
        }

        ScaledFeatureVector scaled = scaler.standardize(features, new ScalerParams(FeatureExpander.FEATURE_NAMES, mean, scale));

        for (int i = 0; i < 21; i++) {
            assertThat(scaled.value(i)).isCloseTo((features.value(i) - mean[i]) / scale[i], within(1e-12));
        }
        assertThat(scaled.getNames()).isEqualTo(features.getNames());
    }

    @Test
    void shorterScalerIsRejected() {
        List<String> names = FeatureExpander.FEATURE_NAMES.subList(0, 20);
        double[] scale = new double[20];
        Arrays.fill(scale, 1.0);
        ScalerParams stale = new ScalerParams(names, new double[20], scale);

        assertThatThrownBy(() -> scaler.standardize(features, stale))
                .isInstanceOf(FeatureShapeException.class)
                .hasMessageContaining("21")
                .hasMessageContaining("20");
    }

    @Test
    void longerScalerIsRejected() {
        List<String> names = new ArrayList<>(FeatureExpander.FEATURE_NAMES);
        names.add("log_ferritin");
        double[] scale = new double[22];
        Arrays.fill(scale, 1.0);
        ScalerParams stale = new ScalerParams(names, new double[22], scale);

        assertThatThrownBy(() -> scaler.standardize(features, stale))
                .isInstanceOf(FeatureShapeException.class);
    }

    @Test
    void permutedScalerOrderIsRejected() {
        List<String> names = new ArrayList<>(FeatureExpander.FEATURE_NAMES);
        Collections.swap(names, 0, 1);
        double[] scale = new double[21];
        Arrays.fill(scale, 1.0);
        ScalerParams permuted = new ScalerParams(names, new double[21], scale);

        assertThatThrownBy(() -> scaler.standardize(features, permuted))
                .isInstanceOf(FeatureShapeException.class)
                .hasMessageContaining("log_MLR");
    }
}
