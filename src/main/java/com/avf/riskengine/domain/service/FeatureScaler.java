package com.avf.riskengine.domain.service;

import com.avf.riskengine.domain.exception.FeatureShapeException;
import com.avf.riskengine.domain.model.FeatureVector;
import com.avf.riskengine.domain.model.ScaledFeatureVector;
import com.avf.riskengine.domain.model.ScalerParams;
import org.springframework.stereotype.Component;

@Component
public class FeatureScaler {

    static final String STAGE = "scaler";

    public ScaledFeatureVector standardize(FeatureVector features, ScalerParams params) {
        if (features.size() != params.size()) {
            throw FeatureShapeException.lengthMismatch(STAGE, features.size(), params.size());
        }

        double[] scaled = new double[features.size()];
        for (int i = 0; i < features.size(); i++) {
            if (!features.name(i).equals(params.featureName(i))) {
                throw FeatureShapeException.nameMismatch(STAGE, i, features.name(i), params.featureName(i));
            }
            scaled[i] = (features.value(i) - params.mean(i)) / params.scale(i);
        }
        return new ScaledFeatureVector(features.getNames(), scaled);
    }
}
