package com.avf.riskengine.domain.service;

import com.avf.riskengine.domain.exception.FeatureShapeException;
import com.avf.riskengine.domain.model.ModelParams;
import com.avf.riskengine.domain.model.ScaledFeatureVector;
import org.springframework.stereotype.Component;

@Component
public class LogisticScorer {

    static final String STAGE = "scorer";

    public double score(ScaledFeatureVector scaled, ModelParams model) {
        return sigmoid(linearPredictor(scaled, model));
    }

    public double linearPredictor(ScaledFeatureVector scaled, ModelParams model) {
        if (scaled.size() != model.size()) {
            throw FeatureShapeException.lengthMismatch(STAGE, scaled.size(), model.size());
        }
        double z = model.getIntercept();
        for (int i = 0; i < scaled.size(); i++) {
            z += model.coefficient(i) * scaled.value(i);
        }
        return z;
    }

    public static double sigmoid(double z) {
        if (z >= 0) {
            return 1.0 / (1.0 + Math.exp(-z));
        }
        double e = Math.exp(z);
        return e / (1.0 + e);
    }
}
