package com.avf.riskengine.domain.service;

import com.avf.riskengine.domain.exception.FeatureShapeException;
import com.avf.riskengine.domain.model.Contribution;
import com.avf.riskengine.domain.model.ModelParams;
import com.avf.riskengine.domain.model.ScaledFeatureVector;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

@Component
public class ContributionExplainer {

    static final String STAGE = "explainer";

    private static final Comparator<Contribution> BY_MAGNITUDE_DESC =
            Comparator.comparingDouble((Contribution c) -> Math.abs(c.value())).reversed();

    public List<Contribution> explain(ScaledFeatureVector scaled, ModelParams model, Map<String, String> labelMap) {
        if (scaled.size() != model.size()) {
            throw FeatureShapeException.lengthMismatch(STAGE, scaled.size(), model.size());
        }

        List<Contribution> contributions = new ArrayList<>(scaled.size());
        for (int i = 0; i < scaled.size(); i++) {
            String feature = model.featureName(i);
            String label = labelMap.getOrDefault(feature, feature);
            contributions.add(new Contribution(feature, label, model.coefficient(i) * scaled.value(i)));
        }

        contributions.sort(BY_MAGNITUDE_DESC);
        return List.copyOf(contributions);
    }
}
