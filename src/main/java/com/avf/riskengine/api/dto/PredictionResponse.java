package com.avf.riskengine.api.dto;

import com.avf.riskengine.domain.model.Contribution;
import com.avf.riskengine.domain.model.PredictionResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictionResponse {

    private double probability;
    private RiskCategory riskCategory;
    private double linearPredictor;
    private double intercept;
    private List<ContributionItem> contributions;

    public static PredictionResponse from(PredictionResult result, Integer top) {
        List<ContributionItem> items = result.getContributions().stream()
                .limit(top != null ? top : Long.MAX_VALUE)
                .map(ContributionItem::from)
                .toList();

        return PredictionResponse.builder()
                .probability(result.getProbability())
                .riskCategory(RiskCategory.fromProbability(result.getProbability()))
                .linearPredictor(result.getLinearPredictor())
                .intercept(result.getIntercept())
                .contributions(items)
                .build();
    }

    public enum RiskCategory {
        LOW, MODERATE, HIGH;

        public static RiskCategory fromProbability(double probability) {
            if (probability < 0.2) return LOW;
            if (probability < 0.5) return MODERATE;
            return HIGH;
        }
    }

    public enum Effect {
        INCREASES_RISK, DECREASES_RISK
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ContributionItem {
        private String feature;
        private String label;
        private double contribution;
        private Effect effect;

        static ContributionItem from(Contribution contribution) {
            return ContributionItem.builder()
                    .feature(contribution.feature())
                    .label(contribution.label())
                    .contribution(contribution.value())
                    .effect(contribution.value() > 0 ? Effect.INCREASES_RISK : Effect.DECREASES_RISK)
                    .build();
        }
    }
}
