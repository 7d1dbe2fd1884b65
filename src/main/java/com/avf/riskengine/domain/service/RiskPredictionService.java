package com.avf.riskengine.domain.service;

import com.avf.riskengine.domain.exception.AvfRiskException;
import com.avf.riskengine.domain.exception.FeatureShapeException;
import com.avf.riskengine.domain.model.Contribution;
import com.avf.riskengine.domain.model.FeatureVector;
import com.avf.riskengine.domain.model.ModelArtifacts;
import com.avf.riskengine.domain.model.ModelParams;
import com.avf.riskengine.domain.model.PatientInput;
import com.avf.riskengine.domain.model.PredictionResult;
import com.avf.riskengine.domain.model.ScaledFeatureVector;
import com.avf.riskengine.domain.model.TransformedInput;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class RiskPredictionService {

    private final ModelArtifacts artifacts;
    private final Preprocessor preprocessor;
    private final FeatureExpander featureExpander;
    private final FeatureScaler featureScaler;
    private final LogisticScorer logisticScorer;
    private final ContributionExplainer contributionExplainer;
    private final ExplainProperties explainProperties;

    private final MeterRegistry meterRegistry;
    private final Counter successCounter;
    private final Counter failureCounter;
    private final Timer predictionTimer;

    public RiskPredictionService(
            ModelArtifacts artifacts,
            Preprocessor preprocessor,
            FeatureExpander featureExpander,
            FeatureScaler featureScaler,
            LogisticScorer logisticScorer,
            ContributionExplainer contributionExplainer,
            ExplainProperties explainProperties,
            MeterRegistry meterRegistry) {
        this.artifacts = artifacts;
        this.preprocessor = preprocessor;
        this.featureExpander = featureExpander;
        this.featureScaler = featureScaler;
        this.logisticScorer = logisticScorer;
        this.contributionExplainer = contributionExplainer;
        this.explainProperties = explainProperties;
        this.meterRegistry = meterRegistry;
        this.successCounter = Counter.builder("avf.prediction.requests")
                .tag("outcome", "success")
                .description("AVF dysfunction predictions")
                .register(meterRegistry);
        this.failureCounter = Counter.builder("avf.prediction.requests")
                .tag("outcome", "failure")
                .description("AVF dysfunction predictions")
                .register(meterRegistry);
        this.predictionTimer = Timer.builder("avf.prediction.duration")
                .description("Scoring pipeline latency")
                .register(meterRegistry);
    }

    public PredictionResult predict(PatientInput input) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            ModelParams model = artifacts.getModel();

            TransformedInput transformed = preprocessor.preprocess(input, artifacts.getWinsorLimits());
            FeatureVector features = featureExpander.expand(transformed);
            ScaledFeatureVector scaled = featureScaler.standardize(features, artifacts.getScaler());

            double z = logisticScorer.linearPredictor(scaled, model);
            double probability = LogisticScorer.sigmoid(z);
            List<Contribution> contributions =
                    contributionExplainer.explain(scaled, model, explainProperties.getLabels());

            successCounter.increment();
            log.debug("[Predict] 예측 완료: input={}, z={}, p={}", input, z, probability);

            return PredictionResult.builder()
                    .probability(probability)
                    .linearPredictor(z)
                    .intercept(model.getIntercept())
                    .contributions(contributions)
                    .build();
        } catch (FeatureShapeException e) {
            failureCounter.increment();
            log.error("[Predict] 피처 정렬 불일치, 아티팩트 조합 확인 필요 (artifactDir={}): {}",
                    artifacts.getSourceDirectory(), e.getMessage(), e);
            throw e;
        } catch (AvfRiskException e) {
            failureCounter.increment();
            log.warn("[Predict] 예측 실패: input={}, reason={}", input, e.getMessage());
            throw e;
        } finally {
            sample.stop(predictionTimer);
        }
    }
}
