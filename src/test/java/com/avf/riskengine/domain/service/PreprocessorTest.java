package com.avf.riskengine.domain.service;

import com.avf.riskengine.domain.exception.NumericDomainException;
import com.avf.riskengine.domain.model.PatientInput;
import com.avf.riskengine.domain.model.TransformedInput;
import com.avf.riskengine.domain.model.WinsorLimits;
import com.avf.riskengine.support.TestArtifacts;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PreprocessorTest {

    private final Preprocessor preprocessor = new Preprocessor();
    private final WinsorLimits limits = TestArtifacts.scenarioLimits();

    @Test
    void valueBelowLowerBoundIsClampedToLower() {
        WinsorLimits tight = new WinsorLimits(Map.of("CRP", new WinsorLimits.Bound(1.0, 50.0)));

        double result = preprocessor.clampAndTransform(0.2, "CRP", tight);

        assertThat(result).isEqualTo(Math.log1p(1.0));
    }

    @Test
    void valueAboveUpperBoundIsClampedToUpper() {
        double result = preprocessor.clampAndTransform(180.0, "CRP", limits);

        assertThat(result).isEqualTo(Math.log1p(50.0));
    }

    @Test
    void valueInsideBoundsIsOnlyTransformed() {
        double result = preprocessor.clampAndTransform(5.0, "CRP", limits);

        assertThat(result).isEqualTo(Math.log1p(5.0));
    }

    @Test
    void limitLookupIgnoresCaseAndWhitespace() {
        WinsorLimits lowerCaseKeys = new WinsorLimits(Map.of(
                "crp", new WinsorLimits.Bound(0.0, 50.0),
                " nlr ", new WinsorLimits.Bound(0.0, 10.0)));

        assertThat(preprocessor.clampAndTransform(120.0, "CRP", lowerCaseKeys)).isEqualTo(Math.log1p(50.0));
        assertThat(preprocessor.clampAndTransform(30.0, "NLR", lowerCaseKeys)).isEqualTo(Math.log1p(10.0));
    }

    @Test
    void unknownVariableSkipsClamping() {
        double result = preprocessor.clampAndTransform(120.0, "ferritin", limits);

        assertThat(result).isEqualTo(Math.log1p(120.0));
    }

    @Test
    void valueBelowLogDomainIsRejected() {
        assertThatThrownBy(() -> preprocessor.clampAndTransform(-2.5, "ferritin", limits))
                .isInstanceOf(NumericDomainException.class)
                .hasMessageContaining("ferritin");
    }

    @Test
    void minusOneIsRejectedInsteadOfNegativeInfinity() {
        assertThatThrownBy(() -> preprocessor.clampAndTransform(-1.0, "ferritin", WinsorLimits.empty()))
                .isInstanceOf(NumericDomainException.class);
    }

    @Test
    void negativeLowerBoundBelowDomainIsRejected() {
        WinsorLimits broken = new WinsorLimits(Map.of("MLR", new WinsorLimits.Bound(-3.0, 2.0)));

        assertThatThrownBy(() -> preprocessor.clampAndTransform(-5.0, "MLR", broken))
                .isInstanceOf(NumericDomainException.class);
    }

    @Test
    void nanIsRejected() {
        assertThatThrownBy(() -> preprocessor.clampAndTransform(Double.NaN, "MLR", limits))
                .isInstanceOf(NumericDomainException.class);
    }

    @Test
    void preprocessTransformsNumericsAndPassesCategoricalsThrough() {
        TransformedInput result = preprocessor.preprocess(TestArtifacts.scenarioInput(), limits);

        assertThat(result.logMlr()).isCloseTo(0.3365, within(1e-4));
        assertThat(result.logCrp()).isCloseTo(1.7918, within(1e-4));
        assertThat(result.logTriglycerides()).isCloseTo(0.9163, within(1e-4));
        assertThat(result.logNlr()).isCloseTo(1.3863, within(1e-4));
        assertThat(result.ijvc()).isEqualTo(PatientInput.IJVC_NO);
        assertThat(result.sex()).isEqualTo(PatientInput.SEX_MALE);
    }
}
