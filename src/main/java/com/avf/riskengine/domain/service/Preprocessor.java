package com.avf.riskengine.domain.service;

import com.avf.riskengine.domain.exception.NumericDomainException;
import com.avf.riskengine.domain.model.PatientInput;
import com.avf.riskengine.domain.model.TransformedInput;
import com.avf.riskengine.domain.model.WinsorLimits;
import com.avf.riskengine.domain.model.WinsorLimits.Bound;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Slf4j
@Component
public class Preprocessor {

    public static final String MLR = "MLR";
    public static final String CRP = "CRP";
    public static final String TRIGLYCERIDES = "triglycerides";
    public static final String NLR = "NLR";

    public double clampAndTransform(double rawValue, String variableName, WinsorLimits limits) {
        if (Double.isNaN(rawValue)) {
            throw new NumericDomainException(variableName, rawValue);
        }

        double value = rawValue;
        Optional<Bound> bound = limits.find(variableName);
        if (bound.isPresent()) {
            value = bound.get().clamp(rawValue);
            if (value != rawValue) {
                log.debug("[Preprocess] 윈저화 적용: variable={}, raw={}, clamped={}", variableName, rawValue, value);
            }
        } else {
            log.debug("[Preprocess] 윈저화 한계 없음, 클램프 생략: variable={}", variableName);
        }

        if (value < -1.0) {
            throw new NumericDomainException(variableName, value);
        }
        double transformed = Math.log1p(value);
        if (!Double.isFinite(transformed)) {
            throw new NumericDomainException(variableName, value);
        }
        return transformed;
    }

    public TransformedInput preprocess(PatientInput input, WinsorLimits limits) {
        return new TransformedInput(
                clampAndTransform(input.getMlr(), MLR, limits),
                clampAndTransform(input.getCrp(), CRP, limits),
                clampAndTransform(input.getTriglycerides(), TRIGLYCERIDES, limits),
                clampAndTransform(input.getNlr(), NLR, limits),
                input.getIjvc(),
                input.getSex());
    }
}
