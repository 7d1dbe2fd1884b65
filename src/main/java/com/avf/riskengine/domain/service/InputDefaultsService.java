package com.avf.riskengine.domain.service;

import com.avf.riskengine.domain.model.DescriptiveStats;
import com.avf.riskengine.domain.model.InputDefaults;
import com.avf.riskengine.domain.model.ModelArtifacts;
import com.avf.riskengine.domain.model.PatientInput;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class InputDefaultsService {

    static final double FALLBACK_MLR = 0.4;
    static final double FALLBACK_CRP = 5.0;
    static final double FALLBACK_TRIGLYCERIDES = 1.5;
    static final double FALLBACK_NLR = 3.0;

    private final ModelArtifacts artifacts;

    public InputDefaults defaults() {
        DescriptiveStats stats = artifacts.getStats();
        return new InputDefaults(
                medianOr(stats, Preprocessor.MLR, FALLBACK_MLR),
                medianOr(stats, Preprocessor.CRP, FALLBACK_CRP),
                medianOr(stats, Preprocessor.TRIGLYCERIDES, FALLBACK_TRIGLYCERIDES),
                medianOr(stats, Preprocessor.NLR, FALLBACK_NLR),
                PatientInput.IJVC_YES,
                PatientInput.SEX_MALE);
    }

    private double medianOr(DescriptiveStats stats, String variable, double fallback) {
        return stats.median(variable).orElseGet(() -> {
            log.debug("[Defaults] 중앙값 없음, 기본값 사용: variable={}, fallback={}", variable, fallback);
            return fallback;
        });
    }
}
