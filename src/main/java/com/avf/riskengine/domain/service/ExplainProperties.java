package com.avf.riskengine.domain.service;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "avf.explain")
public class ExplainProperties {

    private Map<String, String> labels = defaultLabels();

    static Map<String, String> defaultLabels() {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("log_MLR", "MLR (Inflammation)");
        labels.put("log_CRP", "CRP (Inflammation)");
        labels.put("log_triglycerides", "Triglycerides (Lipids)");
        labels.put("log_NLR", "NLR (Inflammation)");
        labels.put("IJVC", "Hx of IJV Cannulation");
        labels.put("sex", "Sex");
        labels.put("log_MLR*log_CRP", "Interaction: MLR x CRP");
        labels.put("log_MLR*log_triglycerides", "Interaction: MLR x TG");
        labels.put("log_MLR*log_NLR", "Interaction: MLR x NLR");
        return labels;
    }
}
