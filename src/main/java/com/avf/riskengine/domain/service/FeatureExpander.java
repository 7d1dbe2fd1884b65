package com.avf.riskengine.domain.service;

import com.avf.riskengine.domain.model.FeatureVector;
import com.avf.riskengine.domain.model.TransformedInput;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class FeatureExpander {

    public static final String LOG_MLR = "log_MLR";
    public static final String LOG_CRP = "log_CRP";
    public static final String LOG_TRIGLYCERIDES = "log_triglycerides";
    public static final String LOG_NLR = "log_NLR";
    public static final String IJVC = "IJVC";
    public static final String SEX = "sex";

    public static final String INTERACTION_MARKER = "*";

    public static final List<String> BASE_FEATURES = List.of(
            LOG_MLR, LOG_CRP, LOG_TRIGLYCERIDES, LOG_NLR, IJVC, SEX);

    static final int[][] INTERACTION_PAIRS = {
            {0, 1}, {0, 2}, {0, 3}, {0, 4}, {0, 5},
            {1, 2}, {1, 3}, {1, 4}, {1, 5},
            {2, 3}, {2, 4}, {2, 5},
            {3, 4}, {3, 5},
            {4, 5}
    };

    public static final List<String> FEATURE_NAMES = buildFeatureNames();

    public static final int FEATURE_COUNT = BASE_FEATURES.size() + INTERACTION_PAIRS.length;

    public FeatureVector expand(TransformedInput input) {
        double[] base = {
                input.logMlr(),
                input.logCrp(),
                input.logTriglycerides(),
                input.logNlr(),
                input.ijvc(),
                input.sex()
        };

        double[] values = new double[FEATURE_COUNT];
        System.arraycopy(base, 0, values, 0, base.length);
        int idx = base.length;
        for (int[] pair : INTERACTION_PAIRS) {
            values[idx++] = base[pair[0]] * base[pair[1]];
        }
        return new FeatureVector(FEATURE_NAMES, values);
    }

    public static String interactionName(String left, String right) {
        return left + INTERACTION_MARKER + right;
    }

    private static List<String> buildFeatureNames() {
        List<String> names = new ArrayList<>(BASE_FEATURES);
        for (int[] pair : INTERACTION_PAIRS) {
            names.add(interactionName(BASE_FEATURES.get(pair[0]), BASE_FEATURES.get(pair[1])));
        }
        return List.copyOf(names);
    }
}
