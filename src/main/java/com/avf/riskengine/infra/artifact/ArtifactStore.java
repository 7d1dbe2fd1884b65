package com.avf.riskengine.infra.artifact;

import com.avf.riskengine.domain.exception.FatalConfigurationException;
import com.avf.riskengine.domain.model.DescriptiveStats;
import com.avf.riskengine.domain.model.ModelArtifacts;
import com.avf.riskengine.domain.model.ModelParams;
import com.avf.riskengine.domain.model.ScalerParams;
import com.avf.riskengine.domain.model.WinsorLimits;
import com.avf.riskengine.domain.service.FeatureExpander;
import com.avf.riskengine.infra.artifact.config.ArtifactProperties;
import com.avf.riskengine.infra.artifact.dto.ModelArtifactFile;
import com.avf.riskengine.infra.artifact.dto.ScalerArtifactFile;
import com.avf.riskengine.infra.artifact.dto.WinsorBoundFile;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class ArtifactStore {

    private final ObjectMapper objectMapper;
    private final ArtifactProperties properties;

    public ModelArtifacts load(List<String> candidateDirectories) {
        Path baseDir = resolveBaseDirectory(candidateDirectories);
        log.info("[Artifact] 아티팩트 디렉터리 선택: {}", baseDir.toAbsolutePath());

        ModelParams model = readModel(baseDir.resolve(properties.getModelFile()));
        ScalerParams scaler = readScaler(baseDir.resolve(properties.getScalerFile()));
        WinsorLimits winsorLimits = readWinsorLimits(baseDir.resolve(properties.getWinsorLimitsFile()));
        DescriptiveStats stats = readStatsOrEmpty(baseDir.resolve(properties.getStatsFile()));

        verifyAlignment(model, scaler);

        log.info("[Artifact] 로드 완료: features={}, intercept={}, winsorVariables={}, stats={}",
                model.size(), model.getIntercept(), winsorLimits.getVariableNames(),
                stats.isEmpty() ? "fallback" : "loaded");

        return ModelArtifacts.builder()
                .model(model)
                .scaler(scaler)
                .winsorLimits(winsorLimits)
                .stats(stats)
                .sourceDirectory(baseDir.toAbsolutePath().toString())
                .loadedAt(Instant.now())
                .build();
    }

    Path resolveBaseDirectory(List<String> candidateDirectories) {
        if (candidateDirectories != null) {
            for (String candidate : candidateDirectories) {
                if (candidate == null || candidate.isBlank()) continue;
                Path path = Path.of(candidate);
                if (Files.isDirectory(path)) {
                    return path;
                }
                log.debug("[Artifact] 후보 디렉터리 없음: {}", path.toAbsolutePath());
            }
        }
        throw new FatalConfigurationException(
                "Model files not found in any candidate directory: " + candidateDirectories);
    }

    ModelParams readModel(Path file) {
        ModelArtifactFile raw = readRequired(file, ModelArtifactFile.class);
        if (raw.getCoefficients() == null) {
            throw new FatalConfigurationException("Model file has no coefficients: " + file);
        }
        if (raw.getIntercept() == null) {
            throw new FatalConfigurationException("Model file has no intercept: " + file);
        }
        double[] coefficients = toFiniteArray(raw.getCoefficients(), "coefficients", file);
        List<String> names = featureNamesOrCanonical(raw.getFeatureNames(), coefficients.length, file);
        return new ModelParams(names, coefficients, raw.getIntercept());
    }

    ScalerParams readScaler(Path file) {
        ScalerArtifactFile raw = readRequired(file, ScalerArtifactFile.class);
        if (raw.getMean() == null || raw.getScale() == null) {
            throw new FatalConfigurationException("Scaler file needs both mean and scale: " + file);
        }
        double[] mean = toFiniteArray(raw.getMean(), "mean", file);
        double[] scale = toFiniteArray(raw.getScale(), "scale", file);
        if (mean.length != scale.length) {
            throw new FatalConfigurationException(String.format(
                    "Scaler mean/scale length mismatch (%d vs %d): %s", mean.length, scale.length, file));
        }

        List<String> names = featureNamesOrCanonical(raw.getFeatureNames(), mean.length, file);
        for (int i = 0; i < scale.length; i++) {
            if (scale[i] == 0.0) {
                log.warn("[Artifact] scale=0 피처를 1.0으로 대체: feature={}", names.get(i));
                scale[i] = 1.0;
            }
        }
        return new ScalerParams(names, mean, scale);
    }

    WinsorLimits readWinsorLimits(Path file) {
        Map<String, WinsorBoundFile> raw = readRequired(file, new TypeReference<LinkedHashMap<String, WinsorBoundFile>>() {});
        Map<String, WinsorLimits.Bound> bounds = new LinkedHashMap<>();
        raw.forEach((name, bound) -> {
            if (bound == null || bound.getLower() == null || bound.getUpper() == null) {
                throw new FatalConfigurationException("Winsor limit for '" + name + "' needs lower and upper: " + file);
            }
            if (bound.getLower() > bound.getUpper()) {
                throw new FatalConfigurationException(String.format(
                        "Winsor limit for '%s' has lower %s > upper %s: %s", name, bound.getLower(), bound.getUpper(), file));
            }
            bounds.put(name, new WinsorLimits.Bound(bound.getLower(), bound.getUpper()));
        });
        return new WinsorLimits(bounds);
    }

    DescriptiveStats readStatsOrEmpty(Path file) {
        if (!Files.isRegularFile(file)) {
            log.info("[Artifact] 기술통계 파일 없음, 기본 입력값 사용: {}", file);
            return DescriptiveStats.empty();
        }
        try {
            Map<String, Map<String, Object>> raw = objectMapper.readValue(file.toFile(),
                    new TypeReference<LinkedHashMap<String, Map<String, Object>>>() {});
            return raw == null ? DescriptiveStats.empty() : new DescriptiveStats(numericStats(raw));
        } catch (IOException e) {
            log.warn("[Artifact] 기술통계 파싱 실패, 기본 입력값 사용: file={}, reason={}", file, e.getMessage());
            return DescriptiveStats.empty();
        }
    }

    private void verifyAlignment(ModelParams model, ScalerParams scaler) {
        List<String> expected = FeatureExpander.FEATURE_NAMES;
        if (model.size() != expected.size()) {
            throw new FatalConfigurationException(String.format(
                    "Model has %d coefficients, pipeline produces %d features", model.size(), expected.size()));
        }
        if (scaler.size() != expected.size()) {
            throw new FatalConfigurationException(String.format(
                    "Scaler has %d entries, pipeline produces %d features", scaler.size(), expected.size()));
        }
        for (int i = 0; i < expected.size(); i++) {
            if (!expected.get(i).equals(model.featureName(i))) {
                throw new FatalConfigurationException(String.format(
                        "Model feature #%d is '%s', expected '%s'", i, model.featureName(i), expected.get(i)));
            }
            if (!expected.get(i).equals(scaler.featureName(i))) {
                throw new FatalConfigurationException(String.format(
                        "Scaler feature #%d is '%s', expected '%s'", i, scaler.featureName(i), expected.get(i)));
            }
        }
    }

    private List<String> featureNamesOrCanonical(List<String> declared, int length, Path file) {
        if (declared == null) {
            log.info("[Artifact] featureNames 미선언, 표준 순서 가정: {}", file.getFileName());
            if (length != FeatureExpander.FEATURE_COUNT) {
                throw new FatalConfigurationException(String.format(
                        "%s has %d values but no featureNames; expected %d", file, length, FeatureExpander.FEATURE_COUNT));
            }
            return FeatureExpander.FEATURE_NAMES;
        }
        if (declared.size() != length) {
            throw new FatalConfigurationException(String.format(
                    "%s declares %d featureNames for %d values", file, declared.size(), length));
        }
        return declared;
    }

    private Map<String, Map<String, Double>> numericStats(Map<String, Map<String, Object>> raw) {
        Map<String, Map<String, Double>> numeric = new LinkedHashMap<>();
        raw.forEach((variable, stats) -> {
            if (stats == null) return;
            Map<String, Double> values = new LinkedHashMap<>();
            stats.forEach((statistic, value) -> {
                if (value instanceof Number number) {
                    values.put(statistic, number.doubleValue());
                } else if (value != null) {
                    log.debug("[Artifact] 수치가 아닌 기술통계 무시: {}.{}={}", variable, statistic, value);
                }
            });
            numeric.put(variable, values);
        });
        return numeric;
    }

    private double[] toFiniteArray(List<Double> values, String field, Path file) {
        double[] result = new double[values.size()];
        for (int i = 0; i < result.length; i++) {
            Double value = values.get(i);
            if (value == null || !Double.isFinite(value)) {
                throw new FatalConfigurationException(String.format(
                        "%s[%d] is not a finite number in %s: %s", field, i, file, value));
            }
            result[i] = value;
        }
        return result;
    }

    private <T> T readRequired(Path file, Class<T> type) {
        requireFile(file);
        T value;
        try {
            value = objectMapper.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new FatalConfigurationException("Error loading model file " + file + ": " + e.getMessage(), e);
        }
        if (value == null) {
            throw new FatalConfigurationException("Artifact file is empty: " + file);
        }
        return value;
    }

    private <T> T readRequired(Path file, TypeReference<T> type) {
        requireFile(file);
        T value;
        try {
            value = objectMapper.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new FatalConfigurationException("Error loading model file " + file + ": " + e.getMessage(), e);
        }
        if (value == null) {
            throw new FatalConfigurationException("Artifact file is empty: " + file);
        }
        return value;
    }

    private void requireFile(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new FatalConfigurationException("Required artifact missing: " + file.toAbsolutePath());
        }
    }
}
