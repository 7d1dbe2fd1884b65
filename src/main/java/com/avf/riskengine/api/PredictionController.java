package com.avf.riskengine.api;

import com.avf.riskengine.api.dto.PredictionResponse;
import com.avf.riskengine.domain.exception.InputValidationException;
import com.avf.riskengine.domain.model.InputDefaults;
import com.avf.riskengine.domain.model.PatientInput;
import com.avf.riskengine.domain.model.PredictionResult;
import com.avf.riskengine.domain.service.InputDefaultsService;
import com.avf.riskengine.domain.service.RiskPredictionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/predict")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class PredictionController {

    private final RiskPredictionService riskPredictionService;
    private final InputDefaultsService inputDefaultsService;

    @PostMapping
    public ResponseEntity<PredictionResponse> predict(
            @Valid @RequestBody PatientInput input,
            @RequestParam(required = false) Integer top) {

        if (top != null && top < 1) {
            throw new InputValidationException("top must be at least 1");
        }

        PredictionResult result = riskPredictionService.predict(input);
        PredictionResponse response = PredictionResponse.from(result, top);

        log.info("[Predict API] 예측 응답: probability={}, category={}",
                String.format("%.4f", response.getProbability()), response.getRiskCategory());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/defaults")
    public ResponseEntity<InputDefaults> defaults() {
        return ResponseEntity.ok(inputDefaultsService.defaults());
    }
}
