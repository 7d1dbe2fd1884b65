package com.avf.riskengine.api;

import com.avf.riskengine.api.dto.ModelInfoResponse;
import com.avf.riskengine.domain.model.ModelArtifacts;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/model")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class ModelInfoController {

    private final ModelArtifacts artifacts;

    @GetMapping("/info")
    public ResponseEntity<ModelInfoResponse> info() {
        return ResponseEntity.ok(ModelInfoResponse.builder()
                .artifactDirectory(artifacts.getSourceDirectory())
                .loadedAt(artifacts.getLoadedAt())
                .featureCount(artifacts.getModel().size())
                .featureNames(artifacts.getModel().getFeatureNames())
                .intercept(artifacts.getModel().getIntercept())
                .winsorizedVariables(artifacts.getWinsorLimits().getVariableNames())
                .descriptiveStatsLoaded(!artifacts.getStats().isEmpty())
                .build());
    }
}
