package com.example.autoslides_backend.controller;

import com.example.autoslides_backend.dto.GenerateRequest;
import com.example.autoslides_backend.dto.GenerateResponse;
import com.example.autoslides_backend.exception.RunFailedException;
import com.example.autoslides_backend.model.PipelineResult;
import com.example.autoslides_backend.service.PipelineOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP endpoint for the full topic-to-deck pipeline.
 */
@RestController
public class GenerateController {
    private final PipelineOrchestrator orchestrator;

    public GenerateController(PipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Operation(summary = "Generate a complete slide deck for a topic")
    @ApiResponse(responseCode = "200", description = "Deck published; warnings list degraded slides")
    @ApiResponse(responseCode = "400", description = "Invalid request payload")
    @ApiResponse(responseCode = "502", description = "Text generation failed")
    @PostMapping("/generate")
    public ResponseEntity<GenerateResponse> generate(@Valid @RequestBody GenerateRequest request) {
        PipelineResult result = orchestrator.run(request.toGenerationRequest());
        if (result.isFailure()) {
            throw new RunFailedException(result.errorCategory(), result.errorMessage());
        }
        return ResponseEntity.ok(GenerateResponse.from(result));
    }
}
