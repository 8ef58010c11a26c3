package com.example.autoslides_backend.controller;

import com.example.autoslides_backend.dto.McpRequest;
import com.example.autoslides_backend.dto.McpResponse;
import com.example.autoslides_backend.service.tools.ToolService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Tool-invocation endpoint and its manifest.
 */
@RestController
public class McpController {
    static final String MANIFEST_LOCATION = "mcp/manifest.yaml";
    static final MediaType YAML = MediaType.parseMediaType("text/yaml");

    private final ToolService toolService;

    public McpController(ToolService toolService) {
        this.toolService = toolService;
    }

    @Operation(summary = "Invoke a single pipeline tool by name")
    @ApiResponse(responseCode = "200", description = "Tool result under 'return'")
    @ApiResponse(responseCode = "400", description = "Unknown tool or invalid arguments")
    @PostMapping("/mcp")
    public ResponseEntity<McpResponse> invoke(@Valid @RequestBody McpRequest request) {
        Object result = toolService.invoke(request.tool(), request.argsOrEmpty());
        return ResponseEntity.ok(new McpResponse(request.tool(), result));
    }

    @Operation(summary = "Tool manifest")
    @GetMapping("/.well-known/mcp/manifest.yaml")
    public ResponseEntity<Resource> manifest() {
        return ResponseEntity.ok()
                .contentType(YAML)
                .body(new ClassPathResource(MANIFEST_LOCATION));
    }
}
