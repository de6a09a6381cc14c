package com.openrangelabs.copilot.controller;

import com.openrangelabs.copilot.dto.ToolDescriptorDto;
import com.openrangelabs.copilot.dto.ToolInvocationRequest;
import com.openrangelabs.copilot.tool.ToolRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * REST controller exposing the agent tools to the orchestration layer.
 *
 * <p>Connector failures come back as a 200 response whose {@code status} field is
 * {@code error} or {@code not_found}; only web-layer problems produce error statuses.
 *
 * @author OpenRange Labs
 * @version 1.0
 */
@RestController
@RequestMapping("/api/tools")
@CrossOrigin(origins = "${copilot.security.cors.allowed-origins}")
@Tag(name = "Agent Tools", description = "CRM and marketing tools callable by the agent layer")
public class ToolController {

    private final ToolRegistry toolRegistry;

    @Autowired
    public ToolController(ToolRegistry toolRegistry) {
        this.toolRegistry = toolRegistry;
    }

    /**
     * Lists every registered tool with its parameters.
     *
     * @return tool catalog ordered by name
     */
    @GetMapping
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    @Operation(summary = "List agent tools", description = "Returns the name, description and parameters of every tool")
    public Flux<ToolDescriptorDto> listTools() {
        return Flux.fromIterable(toolRegistry.getTools())
                .map(ToolDescriptorDto::fromTool);
    }

    /**
     * Invokes one tool.
     *
     * @param toolName the tool name
     * @param request the tool arguments
     * @return the tool's status map
     */
    @PostMapping("/{toolName}")
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    @Operation(summary = "Invoke an agent tool", description = "Runs the named tool and returns its status map")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Tool ran; see the status field for the outcome"),
            @ApiResponse(responseCode = "400", description = "Malformed request body"),
            @ApiResponse(responseCode = "404", description = "No tool with that name")
    })
    public Mono<ResponseEntity<Map<String, Object>>> invokeTool(
            @Parameter(description = "Tool name", example = "query_vtiger_contact") @PathVariable String toolName,
            @Valid @RequestBody ToolInvocationRequest request) {

        return toolRegistry.execute(toolName, request.getArguments())
                .map(ResponseEntity::ok);
    }
}
