package io.contimg.pipeline.controller;

import io.contimg.pipeline.dto.common.ApiResponse;
import io.contimg.pipeline.dto.deadletter.DeadLetterQuery;
import io.contimg.pipeline.dto.deadletter.DeadLetterStats;
import io.contimg.pipeline.dto.deadletter.ReplayRequest;
import io.contimg.pipeline.dto.deadletter.ResolveRequest;
import io.contimg.pipeline.dto.registry.ArtifactLineage;
import io.contimg.pipeline.dto.registry.ArtifactQuery;
import io.contimg.pipeline.model.Artifact;
import io.contimg.pipeline.model.DataType;
import io.contimg.pipeline.model.DeadLetterEntry;
import io.contimg.pipeline.model.FileKind;
import io.contimg.pipeline.model.GroupStatus;
import io.contimg.pipeline.model.ProcessingGroup;
import io.contimg.pipeline.service.pipeline.StageRequest;
import io.contimg.pipeline.service.resilience.CircuitBreakerSnapshot;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;

@Tag(name = "Pipeline Operations", description = "Operator endpoints for inspecting the artifact registry, the dead-letter queue, emitted groups and circuit breakers.")
public interface PipelineOperationsApi {

    @Operation(summary = "Query Artifacts",
            description = "Lists registry artifacts, newest first, filtered by type, lifecycle state, id substring and creation time.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Artifacts returned.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "Found 1 artifact(s).",
                                        "response": [
                                            {
                                                "dataType": "IMAGE",
                                                "dataId": "obs_2025-10-02T00:12:00",
                                                "lifecycleState": "PUBLISHED",
                                                "publishAttempts": 1
                                            }
                                        ],
                                        "showMessage": false,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Invalid filter.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<List<Artifact>>> queryArtifacts(@Valid ArtifactQuery query);

    @Operation(summary = "Get Artifact", description = "Returns one artifact by type and id.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Artifact found."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - No such artifact.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<Artifact>> getArtifact(
            @Parameter(description = "Artifact type.", required = true, example = "IMAGE") @PathVariable DataType type,
            @Parameter(description = "Type-scoped artifact id.", required = true, example = "obs_2025-10-02T00:12:00") @PathVariable String id);

    @Operation(summary = "Get Artifact Lineage", description = "Returns the artifacts this one was derived from and the artifacts derived from it.")
    ResponseEntity<ApiResponse<ArtifactLineage>> getLineage(
            @Parameter(description = "Artifact type.", required = true, example = "MOSAIC") @PathVariable DataType type,
            @Parameter(description = "Type-scoped artifact id.", required = true) @PathVariable String id);

    @Operation(summary = "List Dead Letters", description = "Lists dead-letter entries, newest first.")
    ResponseEntity<ApiResponse<List<DeadLetterEntry>>> listDeadLetters(@Valid DeadLetterQuery query);

    @Operation(summary = "Dead-Letter Statistics", description = "Counts entries by status, and pending entries by reason and by component.")
    ResponseEntity<ApiResponse<DeadLetterStats>> deadLetterStats();

    @Operation(summary = "Replay Dead Letter",
            description = "Gives the failed output a fresh set of attempts, marks the entry REPLAYED and re-runs the stage in the background.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Replay submitted."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflict - Entry is not pending or cannot be replayed.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<StageRequest>> replayDeadLetter(
            @Parameter(description = "Dead-letter entry id.", required = true, example = "42") @PathVariable @Positive(message = "The 'id' must be a positive number.") Long id,
            @RequestBody @Valid ReplayRequest request);

    @Operation(summary = "Resolve Dead Letter", description = "Closes a pending entry without replaying it.")
    ResponseEntity<ApiResponse<DeadLetterEntry>> resolveDeadLetter(
            @Parameter(description = "Dead-letter entry id.", required = true, example = "42") @PathVariable @Positive(message = "The 'id' must be a positive number.") Long id,
            @RequestBody @Valid ResolveRequest request);

    @Operation(summary = "List Groups", description = "Lists emitted, completed, failed and abandoned groups, newest first.")
    ResponseEntity<ApiResponse<List<ProcessingGroup>>> listGroups(
            @Parameter(description = "Restrict to one group status.") @RequestParam(required = false) GroupStatus status,
            @Parameter(description = "Restrict to one member kind.") @RequestParam(required = false) FileKind kind,
            @Parameter(description = "Maximum number of groups.", example = "100") @RequestParam(defaultValue = "100") @Min(value = 1, message = "The 'limit' must be at least 1.") @Max(value = 1000, message = "The 'limit' cannot exceed 1000.") int limit);

    @Operation(summary = "Circuit Breakers", description = "Returns the state of every engine circuit breaker.")
    ResponseEntity<ApiResponse<List<CircuitBreakerSnapshot>>> circuitBreakers();

    @Operation(summary = "Reset Circuit Breakers", description = "Closes every circuit breaker and clears its failure count.")
    ResponseEntity<ApiResponse<List<CircuitBreakerSnapshot>>> resetCircuitBreakers();
}
