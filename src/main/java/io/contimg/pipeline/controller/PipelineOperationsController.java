package io.contimg.pipeline.controller;

import io.contimg.pipeline.dto.common.ApiResponse;
import io.contimg.pipeline.dto.deadletter.DeadLetterQuery;
import io.contimg.pipeline.dto.deadletter.DeadLetterStats;
import io.contimg.pipeline.dto.deadletter.ReplayRequest;
import io.contimg.pipeline.dto.deadletter.ResolveRequest;
import io.contimg.pipeline.dto.registry.ArtifactLineage;
import io.contimg.pipeline.dto.registry.ArtifactQuery;
import io.contimg.pipeline.exception.DeadLetterReplayException;
import io.contimg.pipeline.model.Artifact;
import io.contimg.pipeline.model.ArtifactKey;
import io.contimg.pipeline.model.DataType;
import io.contimg.pipeline.model.DeadLetterEntry;
import io.contimg.pipeline.model.FileKind;
import io.contimg.pipeline.model.GroupStatus;
import io.contimg.pipeline.model.ProcessingGroup;
import io.contimg.pipeline.service.detect.GroupEmissionService;
import io.contimg.pipeline.service.pipeline.DeadLetterReplayService;
import io.contimg.pipeline.service.pipeline.StageRequest;
import io.contimg.pipeline.service.registry.ArtifactRegistryService;
import io.contimg.pipeline.service.resilience.CircuitBreakerRegistry;
import io.contimg.pipeline.service.resilience.CircuitBreakerSnapshot;
import io.contimg.pipeline.service.resilience.DeadLetterQueueService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springdoc.core.annotations.ParameterObject;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Operator surface over the registry, the dead-letter queue, group emissions and circuit breakers.
 * All responses follow the standardized {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Validated
public class PipelineOperationsController implements PipelineOperationsApi {

    private final ArtifactRegistryService artifactRegistryService;
    private final DeadLetterQueueService deadLetterQueueService;
    private final DeadLetterReplayService deadLetterReplayService;
    private final GroupEmissionService groupEmissionService;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    // --- ARTIFACTS ---

    @Override
    @GetMapping("/artifacts")
    public ResponseEntity<ApiResponse<List<Artifact>>> queryArtifacts(@ParameterObject final ArtifactQuery query) {
        log.debug("Querying artifacts with filter: {}", query);
        List<Artifact> artifacts = artifactRegistryService.query(query);
        return ok(artifacts, String.format("Found %d artifact(s).", artifacts.size()), false);
    }

    @Override
    @GetMapping("/artifacts/{type}/{id}")
    public ResponseEntity<ApiResponse<Artifact>> getArtifact(@PathVariable final DataType type,
                                                             @PathVariable final String id) {
        return ok(artifactRegistryService.get(new ArtifactKey(type, id)), "Artifact found.", false);
    }

    @Override
    @GetMapping("/artifacts/{type}/{id}/lineage")
    public ResponseEntity<ApiResponse<ArtifactLineage>> getLineage(@PathVariable final DataType type,
                                                                   @PathVariable final String id) {
        return ok(artifactRegistryService.lineage(new ArtifactKey(type, id)), "Lineage resolved.", false);
    }

    // --- DEAD LETTERS ---

    @Override
    @GetMapping("/dead-letters")
    public ResponseEntity<ApiResponse<List<DeadLetterEntry>>> listDeadLetters(@ParameterObject final DeadLetterQuery query) {
        List<DeadLetterEntry> entries = deadLetterQueueService.list(query);
        return ok(entries, String.format("Found %d dead letter(s).", entries.size()), false);
    }

    @Override
    @GetMapping("/dead-letters/stats")
    public ResponseEntity<ApiResponse<DeadLetterStats>> deadLetterStats() {
        return ok(deadLetterQueueService.stats(), "Dead-letter statistics.", false);
    }

    @Override
    @PostMapping("/dead-letters/{id}/replay")
    public ResponseEntity<ApiResponse<StageRequest>> replayDeadLetter(
            @PathVariable final Long id,
            @RequestBody final ReplayRequest request) {
        log.info("Replay of dead letter {} requested by '{}'.", id, request.getReplayedBy());
        StageRequest submitted = deadLetterReplayService.replay(id, request.getReplayedBy());
        ApiResponse<StageRequest> response = ApiResponse.<StageRequest>builder()
                .response(submitted)
                .displayMessage(String.format("Replay of %s for group %s submitted.", submitted.stage(), submitted.groupId()))
                .showMessage(true)
                .statusCode(HttpStatus.ACCEPTED.value())
                .build();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @Override
    @PostMapping("/dead-letters/{id}/resolve")
    public ResponseEntity<ApiResponse<DeadLetterEntry>> resolveDeadLetter(
            @PathVariable final Long id,
            @RequestBody final ResolveRequest request) {
        log.info("Resolution of dead letter {} requested by '{}'.", id, request.getResolvedBy());
        deadLetterQueueService.resolve(id, request.getResolvedBy(), request.getNotes());
        DeadLetterEntry entry = deadLetterQueueService.get(id)
                .orElseThrow(() -> new DeadLetterReplayException("Dead letter " + id + " disappeared after resolution"));
        return ok(entry, "Dead letter resolved.", true);
    }

    // --- GROUPS ---

    @Override
    @GetMapping("/groups")
    public ResponseEntity<ApiResponse<List<ProcessingGroup>>> listGroups(
            @RequestParam(required = false) final GroupStatus status,
            @RequestParam(required = false) final FileKind kind,
            @RequestParam(defaultValue = "100") final int limit) {
        List<ProcessingGroup> groups = groupEmissionService.list(status, kind, limit);
        return ok(groups, String.format("Found %d group(s).", groups.size()), false);
    }

    // --- CIRCUIT BREAKERS ---

    @Override
    @GetMapping("/circuit-breakers")
    public ResponseEntity<ApiResponse<List<CircuitBreakerSnapshot>>> circuitBreakers() {
        return ok(circuitBreakerRegistry.snapshots(), "Circuit breaker states.", false);
    }

    @Override
    @PostMapping("/circuit-breakers/reset")
    public ResponseEntity<ApiResponse<List<CircuitBreakerSnapshot>>> resetCircuitBreakers() {
        log.warn("Resetting all circuit breakers on operator request.");
        circuitBreakerRegistry.reset();
        return ok(circuitBreakerRegistry.snapshots(), "All circuit breakers reset.", true);
    }

    private static <T> ResponseEntity<ApiResponse<T>> ok(T body, String message, boolean showMessage) {
        ApiResponse<T> response = ApiResponse.<T>builder()
                .response(body)
                .displayMessage(message)
                .showMessage(showMessage)
                .statusCode(HttpStatus.OK.value())
                .build();
        return ResponseEntity.ok(response);
    }
}
