package com.heronix.progress.controller.api;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.progress.model.batch.BatchRequest;
import com.heronix.progress.model.batch.CohortSelector;
import com.heronix.progress.model.batch.EvaluationPeriod;
import com.heronix.progress.model.dto.BatchRunDTO;
import com.heronix.progress.model.dto.BatchRunRequestDTO;
import com.heronix.progress.service.batch.BatchJobService;
import com.heronix.progress.service.batch.BatchRunRegistry.ActiveRunView;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for batch runs.
 */
@RestController
@RequestMapping("/api/v1/progress/batches")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Batch Runs", description = "Cohort-wide SAP and GPA evaluation")
public class BatchController {

    private final BatchJobService batchJobService;

    @PostMapping
    @Operation(summary = "Start batch run", description = "Evaluate a cohort asynchronously")
    @ApiResponses({
        @ApiResponse(responseCode = "202", description = "Batch run started"),
        @ApiResponse(responseCode = "400", description = "Invalid request")
    })
    public ResponseEntity<BatchJobResponse> startRun(@Valid @RequestBody BatchRunRequestDTO dto) {
        BatchRequest request = batchJobService.withBatchId(BatchRequest.builder()
                .kind(dto.getKind())
                .period(new EvaluationPeriod(dto.getAwardYearId(), dto.getTermId()))
                .cohort(dto.getStudentIds() == null
                        ? CohortSelector.allEligible()
                        : CohortSelector.explicit(dto.getStudentIds()))
                .calculateCumulative(dto.isCalculateCumulative())
                .build());

        log.info("API: Starting {} batch run {} for term {}", request.kind(), request.batchId(), dto.getTermId());
        batchJobService.startRun(request);

        return ResponseEntity.accepted().body(new BatchJobResponse(
                request.batchId(), "STARTED", request.kind() + " batch run started"));
    }

    @GetMapping
    @Operation(summary = "List recent runs")
    public ResponseEntity<List<BatchRunDTO>> recentRuns(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(batchJobService.recentRuns(limit));
    }

    @GetMapping("/active")
    @Operation(summary = "List active runs", description = "Runs executing in this instance")
    public ResponseEntity<List<ActiveRunView>> activeRuns() {
        return ResponseEntity.ok(batchJobService.activeRuns());
    }

    @GetMapping("/{batchId}")
    @Operation(summary = "Get run details")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Run found"),
        @ApiResponse(responseCode = "404", description = "Run not found")
    })
    public ResponseEntity<BatchRunDTO> getRun(@PathVariable String batchId) {
        return batchJobService.findRun(batchId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{batchId}/cancel")
    @Operation(summary = "Cancel run", description = "Stop an active run after its current sub-batch")
    @ApiResponses({
        @ApiResponse(responseCode = "202", description = "Cancellation requested"),
        @ApiResponse(responseCode = "404", description = "No active run with this id")
    })
    public ResponseEntity<BatchJobResponse> cancelRun(@PathVariable String batchId) {
        batchJobService.cancel(batchId);
        return ResponseEntity.accepted().body(new BatchJobResponse(batchId, "CANCEL_REQUESTED",
                "Run stops after its current sub-batch"));
    }

    // ========================================================================
    // REQUEST/RESPONSE TYPES
    // ========================================================================

    public record BatchJobResponse(
            String batchId,
            String status,
            String message
    ) {}
}
