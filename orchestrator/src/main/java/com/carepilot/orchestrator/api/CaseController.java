package com.carepilot.orchestrator.api;

import com.carepilot.orchestrator.api.dto.CaseRunResponse;
import com.carepilot.orchestrator.api.dto.CaseStatusResponse;
import com.carepilot.orchestrator.api.dto.StageHistoryResponse;
import com.carepilot.orchestrator.api.dto.StartCaseRequest;
import com.carepilot.orchestrator.model.CaseIntake;
import com.carepilot.orchestrator.model.CaseRun;
import com.carepilot.orchestrator.model.MedicalImage;
import com.carepilot.orchestrator.model.RunOutcome;
import com.carepilot.orchestrator.model.RunState;
import com.carepilot.orchestrator.service.CaseRunService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * REST API for case runs.
 *
 * POST /cases              : start a run
 * GET  /cases/{id}         : poll state and the partial case record
 * GET  /cases/{id}/history : stage history, one row per attempt
 * GET  /cases/{id}/report  : final report once the run has completed
 * POST /cases/{id}/cancel  : stop the run at its next stage boundary
 */
@RestController
@RequestMapping("/cases")
public class CaseController {

    private final CaseRunService runService;

    public CaseController(CaseRunService runService) {
        this.runService = runService;
    }

    /**
     * Start a new case run.
     *
     * Example:
     *   curl -X POST http://localhost:8080/cases \
     *     -H "Content-Type: application/json" \
     *     -d '{"complaint":"persistent high fever, chest pain, shortness of breath"}'
     */
    @PostMapping
    public ResponseEntity<CaseRunResponse> start(@RequestBody StartCaseRequest req) {
        if (req.complaint() == null || req.complaint().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "complaint is required");
        }
        CaseRun run = runService.startRun(new CaseIntake(
                req.complaint(), req.patient(), req.medicalHistory(), decodeImage(req)));
        return ResponseEntity.status(HttpStatus.CREATED).body(CaseRunResponse.from(run.status()));
    }

    @GetMapping("/{id}")
    public CaseStatusResponse getCase(@PathVariable String id) {
        return runService.getStatus(id)
                .map(CaseStatusResponse::from)
                .orElseThrow(() -> notFound(id));
    }

    @GetMapping("/{id}/history")
    public List<StageHistoryResponse> getHistory(@PathVariable String id) {
        return runService.history(id)
                .orElseThrow(() -> notFound(id))
                .stream()
                .map(StageHistoryResponse::from)
                .toList();
    }

    /**
     * HTTP 200: run COMPLETED, body is the final report including markdown
     * HTTP 202: run still in progress
     * HTTP 409: run FAILED or was CANCELLED; no report exists
     * HTTP 404: run ID not found
     */
    @GetMapping("/{id}/report")
    public ResponseEntity<?> getReport(@PathVariable String id) {
        CaseRun run = runService.find(id).orElseThrow(() -> notFound(id));
        RunState state = run.getState();
        if (!state.isTerminal()) {
            return ResponseEntity.accepted()
                    .body(Map.of("status", "pending", "state", state.name()));
        }
        RunOutcome outcome = run.outcome();
        return outcome.report()
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.CONFLICT,
                        "Case run " + id + " ended " + state
                                + outcome.failure().map(r -> " (" + r + ")").orElse("")
                                + "; no report available"));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<CaseRunResponse> cancel(@PathVariable String id) {
        return runService.cancel(id)
                .map(status -> ResponseEntity.accepted().body(CaseRunResponse.from(status)))
                .orElseThrow(() -> notFound(id));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static MedicalImage decodeImage(StartCaseRequest req) {
        if (req.imageBase64() == null || req.imageBase64().isBlank()) {
            return null;
        }
        try {
            return new MedicalImage(Base64.getDecoder().decode(req.imageBase64().strip()), req.imageFilename());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "imageBase64 is not valid base64", e);
        }
    }

    private static ResponseStatusException notFound(String id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Case run not found: " + id);
    }
}
