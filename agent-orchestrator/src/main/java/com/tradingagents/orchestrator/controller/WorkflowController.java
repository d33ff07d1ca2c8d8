package com.tradingagents.orchestrator.controller;

import com.tradingagents.orchestrator.service.ExecutionResult;
import com.tradingagents.orchestrator.service.WorkflowFacade;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/workflow")
public class WorkflowController {

    private final WorkflowFacade workflowFacade;

    public WorkflowController(WorkflowFacade workflowFacade) {
        this.workflowFacade = workflowFacade;
    }

    @PostMapping("/execute")
    public Mono<ResponseEntity<ExecutionResult>> execute(@RequestBody RunRequest request) {
        return workflowFacade.execute(request.ticker(), request.tradeDate())
            .map(WorkflowController::toResponse);
    }

    static ResponseEntity<ExecutionResult> toResponse(ExecutionResult result) {
        return switch (result.status()) {
            case COMPLETED -> ResponseEntity.ok(result);
            case REJECTED  -> ResponseEntity.badRequest().body(result);
            case FAILED    -> ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        };
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
