package com.z254.lumina.tutor.api.v1;

import com.z254.lumina.tutor.api.dto.QueryRequest;
import com.z254.lumina.tutor.domain.model.TutorResponse;
import com.z254.lumina.tutor.observability.TutorEvent;
import com.z254.lumina.tutor.observability.TutorEventPublisher;
import com.z254.lumina.tutor.orchestration.DeadLetter;
import com.z254.lumina.tutor.orchestration.MessageBus;
import com.z254.lumina.tutor.orchestration.TutorOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * REST controller for student queries and orchestrator status.
 */
@RestController
@RequestMapping("/api/v1/tutor")
@Tag(name = "Tutor", description = "Student queries and agent status")
@Slf4j
public class TutorController {

    private final TutorOrchestrator orchestrator;
    private final MessageBus messageBus;
    private final TutorEventPublisher events;

    public TutorController(TutorOrchestrator orchestrator, MessageBus messageBus, TutorEventPublisher events) {
        this.orchestrator = orchestrator;
        this.messageBus = messageBus;
        this.events = events;
    }

    @PostMapping("/query")
    @Operation(summary = "Ask a question",
               description = "Run a student query through the agents and return the merged answer")
    @ApiResponse(responseCode = "200", description = "Answer generated, possibly degraded")
    @ApiResponse(responseCode = "400", description = "Invalid request")
    public Mono<TutorResponse> query(@Valid @RequestBody QueryRequest request) {
        return orchestrator.processQuery(request.getQuery(), request.getContext());
    }

    @GetMapping("/agents")
    @Operation(summary = "List agents", description = "State, metrics and last heartbeat of every agent")
    public List<TutorOrchestrator.AgentStatus> agents() {
        return orchestrator.getAgentStatuses();
    }

    @GetMapping("/stats")
    @Operation(summary = "Orchestrator statistics", description = "Query, bus and correlation statistics")
    public Map<String, Object> stats() {
        return orchestrator.getStats();
    }

    @GetMapping("/dead-letters")
    @Operation(summary = "List dead letters", description = "Messages the bus could not deliver")
    public List<DeadLetter> deadLetters() {
        return messageBus.getDeadLetters();
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Stream events", description = "Server-sent stream of tutoring events")
    public Flux<TutorEvent> streamEvents(
            @Parameter(description = "Only stream events with this name") @RequestParam(required = false)
            String name) {
        return name != null ? events.events(name) : events.events();
    }
}
