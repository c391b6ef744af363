package com.z254.lumina.tutor.orchestration;

import com.z254.lumina.tutor.agent.Agent;
import com.z254.lumina.tutor.agent.AgentException;
import com.z254.lumina.tutor.agent.AgentRegistry;
import com.z254.lumina.tutor.client.McpServiceLayer;
import com.z254.lumina.tutor.config.TutorProperties;
import com.z254.lumina.tutor.domain.model.AgentMessage;
import com.z254.lumina.tutor.domain.model.AgentType;
import com.z254.lumina.tutor.domain.model.ConversationContext;
import com.z254.lumina.tutor.domain.model.ErrorCode;
import com.z254.lumina.tutor.domain.model.ExecutionPlan;
import com.z254.lumina.tutor.domain.model.MessagePriority;
import com.z254.lumina.tutor.domain.model.MessageType;
import com.z254.lumina.tutor.domain.model.TutorResponse;
import com.z254.lumina.tutor.domain.payload.AgentContribution;
import com.z254.lumina.tutor.domain.payload.AgentErrorPayload;
import com.z254.lumina.tutor.domain.payload.AgentPayload;
import com.z254.lumina.tutor.domain.payload.LearningEventNotification;
import com.z254.lumina.tutor.domain.payload.ProcessQueryRequest;
import com.z254.lumina.tutor.domain.payload.ProcessedQuery;
import com.z254.lumina.tutor.observability.StructuredLogger;
import com.z254.lumina.tutor.observability.TutorEventPublisher;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Implementation of the TutorOrchestrator interface.
 *
 * <p>A query first goes to the conversation agent for analysis. The resulting plan is run stage
 * by stage: calls within a stage are concurrent, and a stage starts only once every call of the
 * previous stage has succeeded or failed. Failing agents are left out of the response; a failing
 * conversation agent fails the whole query.
 */
@Service
@Slf4j
public class TutorOrchestratorImpl implements TutorOrchestrator {

    private final MessageBus messageBus;
    private final AgentRegistry agentRegistry;
    private final McpServiceLayer mcpService;
    private final QueryPlanner queryPlanner;
    private final ResponseSynthesizer responseSynthesizer;
    private final TutorEventPublisher events;
    private final StructuredLogger structuredLogger;
    private final OrchestratorMetrics metrics;
    private final TutorProperties.OrchestratorProperties properties;

    private final ResponseCorrelator correlator = new ResponseCorrelator();
    private final Map<AgentType, Instant> lastHeartbeats = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean();
    private final MessageHandler handler = this::handleMessage;

    public TutorOrchestratorImpl(
            MessageBus messageBus,
            AgentRegistry agentRegistry,
            McpServiceLayer mcpService,
            QueryPlanner queryPlanner,
            ResponseSynthesizer responseSynthesizer,
            TutorEventPublisher events,
            StructuredLogger structuredLogger,
            OrchestratorMetrics metrics,
            TutorProperties tutorProperties) {
        this.messageBus = messageBus;
        this.agentRegistry = agentRegistry;
        this.mcpService = mcpService;
        this.queryPlanner = queryPlanner;
        this.responseSynthesizer = responseSynthesizer;
        this.events = events;
        this.structuredLogger = structuredLogger;
        this.metrics = metrics;
        this.properties = tutorProperties.getOrchestrator();
    }

    // --------------------------------------------------------------------------------------------
    // Query processing
    // --------------------------------------------------------------------------------------------

    @Override
    public Mono<TutorResponse> processQuery(String text, ConversationContext context) {
        return Mono.defer(() -> {
            QueryExecution execution = new QueryExecution("req_" + UUID.randomUUID(), text, context,
                    System.currentTimeMillis());

            structuredLogger.setQueryContext(execution.requestId,
                    context != null ? context.getUserId() : null,
                    context != null ? context.getSessionId() : null);
            log.info("Processing query {}", execution.requestId);
            structuredLogger.clearContext();

            return analyseQuery(execution)
                    .flatMap(processed -> {
                        execution.processedQuery = processed;
                        ExecutionPlan plan = queryPlanner.plan(execution.requestId, processed);
                        log.debug("Execution plan for {}: {}", execution.requestId, plan.stages());
                        return executePlan(execution, plan)
                                .then(Mono.fromCallable(() -> responseSynthesizer.synthesize(execution.requestId,
                                        processed, execution.results, execution.failed, execution.startedAt)));
                    })
                    .doOnNext(response -> {
                        TutorResponse.Metadata metadata = response.getMetadata();
                        metrics.recordQuery(metadata.getProcessingTimeMs(), false);
                        events.publish(TutorEventPublisher.QUERY_PROCESSED,
                                "requestId", execution.requestId,
                                "type", response.getType(),
                                "agentsInvolved", metadata.getAgentsInvolved(),
                                "failedAgents", metadata.getFailedAgents(),
                                "confidence", metadata.getConfidence(),
                                "processingTimeMs", metadata.getProcessingTimeMs());
                    })
                    .onErrorResume(e -> {
                        log.error("Query {} failed: {}", execution.requestId, e.getMessage());
                        TutorResponse degraded = responseSynthesizer.degraded(execution.requestId,
                                execution.failed, execution.startedAt);
                        metrics.recordQuery(degraded.getMetadata().getProcessingTimeMs(), true);
                        events.publish(TutorEventPublisher.QUERY_FAILED,
                                "requestId", execution.requestId,
                                "error", e.getMessage(),
                                "failedAgents", degraded.getMetadata().getFailedAgents());
                        return Mono.just(degraded);
                    });
        });
    }

    @Override
    public Mono<Void> publishLearningEvent(LearningEventNotification event) {
        return messageBus.route(AgentMessage.notification(AgentType.ORCHESTRATOR, AgentType.ORCHESTRATOR, event));
    }

    private Mono<ProcessedQuery> analyseQuery(QueryExecution execution) {
        ProcessQueryRequest request = new ProcessQueryRequest(execution.text, execution.context);
        return call(execution, AgentType.CONVERSATION, request)
                .flatMap(payload -> payload instanceof ProcessedQuery processed
                        ? Mono.just(processed)
                        : Mono.error(new AgentException(ErrorCode.PROCESSING_ERROR, AgentType.CONVERSATION, null,
                                "Expected a query analysis but got " + payload.operation())))
                .onErrorMap(e -> {
                    execution.failed.add(AgentType.CONVERSATION);
                    return new AgentException(ErrorCode.CRITICAL_PATH_FAILURE, AgentType.CONVERSATION, null,
                            "Query analysis failed: " + e.getMessage(), e);
                });
    }

    private Mono<Void> executePlan(QueryExecution execution, ExecutionPlan plan) {
        return Flux.fromIterable(plan.stages())
                .concatMap(stage -> executeStage(execution, stage))
                .then();
    }

    /**
     * Run one stage and wait for every member to settle.
     */
    private Mono<Void> executeStage(QueryExecution execution, Set<AgentType> stage) {
        Map<AgentType, AgentContribution> previous = Map.copyOf(execution.results);
        log.debug("Query {} dispatching stage {}", execution.requestId, stage);

        return Flux.fromIterable(stage)
                .flatMap(agentType -> {
                    AgentPayload payload = queryPlanner.payloadFor(agentType, execution.text,
                            execution.processedQuery, execution.context, previous);
                    return call(execution, agentType, payload)
                            .flatMap(result -> result instanceof AgentContribution contribution
                                    ? Mono.just(contribution)
                                    : Mono.error(new AgentException(ErrorCode.PROCESSING_ERROR, agentType, null,
                                            "Unexpected result " + result.operation())))
                            .doOnNext(contribution -> execution.results.put(agentType, contribution))
                            .then()
                            .onErrorResume(e -> {
                                recordAgentFailure(execution, agentType, e);
                                return Mono.empty();
                            });
                })
                .then(Mono.defer(() -> execution.failed.contains(AgentType.CONVERSATION)
                        ? Mono.error(new AgentException(ErrorCode.CRITICAL_PATH_FAILURE, AgentType.CONVERSATION,
                                null, "Conversation agent failed for " + execution.requestId))
                        : Mono.empty()));
    }

    /**
     * Send a request and wait for the correlated response. An error payload fails the call.
     */
    private Mono<AgentPayload> call(QueryExecution execution, AgentType agentType, AgentPayload payload) {
        Duration timeout = agentType == AgentType.CONVERSATION
                ? properties.getConversationTimeout()
                : properties.getAgentTimeout();
        String correlationId = execution.requestId + ":" + agentType + ":"
                + payload.operation().name().toLowerCase(Locale.ROOT);

        AgentMessage request = AgentMessage.request(AgentType.ORCHESTRATOR, agentType, payload, correlationId,
                MessagePriority.HIGH);
        request.setTimeout(timeout);

        return correlator.sendAndAwait(correlationId, timeout, messageBus.route(request))
                .flatMap(response -> response.getPayload() instanceof AgentErrorPayload error
                        ? Mono.error(new AgentException(error.code(), agentType, request.getId(), error.message()))
                        : Mono.just(response.getPayload()));
    }

    private void recordAgentFailure(QueryExecution execution, AgentType agentType, Throwable error) {
        execution.failed.add(agentType);
        log.warn("Query {}: {} failed and is excluded: {}", execution.requestId, agentType, error.getMessage());
        if (!(error instanceof AgentException)) {
            // timeouts and delivery failures are invisible to the agent itself
            events.publish(TutorEventPublisher.AGENT_ERROR,
                    "requestId", execution.requestId,
                    "agentType", agentType,
                    "error", error.getMessage());
        }
    }

    // --------------------------------------------------------------------------------------------
    // Inbound messages
    // --------------------------------------------------------------------------------------------

    private Mono<Void> handleMessage(AgentMessage message) {
        return switch (message.getType()) {
            case RESPONSE -> {
                if (!correlator.complete(message)) {
                    metrics.recordLateResponse();
                }
                yield Mono.empty();
            }
            case ERROR -> {
                if (message.getPayload() instanceof AgentErrorPayload error) {
                    log.debug("{} reported {} for {}: {}", message.getSender(), error.code(),
                            message.getCorrelationId(), error.message());
                }
                yield Mono.empty();
            }
            case HEARTBEAT -> {
                lastHeartbeats.put(message.getSender(), message.getTimestamp());
                yield Mono.empty();
            }
            case NOTIFICATION -> message.getPayload() instanceof LearningEventNotification event
                    ? handleLearningEvent(event)
                    : Mono.empty();
            case REQUEST, TASK_ASSIGNMENT -> {
                log.debug("Ignoring {} addressed to the orchestrator", message.getType());
                yield Mono.empty();
            }
        };
    }

    private Mono<Void> handleLearningEvent(LearningEventNotification event) {
        Map<String, Object> data = new LinkedHashMap<>(event.data());
        if (event.userId() != null) {
            data.put("userId", event.userId());
        }
        return switch (event.event()) {
            case "learning_milestone_reached" -> {
                events.publish(TutorEventPublisher.LEARNING_MILESTONE, data);
                yield mcpService.trackEvent(event.event(), data);
            }
            case "concept_mastered" -> {
                events.publish(TutorEventPublisher.CONCEPT_MASTERED, data);
                yield Mono.empty();
            }
            case "study_session_completed" -> mcpService.trackEvent(event.event(), data);
            default -> {
                log.debug("Unhandled learning event {}", event.event());
                yield Mono.empty();
            }
        };
    }

    // --------------------------------------------------------------------------------------------
    // Lifecycle
    // --------------------------------------------------------------------------------------------

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.isAutoStart()) {
            start().subscribe(
                    null,
                    e -> log.error("Failed to start orchestrator: {}", e.getMessage()));
        }
    }

    @Override
    public Mono<Void> start() {
        return Mono.defer(() -> {
            if (!started.compareAndSet(false, true)) {
                return Mono.empty();
            }
            setupRouting();
            messageBus.subscribe(AgentType.ORCHESTRATOR, handler);

            return Flux.fromIterable(agentRegistry.getAll())
                    .flatMap(agent -> agent.initialize()
                            .onErrorResume(e -> {
                                log.warn("{} agent did not start: {}", agent.getAgentType(), e.getMessage());
                                return Mono.empty();
                            }))
                    .then(Mono.fromRunnable(() -> {
                        List<String> issues = messageBus.validateRoutingTable();
                        issues.forEach(issue -> log.warn("Routing: {}", issue));
                        log.info("Orchestrator started with {} agents", agentRegistry.getAll().size());
                    }));
        });
    }

    @PreDestroy
    @Override
    public void shutdown() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        agentRegistry.getAll().forEach(Agent::shutdown);
        messageBus.unsubscribe(AgentType.ORCHESTRATOR, handler);
        log.info("Orchestrator shut down");
    }

    @Override
    public boolean isStarted() {
        return started.get();
    }

    @Scheduled(fixedDelayString = "${tutor.orchestrator.health-sweep-interval:PT30S}")
    public void scheduledHealthSweep() {
        if (started.get()) {
            runHealthSweep().subscribe(
                    null,
                    e -> log.warn("Health sweep failed: {}", e.getMessage()));
        }
    }

    @Override
    public Mono<Void> runHealthSweep() {
        Mono<Void> serviceCheck = mcpService.getHealth()
                .doOnNext(health -> {
                    if (!health.isHealthy()) {
                        log.warn("Service layer reports status {}", health.status());
                    }
                })
                .onErrorResume(e -> {
                    events.publish(TutorEventPublisher.HEALTH_CHECK_FAILED,
                            "component", "mcp", "error", e.getMessage());
                    return Mono.empty();
                })
                .then();

        Mono<Void> agentChecks = Flux.fromIterable(agentRegistry.getAll())
                .flatMap(agent -> agent.healthCheck()
                        .doOnNext(healthy -> {
                            if (!healthy) {
                                events.publish(TutorEventPublisher.AGENT_UNHEALTHY,
                                        "agentType", agent.getAgentType(),
                                        "state", agent.getState());
                            }
                        })
                        .onErrorResume(e -> {
                            events.publish(TutorEventPublisher.HEALTH_CHECK_FAILED,
                                    "agentType", agent.getAgentType(), "error", e.getMessage());
                            return Mono.empty();
                        }))
                .then();

        return serviceCheck.then(agentChecks);
    }

    // --------------------------------------------------------------------------------------------
    // Status
    // --------------------------------------------------------------------------------------------

    @Override
    public List<AgentStatus> getAgentStatuses() {
        return agentRegistry.getAll().stream()
                .sorted((a, b) -> a.getAgentType().compareTo(b.getAgentType()))
                .map(agent -> new AgentStatus(agent.getAgentType(), agent.getState(), agent.getMetrics(),
                        lastHeartbeats.get(agent.getAgentType())))
                .toList();
    }

    @Override
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>(metrics.snapshot());
        stats.put("started", started.get());
        stats.put("pendingRequests", correlator.pendingCount());
        stats.put("registeredAgents", agentRegistry.getAll().size());
        stats.put("bus", messageBus.getStats());
        return stats;
    }

    ResponseCorrelator getCorrelator() {
        return correlator;
    }

    // ========== Private Methods ==========

    private void setupRouting() {
        Set<AgentType> workers = EnumSet.copyOf(AgentType.workers());
        messageBus.setupRouting(MessageType.REQUEST, workers);
        messageBus.setupRouting(MessageType.TASK_ASSIGNMENT, workers);
        messageBus.setupRouting(MessageType.RESPONSE, EnumSet.of(AgentType.ORCHESTRATOR));
        messageBus.setupRouting(MessageType.ERROR, EnumSet.of(AgentType.ORCHESTRATOR));
        messageBus.setupRouting(MessageType.HEARTBEAT, EnumSet.of(AgentType.ORCHESTRATOR));
        messageBus.setupRouting(MessageType.NOTIFICATION, EnumSet.allOf(AgentType.class));
    }

    /**
     * Mutable state of one query while its plan runs.
     */
    private static final class QueryExecution {
        private final String requestId;
        private final String text;
        private final ConversationContext context;
        private final long startedAt;
        private final Map<AgentType, AgentContribution> results = new ConcurrentHashMap<>();
        private final Set<AgentType> failed = ConcurrentHashMap.newKeySet();
        private volatile ProcessedQuery processedQuery;

        private QueryExecution(String requestId, String text, ConversationContext context, long startedAt) {
            this.requestId = requestId;
            this.text = text;
            this.context = context;
            this.startedAt = startedAt;
        }
    }
}
