package com.z254.lumina.tutor.agent;

import com.z254.lumina.tutor.client.McpServiceLayer;
import com.z254.lumina.tutor.config.TutorProperties;
import com.z254.lumina.tutor.domain.model.AgentCapabilities;
import com.z254.lumina.tutor.domain.model.AgentConfig;
import com.z254.lumina.tutor.domain.model.AgentMessage;
import com.z254.lumina.tutor.domain.model.AgentState;
import com.z254.lumina.tutor.domain.model.AgentType;
import com.z254.lumina.tutor.domain.model.ErrorCode;
import com.z254.lumina.tutor.domain.model.MessageType;
import com.z254.lumina.tutor.domain.payload.AgentErrorPayload;
import com.z254.lumina.tutor.domain.payload.AgentPayload;
import com.z254.lumina.tutor.domain.payload.Heartbeat;
import com.z254.lumina.tutor.observability.TutorEventPublisher;
import com.z254.lumina.tutor.orchestration.MessageBus;
import com.z254.lumina.tutor.orchestration.MessageHandler;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class of every tutoring agent.
 *
 * <p>An agent subscribes to the {@link MessageBus} under its {@link AgentType}, validates each
 * inbound message, runs {@link #processMessage} under a deadline and answers requests. At most
 * {@link AgentConfig#getMaxConcurrentTasks()} messages are processed at once; the rest queue and
 * their wait counts against the deadline. Handling failures are converted to
 * {@link AgentException}s, answered with an {@link AgentErrorPayload} and reported to the
 * orchestrator; they never propagate to the bus.
 *
 * <p>Lifecycle: UNINITIALIZED → INITIALIZING → HEALTHY ⇄ UNHEALTHY → SHUTDOWN.
 */
@Slf4j
public abstract class Agent {

    private static final Set<MessageType> HANDLED_TYPES =
            EnumSet.of(MessageType.REQUEST, MessageType.NOTIFICATION, MessageType.TASK_ASSIGNMENT);

    protected final AgentType agentType;
    protected final AgentConfig config;
    protected final MessageBus messageBus;
    protected final McpServiceLayer mcpService;
    protected final TutorEventPublisher events;

    private final AgentMetrics metrics;
    private final AtomicReference<AgentState> state = new AtomicReference<>(AgentState.UNINITIALIZED);
    private final ConcurrencyLimiter taskLimiter;
    private final MessageHandler handler = this::handleMessage;

    private volatile Disposable healthCheckTask;
    private volatile Disposable heartbeatTask;

    protected Agent(AgentType agentType, AgentConfig config, MessageBus messageBus,
                    McpServiceLayer mcpService, TutorEventPublisher events, int latencyWindow) {
        this.agentType = agentType;
        this.config = config;
        this.messageBus = messageBus;
        this.mcpService = mcpService;
        this.events = events;
        this.metrics = new AgentMetrics(latencyWindow);
        this.taskLimiter = new ConcurrencyLimiter(config.getMaxConcurrentTasks());
    }

    /**
     * Agent configuration from the shared agent properties.
     */
    protected static AgentConfig configFrom(TutorProperties properties, String... requiredTools) {
        TutorProperties.AgentProperties agentProperties = properties.getAgent();
        return AgentConfig.builder()
                .maxConcurrentTasks(agentProperties.getMaxConcurrentTasks())
                .timeout(agentProperties.getDefaultTimeout())
                .healthCheckInterval(agentProperties.getHealthCheckInterval())
                .heartbeatInterval(agentProperties.getHeartbeatInterval())
                .requiredTools(List.of(requiredTools))
                .build();
    }

    /**
     * Produce the response to a validated message. May complete empty for notifications and
     * task assignments.
     */
    public abstract Mono<AgentMessage> processMessage(AgentMessage message);

    public abstract AgentCapabilities getCapabilities();

    /**
     * Agent-specific setup, run during {@link #initialize()}.
     */
    protected Mono<Void> initializeAgent() {
        return Mono.empty();
    }

    /**
     * Agent-specific part of {@link #healthCheck()}.
     */
    protected Mono<Boolean> performHealthCheck() {
        return Mono.just(true);
    }

    protected void shutdownAgent() {
    }

    // --------------------------------------------------------------------------------------------
    // Lifecycle
    // --------------------------------------------------------------------------------------------

    /**
     * Subscribe to the bus, run setup, check required tools and start the periodic health check
     * and heartbeat. May only be called on an uninitialized agent.
     */
    public Mono<Void> initialize() {
        return Mono.defer(() -> {
            if (!state.compareAndSet(AgentState.UNINITIALIZED, AgentState.INITIALIZING)) {
                return Mono.error(new IllegalStateException(
                        agentType + " agent cannot be initialized in state " + state.get()));
            }

            messageBus.subscribe(agentType, handler);
            return initializeAgent()
                    .then(validateRequiredTools())
                    .doOnSuccess(v -> {
                        metrics.markStarted();
                        state.set(AgentState.HEALTHY);
                        startPeriodicTasks();
                        events.publish(TutorEventPublisher.AGENT_INITIALIZED, "agentType", agentType);
                        log.info("Initialized {} agent", agentType);
                    })
                    .onErrorResume(e -> {
                        messageBus.unsubscribe(agentType, handler);
                        state.set(AgentState.UNINITIALIZED);
                        events.publish(TutorEventPublisher.AGENT_INIT_FAILED,
                                "agentType", agentType, "error", e.getMessage());
                        log.error("Failed to initialize {} agent: {}", agentType, e.getMessage());
                        return Mono.error(e instanceof AgentException
                                ? e
                                : new AgentException(ErrorCode.SERVICE_CONNECTION_FAILED, agentType, null,
                                        e.getMessage(), e));
                    });
        });
    }

    public void shutdown() {
        AgentState previous = state.getAndSet(AgentState.SHUTDOWN);
        if (previous == AgentState.SHUTDOWN) {
            return;
        }
        dispose(healthCheckTask);
        dispose(heartbeatTask);
        messageBus.unsubscribe(agentType, handler);
        shutdownAgent();
        log.info("Shut down {} agent", agentType);
    }

    /**
     * Initialized, every required tool reported up by the service layer, and the agent-specific
     * check passes. Moves the agent between HEALTHY and UNHEALTHY.
     */
    public Mono<Boolean> healthCheck() {
        if (!state.get().isInitialized()) {
            return Mono.just(false);
        }
        return mcpService.getHealth()
                .map(health -> config.getRequiredTools().stream().allMatch(health::isServiceUp))
                .onErrorReturn(false)
                .flatMap(baseHealthy -> baseHealthy
                        ? performHealthCheck().onErrorReturn(false)
                        : Mono.just(false))
                .doOnNext(this::updateHealth);
    }

    // --------------------------------------------------------------------------------------------
    // Message handling
    // --------------------------------------------------------------------------------------------

    /**
     * Bus entry point. Completes normally even when handling fails.
     */
    public Mono<Void> handleMessage(AgentMessage message) {
        long started = System.nanoTime();
        String messageId = message != null ? message.getId() : null;

        return Mono.defer(() -> {
                    validateMessage(message);
                    ensureCanHandle(message);
                    Duration timeout = message.getTimeout() != null ? message.getTimeout() : config.getTimeout();
                    return taskLimiter.run(() -> processMessage(message))
                            .timeout(timeout, Mono.error(() -> new AgentException(ErrorCode.TIMEOUT, agentType,
                                    messageId, agentType + " timed out after " + timeout.toMillis() + "ms")))
                            .switchIfEmpty(message.getType() == MessageType.REQUEST
                                    ? Mono.error(() -> new AgentException(ErrorCode.PROCESSING_ERROR, agentType,
                                            messageId, agentType + " produced no response"))
                                    : Mono.empty());
                })
                .doOnNext(response -> metrics.recordSuccess(elapsedMs(started)))
                .flatMap(response -> message.getType() == MessageType.REQUEST
                        ? send(response)
                        : Mono.<Void>empty())
                .onErrorResume(e -> handleError(message, AgentException.from(e, agentType, messageId), started));
    }

    /**
     * Build a response to {@code request} from this agent.
     */
    protected AgentMessage respond(AgentMessage request, AgentPayload payload) {
        AgentMessage response = AgentMessage.response(request, payload);
        response.setSender(agentType);
        return response;
    }

    // --------------------------------------------------------------------------------------------
    // Accessors
    // --------------------------------------------------------------------------------------------

    public AgentType getAgentType() {
        return agentType;
    }

    public AgentConfig getConfig() {
        return config;
    }

    public AgentState getState() {
        return state.get();
    }

    public AgentMetrics.Snapshot getMetrics() {
        return metrics.snapshot();
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private Mono<Void> handleError(AgentMessage message, AgentException error, long started) {
        metrics.recordError(elapsedMs(started));
        String messageId = message != null ? message.getId() : null;
        log.error("{} agent failed handling {}: [{}] {}", agentType, messageId, error.getCode(), error.getMessage());
        events.publish(TutorEventPublisher.AGENT_ERROR,
                "agentType", agentType,
                "messageId", messageId,
                "code", error.getCode(),
                "error", error.getMessage());

        if (message == null) {
            return Mono.empty();
        }

        AgentErrorPayload payload = new AgentErrorPayload(agentType, error.getCode(), error.getMessage(),
                error.isRetryable(), messageId);

        Mono<Void> reply = message.getType() == MessageType.REQUEST && message.getSender() != null
                ? send(respond(message, payload))
                : Mono.empty();
        Mono<Void> report = send(AgentMessage.error(agentType, AgentType.ORCHESTRATOR, payload,
                message.getCorrelationId()));
        return reply.then(report);
    }

    private Mono<Void> send(AgentMessage message) {
        return messageBus.route(message)
                .onErrorResume(e -> {
                    log.warn("{} agent could not deliver {} to {}: {}",
                            agentType, message.getType(), message.getRecipient(), e.getMessage());
                    return Mono.empty();
                });
    }

    private void validateMessage(AgentMessage message) {
        String problem = null;
        if (message == null) {
            problem = "Message is null";
        } else if (message.getId() == null) {
            problem = "Message id is missing";
        } else if (message.getTimestamp() == null) {
            problem = "Message timestamp is missing";
        } else if (message.getSender() == null) {
            problem = "Message sender is missing";
        } else if (message.getType() == null) {
            problem = "Message type is missing";
        } else if (message.getPayload() == null) {
            problem = "Message payload is missing";
        }
        if (problem != null) {
            throw new AgentException(ErrorCode.INVALID_MESSAGE, agentType,
                    message != null ? message.getId() : null, problem);
        }
    }

    private void ensureCanHandle(AgentMessage message) {
        if (!HANDLED_TYPES.contains(message.getType())) {
            throw new AgentException(ErrorCode.UNSUPPORTED_OPERATION, agentType, message.getId(),
                    agentType + " does not handle " + message.getType() + " messages");
        }
        if (!getCapabilities().supports(message.getPayload().operation())) {
            throw new AgentException(ErrorCode.UNSUPPORTED_OPERATION, agentType, message.getId(),
                    agentType + " does not support " + message.getPayload().operation());
        }
    }

    private Mono<Void> validateRequiredTools() {
        List<String> required = config.getRequiredTools();
        if (required == null || required.isEmpty()) {
            return Mono.empty();
        }
        return mcpService.getHealth()
                .onErrorMap(e -> new AgentException(ErrorCode.SERVICE_CONNECTION_FAILED, agentType, null,
                        "Service layer unreachable: " + e.getMessage(), e))
                .flatMap(health -> {
                    List<String> missing = required.stream()
                            .filter(tool -> !health.isServiceUp(tool))
                            .toList();
                    if (!missing.isEmpty()) {
                        return Mono.error(new AgentException(ErrorCode.SERVICE_CONNECTION_FAILED, agentType, null,
                                "Required tools not available: " + missing));
                    }
                    return Mono.<Void>empty();
                });
    }

    private void startPeriodicTasks() {
        healthCheckTask = Flux.interval(config.getHealthCheckInterval())
                .concatMap(tick -> healthCheck().onErrorReturn(false))
                .subscribe();
        heartbeatTask = Flux.interval(config.getHeartbeatInterval())
                .concatMap(tick -> sendHeartbeat())
                .subscribe();
    }

    private Mono<Void> sendHeartbeat() {
        AgentMetrics.Snapshot snapshot = metrics.snapshot();
        return send(AgentMessage.heartbeat(agentType,
                new Heartbeat(state.get(), snapshot.messageCount(), snapshot.errorCount())));
    }

    private void updateHealth(boolean healthy) {
        if (healthy) {
            if (state.compareAndSet(AgentState.UNHEALTHY, AgentState.HEALTHY)) {
                log.info("{} agent recovered", agentType);
            }
        } else if (state.compareAndSet(AgentState.HEALTHY, AgentState.UNHEALTHY)) {
            log.warn("{} agent is unhealthy", agentType);
        }
    }

    private static void dispose(Disposable task) {
        if (task != null) {
            task.dispose();
        }
    }

    private static long elapsedMs(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }
}
