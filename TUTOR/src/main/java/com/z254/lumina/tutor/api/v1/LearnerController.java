package com.z254.lumina.tutor.api.v1;

import com.z254.lumina.tutor.adaptive.AdaptiveEngine;
import com.z254.lumina.tutor.api.dto.ContentRequest;
import com.z254.lumina.tutor.api.dto.InteractionRequest;
import com.z254.lumina.tutor.api.dto.LearningEventRequest;
import com.z254.lumina.tutor.domain.model.BayesianBeliefs;
import com.z254.lumina.tutor.domain.model.ConceptAnalysis;
import com.z254.lumina.tutor.domain.model.GeneratedContent;
import com.z254.lumina.tutor.domain.model.Modality;
import com.z254.lumina.tutor.domain.model.ModalityRecommendation;
import com.z254.lumina.tutor.domain.model.UserAnalytics;
import com.z254.lumina.tutor.domain.payload.LearningEventNotification;
import com.z254.lumina.tutor.orchestration.TutorOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * REST controller for per-learner adaptation.
 */
@RestController
@RequestMapping("/api/v1/learners/{userId}")
@Tag(name = "Learners", description = "Adaptive content, interactions and learner analytics")
@Slf4j
public class LearnerController {

    private final AdaptiveEngine adaptiveEngine;
    private final TutorOrchestrator orchestrator;

    public LearnerController(AdaptiveEngine adaptiveEngine, TutorOrchestrator orchestrator) {
        this.adaptiveEngine = adaptiveEngine;
        this.orchestrator = orchestrator;
    }

    @GetMapping("/recommendation")
    @Operation(summary = "Recommend a modality", description = "Best modality for a concept, with fallbacks")
    public ModalityRecommendation recommendation(
            @Parameter(description = "Learner ID") @PathVariable String userId,
            @Parameter(description = "Concept to present") @RequestParam String concept) {
        return adaptiveEngine.getRecommendation(userId, concept,
                ConceptAnalysis.builder().topic(concept).build());
    }

    @GetMapping("/alternative")
    @Operation(summary = "Suggest an alternative",
               description = "Best-ranked modality other than the one the learner is on")
    public Modality alternative(
            @Parameter(description = "Learner ID") @PathVariable String userId,
            @RequestParam String concept,
            @RequestParam Modality current) {
        return adaptiveEngine.suggestAlternativeModality(userId, concept, current);
    }

    @PostMapping("/interactions")
    @Operation(summary = "Record an interaction", description = "Update the learner model and return new beliefs")
    @ApiResponse(responseCode = "200", description = "Beliefs updated")
    public BayesianBeliefs recordInteraction(
            @Parameter(description = "Learner ID") @PathVariable String userId,
            @Valid @RequestBody InteractionRequest request) {
        return adaptiveEngine.recordUserInteraction(request.toInteraction(userId));
    }

    @GetMapping("/analytics")
    @Operation(summary = "Learner analytics",
               description = "Beliefs, confidence intervals, patterns and recent adaptations")
    public UserAnalytics analytics(@Parameter(description = "Learner ID") @PathVariable String userId) {
        return adaptiveEngine.getUserAnalytics(userId);
    }

    @PostMapping("/content")
    @Operation(summary = "Generate adaptive content",
               description = "Generate content in the best modality, falling back on failure, and start the confusion timer")
    @ApiResponse(responseCode = "201", description = "Content generated")
    @ApiResponse(responseCode = "502", description = "Every candidate modality failed")
    public Mono<ResponseEntity<GeneratedContent>> generateContent(
            @Parameter(description = "Learner ID") @PathVariable String userId,
            @Valid @RequestBody ContentRequest request) {
        log.info("Generating adaptive content on '{}' for {}", request.getTopic(), userId);
        return adaptiveEngine.generateAdaptiveContent(request.toQuery(userId), request.toAnalysis(), userId)
                .doOnNext(content -> adaptiveEngine.startAdaptiveSession(userId, content.getId()))
                .map(content -> ResponseEntity.status(HttpStatus.CREATED).body(content));
    }

    @PostMapping("/content/{contentId}/deeper")
    @Operation(summary = "Go deeper", description = "Regenerate the content one level harder")
    @ApiResponse(responseCode = "404", description = "Unknown content")
    public Mono<GeneratedContent> goDeeper(
            @PathVariable String userId,
            @Parameter(description = "Content ID") @PathVariable String contentId) {
        return adaptiveEngine.progressDeeper(userId, contentId);
    }

    @PostMapping("/content/{contentId}/simpler")
    @Operation(summary = "Simplify", description = "Regenerate the content one level easier")
    @ApiResponse(responseCode = "404", description = "Unknown content")
    public Mono<GeneratedContent> goSimpler(
            @PathVariable String userId,
            @Parameter(description = "Content ID") @PathVariable String contentId) {
        return adaptiveEngine.goSimpler(userId, contentId);
    }

    @DeleteMapping("/content/{contentId}/session")
    @Operation(summary = "End session", description = "Cancel the confusion timer for the content")
    @ApiResponse(responseCode = "204", description = "Session ended")
    public ResponseEntity<Void> endSession(@PathVariable String userId, @PathVariable String contentId) {
        adaptiveEngine.stopAdaptiveSession(userId, contentId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/events")
    @Operation(summary = "Report a learning event",
               description = "Publish learning_milestone_reached, concept_mastered or study_session_completed")
    @ApiResponse(responseCode = "202", description = "Event accepted")
    public Mono<ResponseEntity<Void>> learningEvent(
            @PathVariable String userId,
            @Valid @RequestBody LearningEventRequest request) {
        return orchestrator.publishLearningEvent(
                        new LearningEventNotification(request.getEvent(), userId, request.getData()))
                .then(Mono.just(ResponseEntity.accepted().<Void>build()));
    }
}
