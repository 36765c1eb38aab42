package dev.newsroom.controller;

import dev.newsroom.dto.SubmitTranslationRequest;
import dev.newsroom.dto.TranslationDraftRequest;
import dev.newsroom.dto.TranslationResponse;
import dev.newsroom.dto.TranslationReviewRequest;
import dev.newsroom.entity.StaffUser;
import dev.newsroom.service.TranslationWorkflowService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/translations")
@RequiredArgsConstructor
@Tag(name = "Translations", description = "Per-language translation work and review")
@SecurityRequirement(name = "staffId")
@Slf4j
public class TranslationController {

    private final TranslationWorkflowService translationWorkflowService;

    @GetMapping("/mine")
    @Operation(summary = "My translation assignments")
    public Mono<List<TranslationResponse>> getMyAssignments(@AuthenticationPrincipal StaffUser staff) {
        return translationWorkflowService.translationsForTranslator(staff.getId())
                .map(TranslationResponse::from)
                .collectList();
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get translation assignment")
    public Mono<TranslationResponse> getTranslation(@PathVariable Long id) {
        return translationWorkflowService.getTranslation(id).map(TranslationResponse::from);
    }

    /**
     * Saves the translated draft; the first call creates the translated story.
     */
    @PutMapping("/{id}/draft")
    @Operation(summary = "Save translation draft", description = "Moves the assignment to IN_PROGRESS")
    public Mono<TranslationResponse> saveDraft(@AuthenticationPrincipal StaffUser staff,
                                               @PathVariable Long id,
                                               @Valid @RequestBody TranslationDraftRequest request) {
        log.info("Saving translation draft: id={}, staff={}", id, staff.getId());
        return translationWorkflowService.startWork(id, staff.getId(), request).map(TranslationResponse::from);
    }

    @PostMapping("/{id}/submit")
    @Operation(summary = "Submit for review", description = "Reviewer is picked automatically when none is given")
    public Mono<TranslationResponse> submitForReview(@AuthenticationPrincipal StaffUser staff,
                                                     @PathVariable Long id,
                                                     @RequestBody(required = false) SubmitTranslationRequest request) {
        Long reviewerId = request != null ? request.getReviewerId() : null;
        log.info("Submitting translation: id={}, reviewer={}, staff={}", id, reviewerId, staff.getId());
        return translationWorkflowService.submitForReview(id, staff.getId(), reviewerId, null, null)
                .map(TranslationResponse::from);
    }

    @PostMapping("/{id}/review")
    @Operation(summary = "Review translation", description = "Rejection requires notes")
    public Mono<TranslationResponse> review(@AuthenticationPrincipal StaffUser staff,
                                            @PathVariable Long id,
                                            @Valid @RequestBody TranslationReviewRequest request) {
        log.info("Reviewing translation: id={}, approve={}, staff={}", id, request.getApprove(), staff.getId());
        return translationWorkflowService.review(id, staff.getId(), request.getApprove(), request.getNotes(), null, null)
                .map(TranslationResponse::from);
    }
}
