package dev.newsroom.controller;

import dev.newsroom.dto.SubmitTranslationRequest;
import dev.newsroom.dto.TranslationDraftRequest;
import dev.newsroom.dto.TranslationReviewRequest;
import dev.newsroom.entity.StaffUser;
import dev.newsroom.entity.Translation;
import dev.newsroom.exception.ValidationFailedException;
import dev.newsroom.service.TranslationWorkflowService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TranslationControllerTest {

    @Mock
    private TranslationWorkflowService translationWorkflowService;

    @InjectMocks
    private TranslationController controller;

    private final StaffUser translator = StaffUser.builder().id(21L).staffRole("JOURNALIST").translationLanguage("XHOSA").build();
    private final StaffUser subEditor = StaffUser.builder().id(4L).staffRole("SUB_EDITOR").build();

    private static Translation translation(String status) {
        return Translation.builder().id(800L).originalStoryId(100L).translatedStoryId(900L)
                .targetLanguage("XHOSA").assignedToId(21L).status(status).build();
    }

    @Test
    @DisplayName("GET /api/v1/translations/mine lists the caller's assignments")
    void shouldListMine() {
        when(translationWorkflowService.translationsForTranslator(21L)).thenReturn(Flux.just(translation("PENDING")));

        StepVerifier.create(controller.getMyAssignments(translator))
                .assertNext(list -> assertThat(list).singleElement()
                        .satisfies(response -> assertThat(response.getTargetLanguage()).isEqualTo("XHOSA")))
                .verifyComplete();
    }

    @Test
    @DisplayName("PUT /api/v1/translations/{id}/draft starts work")
    void shouldSaveDraft() {
        TranslationDraftRequest draft = TranslationDraftRequest.builder().title("Isiqhankqalazo").build();
        when(translationWorkflowService.startWork(800L, 21L, draft)).thenReturn(Mono.just(translation("IN_PROGRESS")));

        StepVerifier.create(controller.saveDraft(translator, 800L, draft))
                .assertNext(response -> {
                    assertThat(response.getStatus()).isEqualTo("IN_PROGRESS");
                    assertThat(response.getTranslatedStoryId()).isEqualTo("900");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("POST /api/v1/translations/{id}/submit without a body picks a reviewer")
    void shouldSubmitWithoutBody() {
        when(translationWorkflowService.submitForReview(eq(800L), eq(21L), isNull(), isNull(), isNull()))
                .thenReturn(Mono.just(translation("NEEDS_REVIEW")));

        StepVerifier.create(controller.submitForReview(translator, 800L, null))
                .assertNext(response -> assertThat(response.getStatus()).isEqualTo("NEEDS_REVIEW"))
                .verifyComplete();
    }

    @Test
    @DisplayName("POST /api/v1/translations/{id}/submit passes an explicit reviewer")
    void shouldSubmitToReviewer() {
        when(translationWorkflowService.submitForReview(eq(800L), eq(21L), eq(4L), isNull(), isNull()))
                .thenReturn(Mono.just(translation("NEEDS_REVIEW")));

        StepVerifier.create(controller.submitForReview(translator, 800L,
                        SubmitTranslationRequest.builder().reviewerId(4L).build()))
                .expectNextCount(1)
                .verifyComplete();
    }

    @Test
    @DisplayName("POST /api/v1/translations/{id}/review rejects with notes")
    void shouldReject() {
        when(translationWorkflowService.review(eq(800L), eq(4L), eq(false), eq("Tone is off"), isNull(), isNull()))
                .thenReturn(Mono.just(translation("REJECTED")));

        StepVerifier.create(controller.review(subEditor, 800L,
                        TranslationReviewRequest.builder().approve(false).notes("Tone is off").build()))
                .assertNext(response -> assertThat(response.getStatus()).isEqualTo("REJECTED"))
                .verifyComplete();
    }

    @Test
    @DisplayName("Rejection without notes propagates the validation error")
    void shouldPropagateMissingNotes() {
        when(translationWorkflowService.review(eq(800L), eq(4L), eq(false), isNull(), isNull(), isNull()))
                .thenReturn(Mono.error(new ValidationFailedException("notes", "A reason is required")));

        StepVerifier.create(controller.review(subEditor, 800L, TranslationReviewRequest.builder().approve(false).build()))
                .expectError(ValidationFailedException.class)
                .verify();
    }
}
