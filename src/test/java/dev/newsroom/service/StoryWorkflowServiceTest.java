package dev.newsroom.service;

import dev.newsroom.config.WorkflowProperties;
import dev.newsroom.entity.StaffUser;
import dev.newsroom.entity.Story;
import dev.newsroom.exception.AlreadyTerminalException;
import dev.newsroom.exception.InvalidTransitionException;
import dev.newsroom.exception.ResourceNotFoundException;
import dev.newsroom.exception.StaleStateException;
import dev.newsroom.exception.ValidationFailedException;
import dev.newsroom.metrics.NewsroomMetrics;
import dev.newsroom.repository.StaffUserRepository;
import dev.newsroom.repository.StoryRepository;
import dev.newsroom.service.workflow.RolePolicy;
import dev.newsroom.service.workflow.StageTransition;
import dev.newsroom.service.workflow.TransitionContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.access.AccessDeniedException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StoryWorkflowServiceTest {

    @Mock private StoryRepository storyRepository;
    @Mock private StaffUserRepository staffUserRepository;
    @Mock private TaskOrchestrator taskOrchestrator;
    @Mock private AuditService auditService;
    @Mock private NewsroomMetrics newsroomMetrics;

    private StoryWorkflowService service;

    private StaffUser intern;
    private StaffUser journalist;
    private StaffUser subEditor;

    @BeforeEach
    void setUp() {
        service = new StoryWorkflowService(storyRepository, staffUserRepository,
                new RolePolicy(new WorkflowProperties()), taskOrchestrator, auditService, newsroomMetrics);

        intern = StaffUser.builder().id(1L).staffRole("INTERN").active(true).build();
        journalist = StaffUser.builder().id(2L).staffRole("JOURNALIST").active(true).build();
        subEditor = StaffUser.builder().id(4L).staffRole("SUB_EDITOR").active(true).build();

        lenient().when(staffUserRepository.findById(1L)).thenReturn(Mono.just(intern));
        lenient().when(staffUserRepository.findById(2L)).thenReturn(Mono.just(journalist));
        lenient().when(staffUserRepository.findById(4L)).thenReturn(Mono.just(subEditor));
        lenient().when(auditService.logStageTransition(any(), any(), any(), any())).thenReturn(Mono.empty());
        lenient().when(taskOrchestrator.onStageAdvanced(any(), any(), any(), any())).thenReturn(Mono.empty());
    }

    private static Story story(String stage, String authorRole) {
        return Story.builder()
                .id(500L)
                .title("Water outage in Soweto")
                .stage(stage)
                .authorId(1L)
                .authorRole(authorRole)
                .assignedReviewerId(2L)
                .translation(false)
                .updatedAt(LocalDateTime.now().minusDays(1))
                .build();
    }

    @Nested
    @DisplayName("requestTransition")
    class RequestTransition {

        @Test
        @DisplayName("Should move the story, reset the SLA clock and hand over to the orchestrator")
        void shouldApplyTransition() {
            Story draft = story("DRAFT", "INTERN");
            LocalDateTime before = draft.getUpdatedAt();
            when(storyRepository.findById(500L)).thenReturn(Mono.just(draft));
            when(storyRepository.compareAndSetStage(eq(500L), eq("DRAFT"), eq("NEEDS_JOURNALIST_REVIEW"), any()))
                    .thenReturn(Mono.just(1));

            StepVerifier.create(service.requestTransition(500L, StageTransition.SUBMIT_FOR_REVIEW, 1L, (String) null))
                    .assertNext(moved -> {
                        assertThat(moved.getStage()).isEqualTo("NEEDS_JOURNALIST_REVIEW");
                        assertThat(moved.getUpdatedAt()).isAfter(before);
                    })
                    .verifyComplete();

            verify(auditService).logStageTransition(500L, StageTransition.SUBMIT_FOR_REVIEW, 1L, null);
            verify(taskOrchestrator).onStageAdvanced(eq(draft), eq(StageTransition.SUBMIT_FOR_REVIEW), eq(1L), any());
            verify(newsroomMetrics).recordTransition(StageTransition.SUBMIT_FOR_REVIEW);
        }

        @Test
        @DisplayName("Should reject an edge whose source stage does not match")
        void shouldRejectStageMismatch() {
            when(storyRepository.findById(500L)).thenReturn(Mono.just(story("DRAFT", "INTERN")));

            StepVerifier.create(service.requestTransition(500L, StageTransition.APPROVE, 4L, (String) null))
                    .expectError(InvalidTransitionException.class)
                    .verify();
            verify(storyRepository, never()).compareAndSetStage(any(), any(), any(), any());
        }

        @Test
        @DisplayName("Should forbid a journalist from approving")
        void shouldForbidJournalistApproval() {
            when(storyRepository.findById(500L)).thenReturn(Mono.just(story("NEEDS_SUB_EDITOR_APPROVAL", "INTERN")));

            StepVerifier.create(service.requestTransition(500L, StageTransition.APPROVE, 2L, (String) null))
                    .expectError(AccessDeniedException.class)
                    .verify();
            verifyNoInteractions(taskOrchestrator);
        }

        @Test
        @DisplayName("Should reject the intern-only edge on a journalist's story")
        void shouldRejectEdgeForOtherAuthorRole() {
            Story draft = story("DRAFT", "JOURNALIST");
            when(storyRepository.findById(500L)).thenReturn(Mono.just(draft));

            StepVerifier.create(service.requestTransition(500L, StageTransition.SUBMIT_FOR_REVIEW, 4L, (String) null))
                    .expectError(InvalidTransitionException.class)
                    .verify();
        }

        @Test
        @DisplayName("Should require a reason on rejection edges")
        void shouldRequireReason() {
            when(storyRepository.findById(500L)).thenReturn(Mono.just(story("NEEDS_JOURNALIST_REVIEW", "INTERN")));

            StepVerifier.create(service.requestTransition(500L, StageTransition.REVISE, 2L, "  "))
                    .expectError(ValidationFailedException.class)
                    .verify();
        }

        @Test
        @DisplayName("Should refuse to move a published story")
        void shouldRefusePublished() {
            when(storyRepository.findById(500L)).thenReturn(Mono.just(story("PUBLISHED", "INTERN")));

            StepVerifier.create(service.requestTransition(500L, StageTransition.REVISE, 2L, "late fix"))
                    .expectError(AlreadyTerminalException.class)
                    .verify();
        }

        @Test
        @DisplayName("Should refuse system and group edges")
        void shouldRefuseSystemEdges() {
            when(storyRepository.findById(500L)).thenReturn(Mono.just(story("APPROVED", "INTERN")));

            StepVerifier.create(service.requestTransition(500L, StageTransition.MARK_TRANSLATED, 4L, (String) null))
                    .expectError(InvalidTransitionException.class)
                    .verify();
        }

        @Test
        @DisplayName("Should refuse to move a translated item directly")
        void shouldRefuseTranslationItem() {
            Story translated = story("DRAFT", "JOURNALIST");
            translated.setTranslation(true);
            when(storyRepository.findById(500L)).thenReturn(Mono.just(translated));

            StepVerifier.create(service.requestTransition(500L, StageTransition.SUBMIT_FOR_APPROVAL, 1L, (String) null))
                    .expectError(InvalidTransitionException.class)
                    .verify();
        }

        @Test
        @DisplayName("Should report a missing story as not found")
        void shouldReportMissingStory() {
            when(storyRepository.findById(500L)).thenReturn(Mono.empty());

            StepVerifier.create(service.requestTransition(500L, StageTransition.APPROVE, 4L, (String) null))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }

        @Test
        @DisplayName("Of two requests from the same stage exactly one wins; the other fails stale")
        void concurrentRequestsFromSameStage() {
            // Both callers read the story while it is still in review
            when(storyRepository.findById(500L))
                    .thenReturn(Mono.just(story("NEEDS_JOURNALIST_REVIEW", "INTERN")))
                    .thenReturn(Mono.just(story("NEEDS_JOURNALIST_REVIEW", "INTERN")));
            when(storyRepository.compareAndSetStage(eq(500L), eq("NEEDS_JOURNALIST_REVIEW"), any(), any()))
                    .thenReturn(Mono.just(1))
                    .thenReturn(Mono.just(0));

            StepVerifier.create(service.requestTransition(500L, StageTransition.SEND_FOR_APPROVAL, 2L, (String) null))
                    .assertNext(moved -> assertThat(moved.getStage()).isEqualTo("NEEDS_SUB_EDITOR_APPROVAL"))
                    .verifyComplete();
            StepVerifier.create(service.requestTransition(500L, StageTransition.REVISE, 4L, "Needs more sources"))
                    .expectError(StaleStateException.class)
                    .verify();

            verify(taskOrchestrator, times(1)).onStageAdvanced(any(), any(), any(), any());
            verify(auditService, times(1)).logStageTransition(any(), any(), any(), any());
        }

        @Test
        @DisplayName("A task completed after its story already moved on fails stale, not invalid")
        void shouldReportTaskBehindStoryAsStale() {
            // The competing completion committed first; this caller now reads the new stage
            when(storyRepository.findById(500L)).thenReturn(Mono.just(story("NEEDS_SUB_EDITOR_APPROVAL", "JOURNALIST")));
            TransitionContext fromTask = new TransitionContext(77L, null, null, "{}");

            StepVerifier.create(service.requestTransition(500L, StageTransition.SUBMIT_FOR_APPROVAL, 1L, fromTask))
                    .expectError(StaleStateException.class)
                    .verify();

            verify(storyRepository, never()).compareAndSetStage(any(), any(), any(), any());
            verifyNoInteractions(taskOrchestrator, auditService);
        }

        @Test
        @DisplayName("A direct request from the wrong stage stays an invalid transition")
        void shouldKeepDirectMismatchInvalid() {
            when(storyRepository.findById(500L)).thenReturn(Mono.just(story("NEEDS_SUB_EDITOR_APPROVAL", "JOURNALIST")));

            StepVerifier.create(service.requestTransition(500L, StageTransition.SUBMIT_FOR_APPROVAL, 1L, (String) null))
                    .expectError(InvalidTransitionException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("advanceWhenTranslated")
    class AdvanceWhenTranslated {

        @Test
        @DisplayName("Should move an approved story to TRANSLATED")
        void shouldAdvance() {
            when(storyRepository.findById(500L)).thenReturn(Mono.just(story("APPROVED", "JOURNALIST")));
            when(storyRepository.compareAndSetStage(eq(500L), eq("APPROVED"), eq("TRANSLATED"), any()))
                    .thenReturn(Mono.just(1));

            StepVerifier.create(service.advanceWhenTranslated(500L, 4L))
                    .expectNext(true)
                    .verifyComplete();
            verify(taskOrchestrator).onStageAdvanced(any(), eq(StageTransition.MARK_TRANSLATED), eq(4L),
                    eq(TransitionContext.system()));
        }

        @Test
        @DisplayName("Should do nothing when the story already moved on")
        void shouldIgnoreWhenNotApproved() {
            when(storyRepository.findById(500L)).thenReturn(Mono.just(story("TRANSLATED", "JOURNALIST")));

            StepVerifier.create(service.advanceWhenTranslated(500L, 4L))
                    .expectNext(false)
                    .verifyComplete();
            verify(storyRepository, never()).compareAndSetStage(any(), any(), any(), any());
        }
    }

    @Test
    @DisplayName("availableTransitions lists only the edges the actor may take for this author")
    void availableTransitions() {
        when(storyRepository.findById(500L)).thenReturn(Mono.just(story("NEEDS_SUB_EDITOR_APPROVAL", "INTERN")));

        StepVerifier.create(service.availableTransitions(500L, 4L).collectList())
                .assertNext(transitions -> assertThat(transitions)
                        .containsExactlyInAnyOrder(StageTransition.APPROVE, StageTransition.SEND_BACK))
                .verifyComplete();

        StepVerifier.create(service.availableTransitions(500L, 2L).collectList())
                .assertNext(transitions -> assertThat(transitions).isEmpty())
                .verifyComplete();
    }
}
