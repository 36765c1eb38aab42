package dev.newsroom.service;

import dev.newsroom.config.WorkflowProperties;
import dev.newsroom.dto.TranslationDraftRequest;
import dev.newsroom.dto.TranslationTarget;
import dev.newsroom.entity.StaffUser;
import dev.newsroom.entity.Story;
import dev.newsroom.entity.TaskType;
import dev.newsroom.entity.Translation;
import dev.newsroom.exception.AlreadyTerminalException;
import dev.newsroom.exception.DuplicateResourceException;
import dev.newsroom.exception.InvalidTransitionException;
import dev.newsroom.exception.StaleStateException;
import dev.newsroom.exception.ValidationFailedException;
import dev.newsroom.repository.StaffUserRepository;
import dev.newsroom.repository.StoryRepository;
import dev.newsroom.repository.TranslationRepository;
import dev.newsroom.service.assignment.AssigneeResolver;
import dev.newsroom.service.workflow.RolePolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.security.access.AccessDeniedException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TranslationWorkflowServiceTest {

    @Mock private TranslationRepository translationRepository;
    @Mock private StoryRepository storyRepository;
    @Mock private StaffUserRepository staffUserRepository;
    @Mock private AssigneeResolver assigneeResolver;
    @Mock private TaskOrchestrator taskOrchestrator;
    @Mock private StoryWorkflowService storyWorkflowService;
    @Mock private AuditService auditService;
    @Mock private IdService idService;

    private TranslationWorkflowService service;

    private Story original;
    private StaffUser subEditor;
    private StaffUser afrikaansTranslator;
    private StaffUser xhosaTranslator;

    @BeforeEach
    void setUp() {
        service = new TranslationWorkflowService(translationRepository, storyRepository, staffUserRepository,
                assigneeResolver, new RolePolicy(new WorkflowProperties()), taskOrchestrator, storyWorkflowService,
                auditService, idService);

        original = Story.builder()
                .id(500L)
                .slug("taxi-strike")
                .title("Taxi strike")
                .content("Commuters stranded")
                .stage("APPROVED")
                .language("ENGLISH")
                .translation(false)
                .categoryId(7L)
                .authorId(1L)
                .authorRole("JOURNALIST")
                .build();
        subEditor = StaffUser.builder().id(4L).staffRole("SUB_EDITOR").active(true).build();
        afrikaansTranslator = StaffUser.builder().id(20L).staffRole("JOURNALIST").translationLanguage("AFRIKAANS").active(true).build();
        xhosaTranslator = StaffUser.builder().id(21L).staffRole("JOURNALIST").translationLanguage("XHOSA").active(true).build();

        lenient().when(staffUserRepository.findById(4L)).thenReturn(Mono.just(subEditor));
        lenient().when(staffUserRepository.findById(20L)).thenReturn(Mono.just(afrikaansTranslator));
        lenient().when(staffUserRepository.findById(21L)).thenReturn(Mono.just(xhosaTranslator));
        lenient().when(idService.nextId()).thenReturn(800L, 801L, 802L, 803L);
        lenient().when(translationRepository.save(any(Translation.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        lenient().when(storyRepository.save(any(Story.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        lenient().when(taskOrchestrator.closeStep(any(), any(), any(), any(), any())).thenReturn(Mono.empty());
        lenient().when(taskOrchestrator.createTask(any())).thenReturn(Mono.empty());
        lenient().when(auditService.logTranslationStatus(any(), any(), any(), any())).thenReturn(Mono.empty());
        lenient().when(auditService.logTranslationsDispatched(any(), anyInt(), any())).thenReturn(Mono.empty());
    }

    private static Translation assignment(long id, String language, long translatorId, String status) {
        return Translation.builder()
                .id(id)
                .version(1L)
                .originalStoryId(500L)
                .targetLanguage(language)
                .assignedToId(translatorId)
                .status(status)
                .createdAt(LocalDateTime.now().minusDays(1))
                .build();
    }

    private static TranslationTarget target(String language, Long translatorId) {
        return TranslationTarget.builder().language(language).translatorId(translatorId).build();
    }

    @Nested
    @DisplayName("dispatch")
    class Dispatch {

        @Test
        @DisplayName("Should create one PENDING assignment and one task per language")
        void shouldCreateAssignments() {
            when(storyRepository.findById(500L)).thenReturn(Mono.just(original));
            when(translationRepository.existsByOriginalStoryIdAndTargetLanguage(eq(500L), any())).thenReturn(Mono.just(false));
            when(assigneeResolver.requireEligible(20L, TaskType.STORY_TRANSLATE, "AFRIKAANS")).thenReturn(Mono.just(afrikaansTranslator));
            when(assigneeResolver.requireEligible(21L, TaskType.STORY_TRANSLATE, "XHOSA")).thenReturn(Mono.just(xhosaTranslator));
            when(translationRepository.findByOriginalStoryId(500L)).thenReturn(Flux.just(
                    assignment(800L, "AFRIKAANS", 20L, "PENDING"), assignment(801L, "XHOSA", 21L, "PENDING")));

            StepVerifier.create(service.dispatch(500L,
                            List.of(target("afrikaans", 20L), target("XHOSA", 21L)), 4L, null, null))
                    .assertNext(created -> {
                        assertThat(created).extracting(Translation::getTargetLanguage).containsExactly("AFRIKAANS", "XHOSA");
                        assertThat(created).extracting(Translation::getStatus).containsOnly("PENDING");
                    })
                    .verifyComplete();

            ArgumentCaptor<NewTask> tasks = ArgumentCaptor.forClass(NewTask.class);
            verify(taskOrchestrator, times(2)).createTask(tasks.capture());
            assertThat(tasks.getAllValues()).extracting(NewTask::targetLanguage).containsExactly("AFRIKAANS", "XHOSA");
            assertThat(tasks.getAllValues()).extracting(NewTask::assigneeId).containsExactly(20L, 21L);
            verify(storyWorkflowService, never()).advanceWhenTranslated(any(), any());
        }

        @Test
        @DisplayName("Empty dispatch marks the story as translated straight away")
        void emptyDispatchAdvances() {
            when(storyRepository.findById(500L)).thenReturn(Mono.just(original));
            when(translationRepository.findByOriginalStoryId(500L)).thenReturn(Flux.empty());
            when(storyWorkflowService.advanceWhenTranslated(500L, 4L)).thenReturn(Mono.just(true));

            StepVerifier.create(service.dispatch(500L, List.of(), 4L, null, null))
                    .assertNext(created -> assertThat(created).isEmpty())
                    .verifyComplete();
            verify(storyWorkflowService).advanceWhenTranslated(500L, 4L);
        }

        @Test
        @DisplayName("Should refuse a journalist")
        void shouldRefuseJournalist() {
            StepVerifier.create(service.dispatch(500L, List.of(target("XHOSA", 21L)), 20L, null, null))
                    .expectError(AccessDeniedException.class)
                    .verify();
            verifyNoInteractions(translationRepository);
        }

        @Test
        @DisplayName("Should refuse the story's own language and repeated languages")
        void shouldValidateLanguages() {
            when(storyRepository.findById(500L)).thenReturn(Mono.just(original));

            StepVerifier.create(service.dispatch(500L, List.of(target("ENGLISH", 20L)), 4L, null, null))
                    .expectError(ValidationFailedException.class)
                    .verify();
            StepVerifier.create(service.dispatch(500L, List.of(target("XHOSA", 21L), target("xhosa", 21L)), 4L, null, null))
                    .expectError(ValidationFailedException.class)
                    .verify();
            StepVerifier.create(service.dispatch(500L, List.of(target("ZULU", 21L)), 4L, null, null))
                    .expectError(ValidationFailedException.class)
                    .verify();
        }

        @Test
        @DisplayName("Should refuse a second assignment for the same language")
        void shouldRefuseDuplicateLanguage() {
            when(storyRepository.findById(500L)).thenReturn(Mono.just(original));
            when(translationRepository.existsByOriginalStoryIdAndTargetLanguage(500L, "XHOSA")).thenReturn(Mono.just(true));

            StepVerifier.create(service.dispatch(500L, List.of(target("XHOSA", 21L)), 4L, null, null))
                    .expectError(DuplicateResourceException.class)
                    .verify();
            verify(translationRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should refuse a story that is not yet approved")
        void shouldRefuseUnapproved() {
            original.setStage("NEEDS_SUB_EDITOR_APPROVAL");
            when(storyRepository.findById(500L)).thenReturn(Mono.just(original));

            StepVerifier.create(service.dispatch(500L, List.of(target("XHOSA", 21L)), 4L, null, null))
                    .expectError(InvalidTransitionException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("startWork")
    class StartWork {

        @Test
        @DisplayName("First draft creates the translated story inheriting the category")
        void shouldCreateTranslatedStory() {
            Translation pending = assignment(800L, "AFRIKAANS", 20L, "PENDING");
            when(translationRepository.findById(800L)).thenReturn(Mono.just(pending));
            when(storyRepository.findById(500L)).thenReturn(Mono.just(original));

            TranslationDraftRequest draft = TranslationDraftRequest.builder()
                    .title("Taxistaking").content("Pendelaars gestrand").build();

            StepVerifier.create(service.startWork(800L, 20L, draft))
                    .assertNext(saved -> {
                        assertThat(saved.getStatus()).isEqualTo("IN_PROGRESS");
                        assertThat(saved.getStartedAt()).isNotNull();
                        assertThat(saved.getTranslatedStoryId()).isEqualTo(800L);
                    })
                    .verifyComplete();

            ArgumentCaptor<Story> story = ArgumentCaptor.forClass(Story.class);
            verify(storyRepository).save(story.capture());
            assertThat(story.getValue().isTranslationItem()).isTrue();
            assertThat(story.getValue().getOriginalStoryId()).isEqualTo(500L);
            assertThat(story.getValue().getCategoryId()).isEqualTo(7L);
            assertThat(story.getValue().getSlug()).isEqualTo("taxi-strike-afrikaans");
            assertThat(story.getValue().getStage()).isEqualTo("DRAFT");
            assertThat(story.getValue().getLanguage()).isEqualTo("AFRIKAANS");
        }

        @Test
        @DisplayName("startedAt is set only on first entry")
        void shouldKeepStartedAt() {
            LocalDateTime firstStart = LocalDateTime.now().minusHours(5);
            Translation rejected = assignment(800L, "AFRIKAANS", 20L, "REJECTED");
            rejected.setTranslatedStoryId(900L);
            rejected.setStartedAt(firstStart);
            when(translationRepository.findById(800L)).thenReturn(Mono.just(rejected));

            StepVerifier.create(service.startWork(800L, 20L, null))
                    .assertNext(saved -> {
                        assertThat(saved.getStatus()).isEqualTo("IN_PROGRESS");
                        assertThat(saved.getStartedAt()).isEqualTo(firstStart);
                    })
                    .verifyComplete();
            verify(storyRepository, never()).save(any());
        }

        @Test
        @DisplayName("Only the assigned translator may work on it")
        void shouldRefuseOtherStaff() {
            when(translationRepository.findById(800L)).thenReturn(Mono.just(assignment(800L, "AFRIKAANS", 20L, "PENDING")));

            StepVerifier.create(service.startWork(800L, 21L, null))
                    .expectError(AccessDeniedException.class)
                    .verify();
        }

        @Test
        @DisplayName("Submitted translations are read-only")
        void shouldRefuseWhileInReview() {
            when(translationRepository.findById(800L)).thenReturn(Mono.just(assignment(800L, "AFRIKAANS", 20L, "NEEDS_REVIEW")));

            StepVerifier.create(service.startWork(800L, 20L, null))
                    .expectError(InvalidTransitionException.class)
                    .verify();
        }

        @Test
        @DisplayName("A concurrent save surfaces as stale state")
        void shouldMapOptimisticLockFailure() {
            Translation inProgress = assignment(800L, "AFRIKAANS", 20L, "IN_PROGRESS");
            inProgress.setTranslatedStoryId(900L);
            when(translationRepository.findById(800L)).thenReturn(Mono.just(inProgress));
            when(translationRepository.save(any(Translation.class)))
                    .thenReturn(Mono.error(new OptimisticLockingFailureException("version mismatch")));

            StepVerifier.create(service.startWork(800L, 20L, null))
                    .expectError(StaleStateException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("submitForReview")
    class SubmitForReview {

        private Translation inProgress;

        @BeforeEach
        void setUpDraft() {
            inProgress = assignment(800L, "AFRIKAANS", 20L, "IN_PROGRESS");
            inProgress.setTranslatedStoryId(900L);
            Story translated = Story.builder().id(900L).title("Taxistaking").content("Pendelaars gestrand")
                    .stage("DRAFT").translation(true).originalStoryId(500L).build();
            lenient().when(storyRepository.findById(900L)).thenReturn(Mono.just(translated));
        }

        @Test
        @DisplayName("Should move to NEEDS_REVIEW and open a review task")
        void shouldSubmit() {
            when(translationRepository.findById(800L)).thenReturn(Mono.just(inProgress));
            when(assigneeResolver.pick(TaskType.STORY_TRANSLATION_REVIEW, null, List.of(20L))).thenReturn(Mono.just(4L));

            StepVerifier.create(service.submitForReview(800L, 20L, null, null, null))
                    .assertNext(saved -> {
                        assertThat(saved.getStatus()).isEqualTo("NEEDS_REVIEW");
                        assertThat(saved.getReviewerId()).isEqualTo(4L);
                        assertThat(saved.getSubmittedAt()).isNotNull();
                    })
                    .verifyComplete();
            verify(taskOrchestrator).closeStep(any(), eq(List.of("TRANSLATE:AFRIKAANS")), eq(20L), isNull(), isNull());
        }

        @Test
        @DisplayName("Submitting twice without a rejection in between fails")
        void shouldRefuseSecondSubmit() {
            when(translationRepository.findById(800L)).thenReturn(Mono.just(inProgress));
            when(assigneeResolver.pick(any(), any(), any())).thenReturn(Mono.just(4L));

            StepVerifier.create(service.submitForReview(800L, 20L, null, null, null))
                    .expectNextCount(1)
                    .verifyComplete();
            StepVerifier.create(service.submitForReview(800L, 20L, null, null, null))
                    .expectError(InvalidTransitionException.class)
                    .verify();
        }

        @Test
        @DisplayName("Requires translated title and content")
        void shouldRequireContent() {
            Story empty = Story.builder().id(900L).title("Taxistaking").content(" ").translation(true).build();
            when(translationRepository.findById(800L)).thenReturn(Mono.just(inProgress));
            when(storyRepository.findById(900L)).thenReturn(Mono.just(empty));

            StepVerifier.create(service.submitForReview(800L, 20L, null, null, null))
                    .expectError(ValidationFailedException.class)
                    .verify();
        }

        @Test
        @DisplayName("A translator cannot name themselves as reviewer")
        void shouldRefuseSelfReview() {
            when(translationRepository.findById(800L)).thenReturn(Mono.just(inProgress));

            StepVerifier.create(service.submitForReview(800L, 20L, 20L, null, null))
                    .expectError(ValidationFailedException.class)
                    .verify();
        }

        @Test
        @DisplayName("A rejected translation is reworked before it can be submitted again")
        void shouldRequireReworkAfterRejection() {
            Translation rejected = assignment(800L, "AFRIKAANS", 20L, "REJECTED");
            rejected.setTranslatedStoryId(900L);
            when(translationRepository.findById(800L)).thenReturn(Mono.just(rejected));

            StepVerifier.create(service.submitForReview(800L, 20L, null, null, null))
                    .expectError(InvalidTransitionException.class)
                    .verify();
            verify(translationRepository, never()).save(any());
            verifyNoInteractions(taskOrchestrator);

            StepVerifier.create(service.startWork(800L, 20L, null))
                    .assertNext(saved -> assertThat(saved.getStatus()).isEqualTo("IN_PROGRESS"))
                    .verifyComplete();
            when(assigneeResolver.pick(TaskType.STORY_TRANSLATION_REVIEW, null, List.of(20L))).thenReturn(Mono.just(4L));

            StepVerifier.create(service.submitForReview(800L, 20L, null, null, null))
                    .assertNext(saved -> assertThat(saved.getStatus()).isEqualTo("NEEDS_REVIEW"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Nothing to submit before the first draft")
        void shouldRefuseWithoutDraft() {
            when(translationRepository.findById(801L)).thenReturn(Mono.just(assignment(801L, "AFRIKAANS", 20L, "PENDING")));

            StepVerifier.create(service.submitForReview(801L, 20L, null, null, null))
                    .expectError(InvalidTransitionException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("review")
    class Review {

        private Translation submitted(long id, String language, long translatorId) {
            Translation translation = assignment(id, language, translatorId, "NEEDS_REVIEW");
            translation.setTranslatedStoryId(id + 100);
            translation.setReviewerId(4L);
            return translation;
        }

        @Test
        @DisplayName("Rejecting requires notes")
        void rejectRequiresNotes() {
            when(translationRepository.findById(800L)).thenReturn(Mono.just(submitted(800L, "AFRIKAANS", 20L)));

            StepVerifier.create(service.review(800L, 4L, false, "", null, null))
                    .expectError(ValidationFailedException.class)
                    .verify();
            verify(translationRepository, never()).save(any());
        }

        @Test
        @DisplayName("Rejection hands the work back to the translator")
        void rejectReopensTranslation() {
            when(translationRepository.findById(800L)).thenReturn(Mono.just(submitted(800L, "AFRIKAANS", 20L)));

            StepVerifier.create(service.review(800L, 4L, false, "Headline mistranslated", null, null))
                    .assertNext(saved -> {
                        assertThat(saved.getStatus()).isEqualTo("REJECTED");
                        assertThat(saved.getRejectionReason()).isEqualTo("Headline mistranslated");
                        assertThat(saved.getRejectedAt()).isNotNull();
                    })
                    .verifyComplete();

            ArgumentCaptor<NewTask> task = ArgumentCaptor.forClass(NewTask.class);
            verify(taskOrchestrator).createTask(task.capture());
            assertThat(task.getValue().type()).isEqualTo(TaskType.STORY_TRANSLATE);
            assertThat(task.getValue().assigneeId()).isEqualTo(20L);
            assertThat(task.getValue().description()).isEqualTo("Headline mistranslated");
        }

        @Test
        @DisplayName("Scenario B: one language approved while another is in progress leaves the original APPROVED")
        void partialApprovalDoesNotAdvance() {
            when(translationRepository.findById(800L)).thenReturn(Mono.just(submitted(800L, "AFRIKAANS", 20L)));
            when(storyRepository.compareAndSetStage(eq(900L), eq("DRAFT"), eq("APPROVED"), any())).thenReturn(Mono.just(1));
            Translation afrikaansApproved = assignment(800L, "AFRIKAANS", 20L, "APPROVED");
            Translation xhosaInProgress = assignment(801L, "XHOSA", 21L, "IN_PROGRESS");
            when(translationRepository.findByOriginalStoryId(500L)).thenReturn(Flux.just(afrikaansApproved, xhosaInProgress));

            StepVerifier.create(service.review(800L, 4L, true, null, null, null))
                    .assertNext(saved -> {
                        assertThat(saved.getStatus()).isEqualTo("APPROVED");
                        assertThat(saved.getApprovedAt()).isNotNull();
                    })
                    .verifyComplete();
            verify(storyWorkflowService, never()).advanceWhenTranslated(any(), any());
        }

        @Test
        @DisplayName("Approving the last outstanding language advances the original")
        void lastApprovalAdvancesOriginal() {
            when(translationRepository.findById(801L)).thenReturn(Mono.just(submitted(801L, "XHOSA", 21L)));
            when(storyRepository.compareAndSetStage(eq(901L), eq("DRAFT"), eq("APPROVED"), any())).thenReturn(Mono.just(1));
            when(translationRepository.findByOriginalStoryId(500L)).thenReturn(Flux.just(
                    assignment(800L, "AFRIKAANS", 20L, "APPROVED"), assignment(801L, "XHOSA", 21L, "APPROVED")));
            when(storyWorkflowService.advanceWhenTranslated(500L, 4L)).thenReturn(Mono.just(true));

            StepVerifier.create(service.review(801L, 4L, true, "Good", null, null))
                    .expectNextCount(1)
                    .verifyComplete();
            verify(storyWorkflowService).advanceWhenTranslated(500L, 4L);
        }

        @Test
        @DisplayName("An approved translation cannot be reviewed again")
        void shouldRefuseApproved() {
            Translation approved = submitted(800L, "AFRIKAANS", 20L);
            approved.setStatus("APPROVED");
            when(translationRepository.findById(800L)).thenReturn(Mono.just(approved));

            StepVerifier.create(service.review(800L, 4L, true, null, null, null))
                    .expectError(AlreadyTerminalException.class)
                    .verify();
        }

        @Test
        @DisplayName("Another journalist may not review")
        void shouldRefuseUnrelatedJournalist() {
            when(translationRepository.findById(800L)).thenReturn(Mono.just(submitted(800L, "AFRIKAANS", 20L)));

            StepVerifier.create(service.review(800L, 21L, true, null, null, null))
                    .expectError(AccessDeniedException.class)
                    .verify();
        }
    }
}
