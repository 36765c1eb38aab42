package dev.newsroom.controller;

import dev.newsroom.dto.AuditEntryResponse;
import dev.newsroom.dto.DispatchTranslationsRequest;
import dev.newsroom.dto.GroupPublishResponse;
import dev.newsroom.dto.StoryRequest;
import dev.newsroom.dto.StoryResponse;
import dev.newsroom.dto.TransitionRequest;
import dev.newsroom.dto.TranslationTarget;
import dev.newsroom.entity.ContentRef;
import dev.newsroom.entity.StaffUser;
import dev.newsroom.entity.Story;
import dev.newsroom.entity.Translation;
import dev.newsroom.exception.InvalidTransitionException;
import dev.newsroom.service.GroupPublishService;
import dev.newsroom.service.StoryService;
import dev.newsroom.service.StoryWorkflowService;
import dev.newsroom.service.TaskService;
import dev.newsroom.service.TranslationWorkflowService;
import dev.newsroom.service.workflow.StageTransition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StoryControllerTest {

    @Mock
    private StoryService storyService;

    @Mock
    private StoryWorkflowService storyWorkflowService;

    @Mock
    private TranslationWorkflowService translationWorkflowService;

    @Mock
    private GroupPublishService groupPublishService;

    @Mock
    private TaskService taskService;

    @InjectMocks
    private StoryController controller;

    private final StaffUser journalist = StaffUser.builder().id(3L).staffRole("JOURNALIST").build();
    private final StaffUser subEditor = StaffUser.builder().id(4L).staffRole("SUB_EDITOR").build();

    private static StoryResponse storyResponse(String stage) {
        return StoryResponse.builder().id("100").slug("water-outage").title("Water outage").stage(stage).build();
    }

    @Nested
    @DisplayName("Story records")
    class Records {

        @Test
        @DisplayName("POST /api/v1/stories creates as the caller")
        void shouldCreateAsCaller() {
            StoryRequest request = StoryRequest.builder().title("Water outage").build();
            when(storyService.createStory(request, 3L)).thenReturn(Mono.just(storyResponse("DRAFT")));

            StepVerifier.create(controller.createStory(journalist, request))
                    .assertNext(response -> assertThat(response.getStage()).isEqualTo("DRAFT"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("GET /api/v1/stories/mine pages through the caller's stories")
        void shouldListMine() {
            when(storyService.storiesByAuthor(3L, 1, 10))
                    .thenReturn(Flux.just(storyResponse("DRAFT"), storyResponse("APPROVED")));

            StepVerifier.create(controller.getMyStories(journalist, 1, 10))
                    .assertNext(list -> assertThat(list).hasSize(2))
                    .verifyComplete();
        }

        @Test
        @DisplayName("DELETE /api/v1/stories/{id} passes the caller through")
        void shouldDelete() {
            when(storyService.deleteStory(100L, 4L)).thenReturn(Mono.empty());

            StepVerifier.create(controller.deleteStory(subEditor, 100L)).verifyComplete();
            verify(storyService).deleteStory(100L, 4L);
        }

        @Test
        @DisplayName("GET /api/v1/stories/{id}/audio returns ids as strings")
        void shouldListAudio() {
            when(storyService.audioClipIds(100L)).thenReturn(Flux.just(7L, 8L));

            StepVerifier.create(controller.getAudioClips(100L))
                    .expectNext(List.of("7", "8"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("GET /api/v1/stories/{id}/history lists audit entries")
        void shouldListHistory() {
            when(storyService.history(100L)).thenReturn(Flux.just(
                    AuditEntryResponse.builder().action("STORY_CREATE").build(),
                    AuditEntryResponse.builder().action("STAGE_TRANSITION").build()));

            StepVerifier.create(controller.getHistory(100L))
                    .assertNext(entries -> assertThat(entries).extracting(AuditEntryResponse::getAction)
                            .containsExactly("STORY_CREATE", "STAGE_TRANSITION"))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Workflow")
    class Workflow {

        @Test
        @DisplayName("POST /api/v1/stories/{id}/transitions maps the moved story")
        void shouldRequestTransition() {
            Story moved = Story.builder().id(100L).stage("DRAFT").authorRole("JOURNALIST").build();
            when(storyWorkflowService.requestTransition(100L, StageTransition.RETURN_TO_AUTHOR, 4L, "Add a source"))
                    .thenReturn(Mono.just(moved));

            TransitionRequest request = TransitionRequest.builder()
                    .transition(StageTransition.RETURN_TO_AUTHOR).reason("Add a source").build();

            StepVerifier.create(controller.requestTransition(subEditor, 100L, request))
                    .assertNext(response -> {
                        assertThat(response.getId()).isEqualTo("100");
                        assertThat(response.getStage()).isEqualTo("DRAFT");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Refused transitions propagate")
        void shouldPropagateRefusal() {
            when(storyWorkflowService.requestTransition(100L, StageTransition.APPROVE, 4L, (String) null))
                    .thenReturn(Mono.error(new InvalidTransitionException("Story", "DRAFT", "APPROVE")));

            StepVerifier.create(controller.requestTransition(subEditor, 100L,
                            TransitionRequest.builder().transition(StageTransition.APPROVE).build()))
                    .expectError(InvalidTransitionException.class)
                    .verify();
        }

        @Test
        @DisplayName("GET /api/v1/stories/{id}/transitions lists what the caller may do")
        void shouldListAvailableTransitions() {
            when(storyWorkflowService.availableTransitions(100L, 4L))
                    .thenReturn(Flux.just(StageTransition.APPROVE, StageTransition.RETURN_TO_AUTHOR));

            StepVerifier.create(controller.availableTransitions(subEditor, 100L))
                    .expectNext(List.of(StageTransition.APPROVE, StageTransition.RETURN_TO_AUTHOR))
                    .verifyComplete();
        }

        @Test
        @DisplayName("GET /api/v1/stories/{id}/tasks queries by story reference")
        void shouldListTasks() {
            when(taskService.tasksForContent(ContentRef.story(100L))).thenReturn(Flux.empty());

            StepVerifier.create(controller.getStoryTasks(100L))
                    .expectNext(List.of())
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Translations and publish")
    class TranslationsAndPublish {

        @Test
        @DisplayName("POST /api/v1/stories/{id}/translations dispatches without an originating task")
        void shouldDispatch() {
            List<TranslationTarget> targets = List.of(TranslationTarget.builder().language("XHOSA").translatorId(21L).build());
            Translation created = Translation.builder().id(800L).originalStoryId(100L).targetLanguage("XHOSA")
                    .assignedToId(21L).status("PENDING").build();
            when(translationWorkflowService.dispatch(eq(100L), eq(targets), eq(4L), isNull(), isNull()))
                    .thenReturn(Mono.just(List.of(created)));

            StepVerifier.create(controller.dispatchTranslations(subEditor, 100L,
                            DispatchTranslationsRequest.builder().translations(targets).build()))
                    .assertNext(list -> {
                        assertThat(list).hasSize(1);
                        assertThat(list.get(0).getId()).isEqualTo("800");
                        assertThat(list.get(0).getAssignedToId()).isEqualTo("21");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("GET /api/v1/stories/{id}/group-ready wraps the flag")
        void shouldReportReadiness() {
            when(groupPublishService.isGroupReady(100L)).thenReturn(Mono.just(true));

            StepVerifier.create(controller.isGroupReady(100L))
                    .expectNext(Map.of("ready", true))
                    .verifyComplete();
        }

        @Test
        @DisplayName("POST /api/v1/stories/{id}/publish publishes the group")
        void shouldPublish() {
            GroupPublishResponse published = GroupPublishResponse.builder()
                    .originalStoryId("100").translatedStoryIds(List.of("900")).publishedBy("4")
                    .publishedAt(LocalDateTime.now()).build();
            when(groupPublishService.publishGroup(100L, 4L)).thenReturn(Mono.just(published));

            StepVerifier.create(controller.publishGroup(subEditor, 100L))
                    .expectNext(published)
                    .verifyComplete();
        }
    }
}
