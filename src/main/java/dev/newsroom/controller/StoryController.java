package dev.newsroom.controller;

import dev.newsroom.dto.AuditEntryResponse;
import dev.newsroom.dto.DispatchTranslationsRequest;
import dev.newsroom.dto.GroupPublishResponse;
import dev.newsroom.dto.StoryRequest;
import dev.newsroom.dto.StoryResponse;
import dev.newsroom.dto.TaskResponse;
import dev.newsroom.dto.TransitionRequest;
import dev.newsroom.dto.TranslationResponse;
import dev.newsroom.entity.ContentRef;
import dev.newsroom.entity.StaffUser;
import dev.newsroom.service.GroupPublishService;
import dev.newsroom.service.StoryService;
import dev.newsroom.service.StoryWorkflowService;
import dev.newsroom.service.TaskService;
import dev.newsroom.service.TranslationWorkflowService;
import dev.newsroom.service.workflow.StageTransition;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/stories")
@RequiredArgsConstructor
@Tag(name = "Stories", description = "Story authoring, stage transitions, translations and group publish")
@SecurityRequirement(name = "staffId")
@Slf4j
public class StoryController {

    private final StoryService storyService;
    private final StoryWorkflowService storyWorkflowService;
    private final TranslationWorkflowService translationWorkflowService;
    private final GroupPublishService groupPublishService;
    private final TaskService taskService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create story", description = "Creates a DRAFT story and opens the author's STORY_CREATE task")
    public Mono<StoryResponse> createStory(@AuthenticationPrincipal StaffUser staff,
                                           @Valid @RequestBody StoryRequest request) {
        log.info("Creating story for staff={}", staff.getId());
        return storyService.createStory(request, staff.getId());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get story")
    public Mono<StoryResponse> getStory(@PathVariable Long id) {
        log.debug("Fetching story: id={}", id);
        return storyService.getStory(id);
    }

    @GetMapping("/mine")
    @Operation(summary = "List my stories", description = "Stories authored by the caller, newest first")
    public Mono<List<StoryResponse>> getMyStories(@AuthenticationPrincipal StaffUser staff,
                                                  @RequestParam(defaultValue = "0") int page,
                                                  @RequestParam(defaultValue = "20") int size) {
        return storyService.storiesByAuthor(staff.getId(), page, size).collectList();
    }

    @PutMapping("/{id}")
    @Operation(summary = "Edit draft", description = "Title, content, category and audio of a DRAFT story")
    public Mono<StoryResponse> updateDraft(@AuthenticationPrincipal StaffUser staff,
                                           @PathVariable Long id,
                                           @Valid @RequestBody StoryRequest request) {
        log.info("Updating draft: id={}, staff={}", id, staff.getId());
        return storyService.updateDraft(id, request, staff.getId());
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Delete story", description = "EDITOR and above; refused while translations are in progress")
    public Mono<Void> deleteStory(@AuthenticationPrincipal StaffUser staff, @PathVariable Long id) {
        log.info("Deleting story: id={}, staff={}", id, staff.getId());
        return storyService.deleteStory(id, staff.getId());
    }

    @PostMapping("/{id}/transitions")
    @Operation(summary = "Request stage transition",
            description = "Moves the story along one declared edge; rejection edges need a reason")
    public Mono<StoryResponse> requestTransition(@AuthenticationPrincipal StaffUser staff,
                                                 @PathVariable Long id,
                                                 @Valid @RequestBody TransitionRequest request) {
        log.info("Transition requested: story={}, transition={}, staff={}", id, request.getTransition(), staff.getId());
        return storyWorkflowService.requestTransition(id, request.getTransition(), staff.getId(), request.getReason())
                .map(StoryResponse::from);
    }

    @GetMapping("/{id}/transitions")
    @Operation(summary = "Available transitions", description = "Edges the caller may request on the story right now")
    public Mono<List<StageTransition>> availableTransitions(@AuthenticationPrincipal StaffUser staff,
                                                            @PathVariable Long id) {
        return storyWorkflowService.availableTransitions(id, staff.getId()).collectList();
    }

    @GetMapping("/{id}/tasks")
    @Operation(summary = "Tasks for story")
    public Mono<List<TaskResponse>> getStoryTasks(@PathVariable Long id) {
        return taskService.tasksForContent(ContentRef.story(id)).collectList();
    }

    @GetMapping("/{id}/history")
    @Operation(summary = "Audit history", description = "Stage transitions, edits and publish events, oldest first")
    public Mono<List<AuditEntryResponse>> getHistory(@PathVariable Long id) {
        return storyService.history(id).collectList();
    }

    @GetMapping("/{id}/audio")
    @Operation(summary = "Audio clips", description = "A translation resolves its clips through its original")
    public Mono<List<String>> getAudioClips(@PathVariable Long id) {
        return storyService.audioClipIds(id).map(String::valueOf).collectList();
    }

    @PostMapping("/{id}/translations")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Dispatch translations",
            description = "One assignment per target language; an empty list marks the story as needing none")
    public Mono<List<TranslationResponse>> dispatchTranslations(@AuthenticationPrincipal StaffUser staff,
                                                                @PathVariable Long id,
                                                                @Valid @RequestBody DispatchTranslationsRequest request) {
        log.info("Dispatching {} translation(s) for story={}, staff={}",
                request.getTranslations().size(), id, staff.getId());
        return translationWorkflowService.dispatch(id, request.getTranslations(), staff.getId(), null, null)
                .map(translations -> translations.stream().map(TranslationResponse::from).toList());
    }

    @GetMapping("/{id}/translations")
    @Operation(summary = "Translation assignments of a story")
    public Mono<List<TranslationResponse>> getTranslations(@PathVariable Long id) {
        return translationWorkflowService.translationsForStory(id)
                .map(TranslationResponse::from)
                .collectList();
    }

    @GetMapping("/{id}/translated-stories")
    @Operation(summary = "Translated stories of an original")
    public Mono<List<StoryResponse>> getTranslatedStories(@PathVariable Long id) {
        return storyService.translationsOf(id).collectList();
    }

    @GetMapping("/{id}/group-ready")
    @Operation(summary = "Group publish readiness")
    public Mono<Map<String, Boolean>> isGroupReady(@PathVariable Long id) {
        return groupPublishService.isGroupReady(id).map(ready -> Map.of("ready", ready));
    }

    @PostMapping("/{id}/publish")
    @Operation(summary = "Publish group", description = "Publishes the story and all approved translations together")
    public Mono<GroupPublishResponse> publishGroup(@AuthenticationPrincipal StaffUser staff, @PathVariable Long id) {
        log.info("Group publish requested: story={}, staff={}", id, staff.getId());
        return groupPublishService.publishGroup(id, staff.getId());
    }
}
