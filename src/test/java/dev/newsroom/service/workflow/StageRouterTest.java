package dev.newsroom.service.workflow;

import dev.newsroom.entity.StaffRole;
import dev.newsroom.entity.StoryStage;
import dev.newsroom.exception.InvalidTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StageRouterTest {

    @Nested
    @DisplayName("nextEdge")
    class NextEdge {

        @Test
        @DisplayName("Intern drafts go to journalist review")
        void internDraftGoesToReview() {
            assertThat(StageRouter.nextEdge(StoryStage.DRAFT, StaffRole.INTERN, TaskOutcome.SUBMIT))
                    .contains(StageTransition.SUBMIT_FOR_REVIEW);
        }

        @ParameterizedTest
        @EnumSource(value = StaffRole.class, names = {"JOURNALIST", "SUB_EDITOR", "EDITOR"})
        @DisplayName("Other authors skip straight to sub-editor approval")
        void otherDraftsSkipReview(StaffRole author) {
            assertThat(StageRouter.nextEdge(StoryStage.DRAFT, author, TaskOutcome.SUBMIT))
                    .contains(StageTransition.SUBMIT_FOR_APPROVAL);
        }

        @Test
        @DisplayName("Journalist review approves or sends back to the author")
        void journalistReview() {
            assertThat(StageRouter.nextEdge(StoryStage.NEEDS_JOURNALIST_REVIEW, StaffRole.INTERN, TaskOutcome.APPROVE))
                    .contains(StageTransition.SEND_FOR_APPROVAL);
            assertThat(StageRouter.nextEdge(StoryStage.NEEDS_JOURNALIST_REVIEW, StaffRole.INTERN, TaskOutcome.REVISE))
                    .contains(StageTransition.REVISE);
        }

        @Test
        @DisplayName("Sub-editor rejection depends on who wrote the story")
        void subEditorRejectionRoutesByAuthor() {
            assertThat(StageRouter.nextEdge(StoryStage.NEEDS_SUB_EDITOR_APPROVAL, StaffRole.INTERN, TaskOutcome.REVISE))
                    .contains(StageTransition.SEND_BACK);
            assertThat(StageRouter.nextEdge(StoryStage.NEEDS_SUB_EDITOR_APPROVAL, StaffRole.JOURNALIST, TaskOutcome.REVISE))
                    .contains(StageTransition.RETURN_TO_AUTHOR);
            assertThat(StageRouter.nextEdge(StoryStage.NEEDS_SUB_EDITOR_APPROVAL, StaffRole.JOURNALIST, TaskOutcome.APPROVE))
                    .contains(StageTransition.APPROVE);
        }

        @Test
        @DisplayName("No edge for outcomes a stage does not accept")
        void noEdgeForUnsupportedOutcome() {
            assertThat(StageRouter.nextEdge(StoryStage.DRAFT, StaffRole.JOURNALIST, TaskOutcome.APPROVE)).isEmpty();
            assertThat(StageRouter.nextEdge(StoryStage.NEEDS_JOURNALIST_REVIEW, StaffRole.INTERN, TaskOutcome.REJECT)).isEmpty();
            assertThat(StageRouter.nextEdge(StoryStage.APPROVED, StaffRole.JOURNALIST, TaskOutcome.APPROVE)).isEmpty();
            assertThat(StageRouter.nextEdge(StoryStage.PUBLISHED, StaffRole.JOURNALIST, TaskOutcome.SUBMIT)).isEmpty();
            assertThat(StageRouter.nextEdge(null, StaffRole.JOURNALIST, TaskOutcome.SUBMIT)).isEmpty();
            assertThat(StageRouter.nextEdge(StoryStage.DRAFT, StaffRole.JOURNALIST, null)).isEmpty();
        }

        @Test
        @DisplayName("requireEdge throws InvalidTransition when nothing matches")
        void requireEdgeThrows() {
            assertThatThrownBy(() -> StageRouter.requireEdge(StoryStage.TRANSLATED, StaffRole.EDITOR, TaskOutcome.APPROVE))
                    .isInstanceOf(InvalidTransitionException.class);
        }
    }

    @Nested
    @DisplayName("appliesTo")
    class AppliesTo {

        @Test
        @DisplayName("Intern-only edges do not apply to journalist stories and vice versa")
        void authorSpecificEdges() {
            assertThat(StageRouter.appliesTo(StageTransition.SUBMIT_FOR_REVIEW, StaffRole.INTERN)).isTrue();
            assertThat(StageRouter.appliesTo(StageTransition.SUBMIT_FOR_REVIEW, StaffRole.JOURNALIST)).isFalse();
            assertThat(StageRouter.appliesTo(StageTransition.SEND_BACK, StaffRole.JOURNALIST)).isFalse();
            assertThat(StageRouter.appliesTo(StageTransition.RETURN_TO_AUTHOR, StaffRole.INTERN)).isFalse();
            assertThat(StageRouter.appliesTo(StageTransition.SUBMIT_FOR_APPROVAL, StaffRole.JOURNALIST)).isTrue();
        }

        @Test
        @DisplayName("Shared edges apply to everyone")
        void sharedEdges() {
            assertThat(StageRouter.appliesTo(StageTransition.APPROVE, StaffRole.INTERN)).isTrue();
            assertThat(StageRouter.appliesTo(StageTransition.REVISE, StaffRole.JOURNALIST)).isTrue();
        }
    }

    @Test
    @DisplayName("Every declared edge moves between distinct stages and no edge skips from DRAFT past review")
    void declaredEdgesAreOrdered() {
        for (StageTransition transition : StageTransition.values()) {
            assertThat(transition.from()).isNotEqualTo(transition.to());
        }
        assertThat(StageTransition.from(StoryStage.DRAFT))
                .extracting(StageTransition::to)
                .containsOnly(StoryStage.NEEDS_JOURNALIST_REVIEW, StoryStage.NEEDS_SUB_EDITOR_APPROVAL);
        assertThat(StageTransition.from(StoryStage.PUBLISHED)).isEmpty();
    }
}
