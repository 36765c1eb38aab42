package dev.newsroom.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Join table between stories and audio clips. Only originals own rows here;
 * translated items resolve audio through their original.
 */
@Repository
@RequiredArgsConstructor
public class StoryAudioRepository {

    private final R2dbcEntityTemplate r2dbcTemplate;

    private static final String FIND_CLIP_IDS =
            "SELECT audio_clip_id FROM story_audio_clips WHERE story_id = :storyId ORDER BY audio_clip_id";

    private static final String INSERT_LINK =
            "INSERT INTO story_audio_clips (story_id, audio_clip_id) VALUES (:storyId, :clipId)";

    private static final String DELETE_BY_STORY =
            "DELETE FROM story_audio_clips WHERE story_id = :storyId";

    public Flux<Long> findClipIds(Long storyId) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(FIND_CLIP_IDS)
                .bind("storyId", storyId)
                .map((row, meta) -> row.get("audio_clip_id", Long.class))
                .all();
    }

    public Mono<Void> linkClips(Long storyId, List<Long> clipIds) {
        return Flux.fromIterable(clipIds)
                .concatMap(clipId -> r2dbcTemplate.getDatabaseClient()
                        .sql(INSERT_LINK)
                        .bind("storyId", storyId)
                        .bind("clipId", clipId)
                        .fetch()
                        .rowsUpdated())
                .then();
    }

    public Mono<Void> deleteByStoryId(Long storyId) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(DELETE_BY_STORY)
                .bind("storyId", storyId)
                .fetch()
                .rowsUpdated()
                .then();
    }
}
