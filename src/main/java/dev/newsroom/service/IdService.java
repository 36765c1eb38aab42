package dev.newsroom.service;

import dev.newsroom.util.SnowflakeId;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Hands out ids for new stories, tasks, assignments and audit rows.
 */
@Service
@RequiredArgsConstructor
public class IdService {

    private final SnowflakeId snowflakeId;

    public long nextId() {
        return snowflakeId.nextId();
    }
}
