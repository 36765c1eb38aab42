package dev.newsroom.config;

import dev.newsroom.entity.NewRecordAware;
import org.reactivestreams.Publisher;
import org.springframework.data.r2dbc.mapping.event.AfterConvertCallback;
import org.springframework.data.relational.core.sql.SqlIdentifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Stories, tasks, translations, staff and audit rows read from the database are
 * existing rows: a later {@code save()} must update them, not insert their id again.
 */
@Component
public class LoadedEntityCallback implements AfterConvertCallback<NewRecordAware> {

    @Override
    public Publisher<NewRecordAware> onAfterConvert(NewRecordAware entity, SqlIdentifier table) {
        entity.setNewRecord(false);
        return Mono.just(entity);
    }
}
