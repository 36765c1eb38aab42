package dev.newsroom.entity;

/**
 * Implemented by entities whose Snowflake ids are assigned before the first save.
 * {@link dev.newsroom.config.LoadedEntityCallback} clears the flag once a row
 * has been read back, so that {@code save()} issues an UPDATE rather than an INSERT.
 */
public interface NewRecordAware {
    void setNewRecord(boolean newRecord);
}
