package io.jobwarden;

/**
 * A record the automation engine can read and mutate by dotted attribute path
 * (e.g. {@code ticket.state_id}).
 *
 * <p>The first path segment names the entity; the rest addresses a field, possibly nested.
 * Implementations decide how the record is persisted; the engine only goes through
 * {@link RecordStore#save(TargetRecord, io.jobwarden.core.ChangeContext)}.
 */
public interface TargetRecord {

    String id();

    /**
     * Entity name this record belongs to (the first segment of every path it accepts).
     */
    String entity();

    /**
     * Current value at {@code path}, or {@code null} when unset.
     *
     * @throws IllegalArgumentException when the path does not belong to this record's entity
     */
    Object get(String path);

    /**
     * Assign {@code value} at {@code path}. Not persisted until saved.
     *
     * @throws IllegalArgumentException when the path does not belong to this record's entity
     */
    void set(String path, Object value);
}
