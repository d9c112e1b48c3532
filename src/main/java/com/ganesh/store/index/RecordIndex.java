package com.ganesh.store.index;

import com.ganesh.store.Item;
import com.ganesh.store.exception.DuplicateRecordException;
import com.ganesh.store.exception.IndexException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Indexed storage for Item records, keyed by Item ID.
 *
 * <p>Implementations must make every single-key mutation atomic; {@link #insert(Item)} in
 * particular is an insert-if-absent. Nothing is promised across keys. All methods report engine
 * failures as {@link IndexException}.
 */
public interface RecordIndex extends AutoCloseable {

    /**
     * @param id The Item ID.
     * @return The record, or empty if there is none.
     */
    Optional<Item> get(String id);

    /**
     * @param id The Item ID.
     * @return {@code true} if a record exists for the ID.
     */
    default boolean contains(String id) {
        return get(id).isPresent();
    }

    /**
     * Stores a new record under its ID.
     *
     * @param item The record; its ID must be set.
     * @throws DuplicateRecordException if a record with the same ID exists.
     */
    void insert(Item item);

    /**
     * Removes a record.
     *
     * @param id The Item ID.
     * @return {@code true} if a record was removed, {@code false} if there was none.
     */
    boolean delete(String id);

    /**
     * @param now The reference time.
     * @return Every record whose expiry is strictly before {@code now}.
     */
    List<Item> findExpiredBefore(Instant now);

    /**
     * @return Every record in the index.
     */
    List<Item> findAll();

    /**
     * Releases the engine's resources. Further calls fail.
     */
    @Override
    void close();
}
