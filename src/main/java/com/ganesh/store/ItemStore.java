package com.ganesh.store;

import com.ganesh.store.exception.BlobStoreException;
import com.ganesh.store.exception.IdAllocationException;
import com.ganesh.store.exception.IndexException;
import com.ganesh.store.exception.ItemNotFoundException;

import java.io.InputStream;

/**
 * Stores Items, each a metadata record paired with a binary payload, under short random IDs.
 *
 * <p>Every operation may be called from many threads at once. {@link ItemNotFoundException} is
 * the only routine failure; every other {@link com.ganesh.store.exception.StoreException} means
 * the store is degraded.
 */
public interface ItemStore extends AutoCloseable {

    /**
     * Stores a new Item. An ID is allocated, the record is written, then the payload is copied
     * into the blob store. The payload stream is closed in every case.
     *
     * @param item    The Item metadata; any ID it carries is ignored.
     * @param payload The Item contents.
     * @return The allocated ID.
     * @throws IdAllocationException if no free ID was found.
     * @throws IndexException if the record cannot be written.
     * @throws BlobStoreException if the payload cannot be stored; the record is rolled back.
     */
    String put(Item item, InputStream payload);

    /**
     * Looks up an Item. With automatic cleanup enabled an expired Item is deleted by this call and
     * reported as not found.
     *
     * @param id The Item ID.
     * @return The Item record.
     * @throws ItemNotFoundException if there is no live Item for the ID.
     */
    Item get(String id);

    /**
     * Opens the payload of an Item. No expiry check is made; call {@link #get(String)} first when
     * expiry matters. The caller closes the stream.
     *
     * @param id The Item ID.
     * @return The payload.
     * @throws BlobStoreException if the blob cannot be opened.
     */
    InputStream getFile(String id);

    /**
     * Removes the record and then the blob of an Item. A record that is already gone is not an
     * error; any leftover blob is still removed. Neither is a blob that is already gone once the
     * record was removed, which happens when a read and a sweep delete the same expired Item.
     *
     * @param id The Item ID.
     * @throws BlobStoreException if an existing blob cannot be removed.
     */
    void delete(String id);

    /**
     * @return The metrics collector for this store instance.
     */
    StoreMetrics getMetrics();

    /**
     * Stops background cleanup, waiting for it to finish, then closes the record index.
     * Repeated calls have no effect.
     */
    @Override
    void close();
}
