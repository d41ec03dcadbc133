package io.recordqueue.spi;

import io.recordqueue.EditNotPermittedException;
import io.recordqueue.RecordNotFoundException;
import io.recordqueue.RecordStoreException;
import io.recordqueue.StoredRecord;

/**
 * Backing store the workers apply jobs against.
 *
 * <p>Implementations are called concurrently by every worker and are responsible for
 * their own connection pooling. All methods are synchronous. The JDBC implementation,
 * {@code io.recordqueue.jdbc.JdbcRecordStore}, lives in the {@code recordqueue-jdbc} module.
 */
public interface RecordStore extends AutoCloseable {

    /**
     * Creates a record owned by {@code ownerId}.
     *
     * @param ownerId     the owning principal
     * @param payloadJson the record data
     * @return the stored record
     * @throws RecordStoreException on constraint violation or connectivity failure
     */
    StoredRecord create(String ownerId, String payloadJson);

    /**
     * Replaces the payload of a record if, and only if, the store's eligibility rule
     * allows {@code ownerId} to edit it right now. The check and the write are atomic.
     *
     * @param targetId    the record to update
     * @param ownerId     the principal requesting the edit
     * @param payloadJson the new record data
     * @return the updated record
     * @throws EditNotPermittedException if the eligibility rule rejects the write
     * @throws RecordStoreException      on any other failure
     */
    StoredRecord updateIfEditable(String targetId, String ownerId, String payloadJson);

    /**
     * Marks a record as deleted, recording who deleted it and when. The row is kept.
     *
     * @param targetId      the record to delete
     * @param actingAdminId the principal performing the deletion
     * @throws RecordNotFoundException if the record does not exist
     * @throws RecordStoreException    on any other failure
     */
    void softDelete(String targetId, String actingAdminId);

    /**
     * Releases connections held by the store. Called once, after every worker has stopped.
     */
    @Override
    default void close() {
    }
}
