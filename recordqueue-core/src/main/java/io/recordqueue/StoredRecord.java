package io.recordqueue;

import java.time.Instant;

/**
 * A record as returned by the {@link io.recordqueue.spi.RecordStore}.
 *
 * @param id           record identifier
 * @param ownerId      owning principal
 * @param payloadJson  record data as JSON
 * @param createdAt    creation time
 * @param lastEditedAt time of the last edit, or {@code null} if never edited
 * @param edited       whether the record has been edited at least once
 * @param deleted      whether the record has been soft-deleted
 * @param deletedAt    soft-delete time, or {@code null}
 * @param deletedBy    principal that soft-deleted the record, or {@code null}
 */
public record StoredRecord(
    String id,
    String ownerId,
    String payloadJson,
    Instant createdAt,
    Instant lastEditedAt,
    boolean edited,
    boolean deleted,
    Instant deletedAt,
    String deletedBy) {
}
