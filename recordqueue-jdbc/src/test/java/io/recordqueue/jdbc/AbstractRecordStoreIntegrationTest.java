package io.recordqueue.jdbc;

import io.recordqueue.EditNotPermittedException;
import io.recordqueue.RecordNotFoundException;
import io.recordqueue.RecordStoreException;
import io.recordqueue.StoredRecord;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Shared record store behavior, run against each database.
 * Subclasses provide the DataSource.
 */
abstract class AbstractRecordStoreIntegrationTest {

    abstract DataSource dataSource();

    JdbcRecordStore store() {
        return JdbcRecordStore.builder().dataSource(dataSource()).build();
    }

    @Test
    void createInsertsUneditedRecord() {
        JdbcRecordStore store = store();

        StoredRecord created = store.create("user-1", "{\"name\":\"Ayla\"}");

        StoredRecord loaded = store.findById(created.id()).orElseThrow();
        assertEquals("user-1", loaded.ownerId());
        assertEquals("{\"name\":\"Ayla\"}", loaded.payloadJson());
        assertFalse(loaded.edited());
        assertFalse(loaded.deleted());
        assertEquals(null, loaded.lastEditedAt());
        assertNotNull(loaded.createdAt());
    }

    @Test
    void secondRecordForSameOwnerIsPermanentFailure() {
        JdbcRecordStore store = store();
        store.create("user-1", "{}");

        RecordStoreException e = assertThrows(RecordStoreException.class, () -> store.create("user-1", "{}"));

        assertFalse(e.isTransient());
    }

    @Test
    void firstEditIsAllowed() {
        JdbcRecordStore store = store();
        StoredRecord created = store.create("user-1", "{\"v\":1}");

        StoredRecord updated = store.updateIfEditable(created.id(), "user-1", "{\"v\":2}");

        assertEquals("{\"v\":2}", updated.payloadJson());
        assertTrue(updated.edited());
        assertNotNull(updated.lastEditedAt());
    }

    @Test
    void editWithinCooldownIsRejected() {
        JdbcRecordStore store = store();
        StoredRecord created = store.create("user-1", "{\"v\":1}");
        store.updateIfEditable(created.id(), "user-1", "{\"v\":2}");

        assertThrows(EditNotPermittedException.class,
                () -> store.updateIfEditable(created.id(), "user-1", "{\"v\":3}"));
        assertEquals("{\"v\":2}", store.findById(created.id()).orElseThrow().payloadJson());
    }

    @Test
    void editAfterCooldownIsAllowed() throws Exception {
        JdbcRecordStore store = store();
        StoredRecord created = store.create("user-1", "{\"v\":1}");
        setLastEditedAt(created.id(), Instant.now().minus(Duration.ofDays(8)));

        StoredRecord updated = store.updateIfEditable(created.id(), "user-1", "{\"v\":2}");

        assertEquals("{\"v\":2}", updated.payloadJson());
    }

    @Test
    void editByAnotherOwnerIsRejected() {
        JdbcRecordStore store = store();
        StoredRecord created = store.create("user-1", "{}");

        assertThrows(EditNotPermittedException.class,
                () -> store.updateIfEditable(created.id(), "user-2", "{\"v\":2}"));
    }

    @Test
    void editOfMissingRecordIsRejected() {
        assertThrows(EditNotPermittedException.class,
                () -> store().updateIfEditable("missing", "user-1", "{}"));
    }

    @Test
    void softDeleteKeepsRowAndBlocksEdits() {
        JdbcRecordStore store = store();
        StoredRecord created = store.create("user-1", "{}");

        store.softDelete(created.id(), "admin-1");

        StoredRecord deleted = store.findById(created.id()).orElseThrow();
        assertTrue(deleted.deleted());
        assertEquals("admin-1", deleted.deletedBy());
        assertNotNull(deleted.deletedAt());
        assertThrows(EditNotPermittedException.class,
                () -> store.updateIfEditable(created.id(), "user-1", "{\"v\":2}"));
    }

    @Test
    void softDeleteOfMissingRecordThrows() {
        assertThrows(RecordNotFoundException.class, () -> store().softDelete("missing", "admin-1"));
    }

    @Test
    void zeroCooldownAllowsRepeatedEdits() {
        JdbcRecordStore store = JdbcRecordStore.builder()
                .dataSource(dataSource())
                .editCooldown(Duration.ZERO)
                .build();
        StoredRecord created = store.create("user-1", "{\"v\":1}");

        store.updateIfEditable(created.id(), "user-1", "{\"v\":2}");
        store.updateIfEditable(created.id(), "user-1", "{\"v\":3}");

        assertEquals("{\"v\":3}", store.findByOwner("user-1").orElseThrow().payloadJson());
    }

    private void setLastEditedAt(String id, Instant at) throws Exception {
        try (Connection conn = dataSource().getConnection();
             PreparedStatement ps = conn.prepareStatement(
                     "UPDATE record SET last_edited_at=?, is_edited=TRUE WHERE id=?")) {
            ps.setTimestamp(1, Timestamp.from(at));
            ps.setString(2, id);
            ps.executeUpdate();
        }
    }
}
