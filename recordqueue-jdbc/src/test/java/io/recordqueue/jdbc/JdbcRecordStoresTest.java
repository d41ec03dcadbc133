package io.recordqueue.jdbc;

import io.recordqueue.jdbc.store.H2RecordStore;
import io.recordqueue.jdbc.store.JdbcRecordStores;
import io.recordqueue.jdbc.store.PostgresRecordStore;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcRecordStoresTest {

  @Test
  void allStoresAreRegistered() {
    assertTrue(JdbcRecordStores.all().size() >= 2);
  }

  @Test
  void detectsByUrlPrefix() {
    assertInstanceOf(H2RecordStore.class, JdbcRecordStores.detect("jdbc:h2:mem:test"));
    assertInstanceOf(PostgresRecordStore.class, JdbcRecordStores.detect("jdbc:postgresql://localhost/app"));
    assertInstanceOf(PostgresRecordStore.class, JdbcRecordStores.detect("JDBC:POSTGRESQL://localhost/app"));
  }

  @Test
  void detectsFromDataSource() {
    assertEquals("h2", JdbcRecordStores.detect(TestSchemas.newH2DataSource()).name());
  }

  @Test
  void getByNameIsCaseInsensitive() {
    assertEquals("postgresql", JdbcRecordStores.get("PostgreSQL").name());
  }

  @Test
  void unknownUrlOrNameThrows() {
    assertThrows(IllegalArgumentException.class, () -> JdbcRecordStores.detect("jdbc:oracle:thin:@x"));
    assertThrows(IllegalArgumentException.class, () -> JdbcRecordStores.detect(""));
    assertThrows(IllegalArgumentException.class, () -> JdbcRecordStores.get("sqlite"));
  }

  @Test
  void findReturnsEmptyForUnknownUrl() {
    assertTrue(JdbcRecordStores.find("jdbc:sqlite:app.db").isEmpty());
    assertTrue(JdbcRecordStores.find(null).isEmpty());
    assertTrue(JdbcRecordStores.find("jdbc:h2:file:./data").isPresent());
  }

  @Test
  void withTableNameKeepsDialect() {
    var store = JdbcRecordStores.get("h2").withTableName("character_record");

    assertInstanceOf(H2RecordStore.class, store);
    assertEquals("character_record", store.tableName());
  }
}
