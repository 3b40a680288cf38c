package io.bulkaction.jdbc;

import org.junit.jupiter.api.Test;

import java.sql.Connection;

import static org.junit.jupiter.api.Assertions.*;

class DataSourceConnectionProviderTest {

  @Test
  void rejectsNullDataSource() {
    assertThrows(NullPointerException.class, () -> new DataSourceConnectionProvider(null));
  }

  @Test
  void opensWorkingConnections() throws Exception {
    TestDatabase db = TestDatabase.create("provider");
    DataSourceConnectionProvider provider = db.connectionProvider();
    try (Connection conn = provider.getConnection()) {
      assertTrue(conn.isValid(1));
      assertFalse(conn.isClosed());
    }
  }
}
