package io.bulkaction.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * In-memory H2 database with the ledger schema and a {@code widget} target table.
 * Shared by the store and engine integration tests.
 */
public final class TestDatabase {
  private static final String SCHEMA = "bulkaction/schema-h2.sql";

  private final JdbcDataSource dataSource;

  private TestDatabase(String name) {
    this.dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + name + "_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
  }

  public static TestDatabase create(String name) throws SQLException {
    TestDatabase db = new TestDatabase(name);
    for (String statement : readSchema().split(";")) {
      if (!statement.isBlank()) {
        db.execute(statement);
      }
    }
    db.execute("CREATE TABLE widget ("
        + "id BIGINT PRIMARY KEY,"
        + "name VARCHAR(100) NOT NULL,"
        + "status VARCHAR(20),"
        + "score INT,"
        + "deleted_at TIMESTAMP"
        + ")");
    return db;
  }

  private static String readSchema() {
    try (InputStream in = TestDatabase.class.getClassLoader().getResourceAsStream(SCHEMA)) {
      if (in == null) {
        throw new IllegalStateException("Missing classpath resource " + SCHEMA);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + SCHEMA, e);
    }
  }

  public DataSource dataSource() {
    return dataSource;
  }

  public DataSourceConnectionProvider connectionProvider() {
    return new DataSourceConnectionProvider(dataSource);
  }

  public Connection connection() throws SQLException {
    return dataSource.getConnection();
  }

  /**
   * Inserts widgets {@code 1..count}. Even ids are {@code active}, odd ones {@code idle};
   * {@code score} equals the id.
   */
  public void insertWidgets(int count) throws SQLException {
    insertWidgetsFrom(1, count);
  }

  public void insertWidgetsFrom(int firstId, int lastId) throws SQLException {
    execute("INSERT INTO widget (id, name, status, score, deleted_at) "
        + "SELECT X, 'widget-' || X, CASE WHEN MOD(X, 2) = 0 THEN 'active' ELSE 'idle' END, X, NULL "
        + "FROM SYSTEM_RANGE(" + firstId + ", " + lastId + ")");
  }

  public void execute(String sql) throws SQLException {
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      st.execute(sql);
    }
  }

  public long count(String sql, Object... params) throws SQLException {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      for (int i = 0; i < params.length; i++) {
        ps.setObject(i + 1, params[i]);
      }
      try (ResultSet rs = ps.executeQuery()) {
        rs.next();
        return rs.getLong(1);
      }
    }
  }

  public Object value(String sql, Object... params) throws SQLException {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      for (int i = 0; i < params.length; i++) {
        ps.setObject(i + 1, params[i]);
      }
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? rs.getObject(1) : null;
      }
    }
  }

  public long deletedWidgets() throws SQLException {
    return count("SELECT COUNT(*) FROM widget WHERE deleted_at IS NOT NULL");
  }
}
