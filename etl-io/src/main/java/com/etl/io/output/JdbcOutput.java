package com.etl.io.output;

import com.etl.core.Options;
import com.etl.core.Output;
import com.etl.core.Pipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Inserts every record as one row of a database table.
 *
 * <p>Options: {@code table} (required), {@code url}, {@code user} and {@code password} for
 * {@link DriverManager}, {@code columns} (defaults to the field names of the first record), and
 * {@code sessionKey}. With a session key the connection is looked up in the session first and only
 * opened from {@code url} when none is there; a connection it opens is published under that key
 * and left open, so chained stages share it. Without a session key the connection belongs to this
 * output and is closed with it.
 *
 * <p>Rows refused by the database for their data (SQL states {@code 22} and {@code 23}) are
 * rejected; any other database error aborts the run.
 */
public final class JdbcOutput implements Output {
  private static final Logger log = LoggerFactory.getLogger(JdbcOutput.class);
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

  private final String url;
  private final String user;
  private final String password;
  private final String table;
  private final List<String> configuredColumns;
  private final String sessionKey;

  private Connection connection;
  private boolean owned;
  private List<String> columns;
  private PreparedStatement insert;
  private long rows;

  public JdbcOutput(Map<String, Object> options) {
    this.url = Options.string(options, "url", null);
    this.user = Options.string(options, "user", null);
    this.password = Options.string(options, "password", null);
    this.table = identifier(Options.string(options, "table", null), "table");
    this.sessionKey = Options.string(options, "sessionKey", null);
    List<?> cols = Options.get(options, "columns", List.class);
    if (cols == null) {
      this.configuredColumns = null;
    } else {
      List<String> names = new ArrayList<>(cols.size());
      for (Object col : cols) names.add(identifier(String.valueOf(col), "column"));
      this.configuredColumns = List.copyOf(names);
    }
    if (url == null && sessionKey == null) throw new IllegalArgumentException("Option 'url' or 'sessionKey' is required");
  }

  @Override
  public void open(Pipeline pipeline) throws IOException {
    Object shared = sessionKey == null ? null : pipeline.session().get(sessionKey);
    try {
      if (shared instanceof Connection c && !c.isClosed()) {
        connection = c;
        owned = false;
      } else if (shared != null && !(shared instanceof Connection)) {
        throw new IOException("Session value '" + sessionKey + "' is not a database connection");
      } else if (url == null) {
        throw new IOException("No connection in session '" + sessionKey + "' and no 'url' to open one");
      } else {
        connection = user == null && password == null
            ? DriverManager.getConnection(url)
            : DriverManager.getConnection(url, user, password);
        owned = sessionKey == null;
        if (sessionKey != null) pipeline.session().set(sessionKey, connection);
        log.debug("[{}] connected to {}", pipeline.name(), url);
      }
    } catch (SQLException e) {
      throw new IOException("Cannot connect to '" + url + "': " + e.getMessage(), e);
    }
    columns = configuredColumns;
    insert = null;
    rows = 0;
  }

  @Override
  public boolean write(Pipeline pipeline, Map<String, Object> record) throws IOException {
    try {
      if (insert == null) prepare(record);
      for (int i = 0; i < columns.size(); i++) insert.setObject(i + 1, record.get(columns.get(i)));
      insert.executeUpdate();
      rows++;
      return true;
    } catch (SQLException e) {
      if (isDataError(e)) {
        log.warn("[{}] row rejected by {}: {}", pipeline.name(), table, e.getMessage());
        return false;
      }
      throw new IOException("Insert into " + table + " failed: " + e.getMessage(), e);
    }
  }

  @Override
  public void close(Pipeline pipeline) throws IOException {
    try {
      if (insert != null) insert.close();
      if (owned && connection != null) connection.close();
    } catch (SQLException e) {
      throw new IOException("Cannot close connection for " + table + ": " + e.getMessage(), e);
    } finally {
      insert = null;
      connection = null;
    }
    log.debug("[{}] inserted {} rows into {}", pipeline.name(), rows, table);
  }

  /** Rows inserted by the current or last run. */
  public long rows() {
    return rows;
  }

  private void prepare(Map<String, Object> record) throws SQLException, IOException {
    if (columns == null) {
      List<String> names = new ArrayList<>(record.size());
      for (String field : record.keySet()) {
        try {
          names.add(identifier(field, "column"));
        } catch (IllegalArgumentException e) {
          throw new IOException(e.getMessage() + "; set the 'columns' option", e);
        }
      }
      columns = List.copyOf(names);
    }
    if (columns.isEmpty()) throw new IOException("No columns to insert into " + table);

    StringBuilder sql = new StringBuilder("INSERT INTO ").append(table).append(" (")
        .append(String.join(", ", columns)).append(") VALUES (");
    for (int i = 0; i < columns.size(); i++) sql.append(i == 0 ? "?" : ", ?");
    sql.append(')');
    insert = connection.prepareStatement(sql.toString());
  }

  private static boolean isDataError(SQLException e) {
    String state = e.getSQLState();
    return state != null && (state.startsWith("22") || state.startsWith("23"));
  }

  private static String identifier(String name, String what) {
    if (name == null) throw new IllegalArgumentException("Option '" + what + "' is required");
    if (!IDENTIFIER.matcher(name).matches()) {
      throw new IllegalArgumentException("Not a plain SQL " + what + " name: '" + name + "'");
    }
    return name;
  }
}
