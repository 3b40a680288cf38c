package io.bulkaction.jdbc.record;

import io.bulkaction.util.JsonCodec;

import java.math.BigDecimal;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.Date;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;

/**
 * Converts between JDBC column values and the plain values records and snapshots carry.
 *
 * <p>Read values are normalized to {@code java.time} types and strings, which survive a JSON
 * round trip as their ISO text. Written values are coerced back to the column's SQL type, so a
 * snapshot restored from JSON lands with the type it was read with. Binary values travel as
 * {@link JsonCodec#BINARY_PREFIX}-tagged Base64 text.
 */
final class ColumnValues {

  private ColumnValues() {}

  static Object normalize(Object value) throws SQLException {
    if (value instanceof Timestamp ts) {
      return ts.toLocalDateTime();
    }
    if (value instanceof Date date) {
      return date.toLocalDate();
    }
    if (value instanceof Time time) {
      return time.toLocalTime();
    }
    if (value instanceof Clob clob) {
      long length = clob.length();
      return length == 0 ? "" : clob.getSubString(1, (int) length);
    }
    if (value instanceof Blob blob) {
      long length = blob.length();
      return length == 0 ? new byte[0] : blob.getBytes(1, (int) length);
    }
    return value;
  }

  /**
   * @throws IllegalArgumentException if the value cannot represent the column type
   */
  static Object coerce(Object value, int sqlType) {
    if (value == null) {
      return null;
    }
    try {
      switch (sqlType) {
        case Types.TIMESTAMP:
        case Types.TIMESTAMP_WITH_TIMEZONE:
          return toTimestamp(value);
        case Types.DATE:
          if (value instanceof LocalDate d) {
            return Date.valueOf(d);
          }
          if (value instanceof LocalDateTime dt) {
            return Date.valueOf(dt.toLocalDate());
          }
          return value instanceof String s ? Date.valueOf(LocalDate.parse(s)) : value;
        case Types.TIME:
          if (value instanceof LocalTime t) {
            return Time.valueOf(t);
          }
          return value instanceof String s ? Time.valueOf(LocalTime.parse(s)) : value;
        case Types.TINYINT:
        case Types.SMALLINT:
        case Types.INTEGER:
          if (value instanceof Number n) {
            return n.intValue();
          }
          return value instanceof String s ? Integer.parseInt(s.trim()) : value;
        case Types.BIGINT:
          if (value instanceof Number n) {
            return n.longValue();
          }
          return value instanceof String s ? Long.parseLong(s.trim()) : value;
        case Types.DECIMAL:
        case Types.NUMERIC:
          if (value instanceof BigDecimal) {
            return value;
          }
          if (value instanceof Number || value instanceof String) {
            return new BigDecimal(value.toString().trim());
          }
          return value;
        case Types.REAL:
        case Types.FLOAT:
        case Types.DOUBLE:
          if (value instanceof Number n) {
            return n.doubleValue();
          }
          return value instanceof String s ? Double.parseDouble(s.trim()) : value;
        case Types.BOOLEAN:
        case Types.BIT:
          if (value instanceof Number n) {
            return n.intValue() != 0;
          }
          return value instanceof String s ? Boolean.parseBoolean(s.trim()) : value;
        case Types.CHAR:
        case Types.VARCHAR:
        case Types.LONGVARCHAR:
        case Types.NCHAR:
        case Types.NVARCHAR:
        case Types.LONGNVARCHAR:
        case Types.CLOB:
        case Types.NCLOB:
          return value instanceof String ? value : value.toString();
        case Types.BINARY:
        case Types.VARBINARY:
        case Types.LONGVARBINARY:
        case Types.BLOB:
          return toBytes(value);
        default:
          return value;
      }
    } catch (NumberFormatException | DateTimeParseException e) {
      throw new IllegalArgumentException("Value '" + value + "' does not fit SQL type " + sqlType,
          e);
    }
  }

  private static byte[] toBytes(Object value) {
    if (value instanceof byte[] bytes) {
      return bytes;
    }
    if (value instanceof String s) {
      byte[] decoded = JsonCodec.decodeBinary(s);
      if (decoded == null) {
        throw new IllegalArgumentException("Binary value must be " + JsonCodec.BINARY_PREFIX
            + "-tagged Base64");
      }
      return decoded;
    }
    throw new IllegalArgumentException("Value of type " + value.getClass().getName()
        + " does not fit a binary column");
  }

  private static Object toTimestamp(Object value) {
    if (value instanceof Timestamp) {
      return value;
    }
    if (value instanceof Instant i) {
      return Timestamp.from(i);
    }
    if (value instanceof LocalDateTime dt) {
      return Timestamp.valueOf(dt);
    }
    if (value instanceof OffsetDateTime odt) {
      return Timestamp.from(odt.toInstant());
    }
    if (value instanceof ZonedDateTime zdt) {
      return Timestamp.from(zdt.toInstant());
    }
    if (value instanceof LocalDate d) {
      return Timestamp.valueOf(d.atStartOfDay());
    }
    if (value instanceof java.util.Date d) {
      return new Timestamp(d.getTime());
    }
    if (value instanceof String s) {
      String text = s.trim();
      if (text.endsWith("Z") || text.matches(".*[+-]\\d\\d:\\d\\d$")) {
        return Timestamp.from(OffsetDateTime.parse(text).toInstant());
      }
      if (text.length() == 10) {
        return Timestamp.valueOf(LocalDate.parse(text).atStartOfDay());
      }
      return Timestamp.valueOf(LocalDateTime.parse(text.replace(' ', 'T')));
    }
    return value;
  }
}
