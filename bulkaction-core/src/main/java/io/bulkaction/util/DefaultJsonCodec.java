package io.bulkaction.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dependency-free JSON encoder and recursive-descent parser.
 *
 * <p>Accessible via {@link JsonCodec#getDefault()}. Object key order is preserved.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Object value) {
    StringBuilder sb = new StringBuilder();
    write(sb, value);
    return sb.toString();
  }

  private static void write(StringBuilder sb, Object value) {
    if (value == null) {
      sb.append("null");
    } else if (value instanceof String s) {
      sb.append('"').append(escape(s)).append('"');
    } else if (value instanceof Boolean) {
      sb.append(value);
    } else if (value instanceof byte[] bytes) {
      sb.append('"').append(JsonCodec.encodeBinary(bytes)).append('"');
    } else if (isNonFinite(value)) {
      throw new IllegalArgumentException("Non-finite number cannot be encoded: " + value);
    } else if (value instanceof BigDecimal bd) {
      sb.append(bd.toPlainString());
    } else if (value instanceof Number) {
      sb.append(value);
    } else if (value instanceof Map<?, ?> map) {
      sb.append('{');
      boolean first = true;
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (entry.getKey() == null) {
          throw new IllegalArgumentException("JSON object keys cannot be null");
        }
        if (!first) {
          sb.append(',');
        }
        first = false;
        sb.append('"').append(escape(entry.getKey().toString())).append("\":");
        write(sb, entry.getValue());
      }
      sb.append('}');
    } else if (value instanceof Collection<?> items) {
      sb.append('[');
      boolean first = true;
      for (Object item : items) {
        if (!first) {
          sb.append(',');
        }
        first = false;
        write(sb, item);
      }
      sb.append(']');
    } else {
      sb.append('"').append(escape(value.toString())).append('"');
    }
  }

  private static boolean isNonFinite(Object value) {
    if (value instanceof Double d) {
      return d.isNaN() || d.isInfinite();
    }
    if (value instanceof Float f) {
      return f.isNaN() || f.isInfinite();
    }
    return false;
  }

  @Override
  public Object parse(String json) {
    if (json == null || json.isBlank()) {
      return null;
    }
    Parser parser = new Parser(json);
    Object value = parser.readValue();
    parser.skipWhitespace();
    if (parser.pos != json.length()) {
      throw new IllegalArgumentException("Trailing characters at offset " + parser.pos);
    }
    return value;
  }

  private static final class Parser {
    private final String input;
    private int pos;

    Parser(String input) {
      this.input = input;
    }

    Object readValue() {
      skipWhitespace();
      if (pos >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON");
      }
      char c = input.charAt(pos);
      switch (c) {
        case '{':
          return readObject();
        case '[':
          return readArray();
        case '"':
          pos++;
          return readString();
        case 't':
          expectLiteral("true");
          return Boolean.TRUE;
        case 'f':
          expectLiteral("false");
          return Boolean.FALSE;
        case 'n':
          expectLiteral("null");
          return null;
        default:
          if (c == '-' || (c >= '0' && c <= '9')) {
            return readNumber();
          }
          throw new IllegalArgumentException("Unexpected character '" + c + "' at offset " + pos);
      }
    }

    private Map<String, Object> readObject() {
      pos++;
      Map<String, Object> result = new LinkedHashMap<>();
      skipWhitespace();
      if (peek() == '}') {
        pos++;
        return result;
      }
      while (true) {
        skipWhitespace();
        if (peek() != '"') {
          throw new IllegalArgumentException("Expected string key at offset " + pos);
        }
        pos++;
        String key = readString();
        skipWhitespace();
        if (peek() != ':') {
          throw new IllegalArgumentException("Expected ':' at offset " + pos);
        }
        pos++;
        result.put(key, readValue());
        skipWhitespace();
        char next = peek();
        pos++;
        if (next == '}') {
          return result;
        }
        if (next != ',') {
          throw new IllegalArgumentException("Expected ',' or '}' at offset " + (pos - 1));
        }
      }
    }

    private List<Object> readArray() {
      pos++;
      List<Object> result = new ArrayList<>();
      skipWhitespace();
      if (peek() == ']') {
        pos++;
        return result;
      }
      while (true) {
        result.add(readValue());
        skipWhitespace();
        char next = peek();
        pos++;
        if (next == ']') {
          return result;
        }
        if (next != ',') {
          throw new IllegalArgumentException("Expected ',' or ']' at offset " + (pos - 1));
        }
      }
    }

    private String readString() {
      StringBuilder sb = new StringBuilder();
      while (pos < input.length()) {
        char c = input.charAt(pos++);
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        if (pos >= input.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char esc = input.charAt(pos++);
        switch (esc) {
          case '"', '\\', '/' -> sb.append(esc);
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'u' -> {
            if (pos + 4 > input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            sb.append((char) Integer.parseInt(input.substring(pos, pos + 4), 16));
            pos += 4;
          }
          default -> throw new IllegalArgumentException("Invalid escape sequence: \\" + esc);
        }
      }
      throw new IllegalArgumentException("Unterminated string");
    }

    private Number readNumber() {
      int start = pos;
      boolean integral = true;
      while (pos < input.length()) {
        char c = input.charAt(pos);
        if (c == '.' || c == 'e' || c == 'E') {
          integral = false;
        } else if (!(c == '-' || c == '+' || (c >= '0' && c <= '9'))) {
          break;
        }
        pos++;
      }
      String text = input.substring(start, pos);
      try {
        if (integral) {
          BigInteger big = new BigInteger(text);
          if (big.bitLength() < 64) {
            return big.longValue();
          }
          return new BigDecimal(big);
        }
        return new BigDecimal(text);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid number: " + text, e);
      }
    }

    private void expectLiteral(String literal) {
      if (!input.startsWith(literal, pos)) {
        throw new IllegalArgumentException("Expected '" + literal + "' at offset " + pos);
      }
      pos += literal.length();
    }

    private char peek() {
      if (pos >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON");
      }
      return input.charAt(pos);
    }

    void skipWhitespace() {
      while (pos < input.length()) {
        char c = input.charAt(pos);
        if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
          break;
        }
        pos++;
      }
    }
  }

  private static String escape(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 8);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\b' -> sb.append("\\b");
        case '\f' -> sb.append("\\f");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    return sb.toString();
  }
}
