package liveevents.util;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lightweight JSON encoder/decoder with no external dependencies.
 *
 * <p>Encoding accepts {@code null}, {@link CharSequence}, {@link Character},
 * {@link Boolean}, finite {@link Number}s, {@link Map}s with non-null keys (keys are
 * written with {@code String.valueOf}), {@link Iterable}s, arrays, {@link Enum}s
 * (by name) and {@link TemporalAccessor}s (by {@code toString()}, which is ISO-8601
 * for {@code java.time} types). Nesting deeper than {@value #MAX_DEPTH} levels is
 * rejected, which also catches self-referencing structures.
 *
 * <p>Decoding produces {@link LinkedHashMap}, {@link ArrayList}, {@link String},
 * {@link Boolean}, {@code null}, and numbers narrowed to the smallest of
 * {@link Integer}, {@link Long} or {@link BigInteger} for integral values and
 * {@link Double} otherwise.
 *
 * <p>This is the default {@link JsonCodec} implementation, accessible via
 * {@link JsonCodec#getDefault()} or the singleton {@link #INSTANCE}.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  static final int MAX_DEPTH = 128;

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Object value) {
    StringBuilder sb = new StringBuilder();
    write(sb, value, 0);
    return sb.toString();
  }

  @Override
  public Object parse(String json) {
    if (json == null) {
      throw new IllegalArgumentException("JSON input is null");
    }
    Parser parser = new Parser(json);
    Object value = parser.readValue(0);
    parser.skipWhitespace();
    if (parser.pos < json.length()) {
      throw new IllegalArgumentException("Unexpected trailing content at offset " + parser.pos);
    }
    return value;
  }

  private static void write(StringBuilder sb, Object value, int depth) {
    if (depth > MAX_DEPTH) {
      throw new IllegalArgumentException("JSON nesting exceeds " + MAX_DEPTH + " levels");
    }
    if (value == null) {
      sb.append("null");
    } else if (value instanceof CharSequence || value instanceof Character) {
      writeString(sb, value.toString());
    } else if (value instanceof Boolean) {
      sb.append(value);
    } else if (value instanceof Number number) {
      writeNumber(sb, number);
    } else if (value instanceof Enum<?> constant) {
      writeString(sb, constant.name());
    } else if (value instanceof TemporalAccessor) {
      writeString(sb, value.toString());
    } else if (value instanceof Map<?, ?> map) {
      writeObject(sb, map, depth);
    } else if (value instanceof Iterable<?> iterable) {
      sb.append('[');
      boolean first = true;
      for (Object element : iterable) {
        if (!first) {
          sb.append(',');
        }
        first = false;
        write(sb, element, depth + 1);
      }
      sb.append(']');
    } else if (value.getClass().isArray()) {
      sb.append('[');
      int length = Array.getLength(value);
      for (int i = 0; i < length; i++) {
        if (i > 0) {
          sb.append(',');
        }
        write(sb, Array.get(value, i), depth + 1);
      }
      sb.append(']');
    } else {
      throw new IllegalArgumentException(
          "Unsupported JSON value type: " + value.getClass().getName());
    }
  }

  private static void writeObject(StringBuilder sb, Map<?, ?> map, int depth) {
    sb.append('{');
    boolean first = true;
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("JSON objects cannot contain null keys");
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      writeString(sb, String.valueOf(entry.getKey()));
      sb.append(':');
      write(sb, entry.getValue(), depth + 1);
    }
    sb.append('}');
  }

  private static void writeNumber(StringBuilder sb, Number number) {
    if (number instanceof Double || number instanceof Float) {
      double d = number.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new IllegalArgumentException("JSON cannot represent " + number);
      }
    }
    if (number instanceof BigDecimal decimal) {
      sb.append(decimal.toString());
    } else {
      sb.append(number);
    }
  }

  private static void writeString(StringBuilder sb, String value) {
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    sb.append('"');
  }

  private static final class Parser {
    private final String input;
    private int pos;

    private Parser(String input) {
      this.input = input;
    }

    private Object readValue(int depth) {
      if (depth > MAX_DEPTH) {
        throw new IllegalArgumentException("JSON nesting exceeds " + MAX_DEPTH + " levels");
      }
      skipWhitespace();
      if (pos >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON input");
      }
      char ch = input.charAt(pos);
      switch (ch) {
        case '{':
          return readObject(depth);
        case '[':
          return readArray(depth);
        case '"':
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
          if (ch == '-' || (ch >= '0' && ch <= '9')) {
            return readNumber();
          }
          throw new IllegalArgumentException("Unexpected character '" + ch + "' at offset " + pos);
      }
    }

    private Map<String, Object> readObject(int depth) {
      pos++;
      Map<String, Object> result = new LinkedHashMap<>();
      skipWhitespace();
      if (pos < input.length() && input.charAt(pos) == '}') {
        pos++;
        return result;
      }
      while (true) {
        skipWhitespace();
        if (pos >= input.length() || input.charAt(pos) != '"') {
          throw new IllegalArgumentException("Expected string key at offset " + pos);
        }
        String key = readString();
        skipWhitespace();
        if (pos >= input.length() || input.charAt(pos) != ':') {
          throw new IllegalArgumentException("Expected ':' after key");
        }
        pos++;
        result.put(key, readValue(depth + 1));
        skipWhitespace();
        if (pos >= input.length()) {
          throw new IllegalArgumentException("Unexpected end of JSON object");
        }
        char next = input.charAt(pos++);
        if (next == '}') {
          return result;
        }
        if (next != ',') {
          throw new IllegalArgumentException("Expected ',' or '}'");
        }
      }
    }

    private List<Object> readArray(int depth) {
      pos++;
      List<Object> result = new ArrayList<>();
      skipWhitespace();
      if (pos < input.length() && input.charAt(pos) == ']') {
        pos++;
        return result;
      }
      while (true) {
        result.add(readValue(depth + 1));
        skipWhitespace();
        if (pos >= input.length()) {
          throw new IllegalArgumentException("Unexpected end of JSON array");
        }
        char next = input.charAt(pos++);
        if (next == ']') {
          return result;
        }
        if (next != ',') {
          throw new IllegalArgumentException("Expected ',' or ']'");
        }
      }
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
        if (!integral) {
          return Double.parseDouble(text);
        }
        BigInteger value = new BigInteger(text);
        if (value.bitLength() < 32) {
          return value.intValue();
        }
        if (value.bitLength() < 64) {
          return value.longValue();
        }
        return value;
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid number: " + text, ex);
      }
    }

    private String readString() {
      pos++;
      StringBuilder sb = new StringBuilder();
      while (pos < input.length()) {
        char c = input.charAt(pos);
        if (c == '"') {
          pos++;
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          pos++;
          continue;
        }
        if (pos + 1 >= input.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char next = input.charAt(pos + 1);
        switch (next) {
          case '"':
          case '\\':
          case '/':
            sb.append(next);
            break;
          case 'b':
            sb.append('\b');
            break;
          case 'f':
            sb.append('\f');
            break;
          case 'n':
            sb.append('\n');
            break;
          case 'r':
            sb.append('\r');
            break;
          case 't':
            sb.append('\t');
            break;
          case 'u':
            if (pos + 5 >= input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(input.substring(pos + 2, pos + 6), 16));
            } catch (NumberFormatException ex) {
              throw new IllegalArgumentException("Invalid unicode escape", ex);
            }
            pos += 4;
            break;
          default:
            throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
        }
        pos += 2;
      }
      throw new IllegalArgumentException("Unterminated string");
    }

    private void expectLiteral(String literal) {
      if (!input.startsWith(literal, pos)) {
        throw new IllegalArgumentException("Expected '" + literal + "' at offset " + pos);
      }
      pos += literal.length();
    }

    private void skipWhitespace() {
      while (pos < input.length()) {
        char c = input.charAt(pos);
        if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
          break;
        }
        pos++;
      }
    }
  }
}
