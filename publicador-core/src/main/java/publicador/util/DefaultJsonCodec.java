package publicador.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dependency-free {@link JsonCodec} for flat objects of scalar members.
 *
 * <p>Nested objects and arrays are rejected: credentials blobs are expected to be a single
 * level of keys such as {@code telegramBotToken} or {@code apiKey}.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (json == null || json.isBlank() || "null".equals(json.trim())) {
      return Collections.emptyMap();
    }
    Cursor in = new Cursor(json.trim());
    in.expect('{');
    Map<String, String> result = new LinkedHashMap<>();
    in.skipWhitespace();
    if (in.peek() == '}') {
      return result;
    }
    while (true) {
      in.skipWhitespace();
      in.expect('"');
      String key = in.readString();
      in.skipWhitespace();
      in.expect(':');
      in.skipWhitespace();
      String value = in.readScalar();
      if (value != null) {
        result.put(key, value);
      }
      in.skipWhitespace();
      char next = in.next();
      if (next == '}') {
        return result;
      }
      if (next != ',') {
        throw new IllegalArgumentException("Expected ',' or '}' at position " + (in.pos - 1));
      }
    }
  }

  private static final class Cursor {
    private final String input;
    private int pos;

    private Cursor(String input) {
      this.input = input;
    }

    char peek() {
      if (pos >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      return input.charAt(pos);
    }

    char next() {
      char c = peek();
      pos++;
      return c;
    }

    void expect(char expected) {
      char c = next();
      if (c != expected) {
        throw new IllegalArgumentException(
            "Expected '" + expected + "' but found '" + c + "' at position " + (pos - 1));
      }
    }

    void skipWhitespace() {
      while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
        pos++;
      }
    }

    /** Reads a scalar member value; returns {@code null} for JSON null. */
    String readScalar() {
      char c = peek();
      if (c == '"') {
        pos++;
        return readString();
      }
      if (c == '{' || c == '[') {
        throw new IllegalArgumentException("Nested values are not supported at position " + pos);
      }
      int start = pos;
      while (pos < input.length()) {
        char ch = input.charAt(pos);
        if (ch == ',' || ch == '}' || Character.isWhitespace(ch)) {
          break;
        }
        pos++;
      }
      String literal = input.substring(start, pos);
      if (literal.equals("null")) {
        return null;
      }
      if (literal.equals("true") || literal.equals("false") || literal.matches("-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?")) {
        return literal;
      }
      throw new IllegalArgumentException("Invalid literal '" + literal + "' at position " + start);
    }

    /** Reads string contents; the opening quote has already been consumed. */
    String readString() {
      StringBuilder sb = new StringBuilder();
      while (true) {
        char c = next();
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        char esc = next();
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
            try {
              sb.append((char) Integer.parseInt(input.substring(pos, pos + 4), 16));
            } catch (NumberFormatException ex) {
              throw new IllegalArgumentException("Invalid unicode escape", ex);
            }
            pos += 4;
          }
          default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + esc);
        }
      }
    }
  }
}
