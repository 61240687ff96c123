/*
 * Copyright 2025 Andrew Aylett
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package eu.aylett.quotaguard.cost;

import eu.aylett.quotaguard.cost.QueryToken.Kind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits graph query text into tokens.
 * <p>
 * Whitespace, commas and comments are dropped. The only structure checked is
 * that brackets balance; anything more is left to the service.
 * </p>
 */
final class QueryLexer {
  private static final String PUNCTUATORS = "{}()[]:=!@|&";

  private final String source;
  private final List<QueryToken> tokens = new ArrayList<>();
  private int pos;

  private QueryLexer(String source) {
    this.source = source;
  }

  static List<QueryToken> tokenize(String source) throws QueryParseException {
    return new QueryLexer(source).run();
  }

  private List<QueryToken> run() throws QueryParseException {
    while (pos < source.length()) {
      var c = source.charAt(pos);
      if (Character.isWhitespace(c) || c == ',' || c == '\uFEFF') {
        pos++;
      } else if (c == '#') {
        skipComment();
      } else if (c == '"') {
        readString();
      } else if (c == '$') {
        readVariable();
      } else if (c == '.') {
        readSpread();
      } else if (isNameStart(c)) {
        var start = pos;
        tokens.add(new QueryToken(Kind.NAME, readName(), start));
      } else if (c == '-' || isDigit(c)) {
        readNumber();
      } else if (PUNCTUATORS.indexOf(c) >= 0) {
        tokens.add(new QueryToken(Kind.PUNCTUATOR, String.valueOf(c), pos));
        pos++;
      } else {
        throw new QueryParseException("Unexpected character '" + c + "'", pos);
      }
    }
    if (tokens.isEmpty()) {
      throw new QueryParseException("Query is empty", 0);
    }
    checkBalanced();
    return tokens;
  }

  private void skipComment() {
    while (pos < source.length() && source.charAt(pos) != '\n' && source.charAt(pos) != '\r') {
      pos++;
    }
  }

  private void readString() throws QueryParseException {
    var start = pos;
    if (source.startsWith("\"\"\"", pos)) {
      var end = source.indexOf("\"\"\"", pos + 3);
      while (end > 0 && source.charAt(end - 1) == '\\') {
        end = source.indexOf("\"\"\"", end + 3);
      }
      if (end < 0) {
        throw new QueryParseException("Unterminated block string", start);
      }
      pos = end + 3;
      tokens.add(new QueryToken(Kind.STRING, source.substring(start + 3, end), start));
      return;
    }
    pos++;
    while (pos < source.length()) {
      var c = source.charAt(pos);
      if (c == '\\') {
        pos += 2;
      } else if (c == '"') {
        pos++;
        tokens.add(new QueryToken(Kind.STRING, source.substring(start + 1, pos - 1), start));
        return;
      } else if (c == '\n' || c == '\r') {
        break;
      } else {
        pos++;
      }
    }
    throw new QueryParseException("Unterminated string", start);
  }

  private void readVariable() throws QueryParseException {
    var start = pos;
    pos++;
    if (pos >= source.length() || !isNameStart(source.charAt(pos))) {
      throw new QueryParseException("Expected a variable name after '$'", start);
    }
    tokens.add(new QueryToken(Kind.VARIABLE, readName(), start));
  }

  private void readSpread() throws QueryParseException {
    if (!source.startsWith("...", pos)) {
      throw new QueryParseException("Unexpected '.'", pos);
    }
    tokens.add(new QueryToken(Kind.SPREAD, "...", pos));
    pos += 3;
  }

  private String readName() {
    var start = pos;
    while (pos < source.length() && isNamePart(source.charAt(pos))) {
      pos++;
    }
    return source.substring(start, pos);
  }

  private void readNumber() throws QueryParseException {
    var start = pos;
    if (source.charAt(pos) == '-') {
      pos++;
    }
    if (pos >= source.length() || !isDigit(source.charAt(pos))) {
      throw new QueryParseException("Expected a digit", pos);
    }
    skipDigits();
    if (pos < source.length() && source.charAt(pos) == '.') {
      pos++;
      skipDigits();
    }
    if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
      pos++;
      if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
        pos++;
      }
      skipDigits();
    }
    tokens.add(new QueryToken(Kind.NUMBER, source.substring(start, pos), start));
  }

  private void skipDigits() {
    while (pos < source.length() && isDigit(source.charAt(pos))) {
      pos++;
    }
  }

  private void checkBalanced() throws QueryParseException {
    var open = new ArrayDeque<QueryToken>();
    for (var token : tokens) {
      if (!token.is(Kind.PUNCTUATOR)) {
        continue;
      }
      switch (token.text()) {
        case "{", "(", "[" -> open.push(token);
        case "}" -> close(open, token, "{");
        case ")" -> close(open, token, "(");
        case "]" -> close(open, token, "[");
        default -> {
        }
      }
    }
    if (!open.isEmpty()) {
      var unclosed = open.peek();
      throw new QueryParseException("Unclosed '" + unclosed.text() + "'", unclosed.position());
    }
  }

  private static void close(ArrayDeque<QueryToken> open, QueryToken closer, String expected)
      throws QueryParseException {
    var opener = open.poll();
    if (opener == null || !opener.text().equals(expected)) {
      throw new QueryParseException("Unbalanced '" + closer.text() + "'", closer.position());
    }
  }

  private static boolean isNameStart(char c) {
    return c == '_' || (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
  }

  private static boolean isNamePart(char c) {
    return isNameStart(c) || isDigit(c);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
