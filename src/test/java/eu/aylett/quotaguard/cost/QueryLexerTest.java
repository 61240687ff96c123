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
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

class QueryLexerTest {
  @Test
  void tokenizesNamesVariablesNumbersAndPunctuation() throws QueryParseException {
    var tokens = QueryLexer.tokenize("query($n: Int!) { issues(first: $n, after: -1.5e3) { id } }");
    assertThat(tokens.stream().map(QueryToken::kind).toList(),
        contains(Kind.NAME, Kind.PUNCTUATOR, Kind.VARIABLE, Kind.PUNCTUATOR, Kind.NAME, Kind.PUNCTUATOR,
            Kind.PUNCTUATOR, Kind.PUNCTUATOR, Kind.NAME, Kind.PUNCTUATOR, Kind.NAME, Kind.PUNCTUATOR, Kind.VARIABLE,
            Kind.NAME, Kind.PUNCTUATOR, Kind.NUMBER, Kind.PUNCTUATOR, Kind.PUNCTUATOR, Kind.NAME, Kind.PUNCTUATOR,
            Kind.PUNCTUATOR));
    assertThat(tokens.get(2), equalTo(new QueryToken(Kind.VARIABLE, "n", 6)));
    assertThat(tokens.get(15).text(), is("-1.5e3"));
  }

  @Test
  void recordsWhereNamesStart() throws QueryParseException {
    var tokens = QueryLexer.tokenize("  { viewer }");
    assertThat(tokens.get(1), equalTo(new QueryToken(Kind.NAME, "viewer", 4)));
  }

  @Test
  void skipsCommentsAndCommas() throws QueryParseException {
    var tokens = QueryLexer.tokenize("{ # the viewer\n  viewer, login }");
    assertThat(tokens.stream().map(QueryToken::text).toList(), contains("{", "viewer", "login", "}"));
  }

  @Test
  void readsStringsAndBlockStrings() throws QueryParseException {
    var tokens = QueryLexer.tokenize("{ search(query: \"is:open \\\"x\\\"\", note: \"\"\"multi\nline\"\"\") { id } }");
    assertThat(tokens.get(5), equalTo(new QueryToken(Kind.STRING, "is:open \\\"x\\\"", 16)));
    assertThat(tokens.get(8).kind(), is(Kind.STRING));
    assertThat(tokens.get(8).text(), is("multi\nline"));
  }

  @Test
  void readsSpreads() throws QueryParseException {
    var tokens = QueryLexer.tokenize("{ ...on User { login } }");
    assertThat(tokens.get(1), equalTo(new QueryToken(Kind.SPREAD, "...", 2)));
  }

  @Test
  void rejectsUnterminatedStrings() {
    var thrown = assertThrows(QueryParseException.class, () -> QueryLexer.tokenize("{ a(b: \"open) }"));
    assertThat(thrown.position, is(7));
    assertThat(thrown.getMessage(), containsString("Unterminated string"));
  }

  @Test
  void rejectsUnknownCharacters() {
    var thrown = assertThrows(QueryParseException.class, () -> QueryLexer.tokenize("{ a; }"));
    assertThat(thrown.getMessage(), is("Unexpected character ';' at position 3"));
  }

  @Test
  void rejectsUnbalancedBrackets() {
    assertThrows(QueryParseException.class, () -> QueryLexer.tokenize("{ a { b }"));
    assertThrows(QueryParseException.class, () -> QueryLexer.tokenize("{ a(b: 1 }"));
    assertThrows(QueryParseException.class, () -> QueryLexer.tokenize("{ a } }"));
  }

  @Test
  void rejectsBlankQueries() {
    assertThrows(QueryParseException.class, () -> QueryLexer.tokenize("   # nothing here"));
  }

  @Test
  void rejectsLoneDotsAndDollars() {
    assertThrows(QueryParseException.class, () -> QueryLexer.tokenize("{ a.b }"));
    assertThrows(QueryParseException.class, () -> QueryLexer.tokenize("{ a(b: $) }"));
  }
}
