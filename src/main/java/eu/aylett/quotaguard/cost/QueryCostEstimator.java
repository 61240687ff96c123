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

import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import eu.aylett.quotaguard.cost.QueryToken.Kind;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Estimates how many points a graph query will cost before it's sent.
 * <p>
 * The estimate has three parts. Every distinct field is charged from the
 * model's table. Every connection (a field with a {@code first:} argument) is
 * charged in proportion to the log of its page size, so doubling a small page
 * costs more than doubling a large one. Deep nesting is charged by depth, in
 * groups of three nested selections.
 * </p>
 * <p>
 * This never throws for bad query text: a query we can't scan gets the
 * model's fallback estimate, with a warning saying why.
 * </p>
 */
public class QueryCostEstimator {
  private static final Logger LOG = LoggerFactory.getLogger(QueryCostEstimator.class);
  private static final Set<String> KEYWORDS = ImmutableSet.of("query", "mutation", "subscription", "fragment", "on");
  private static final int NESTING_START_DEPTH = 2;
  private static final int NESTED_GROUP_SIZE = 3;

  private final CostModel model;

  public QueryCostEstimator(CostModel model) {
    this.model = model;
  }

  /**
   * An estimator calibrated against the GitHub GraphQL API.
   */
  public QueryCostEstimator() {
    this(CostModel.github());
  }

  public CostModel model() {
    return model;
  }

  public CostBreakdown estimate(String query) {
    return estimate(query, Map.of());
  }

  /**
   * Estimate the cost of a query.
   *
   * @param query
   *          the query text
   * @param variables
   *          the values the query will be sent with, used to resolve
   *          {@code first: $var} page sizes
   */
  public CostBreakdown estimate(String query, Map<String, ? extends @Nullable Object> variables) {
    List<QueryToken> tokens;
    try {
      tokens = QueryLexer.tokenize(query);
    } catch (QueryParseException e) {
      LOG.debug("Falling back to a fixed estimate for unreadable query", e);
      return CostBreakdown.fallback(model.fallbackPoints(), "Failed to parse query: " + e.getMessage());
    }

    var fields = extractFields(tokens);
    var connections = extractConnections(tokens, variables);
    var nesting = extractNesting(tokens);

    long baseFields = model.baseQueryCost();
    for (var field : fields) {
      baseFields += model.fieldCost(field);
    }

    long connectionCost = 0;
    long largestPage = 0;
    for (var connection : connections) {
      var first = pageSize(connection.first());
      largestPage = Math.max(largestPage, first);
      connectionCost += (long) Math
          .ceil(model.connectionCost(connection.field()) * model.connectionMultiplier() * Math.log(first + 1.0));
    }

    long nestedCost = nesting.groups()
        * (long) Math.ceil(model.nestedQueryMultiplier() * Math.pow(nesting.level(), 1.5));

    var total = Ints.saturatedCast(baseFields + connectionCost + nestedCost);
    var warnings = new ArrayList<String>();
    if (total > model.maxComplexityPerQuery()) {
      warnings.add("Query complexity (" + total + ") exceeds recommended maximum (" + model.maxComplexityPerQuery()
          + ")");
    }
    if (largestPage > model.largeConnectionThreshold()) {
      warnings.add("Connection asks for " + largestPage + " items; paginate with first <= "
          + model.largeConnectionThreshold() + " instead");
    }
    if (nesting.groups() > model.nestedGroupWarningThreshold()) {
      warnings.add("Query is deeply nested (" + nesting.groups() + " nested groups); split it into several queries");
    }
    return new CostBreakdown(Ints.saturatedCast(baseFields), Ints.saturatedCast(connectionCost),
        Ints.saturatedCast(nestedCost), fields.size(), total, warnings);
  }

  /**
   * Estimate a query and compare it with a budget.
   */
  public SafetyCheck checkSafety(String query, Map<String, ? extends @Nullable Object> variables, int maxPoints) {
    var breakdown = estimate(query, variables);
    return new SafetyCheck(breakdown.estimatedPoints() <= maxPoints, breakdown.estimatedPoints(),
        breakdown.warnings());
  }

  public SafetyCheck checkSafety(String query, Map<String, ? extends @Nullable Object> variables) {
    return checkSafety(query, variables, SafetyCheck.DEFAULT_MAX_POINTS);
  }

  /**
   * Advice on making an expensive query cheaper.
   */
  public List<String> suggestions(CostBreakdown breakdown) {
    var suggestions = new ArrayList<String>();
    if (breakdown.estimatedPoints() > 100) {
      suggestions.add("Break this query into smaller, focused queries");
    }
    if (breakdown.connections() > breakdown.baseFields()) {
      suggestions.add("Use smaller \"first\" values and page through the results");
    }
    if (breakdown.nestedQueries() > 20) {
      suggestions.add("Fetch deeply nested data in separate queries");
    }
    if (breakdown.totalFields() > 20) {
      suggestions.add("Request only the fields you need");
    }
    return suggestions;
  }

  /**
   * Distinct field names, in order of first appearance.
   * <p>
   * Skipped: keywords, names inside argument lists, aliases, directives,
   * operation and fragment names, type conditions, and names called with
   * arguments but no selection.
   * </p>
   */
  private static Set<String> extractFields(List<QueryToken> tokens) {
    var fields = new LinkedHashSet<String>();
    var argumentDepth = 0;
    for (var i = 0; i < tokens.size(); i++) {
      var token = tokens.get(i);
      if (token.isPunctuator('(')) {
        argumentDepth++;
        continue;
      }
      if (token.isPunctuator(')')) {
        argumentDepth--;
        continue;
      }
      if (argumentDepth > 0 || !token.is(Kind.NAME)) {
        continue;
      }
      if (KEYWORDS.contains(token.text().toLowerCase(Locale.ROOT))) {
        continue;
      }
      var previous = i > 0 ? tokens.get(i - 1) : null;
      if (previous != null && (previous.isPunctuator('@') || previous.is(Kind.SPREAD)
          || (previous.is(Kind.NAME) && KEYWORDS.contains(previous.text())))) {
        continue;
      }
      var next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
      if (next != null && next.isPunctuator(':')) {
        continue;
      }
      if (next != null && next.isPunctuator('(')) {
        var close = matchingParen(tokens, i + 1);
        if (close + 1 >= tokens.size() || !tokens.get(close + 1).isPunctuator('{')) {
          continue;
        }
      }
      fields.add(token.text());
    }
    return fields;
  }

  private static List<Connection> extractConnections(List<QueryToken> tokens,
      Map<String, ? extends @Nullable Object> variables) {
    var connections = new ArrayList<Connection>();
    for (var i = 0; i + 1 < tokens.size(); i++) {
      var token = tokens.get(i);
      if (!token.is(Kind.NAME) || !tokens.get(i + 1).isPunctuator('(')) {
        continue;
      }
      var close = matchingParen(tokens, i + 1);
      for (var j = i + 2; j + 2 <= close; j++) {
        var argument = tokens.get(j);
        if (argument.is(Kind.NAME) && argument.text().equals("first") && tokens.get(j + 1).isPunctuator(':')) {
          var value = tokens.get(j + 2);
          if (value.is(Kind.NUMBER) || value.is(Kind.VARIABLE)) {
            connections.add(new Connection(token.text(), resolveFirst(value, variables)));
            break;
          }
        }
      }
    }
    return connections;
  }

  private static @Nullable Long resolveFirst(QueryToken value, Map<String, ? extends @Nullable Object> variables) {
    if (value.is(Kind.NUMBER)) {
      return Longs.tryParse(value.text());
    }
    var bound = variables.get(value.text());
    if (bound instanceof Number number) {
      return number.longValue();
    }
    if (bound instanceof String text) {
      return Longs.tryParse(text.trim());
    }
    return null;
  }

  /**
   * The page size to charge for: anything missing, unreadable or not positive
   * gets the model's default.
   */
  private long pageSize(@Nullable Long first) {
    return first == null || first <= 0 ? model.defaultFirst() : first;
  }

  private Nesting extractNesting(List<QueryToken> tokens) {
    var depth = 0;
    var maxDepth = 0;
    var nestedSelections = 0;
    for (var token : tokens) {
      if (token.isPunctuator('{')) {
        depth++;
        maxDepth = Math.max(maxDepth, depth);
        if (depth > NESTING_START_DEPTH) {
          nestedSelections++;
        }
      } else if (token.isPunctuator('}')) {
        depth--;
      }
    }
    var groups = (nestedSelections + NESTED_GROUP_SIZE - 1) / NESTED_GROUP_SIZE;
    return new Nesting(groups, Math.max(0, Math.min(maxDepth - 1, model.maxNestingLevel())));
  }

  /**
   * The index of the ')' closing the '(' at {@code open}. The lexer has already
   * checked that brackets balance.
   */
  private static int matchingParen(List<QueryToken> tokens, int open) {
    var depth = 0;
    for (var i = open; i < tokens.size(); i++) {
      if (tokens.get(i).isPunctuator('(')) {
        depth++;
      } else if (tokens.get(i).isPunctuator(')')) {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
    }
    return tokens.size() - 1;
  }

  private record Connection(String field, @Nullable Long first) {
  }

  private record Nesting(int groups, int level) {
  }
}
