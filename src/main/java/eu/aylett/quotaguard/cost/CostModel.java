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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * The numbers behind a {@link QueryCostEstimator}.
 *
 * @param baseQueryCost
 *          charged once for every query
 * @param fieldCosts
 *          per-field charges; fields not listed, or listed at zero, cost
 *          {@code unknownFieldCost} as fields and {@code unknownConnectionCost}
 *          as connections
 * @param unknownFieldCost
 *          the charge for a field not in the table
 * @param unknownConnectionCost
 *          the base charge for a connection whose field isn't in the table
 * @param defaultFirst
 *          the page size assumed when a connection's {@code first} can't be
 *          resolved
 * @param connectionMultiplier
 *          scales connection costs
 * @param nestedQueryMultiplier
 *          scales the cost of deep nesting
 * @param maxComplexityPerQuery
 *          estimates above this get a warning
 * @param fallbackPoints
 *          the estimate for a query we can't read
 * @param maxNestingLevel
 *          nesting deeper than this is charged as this deep
 * @param largeConnectionThreshold
 *          connections asking for more items than this get a warning
 * @param nestedGroupWarningThreshold
 *          more nested groups than this get a warning
 */
public record CostModel(int baseQueryCost, Map<String, Integer> fieldCosts, int unknownFieldCost,
    int unknownConnectionCost, int defaultFirst, double connectionMultiplier, double nestedQueryMultiplier,
    int maxComplexityPerQuery, int fallbackPoints, int maxNestingLevel, int largeConnectionThreshold,
    int nestedGroupWarningThreshold) {

  private static final ImmutableMap<String, Integer> GITHUB_FIELD_COSTS = ImmutableMap.<String, Integer>builder()
      // Expensive connections
      .put("history", 5)
      .put("commits", 5)
      .put("collaborators", 3)
      .put("languages", 2)
      .put("repositoryTopics", 1)
      .put("issues", 2)
      .put("pullRequests", 2)
      .put("releases", 2)
      .put("discussions", 3)
      .put("projectsV2", 4)
      .put("milestones", 2)
      .put("reactions", 1)
      .put("reviews", 2)
      .put("assignees", 1)
      .put("labels", 1)
      .put("comments", 1)
      // Search
      .put("search", 10)
      .put("repositories", 5)
      .put("users", 3)
      .put("organizations", 3)
      // Single linked objects
      .put("defaultBranchRef", 2)
      .put("primaryLanguage", 1)
      .put("licenseInfo", 1)
      .put("owner", 1)
      .put("author", 1)
      .put("creator", 1)
      // Scalars; zero means they're charged as unknown fields
      .put("id", 0)
      .put("name", 0)
      .put("login", 0)
      .put("title", 0)
      .put("description", 0)
      .put("url", 0)
      .put("createdAt", 0)
      .put("updatedAt", 0)
      .put("stargazerCount", 0)
      .put("forkCount", 0)
      .put("state", 0)
      .put("number", 0)
      .build();

  public CostModel {
    Preconditions.checkArgument(baseQueryCost >= 0, "baseQueryCost must not be negative");
    Preconditions.checkArgument(defaultFirst >= 0, "defaultFirst must not be negative");
    Preconditions.checkArgument(maxNestingLevel > 0, "maxNestingLevel must be positive");
    fieldCosts = ImmutableMap.copyOf(fieldCosts);
  }

  /**
   * The model calibrated against the GitHub GraphQL API.
   */
  public static CostModel github() {
    return new CostModel(1, GITHUB_FIELD_COSTS, 1, 2, 10, 1.5, 2, 1000, 50, 5, 100, 3);
  }

  public int fieldCost(String field) {
    return listedCost(field, unknownFieldCost);
  }

  public int connectionCost(String field) {
    return listedCost(field, unknownConnectionCost);
  }

  private int listedCost(String field, int otherwise) {
    var cost = fieldCosts.get(field);
    return cost == null || cost <= 0 ? otherwise : cost;
  }

  public CostModel withMaxComplexityPerQuery(int value) {
    return new CostModel(baseQueryCost, fieldCosts, unknownFieldCost, unknownConnectionCost, defaultFirst,
        connectionMultiplier, nestedQueryMultiplier, value, fallbackPoints, maxNestingLevel, largeConnectionThreshold,
        nestedGroupWarningThreshold);
  }

  public CostModel withFieldCost(String field, int cost) {
    var costs = ImmutableMap.<String, Integer>builder().putAll(fieldCosts).put(field, cost).buildKeepingLast();
    return new CostModel(baseQueryCost, costs, unknownFieldCost, unknownConnectionCost, defaultFirst,
        connectionMultiplier, nestedQueryMultiplier, maxComplexityPerQuery, fallbackPoints, maxNestingLevel,
        largeConnectionThreshold, nestedGroupWarningThreshold);
  }
}
