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

import java.util.List;

/**
 * The estimated cost of a query, and how it was arrived at.
 *
 * @param baseFields
 *          the base query cost plus the cost of every distinct field
 * @param connections
 *          the cost of paged connections
 * @param nestedQueries
 *          the cost of deep nesting
 * @param totalFields
 *          how many distinct fields were found
 * @param estimatedPoints
 *          the total estimate
 * @param warnings
 *          anything the caller should think about before sending the query
 */
public record CostBreakdown(int baseFields, int connections, int nestedQueries, int totalFields,
    int estimatedPoints, List<String> warnings) {
  public CostBreakdown {
    warnings = List.copyOf(warnings);
  }

  static CostBreakdown fallback(int points, String warning) {
    return new CostBreakdown(0, 0, 0, 0, points, List.of(warning));
  }
}
