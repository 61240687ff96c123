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

/**
 * Typical costs for common kinds of query, for budgeting without a query in
 * hand.
 */
public enum QueryPattern {
  REPOSITORY_BASIC(5),
  REPOSITORY_DETAILED(25),
  SEARCH_REPOSITORIES(15),
  USER_PROFILE(8),
  BATCH_REPOSITORIES(40);

  private final int points;

  QueryPattern(int points) {
    this.points = points;
  }

  public int points() {
    return points;
  }
}
