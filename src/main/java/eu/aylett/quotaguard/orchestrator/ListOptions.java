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

package eu.aylett.quotaguard.orchestrator;

import com.google.common.base.Preconditions;

/**
 * How much of a paged listing to fetch.
 */
public record ListOptions(int maxPages, int perPage) {
  public ListOptions {
    Preconditions.checkArgument(maxPages > 0, "maxPages must be positive");
    Preconditions.checkArgument(perPage > 0, "perPage must be positive");
  }

  public static ListOptions defaults() {
    return new ListOptions(5, 100);
  }

  public static ListOptions singlePage(int perPage) {
    return new ListOptions(1, perPage);
  }
}
