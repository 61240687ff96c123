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

package eu.aylett.quotaguard.admission;

import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;

/**
 * A named quota bucket on the remote service.
 *
 * @param name
 *          the bucket name, as the service reports it
 */
public record ResourceClass(String name) {
  /** General REST calls. */
  public static final ResourceClass CORE = new ResourceClass("core");
  /** Search endpoints, which have a much smaller quota. */
  public static final ResourceClass SEARCH = new ResourceClass("search");
  /** The graph query endpoint, charged in points rather than calls. */
  public static final ResourceClass GRAPHQL = new ResourceClass("graphql");

  public ResourceClass {
    Preconditions.checkArgument(!name.isBlank(), "Resource class name must not be blank");
  }

  /**
   * Work out which bucket a request path is charged against.
   */
  public static ResourceClass forPath(@Nullable String path) {
    if (path == null) {
      return CORE;
    }
    if (path.contains("/search/")) {
      return SEARCH;
    }
    if (path.contains("graphql")) {
      return GRAPHQL;
    }
    return CORE;
  }

  @Override
  public String toString() {
    return name;
  }
}
