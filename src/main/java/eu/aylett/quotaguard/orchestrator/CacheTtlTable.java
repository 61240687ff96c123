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
import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Map;

/**
 * How long to cache each operation's results.
 * <p>
 * A TTL of zero means the operation is never cached; write operations should
 * always be zero.
 * </p>
 */
public record CacheTtlTable(Map<String, Duration> perOperation, Duration globalDefault) {
  public CacheTtlTable {
    perOperation = ImmutableMap.copyOf(perOperation);
    perOperation.forEach((operation, ttl) -> Preconditions.checkArgument(!ttl.isNegative(),
        "TTL for %s must not be negative", operation));
    Preconditions.checkArgument(!globalDefault.isNegative(), "globalDefault must not be negative");
  }

  /**
   * TTLs for the GitHub REST operations we know about.
   */
  public static CacheTtlTable defaults() {
    return new CacheTtlTable(ImmutableMap.<String, Duration>builder()
        .put("repos.get", Duration.ofMinutes(10))
        .put("repos.listBranches", Duration.ofMinutes(5))
        .put("repos.listTags", Duration.ofMinutes(10))
        .put("users.get", Duration.ofMinutes(30))
        .put("users.getAuthenticated", Duration.ofMinutes(30))
        .put("orgs.get", Duration.ofMinutes(15))
        .put("orgs.listMembers", Duration.ofMinutes(10))
        .put("repos.getContent", Duration.ofMinutes(5))
        .put("issues.create", Duration.ZERO)
        .put("pulls.create", Duration.ZERO)
        .put("repos.createOrUpdateFileContents", Duration.ZERO)
        .put("actions.listWorkflowRuns", Duration.ofSeconds(30))
        .build(), Duration.ofMinutes(5));
  }

  /**
   * An explicit TTL wins; then the operation's entry; then the global default.
   */
  public Duration resolve(String operation, @Nullable Duration explicit) {
    if (explicit != null) {
      return explicit;
    }
    return perOperation.getOrDefault(operation, globalDefault);
  }

  public CacheTtlTable with(String operation, Duration ttl) {
    return new CacheTtlTable(ImmutableMap.<String, Duration>builder()
        .putAll(perOperation)
        .put(operation, ttl)
        .buildKeepingLast(), globalDefault);
  }

  public CacheTtlTable withGlobalDefault(Duration ttl) {
    return new CacheTtlTable(perOperation, ttl);
  }
}
