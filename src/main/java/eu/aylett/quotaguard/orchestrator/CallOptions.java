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

import eu.aylett.quotaguard.admission.ResourceClass;
import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * How a single call should be treated.
 *
 * @param cacheTtl
 *          how long to cache the result; null to look it up by operation, zero
 *          never to cache it
 * @param skipCache
 *          bypass the cache for this call
 * @param skipDeduplication
 *          always make a fresh call, even if an identical one is in flight
 * @param resourceClass
 *          the quota bucket the call draws on
 * @param priority
 *          higher is admitted sooner
 */
public record CallOptions(@Nullable Duration cacheTtl, boolean skipCache, boolean skipDeduplication,
    ResourceClass resourceClass, int priority) {
  public static final int DEFAULT_PRIORITY = 1;

  public CallOptions {
    if (cacheTtl != null && cacheTtl.isNegative()) {
      throw new IllegalArgumentException("cacheTtl must not be negative");
    }
  }

  public static CallOptions defaults() {
    return new CallOptions(null, false, false, ResourceClass.CORE, DEFAULT_PRIORITY);
  }

  public CallOptions withCacheTtl(@Nullable Duration cacheTtl) {
    return new CallOptions(cacheTtl, skipCache, skipDeduplication, resourceClass, priority);
  }

  public CallOptions withSkipCache(boolean skipCache) {
    return new CallOptions(cacheTtl, skipCache, skipDeduplication, resourceClass, priority);
  }

  public CallOptions withSkipDeduplication(boolean skipDeduplication) {
    return new CallOptions(cacheTtl, skipCache, skipDeduplication, resourceClass, priority);
  }

  public CallOptions withResourceClass(ResourceClass resourceClass) {
    return new CallOptions(cacheTtl, skipCache, skipDeduplication, resourceClass, priority);
  }

  public CallOptions withPriority(int priority) {
    return new CallOptions(cacheTtl, skipCache, skipDeduplication, resourceClass, priority);
  }
}
