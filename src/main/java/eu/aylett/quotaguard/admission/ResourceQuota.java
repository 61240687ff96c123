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

import java.time.Duration;
import java.time.Instant;

/**
 * A snapshot of one resource class's quota.
 * <p>
 * Remaining quota is never negative: a service that reports a negative count
 * has run out, which we record as zero.
 * </p>
 *
 * @param resourceName
 *          the resource class this quota belongs to
 * @param limit
 *          the size of the bucket
 * @param remaining
 *          how much of the bucket we believe is left
 * @param resetAt
 *          when the bucket is next refilled
 */
public record ResourceQuota(String resourceName, long limit, long remaining, Instant resetAt) {
  public ResourceQuota {
    Preconditions.checkArgument(limit >= 0, "Quota limit must not be negative: %s", limit);
    remaining = Math.max(0, remaining);
  }

  static ResourceQuota initial(ResourceClass resourceClass, long limit, Instant now) {
    return new ResourceQuota(resourceClass.name(), limit, limit, now);
  }

  ResourceQuota exhausted(Instant reset) {
    return new ResourceQuota(resourceName, limit, 0, reset);
  }

  ResourceQuota replenished() {
    return new ResourceQuota(resourceName, limit, limit, resetAt);
  }

  ResourceQuota updatedFrom(RateLimitHeaders headers) {
    return new ResourceQuota(resourceName, Math.max(0, headers.limit()), headers.remaining(), headers.resetAt());
  }

  /**
   * How long until this quota resets, or zero if it already has.
   */
  public Duration untilReset(Instant now) {
    return now.isBefore(resetAt) ? Duration.between(now, resetAt) : Duration.ZERO;
  }
}
