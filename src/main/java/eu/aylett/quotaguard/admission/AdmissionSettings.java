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
import com.google.common.collect.ImmutableMap;

import java.time.Duration;
import java.util.Map;

/**
 * Tuning for a {@link RateAdmissionController}.
 *
 * @param minInterval
 *          the minimum spacing between any two dispatches, across all resource
 *          classes
 * @param dispatchDelay
 *          the pause a queue takes after each task settles before dispatching
 *          the next one
 * @param lowWatermark
 *          once remaining quota drops to this, hold everything for that class
 *          until the quota resets
 * @param quotaRetryHorizon
 *          a task refused for lack of quota is queued once more if the quota
 *          resets within this long; otherwise the refusal goes to the caller
 * @param defaultLimits
 *          the quota each resource class starts with, before the service has
 *          told us otherwise
 */
public record AdmissionSettings(Duration minInterval, Duration dispatchDelay, long lowWatermark,
    Duration quotaRetryHorizon, Map<ResourceClass, Long> defaultLimits) {
  private static final long FALLBACK_LIMIT = 5000;

  public AdmissionSettings {
    Preconditions.checkArgument(!minInterval.isNegative(), "minInterval must not be negative");
    Preconditions.checkArgument(!dispatchDelay.isNegative(), "dispatchDelay must not be negative");
    Preconditions.checkArgument(lowWatermark >= 0, "lowWatermark must not be negative");
    Preconditions.checkArgument(!quotaRetryHorizon.isNegative(), "quotaRetryHorizon must not be negative");
    defaultLimits = ImmutableMap.copyOf(defaultLimits);
  }

  /**
   * Settings calibrated for the public GitHub API.
   */
  public static AdmissionSettings defaults() {
    return new AdmissionSettings(Duration.ofMillis(100), Duration.ofMillis(50), 10, Duration.ofSeconds(60),
        ImmutableMap.of(ResourceClass.CORE, 5000L, ResourceClass.SEARCH, 30L, ResourceClass.GRAPHQL, 5000L));
  }

  public AdmissionSettings withMinInterval(Duration value) {
    return new AdmissionSettings(value, dispatchDelay, lowWatermark, quotaRetryHorizon, defaultLimits);
  }

  public AdmissionSettings withDispatchDelay(Duration value) {
    return new AdmissionSettings(minInterval, value, lowWatermark, quotaRetryHorizon, defaultLimits);
  }

  public AdmissionSettings withLowWatermark(long value) {
    return new AdmissionSettings(minInterval, dispatchDelay, value, quotaRetryHorizon, defaultLimits);
  }

  public AdmissionSettings withQuotaRetryHorizon(Duration value) {
    return new AdmissionSettings(minInterval, dispatchDelay, lowWatermark, value, defaultLimits);
  }

  public AdmissionSettings withDefaultLimit(ResourceClass resourceClass, long limit) {
    Preconditions.checkArgument(limit >= 0, "limit must not be negative");
    var limits = ImmutableMap.<ResourceClass, Long>builder()
        .putAll(defaultLimits)
        .put(resourceClass, limit)
        .buildKeepingLast();
    return new AdmissionSettings(minInterval, dispatchDelay, lowWatermark, quotaRetryHorizon, limits);
  }

  /**
   * The starting quota for a resource class. Classes we've not been told about
   * start with the same quota as {@link ResourceClass#CORE}.
   */
  public long defaultLimitFor(ResourceClass resourceClass) {
    var limit = defaultLimits.get(resourceClass);
    if (limit != null) {
      return limit;
    }
    return defaultLimits.getOrDefault(ResourceClass.CORE, FALLBACK_LIMIT);
  }
}
