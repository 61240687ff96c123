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

package eu.aylett.quotaguard.dedup;

import com.google.common.base.Preconditions;

import java.time.Duration;

/**
 * @param maxPendingAge
 *          how long a request may stay in flight before the sweep forgets it;
 *          also the sweep interval
 * @param enableMetrics
 *          whether to count requests
 */
public record DeduplicationSettings(Duration maxPendingAge, boolean enableMetrics) {
  public DeduplicationSettings {
    Preconditions.checkArgument(!maxPendingAge.isNegative() && !maxPendingAge.isZero(),
        "maxPendingAge must be positive");
  }

  public static DeduplicationSettings defaults() {
    return new DeduplicationSettings(Duration.ofSeconds(5), true);
  }

  public DeduplicationSettings withMaxPendingAge(Duration value) {
    return new DeduplicationSettings(value, enableMetrics);
  }

  public DeduplicationSettings withMetrics(boolean value) {
    return new DeduplicationSettings(maxPendingAge, value);
  }
}
