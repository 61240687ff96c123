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

import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;

/**
 * A request that's currently in flight.
 * <p>
 * Entries become available from a {@link java.util.concurrent.DelayQueue} once
 * they've been pending for longer than the maximum pending age. Equality is
 * identity: a later request for the same key is a different entry.
 * </p>
 */
final class PendingEntry<T> implements Delayed {
  final String key;
  final CompletableFuture<T> future;
  final Instant createdAt;
  private final InstantSource clock;
  private final Instant expiry;

  PendingEntry(String key, CompletableFuture<T> future, InstantSource clock, Duration maxPendingAge) {
    this.key = key;
    this.future = future;
    this.clock = clock;
    this.createdAt = clock.instant();
    this.expiry = createdAt.plus(maxPendingAge);
  }

  Duration age() {
    return Duration.between(createdAt, clock.instant());
  }

  @Override
  public long getDelay(TimeUnit unit) {
    return clock.instant().until(expiry, unit.toChronoUnit());
  }

  @Override
  public int compareTo(Delayed o) {
    if (o instanceof PendingEntry<?> other) {
      return expiry.compareTo(other.expiry);
    }
    return Long.compare(getDelay(TimeUnit.MILLISECONDS), o.getDelay(TimeUnit.MILLISECONDS));
  }
}
