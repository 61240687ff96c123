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

import eu.aylett.quotaguard.dedup.RequestKeys;
import eu.aylett.quotaguard.spi.ResponseCache;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Caches forever, and remembers the TTL it was asked for.
 */
class InMemoryResponseCache implements ResponseCache {
  final Map<String, CompletableFuture<?>> entries = new ConcurrentHashMap<>();
  final List<Duration> requestedTtls = new CopyOnWriteArrayList<>();

  @Override
  @SuppressWarnings("unchecked")
  public <T> CompletableFuture<T> get(String operation, Map<String, ? extends @Nullable Object> params,
      Supplier<? extends CompletionStage<T>> producer, Duration ttl) {
    requestedTtls.add(ttl);
    return (CompletableFuture<T>) entries.computeIfAbsent(RequestKeys.of(operation, params),
        key -> producer.get().toCompletableFuture());
  }

  @Override
  public int invalidate(Pattern keyPattern) {
    var matching = entries.keySet().stream().filter(key -> keyPattern.matcher(key).find()).toList();
    matching.forEach(entries::remove);
    return matching.size();
  }

  @Override
  public void clear() {
    entries.clear();
  }
}
