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

package eu.aylett.quotaguard.spi;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * A cache of responses, keyed by operation and parameters.
 */
public interface ResponseCache {
  /**
   * Return the cached value for this request, or produce and cache it.
   * <p>
   * Implementations must call {@code producer} at most once per unexpired key.
   * </p>
   */
  <T> CompletableFuture<T> get(String operation, Map<String, ? extends @Nullable Object> params,
      Supplier<? extends CompletionStage<T>> producer, Duration ttl);

  /**
   * Drop every entry whose key matches.
   *
   * @return how many entries were dropped
   */
  default int invalidate(Pattern keyPattern) {
    return 0;
  }

  default void clear() {
  }
}
