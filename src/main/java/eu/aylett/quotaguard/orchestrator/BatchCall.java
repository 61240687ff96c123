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

import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * One call in a batch.
 */
public record BatchCall<T>(String operation, Map<String, ? extends @Nullable Object> params,
    Supplier<? extends CompletionStage<T>> fetcher, CallOptions options) {
  public BatchCall(String operation, Map<String, ? extends @Nullable Object> params,
      Supplier<? extends CompletionStage<T>> fetcher) {
    this(operation, params, fetcher, CallOptions.defaults());
  }
}
