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

/**
 * The outcome of one call in a batch: either its data or its error.
 */
public record BatchResult<T>(String operation, @Nullable T data, @Nullable Throwable error) {
  static <T> BatchResult<T> success(String operation, @Nullable T data) {
    return new BatchResult<>(operation, data, null);
  }

  static <T> BatchResult<T> failure(String operation, Throwable error) {
    return new BatchResult<>(operation, null, error);
  }

  public boolean succeeded() {
    return error == null;
  }
}
