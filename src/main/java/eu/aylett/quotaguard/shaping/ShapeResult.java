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

package eu.aylett.quotaguard.shaping;

import org.jspecify.annotations.Nullable;

/**
 * The outcome of shaping a response.
 *
 * @param data
 *          the shaped data; the original instance when nothing needed to
 *          change
 * @param truncated
 *          whether anything was dropped or shortened
 * @param originalSizeBytes
 *          the serialized size before the byte budget was applied, or null if
 *          it couldn't be measured
 */
public record ShapeResult<T>(T data, boolean truncated, @Nullable Long originalSizeBytes) {
  public static <T> ShapeResult<T> unshaped(T data) {
    return new ShapeResult<>(data, false, null);
  }
}
