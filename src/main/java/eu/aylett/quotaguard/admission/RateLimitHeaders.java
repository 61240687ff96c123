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

import com.google.common.primitives.Longs;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Quota metadata as reported by the remote service on a response.
 *
 * @param limit
 *          the size of the bucket
 * @param remaining
 *          how much of the bucket is left
 * @param resetAt
 *          when the bucket is refilled
 */
public record RateLimitHeaders(long limit, long remaining, Instant resetAt) {
  public static final String LIMIT_HEADER = "x-ratelimit-limit";
  public static final String REMAINING_HEADER = "x-ratelimit-remaining";
  public static final String RESET_HEADER = "x-ratelimit-reset";

  /**
   * Read the quota headers from a response. Header names are matched without
   * regard to case; the reset header is in epoch seconds.
   *
   * @return the parsed headers, or empty if any of the three is missing or not a
   *         number
   */
  public static Optional<RateLimitHeaders> parse(Map<String, String> headers) {
    var byName = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
    byName.putAll(headers);

    var limit = number(byName.get(LIMIT_HEADER));
    var remaining = number(byName.get(REMAINING_HEADER));
    var reset = number(byName.get(RESET_HEADER));
    if (limit == null || remaining == null || reset == null) {
      return Optional.empty();
    }
    return Optional.of(new RateLimitHeaders(limit, remaining, Instant.ofEpochSecond(reset)));
  }

  private static @Nullable Long number(@Nullable String value) {
    return value == null ? null : Longs.tryParse(value.trim());
  }
}
