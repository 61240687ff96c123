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

import org.jspecify.annotations.Nullable;

/**
 * Implemented by transport results that carry the service's quota headers, so
 * the controller can pick them up without knowing the transport.
 */
public interface QuotaReporting {
  /**
   * @return the quota reported alongside this result, or null if the response
   *         didn't include one
   */
  @Nullable
  RateLimitHeaders rateLimitHeaders();
}
