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

import java.time.Instant;

/**
 * Thrown by a transport when the remote service has refused a call because the
 * quota is used up.
 * <p>
 * The admission controller looks for this exception specifically: it marks the
 * resource class as exhausted until {@link #resetAt}, so nothing else is sent
 * until the service will accept it.
 * </p>
 */
public class QuotaExhaustedException extends RuntimeException {
  /**
   * When the service says the quota will be refilled.
   */
  public final Instant resetAt;

  /**
   * Constructs a new QuotaExhaustedException.
   *
   * @param message
   *          the detail message
   * @param resetAt
   *          when the quota resets
   */
  public QuotaExhaustedException(String message, Instant resetAt) {
    this(message, resetAt, null);
  }

  /**
   * Constructs a new QuotaExhaustedException wrapping the transport's own error.
   *
   * @param message
   *          the detail message
   * @param resetAt
   *          when the quota resets
   * @param cause
   *          the transport failure that carried the signal
   */
  public QuotaExhaustedException(String message, Instant resetAt, @Nullable Throwable cause) {
    super(message + " (quota resets at " + resetAt + ")", cause);
    this.resetAt = resetAt;
  }
}
