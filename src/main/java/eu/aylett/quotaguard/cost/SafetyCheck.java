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

package eu.aylett.quotaguard.cost;

import java.util.List;

/**
 * Whether a query fits within a point budget.
 */
public record SafetyCheck(boolean safe, int points, List<String> warnings) {
  public static final int DEFAULT_MAX_POINTS = 50;

  public SafetyCheck {
    warnings = List.copyOf(warnings);
  }
}
