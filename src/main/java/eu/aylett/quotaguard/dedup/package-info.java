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

/**
 * In-flight request collapsing.
 * <p>
 * When several callers ask for the same thing at the same time, only one call
 * goes to the service and they all share its outcome. Nothing is remembered
 * once the call settles: that's the cache's job, not ours.
 * </p>
 */
@NullMarked
package eu.aylett.quotaguard.dedup;

import org.jspecify.annotations.NullMarked;
