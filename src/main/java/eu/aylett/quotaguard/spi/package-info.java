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
 * What the orchestrator needs from the world around it.
 * <p>
 * None of these are implemented here: the transport, the cache, the paging
 * engine and the performance monitor are all supplied by the application.
 * </p>
 */
@NullMarked
package eu.aylett.quotaguard.spi;

import org.jspecify.annotations.NullMarked;
