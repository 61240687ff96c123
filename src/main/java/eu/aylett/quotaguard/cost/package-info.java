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
 * Up-front point estimates for graph queries.
 * <p>
 * The estimate is deliberately rough: a lexical scan, not a parse, calibrated
 * against how the service actually charges. Use it to pick page sizes before
 * sending a query; it never stops a query from being sent.
 * </p>
 */
@NullMarked
package eu.aylett.quotaguard.cost;

import org.jspecify.annotations.NullMarked;
