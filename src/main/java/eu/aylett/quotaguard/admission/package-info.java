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
 * Quota-aware admission for calls to a rate-limited remote API.
 * <p>
 * The remote service hands out a separate quota for each class of resource
 * (plain REST calls, search, graph queries), and tells us how much is left on
 * every response. Rather than letting callers race each other into a 403, we
 * queue their work per resource class and only let it out when there's quota to
 * spend, in priority order.
 * </p>
 * <p>
 * One instance of {@link eu.aylett.quotaguard.admission.RateAdmissionController}
 * should be shared by everything that talks to the same account on the same
 * service: the quota is per account, so the controller must be too.
 * </p>
 */
@NullMarked
package eu.aylett.quotaguard.admission;

import org.jspecify.annotations.NullMarked;
