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

package eu.aylett.quotaguard.spi;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.util.concurrent.CompletionStage;

/**
 * The remote API calls the orchestrator's convenience methods make.
 * <p>
 * A transport that sees an exhausted quota should fail the returned stage
 * with {@link eu.aylett.quotaguard.admission.QuotaExhaustedException}.
 * </p>
 */
public interface ApiTransport {
  CompletionStage<JsonNode> getContent(String owner, String repo, String path, @Nullable String ref);

  CompletionStage<JsonNode> getRepository(String owner, String repo);

  CompletionStage<JsonNode> getUser(String username);

  CompletionStage<JsonNode> getAuthenticatedUser();
}
