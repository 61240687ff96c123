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

package eu.aylett.quotaguard.dedup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic keys for requests.
 * <p>
 * Two requests get the same key when they name the same operation and their
 * non-null parameters serialize the same, whatever order the parameters were
 * supplied in.
 * </p>
 */
public final class RequestKeys {
  private static final ObjectMapper MAPPER = JsonMapper.builder()
      .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
      .build();

  private RequestKeys() {
  }

  public static String of(String operation, Map<String, ? extends @Nullable Object> params) {
    var sorted = new TreeMap<String, Object>();
    params.forEach((name, value) -> {
      if (value != null) {
        sorted.put(name, value);
      }
    });
    try {
      return operation + ":" + MAPPER.writeValueAsString(sorted);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Parameters for " + operation + " can't be serialized into a request key", e);
    }
  }
}
