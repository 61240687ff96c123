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

package eu.aylett.quotaguard.shaping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounds the size of a response before it's returned to a caller.
 * <p>
 * Arrays are cut to at most {@code maxItems} elements, and then to the longest
 * prefix that serializes within {@code maxBytes}. Anything else that's over
 * budget has its long strings shortened, at any depth. Sizes are measured as
 * the UTF-8 length of the JSON serialization.
 * </p>
 * <p>
 * The caller's data is never modified: when shaping changes something, the
 * result is a new structure. When shaping fails, the original data is returned
 * as it was.
 * </p>
 */
public class ResponseShaper {
  private static final Logger LOG = LoggerFactory.getLogger(ResponseShaper.class);

  public static final long DEFAULT_MAX_BYTES = 10L * 1024 * 1024;
  public static final int DEFAULT_MAX_ITEMS = 1000;
  public static final int MAX_FIELD_LENGTH = 1000;
  public static final String TRUNCATION_MARKER = "... [truncated]";

  private final ObjectMapper mapper;

  /**
   * Fully configurable constructor.
   *
   * @param mapper
   *          used to measure and convert responses; should match however the
   *          responses will eventually be written out
   */
  public ResponseShaper(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  /**
   * Measures responses as compact JSON.
   */
  public ResponseShaper() {
    this(JsonMapper.builder().build());
  }

  public <T> ShapeResult<T> shape(T data) {
    return shape(data, DEFAULT_MAX_BYTES, DEFAULT_MAX_ITEMS);
  }

  public <T> ShapeResult<T> shape(T data, long maxBytes, int maxItems) {
    Preconditions.checkArgument(maxBytes >= 0, "maxBytes must not be negative");
    Preconditions.checkArgument(maxItems >= 0, "maxItems must not be negative");
    try {
      if (isSequence(data)) {
        return shapeSequence(data, maxBytes, maxItems);
      }
      return shapeObject(data, maxBytes);
    } catch (JsonProcessingException | RuntimeException e) {
      LOG.warn("Unable to shape {}, returning it unchanged", data.getClass().getName(), e);
      return ShapeResult.unshaped(data);
    }
  }

  private <T> ShapeResult<T> shapeSequence(T data, long maxBytes, int maxItems) throws JsonProcessingException {
    var capped = data;
    var truncated = false;
    if (length(data) > maxItems) {
      capped = prefix(data, maxItems);
      truncated = true;
    }

    var sizeBytes = sizeOf(capped);
    if (sizeBytes <= maxBytes) {
      return new ShapeResult<>(capped, truncated, sizeBytes);
    }

    // Largest prefix that fits; the empty prefix always serves as a floor.
    var low = 0;
    var high = length(capped);
    var bestFit = prefix(capped, 0);
    while (low <= high) {
      var mid = (low + high) >>> 1;
      var candidate = prefix(capped, mid);
      if (sizeOf(candidate) <= maxBytes) {
        bestFit = candidate;
        low = mid + 1;
      } else {
        high = mid - 1;
      }
    }
    LOG.debug("Cut {} items ({} bytes) to {} items to fit {} bytes", length(capped), sizeBytes, length(bestFit),
        maxBytes);
    return new ShapeResult<>(bestFit, true, sizeBytes);
  }

  private <T> ShapeResult<T> shapeObject(T data, long maxBytes) throws JsonProcessingException {
    var sizeBytes = sizeOf(data);
    if (sizeBytes <= maxBytes) {
      return new ShapeResult<>(data, false, sizeBytes);
    }
    JsonNode tree = mapper.valueToTree(data);
    var shortened = truncateStrings(tree);
    return new ShapeResult<>(fromTree(shortened, data), true, sizeBytes);
  }

  private JsonNode truncateStrings(JsonNode node) {
    if (node.isTextual()) {
      var text = node.textValue();
      if (text.length() > MAX_FIELD_LENGTH) {
        return mapper.getNodeFactory().textNode(text.substring(0, MAX_FIELD_LENGTH) + TRUNCATION_MARKER);
      }
      return node;
    }
    if (node.isArray()) {
      var copy = mapper.createArrayNode();
      node.forEach(element -> copy.add(truncateStrings(element)));
      return copy;
    }
    if (node.isObject()) {
      var copy = mapper.createObjectNode();
      node.fields().forEachRemaining(field -> copy.set(field.getKey(), truncateStrings(field.getValue())));
      return copy;
    }
    return node;
  }

  @SuppressWarnings("unchecked")
  private <T> T fromTree(JsonNode tree, T original) throws JsonProcessingException {
    if (original instanceof JsonNode) {
      return (T) tree;
    }
    if (original instanceof Map) {
      return (T) mapper.convertValue(tree, LinkedHashMap.class);
    }
    return (T) mapper.treeToValue(tree, original.getClass());
  }

  private long sizeOf(Object value) throws JsonProcessingException {
    return mapper.writeValueAsBytes(value).length;
  }

  private static boolean isSequence(Object data) {
    return data instanceof List || data instanceof Object[] || data instanceof ArrayNode;
  }

  private static int length(Object sequence) {
    if (sequence instanceof List<?> list) {
      return list.size();
    }
    if (sequence instanceof Object[] array) {
      return array.length;
    }
    return ((ArrayNode) sequence).size();
  }

  @SuppressWarnings("unchecked")
  private <T> T prefix(T sequence, int length) {
    if (sequence instanceof List<?> list) {
      return (T) new ArrayList<>(list.subList(0, length));
    }
    if (sequence instanceof Object[] array) {
      return (T) Arrays.copyOf(array, length);
    }
    var source = (ArrayNode) sequence;
    var copy = mapper.createArrayNode();
    for (var i = 0; i < length; i++) {
      copy.add(source.get(i));
    }
    return (T) copy;
  }
}
