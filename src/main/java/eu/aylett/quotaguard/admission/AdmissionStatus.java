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

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * A point-in-time view of the controller.
 *
 * @param perResource
 *          the quota we hold for each resource class seen so far
 * @param queueLength
 *          tasks waiting to be dispatched, across all resource classes; tasks
 *          already running aren't counted
 */
public record AdmissionStatus(Map<ResourceClass, ResourceQuota> perResource, int queueLength) {
  public AdmissionStatus {
    perResource = ImmutableMap.copyOf(perResource);
  }

  public @Nullable ResourceQuota quota(ResourceClass resourceClass) {
    return perResource.get(resourceClass);
  }
}
