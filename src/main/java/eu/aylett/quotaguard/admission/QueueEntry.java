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

import org.jetbrains.annotations.Contract;
import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * A task waiting in a resource class's queue.
 * <p>
 * Entries order highest priority first, then by submission order. The result
 * future is what the submitter is holding: completing it resolves or rejects
 * their call.
 * </p>
 */
final class QueueEntry<T> implements Comparable<QueueEntry<?>> {
  final int priority;
  final long sequence;
  private final Supplier<? extends CompletionStage<T>> task;
  private final CompletableFuture<T> result = new CompletableFuture<>();
  private boolean readmitted;

  QueueEntry(int priority, long sequence, Supplier<? extends CompletionStage<T>> task) {
    this.priority = priority;
    this.sequence = sequence;
    this.task = task;
  }

  CompletableFuture<T> result() {
    return result;
  }

  /**
   * Start the task. A task that throws rather than returning a stage is treated
   * as having failed.
   */
  CompletionStage<T> start() {
    try {
      return task.get();
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  boolean readmitted() {
    return readmitted;
  }

  void markReadmitted() {
    readmitted = true;
  }

  @Override
  public int compareTo(QueueEntry<?> o) {
    var byPriority = Integer.compare(o.priority, priority);
    if (byPriority != 0) {
      return byPriority;
    }
    return Long.compare(sequence, o.sequence);
  }

  @Override
  @Contract(value = "null -> false", pure = true)
  public boolean equals(@Nullable Object obj) {
    if (obj instanceof QueueEntry<?> that) {
      return priority == that.priority && sequence == that.sequence;
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(priority, sequence);
  }
}
