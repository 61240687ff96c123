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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.InstantSource;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Collapses concurrent identical requests into one execution.
 * <p>
 * The first caller for a key starts the executor; anyone else who asks for the
 * same key before it settles gets the same outcome without a second call.
 * Once it settles, the key is forgotten, whether it succeeded or failed.
 * </p>
 * <p>
 * Each caller gets their own copy of the shared future, so a caller who stops
 * waiting and cancels theirs doesn't cancel anyone else's.
 * </p>
 */
public class RequestDeduplicator implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(RequestDeduplicator.class);

  private final DeduplicationSettings settings;
  private final InstantSource clock;
  private final ConcurrentHashMap<String, PendingEntry<?>> pending = new ConcurrentHashMap<>();
  private final DelayQueue<PendingEntry<?>> expiries = new DelayQueue<>();
  private final AtomicLong totalRequests = new AtomicLong(0);
  private final AtomicLong deduplicatedRequests = new AtomicLong(0);
  private final @Nullable ScheduledExecutorService ownedScheduler;
  private final @Nullable ScheduledFuture<?> sweepTask;

  /**
   * A fully configurable deduplicator.
   *
   * @param settings
   *          pending age and metrics
   * @param clock
   *          the time source for ageing entries (mainly for testing)
   * @param scheduler
   *          runs the periodic stale-entry sweep; if null, stale entries are
   *          only swept when a request arrives or {@link #sweepStale()} is
   *          called
   */
  public RequestDeduplicator(DeduplicationSettings settings, InstantSource clock,
      @Nullable ScheduledExecutorService scheduler) {
    this(settings, clock, scheduler, false);
  }

  /**
   * A deduplicator with its own sweeper thread, using the system clock.
   */
  public RequestDeduplicator(DeduplicationSettings settings) {
    this(settings, Clock.systemUTC(), newScheduler(), true);
  }

  public RequestDeduplicator() {
    this(DeduplicationSettings.defaults());
  }

  private RequestDeduplicator(DeduplicationSettings settings, InstantSource clock,
      @Nullable ScheduledExecutorService scheduler, boolean ownsScheduler) {
    this.settings = settings;
    this.clock = clock;
    this.ownedScheduler = ownsScheduler ? scheduler : null;
    if (scheduler != null) {
      var interval = settings.maxPendingAge().toMillis();
      this.sweepTask = scheduler.scheduleAtFixedRate(this::sweepStale, interval, interval, TimeUnit.MILLISECONDS);
    } else {
      this.sweepTask = null;
    }
  }

  private static ScheduledExecutorService newScheduler() {
    return Executors.newSingleThreadScheduledExecutor(
        new ThreadFactoryBuilder().setNameFormat("request-dedup-sweep-%d").setDaemon(true).build());
  }

  /**
   * Run the executor, unless an identical request is already in flight, in
   * which case share its outcome.
   *
   * @param operation
   *          the name of the remote operation
   * @param params
   *          the operation's parameters; null values are ignored
   * @param executor
   *          starts the request
   */
  public <T> CompletableFuture<T> dedupe(String operation, Map<String, ? extends @Nullable Object> params,
      Supplier<? extends CompletionStage<T>> executor) {
    sweepStale();
    var key = RequestKeys.of(operation, params);
    if (settings.enableMetrics()) {
      totalRequests.incrementAndGet();
    }

    var entry = new PendingEntry<T>(key, new CompletableFuture<>(), clock, settings.maxPendingAge());
    var existing = pending.putIfAbsent(key, entry);
    if (existing != null) {
      if (settings.enableMetrics()) {
        deduplicatedRequests.incrementAndGet();
      }
      LOG.debug("Joining in-flight request {}", key);
      @SuppressWarnings("unchecked")
      var shared = (CompletableFuture<T>) existing.future;
      return shared.copy();
    }

    expiries.offer(entry);
    start(entry, executor);
    return entry.future.copy();
  }

  private <T> void start(PendingEntry<T> entry, Supplier<? extends CompletionStage<T>> executor) {
    CompletionStage<T> stage;
    try {
      stage = executor.get();
    } catch (RuntimeException e) {
      stage = CompletableFuture.failedFuture(e);
    }
    stage.whenComplete((value, error) -> {
      // Forget the key before anyone sees the outcome, so a caller reacting to
      // it starts a fresh request
      pending.remove(entry.key, entry);
      expiries.remove(entry);
      if (error == null) {
        entry.future.complete(value);
      } else {
        entry.future.completeExceptionally(unwrap(error));
      }
    });
  }

  /**
   * Forget requests that have been in flight for longer than the maximum
   * pending age. Their callers keep waiting on the original execution; only
   * new callers are affected, and they'll start a fresh one.
   *
   * @return how many entries were dropped
   */
  public int sweepStale() {
    var dropped = 0;
    PendingEntry<?> expired;
    while ((expired = expiries.poll()) != null) {
      if (pending.remove(expired.key, expired)) {
        dropped++;
        LOG.warn("Dropped request {} after {}ms in flight", expired.key, expired.age().toMillis());
      }
    }
    return dropped;
  }

  public DeduplicationMetrics getMetrics() {
    return new DeduplicationMetrics(totalRequests.get(), deduplicatedRequests.get(), pending.size());
  }

  public int getPendingCount() {
    return pending.size();
  }

  /**
   * Forget every in-flight request. Executions already started carry on.
   */
  public void clear() {
    pending.clear();
    expiries.clear();
  }

  @Override
  public void close() {
    if (sweepTask != null) {
      sweepTask.cancel(false);
    }
    if (ownedScheduler != null) {
      ownedScheduler.shutdownNow();
    }
    clear();
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }
}
