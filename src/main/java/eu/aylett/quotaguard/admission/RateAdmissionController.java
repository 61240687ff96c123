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
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.util.HashMap;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Queues calls to a rate-limited service and lets them out only when the
 * service has quota for them.
 * <p>
 * Each resource class has its own queue, drained by at most one loop at a
 * time. The loop takes the highest-priority task, waits until it may be sent,
 * runs it to completion, pauses briefly, and moves on. Nothing blocks a thread:
 * waits are scheduled on the controller's scheduler.
 * </p>
 * <p>
 * A task's own failures reach its caller unchanged. The controller only reads
 * them to notice when the service has run out of quota.
 * </p>
 */
public class RateAdmissionController implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(RateAdmissionController.class);
  private static final int DEFAULT_PRIORITY = 1;

  private final AdmissionSettings settings;
  private final InstantSource clock;
  private final ScheduledExecutorService scheduler;
  private final boolean ownsScheduler;
  private final AtomicLong sequence = new AtomicLong(0);

  // Guarded by this
  private final Map<ResourceClass, ResourceQuota> quotas = new HashMap<>();
  private final Map<ResourceClass, Lane> lanes = new HashMap<>();
  private Instant lastDispatch = Instant.EPOCH;
  private boolean closed;

  /**
   * A fully configurable controller.
   * <p>
   * The scheduler is used for every wait and every dispatch; it is not shut down
   * when the controller is closed.
   * </p>
   *
   * @param settings
   *          spacing, thresholds and starting quotas
   * @param clock
   *          the time source quota resets are measured against (mainly for
   *          testing)
   * @param scheduler
   *          runs the queue drain loops
   */
  public RateAdmissionController(AdmissionSettings settings, InstantSource clock,
      ScheduledExecutorService scheduler) {
    this(settings, clock, scheduler, false);
  }

  /**
   * A controller with its own single scheduler thread, using the system clock.
   */
  public RateAdmissionController(AdmissionSettings settings) {
    this(settings, Clock.systemUTC(), newScheduler(), true);
  }

  /**
   * A controller with the default settings, calibrated for the GitHub API.
   */
  public RateAdmissionController() {
    this(AdmissionSettings.defaults());
  }

  private RateAdmissionController(AdmissionSettings settings, InstantSource clock,
      ScheduledExecutorService scheduler, boolean ownsScheduler) {
    this.settings = settings;
    this.clock = clock;
    this.scheduler = scheduler;
    this.ownsScheduler = ownsScheduler;
    var now = clock.instant();
    settings.defaultLimits()
        .forEach((resourceClass, limit) -> quotas.put(resourceClass, ResourceQuota.initial(resourceClass, limit, now)));
  }

  private static ScheduledExecutorService newScheduler() {
    return Executors.newSingleThreadScheduledExecutor(
        new ThreadFactoryBuilder().setNameFormat("quota-admission-%d").setDaemon(true).build());
  }

  /**
   * Queue a task against a resource class, and run it once there's quota.
   *
   * @param resourceClass
   *          the quota bucket the task draws on
   * @param priority
   *          higher runs sooner; equal priorities run in submission order
   * @param task
   *          starts the remote call
   * @return the outcome of the task, once it has been admitted and has settled
   */
  public <T> CompletableFuture<T> wrap(ResourceClass resourceClass, int priority,
      Supplier<? extends CompletionStage<T>> task) {
    var entry = new QueueEntry<T>(priority, sequence.getAndIncrement(), task);
    enqueue(resourceClass, entry);
    return entry.result();
  }

  /**
   * Queue a task against the core quota, at the default priority.
   */
  public <T> CompletableFuture<T> wrap(Supplier<? extends CompletionStage<T>> task) {
    return wrap(ResourceClass.CORE, DEFAULT_PRIORITY, task);
  }

  /**
   * Wrap a task so that every time it's called, it goes through this controller.
   */
  public <T> Supplier<CompletableFuture<T>> decorate(ResourceClass resourceClass, int priority,
      Supplier<? extends CompletionStage<T>> task) {
    return () -> wrap(resourceClass, priority, task);
  }

  /**
   * Complete once the quota for a resource class has reset.
   * <p>
   * Unlike {@link #wrap}, this waits regardless of how much quota is left, for
   * callers that need a hard sync point.
   * </p>
   */
  public CompletableFuture<Void> waitForReset(ResourceClass resourceClass) {
    Duration wait;
    synchronized (this) {
      wait = quotaFor(resourceClass).untilReset(clock.instant());
    }
    if (wait.isZero()) {
      return CompletableFuture.completedFuture(null);
    }
    LOG.info("Waiting {}s for {} quota to reset", (wait.toMillis() + 999) / 1000, resourceClass);
    var reset = new CompletableFuture<Void>();
    scheduler.schedule(() -> reset.complete(null), wait.toNanos(), TimeUnit.NANOSECONDS);
    return reset;
  }

  /**
   * Record quota headers observed outside a wrapped task, for example by a
   * transport-level response hook.
   */
  public void recordQuota(ResourceClass resourceClass, RateLimitHeaders headers) {
    synchronized (this) {
      quotas.put(resourceClass, quotaFor(resourceClass).updatedFrom(headers));
    }
    LOG.debug("{} quota now {} of {}, resets at {}", resourceClass, headers.remaining(), headers.limit(),
        headers.resetAt());
  }

  public synchronized AdmissionStatus getStatus() {
    var queued = lanes.values().stream().mapToInt(lane -> lane.queue.size()).sum();
    return new AdmissionStatus(ImmutableMap.copyOf(quotas), queued);
  }

  /**
   * Stop admitting work. Anything still queued fails with an
   * {@link IllegalStateException}; tasks already running are left to finish.
   */
  @Override
  public void close() {
    synchronized (this) {
      closed = true;
      for (var lane : lanes.values()) {
        QueueEntry<?> entry;
        while ((entry = lane.queue.poll()) != null) {
          entry.result().completeExceptionally(new IllegalStateException("Admission controller closed"));
        }
      }
    }
    if (ownsScheduler) {
      scheduler.shutdownNow();
    }
  }

  private void enqueue(ResourceClass resourceClass, QueueEntry<?> entry) {
    boolean startDrain;
    synchronized (this) {
      if (closed) {
        entry.result().completeExceptionally(new IllegalStateException("Admission controller closed"));
        return;
      }
      var lane = lanes.computeIfAbsent(resourceClass, rc -> new Lane());
      quotaFor(resourceClass);
      lane.queue.add(entry);
      startDrain = !lane.draining;
      lane.draining = true;
    }
    if (startDrain) {
      schedule(resourceClass, Duration.ZERO);
    }
  }

  private void drain(ResourceClass resourceClass) {
    QueueEntry<?> next;
    Duration wait;
    synchronized (this) {
      var lane = lanes.get(resourceClass);
      if (lane == null) {
        return;
      }
      var head = lane.queue.peek();
      if (head == null) {
        lane.draining = false;
        return;
      }
      next = head;
      wait = throttleDelay(resourceClass);
      if (wait.isZero()) {
        lane.queue.poll();
        lastDispatch = clock.instant();
      }
    }
    if (!wait.isZero()) {
      LOG.debug("Holding {} queue for {}ms", resourceClass, wait.toMillis());
      schedule(resourceClass, wait);
      return;
    }
    dispatch(resourceClass, next);
  }

  private <T> void dispatch(ResourceClass resourceClass, QueueEntry<T> entry) {
    if (entry.result().isDone()) {
      // Abandoned by the caller before it was admitted
      schedule(resourceClass, Duration.ZERO);
      return;
    }
    entry.start().whenComplete((value, error) -> {
      if (error == null) {
        observe(resourceClass, value);
        entry.result().complete(value);
      } else {
        var cause = unwrap(error);
        if (!readmitAfterExhaustion(resourceClass, entry, cause)) {
          entry.result().completeExceptionally(cause);
        }
      }
      schedule(resourceClass, settings.dispatchDelay());
    });
  }

  /**
   * Decide how long the head of a queue has to wait. Must hold the lock.
   */
  private Duration throttleDelay(ResourceClass resourceClass) {
    var now = clock.instant();
    var quota = quotaFor(resourceClass);
    if (quota.remaining() <= settings.lowWatermark()) {
      var untilReset = quota.untilReset(now);
      if (!untilReset.isZero()) {
        return untilReset;
      }
      // The reset time has passed, so the service has refilled the bucket
      quotas.put(resourceClass, quota.replenished());
      LOG.debug("{} quota reset, assuming {} available", resourceClass, quota.limit());
    }

    var sinceLast = Duration.between(lastDispatch, now);
    if (sinceLast.compareTo(settings.minInterval()) < 0) {
      return settings.minInterval().minus(sinceLast);
    }
    return Duration.ZERO;
  }

  private void observe(ResourceClass resourceClass, @Nullable Object value) {
    if (value instanceof QuotaReporting reporting) {
      var headers = reporting.rateLimitHeaders();
      if (headers != null) {
        recordQuota(resourceClass, headers);
      }
    }
  }

  /**
   * Mark the quota exhausted if the failure says so, and put the entry back in
   * the queue if the reset is close enough to wait for.
   *
   * @return true if the entry has been queued again
   */
  private boolean readmitAfterExhaustion(ResourceClass resourceClass, QueueEntry<?> entry, Throwable cause) {
    if (!(cause instanceof QuotaExhaustedException exhausted)) {
      return false;
    }
    var wait = Duration.between(clock.instant(), exhausted.resetAt);
    synchronized (this) {
      quotas.put(resourceClass, quotaFor(resourceClass).exhausted(exhausted.resetAt));
      LOG.info("{} quota exhausted until {}", resourceClass, exhausted.resetAt);
      if (closed || entry.readmitted() || wait.compareTo(settings.quotaRetryHorizon()) > 0) {
        return false;
      }
      entry.markReadmitted();
      lanes.computeIfAbsent(resourceClass, rc -> new Lane()).queue.add(entry);
    }
    LOG.info("Requeued {} task to run after the quota resets", resourceClass);
    return true;
  }

  /**
   * Must hold the lock.
   */
  private ResourceQuota quotaFor(ResourceClass resourceClass) {
    return quotas.computeIfAbsent(resourceClass,
        rc -> ResourceQuota.initial(rc, settings.defaultLimitFor(rc), clock.instant()));
  }

  private void schedule(ResourceClass resourceClass, Duration delay) {
    synchronized (this) {
      if (closed) {
        return;
      }
    }
    try {
      if (delay.isZero()) {
        scheduler.execute(() -> drain(resourceClass));
      } else {
        scheduler.schedule(() -> drain(resourceClass), delay.toNanos(), TimeUnit.NANOSECONDS);
      }
    } catch (RejectedExecutionException e) {
      LOG.warn("Scheduler refused to drain the {} queue; failing queued tasks", resourceClass, e);
      failQueued(resourceClass, e);
    }
  }

  private synchronized void failQueued(ResourceClass resourceClass, Throwable reason) {
    var lane = lanes.get(resourceClass);
    if (lane == null) {
      return;
    }
    QueueEntry<?> entry;
    while ((entry = lane.queue.poll()) != null) {
      entry.result().completeExceptionally(reason);
    }
    lane.draining = false;
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }

  private static final class Lane {
    final PriorityQueue<QueueEntry<?>> queue = new PriorityQueue<>();
    boolean draining;
  }
}
