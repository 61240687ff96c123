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

import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RateAdmissionControllerTest {
  private static final AdmissionSettings UNSPACED = AdmissionSettings.defaults()
      .withMinInterval(Duration.ZERO)
      .withDispatchDelay(Duration.ZERO);

  private RateAdmissionController controller;

  @BeforeEach
  void setUp() {
    controller = new RateAdmissionController(UNSPACED);
  }

  @AfterEach
  void tearDown() {
    controller.close();
  }

  @Test
  void runsTaskAndReturnsItsValue() throws Exception {
    var result = controller.wrap(() -> CompletableFuture.completedFuture("ok"));
    assertThat(result.get(5, TimeUnit.SECONDS), is("ok"));
  }

  @Test
  void dispatchesInPriorityOrderWithTiesInSubmissionOrder() throws Exception {
    var gate = new CompletableFuture<String>();
    var started = new CountDownLatch(1);
    var blocker = controller.wrap(ResourceClass.CORE, 1, () -> {
      started.countDown();
      return gate;
    });
    assertTrue(started.await(5, TimeUnit.SECONDS));

    var order = Collections.synchronizedList(new ArrayList<String>());
    var results = new ArrayList<CompletableFuture<String>>();
    for (var label : List.of("1a", "5a", "3a", "5b")) {
      var priority = Character.getNumericValue(label.charAt(0));
      results.add(controller.wrap(ResourceClass.CORE, priority, () -> {
        order.add(label);
        return CompletableFuture.completedFuture(label);
      }));
    }
    assertThat(controller.getStatus().queueLength(), is(4));

    gate.complete("done");
    blocker.get(5, TimeUnit.SECONDS);
    CompletableFuture.allOf(results.toArray(new CompletableFuture<?>[0])).get(5, TimeUnit.SECONDS);

    assertThat(order, contains("5a", "5b", "3a", "1a"));
    assertThat(controller.getStatus().queueLength(), is(0));
  }

  @Test
  void lowQuotaHoldsOnlyItsOwnResourceClass() throws Exception {
    var resetAt = Instant.now().plusMillis(800);
    controller.recordQuota(ResourceClass.SEARCH, new RateLimitHeaders(30, 5, resetAt));

    var searchRanAt = new AtomicReference<Instant>();
    var search = controller.wrap(ResourceClass.SEARCH, 1, () -> {
      searchRanAt.set(Instant.now());
      return CompletableFuture.completedFuture("search");
    });
    var core = controller.wrap(ResourceClass.CORE, 1, () -> CompletableFuture.completedFuture("core"));

    assertThat(core.get(5, TimeUnit.SECONDS), is("core"));
    assertThat(search.isDone(), is(false));

    assertThat(search.get(5, TimeUnit.SECONDS), is("search"));
    assertThat(searchRanAt.get(), greaterThanOrEqualTo(resetAt));
  }

  @Test
  void passedResetRefillsTheQuota() throws Exception {
    controller.recordQuota(ResourceClass.CORE, new RateLimitHeaders(5000, 3, Instant.now().minusSeconds(1)));

    controller.wrap(() -> CompletableFuture.completedFuture("ok")).get(5, TimeUnit.SECONDS);

    var quota = controller.getStatus().quota(ResourceClass.CORE);
    assertThat(quota, notNullValue());
    assertThat(quota.remaining(), is(5000L));
  }

  @Test
  void transportErrorsReachTheCallerUnchanged() {
    var failure = new IOException("connection reset");
    var result = controller.<String>wrap(() -> CompletableFuture.failedFuture(failure));
    var thrown = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
    assertThat(thrown.getCause(), sameInstance(failure));
  }

  @Test
  void tasksThatThrowFailTheirCallerOnly() throws Exception {
    var failure = new IllegalStateException("bad task");
    var bad = controller.<String>wrap(() -> {
      throw failure;
    });
    var good = controller.wrap(() -> CompletableFuture.completedFuture("fine"));

    var thrown = assertThrows(ExecutionException.class, () -> bad.get(5, TimeUnit.SECONDS));
    assertThat(thrown.getCause(), sameInstance(failure));
    assertThat(good.get(5, TimeUnit.SECONDS), is("fine"));
  }

  @Test
  void exhaustionBeyondTheHorizonPropagatesAndEmptiesTheQuota() {
    var resetAt = Instant.now().plus(Duration.ofHours(1));
    var exhausted = new QuotaExhaustedException("API rate limit exceeded", resetAt);
    var result = controller.<String>wrap(() -> CompletableFuture.failedFuture(exhausted));

    var thrown = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
    assertThat(thrown.getCause(), sameInstance(exhausted));

    var quota = controller.getStatus().quota(ResourceClass.CORE);
    assertThat(quota, notNullValue());
    assertThat(quota.remaining(), is(0L));
    assertThat(quota.resetAt(), equalTo(resetAt));
  }

  @Test
  void exhaustionWithinTheHorizonIsRetriedAfterTheReset() throws Exception {
    var resetAt = Instant.now().plusMillis(300);
    var attempts = new AtomicInteger(0);
    var result = controller.wrap(() -> {
      if (attempts.getAndIncrement() == 0) {
        return CompletableFuture.failedFuture(new QuotaExhaustedException("API rate limit exceeded", resetAt));
      }
      return CompletableFuture.completedFuture("ok");
    });

    assertThat(result.get(5, TimeUnit.SECONDS), is("ok"));
    assertThat(attempts.get(), is(2));
  }

  @Test
  void exhaustionIsOnlyRetriedOnce() {
    var attempts = new AtomicInteger(0);
    var result = controller.<String>wrap(() -> {
      attempts.incrementAndGet();
      return CompletableFuture
          .failedFuture(new QuotaExhaustedException("API rate limit exceeded", Instant.now().plusMillis(100)));
    });

    var thrown = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
    assertThat(thrown.getCause(), instanceOf(QuotaExhaustedException.class));
    assertThat(attempts.get(), is(2));
  }

  @Test
  void quotaReportingResultsUpdateTheQuota() throws Exception {
    var resetAt = Instant.parse("2030-01-01T00:00:00Z");
    var reply = new Reply("body", new RateLimitHeaders(5000, 4321, resetAt));

    assertThat(controller.wrap(() -> CompletableFuture.completedFuture(reply)).get(5, TimeUnit.SECONDS),
        sameInstance(reply));

    assertThat(controller.getStatus().quota(ResourceClass.CORE),
        equalTo(new ResourceQuota("core", 5000, 4321, resetAt)));
  }

  @Test
  void resultsWithoutHeadersLeaveTheQuotaAlone() throws Exception {
    var before = controller.getStatus().quota(ResourceClass.CORE);
    controller.wrap(() -> CompletableFuture.completedFuture(new Reply("body", null))).get(5, TimeUnit.SECONDS);
    assertThat(controller.getStatus().quota(ResourceClass.CORE), equalTo(before));
  }

  @Test
  void waitForResetCompletesImmediatelyWhenAlreadyReset() {
    assertThat(controller.waitForReset(ResourceClass.CORE).isDone(), is(true));
  }

  @Test
  void waitForResetWaitsForTheReset() throws Exception {
    var resetAt = Instant.now().plusMillis(300);
    controller.recordQuota(ResourceClass.GRAPHQL, new RateLimitHeaders(5000, 4000, resetAt));

    var reset = controller.waitForReset(ResourceClass.GRAPHQL);
    assertThat(reset.isDone(), is(false));
    reset.get(5, TimeUnit.SECONDS);
    assertThat(Instant.now(), greaterThanOrEqualTo(resetAt));
  }

  @Test
  void unknownResourceClassesStartWithTheCoreQuota() throws Exception {
    var codeScanning = new ResourceClass("code_scanning_upload");
    controller.wrap(codeScanning, 1, () -> CompletableFuture.completedFuture("ok")).get(5, TimeUnit.SECONDS);

    var quota = controller.getStatus().quota(codeScanning);
    assertThat(quota, notNullValue());
    assertThat(quota.limit(), is(5000L));
  }

  @Test
  void decoratedTasksGoThroughTheControllerEachTime() throws Exception {
    var calls = new AtomicInteger(0);
    var decorated = controller.decorate(ResourceClass.CORE, 1,
        () -> CompletableFuture.completedFuture(calls.incrementAndGet()));

    assertThat(decorated.get().get(5, TimeUnit.SECONDS), is(1));
    assertThat(decorated.get().get(5, TimeUnit.SECONDS), is(2));
  }

  @Test
  void closingFailsQueuedTasks() throws Exception {
    var gate = new CompletableFuture<String>();
    var started = new CountDownLatch(1);
    controller.wrap(() -> {
      started.countDown();
      return gate;
    });
    assertTrue(started.await(5, TimeUnit.SECONDS));
    var queued = controller.wrap(() -> CompletableFuture.completedFuture("never"));

    controller.close();

    var thrown = assertThrows(ExecutionException.class, () -> queued.get(5, TimeUnit.SECONDS));
    assertThat(thrown.getCause(), instanceOf(IllegalStateException.class));
    var late = controller.wrap(() -> CompletableFuture.completedFuture("late"));
    assertThat(late.isCompletedExceptionally(), is(true));
  }

  @Test
  void minimumIntervalSpacesDispatches() throws Exception {
    var scheduler = Executors.newSingleThreadScheduledExecutor();
    try (var spaced = new RateAdmissionController(UNSPACED.withMinInterval(Duration.ofMillis(100)), Clock.systemUTC(),
        scheduler)) {
      var times = Collections.synchronizedList(new ArrayList<Long>());
      var first = spaced.wrap(() -> CompletableFuture.completedFuture(times.add(System.nanoTime())));
      var second = spaced.wrap(() -> CompletableFuture.completedFuture(times.add(System.nanoTime())));
      CompletableFuture.allOf(first, second).get(5, TimeUnit.SECONDS);

      assertThat(times.get(1) - times.get(0), greaterThanOrEqualTo(Duration.ofMillis(90).toNanos()));
    } finally {
      scheduler.shutdownNow();
    }
  }

  private record Reply(String body, @Nullable RateLimitHeaders rateLimitHeaders) implements QuotaReporting {
  }
}
