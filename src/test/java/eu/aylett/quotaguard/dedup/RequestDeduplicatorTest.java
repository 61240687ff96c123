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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.stubbing.Answer;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RequestDeduplicatorTest {
  private static final Map<String, Object> ISSUE = Map.of("owner", "a", "repo", "b", "issue_number", 1);

  private InstantAnswer instantAnswer;
  private RequestDeduplicator deduplicator;

  @BeforeEach
  void setUp() {
    var clock = mock(InstantSource.class);
    instantAnswer = new InstantAnswer();
    when(clock.instant()).thenAnswer(instantAnswer);
    deduplicator = new RequestDeduplicator(DeduplicationSettings.defaults(), clock, null);
  }

  @Test
  void concurrentIdenticalRequestsRunOnce() throws Exception {
    var source = new CompletableFuture<String>();
    var executions = new AtomicInteger(0);
    var results = new ArrayList<CompletableFuture<String>>();
    for (var i = 0; i < 10; i++) {
      results.add(deduplicator.dedupe("get_issue", ISSUE, () -> {
        executions.incrementAndGet();
        return source;
      }));
    }

    source.complete("issue #1");

    assertThat(executions.get(), is(1));
    for (var result : results) {
      assertThat(result.get(5, TimeUnit.SECONDS), is("issue #1"));
    }
  }

  @Test
  void requestsFromManyThreadsRunOnce() throws Exception {
    var source = new CompletableFuture<String>();
    var executions = new AtomicInteger(0);
    var ready = new CountDownLatch(1);
    var pool = Executors.newFixedThreadPool(8);
    try {
      var submitted = new ArrayList<CompletableFuture<CompletableFuture<String>>>();
      for (var i = 0; i < 32; i++) {
        submitted.add(CompletableFuture.supplyAsync(() -> {
          try {
            ready.await();
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
          }
          return deduplicator.dedupe("get_issue", ISSUE, () -> {
            executions.incrementAndGet();
            return source;
          });
        }, pool));
      }
      ready.countDown();
      var results = new ArrayList<CompletableFuture<String>>();
      for (var future : submitted) {
        results.add(future.get(5, TimeUnit.SECONDS));
      }
      source.complete("issue #1");

      assertThat(executions.get(), is(1));
      for (var result : results) {
        assertThat(result.get(5, TimeUnit.SECONDS), is("issue #1"));
      }
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void parameterOrderDoesNotDefeatCollapsing() throws Exception {
    var first = new LinkedHashMap<String, Object>();
    first.put("owner", "a");
    first.put("repo", "b");
    first.put("issue_number", 1);
    var second = new LinkedHashMap<String, Object>();
    second.put("issue_number", 1);
    second.put("repo", "b");
    second.put("owner", "a");

    var source = new CompletableFuture<String>();
    var fetchA = new AtomicInteger(0);
    var fetchB = new AtomicInteger(0);
    var a = deduplicator.dedupe("get_issue", first, () -> {
      fetchA.incrementAndGet();
      return source;
    });
    var b = deduplicator.dedupe("get_issue", second, () -> {
      fetchB.incrementAndGet();
      return CompletableFuture.completedFuture("second");
    });
    source.complete("first");

    assertThat(fetchA.get() + fetchB.get(), is(1));
    assertThat(a.get(5, TimeUnit.SECONDS), is("first"));
    assertThat(b.get(5, TimeUnit.SECONDS), is("first"));
  }

  @Test
  void failuresAreSharedButNotRemembered() throws Exception {
    var failure = new IOException("timeout");
    var source = new CompletableFuture<String>();
    var a = deduplicator.dedupe("get_issue", ISSUE, () -> source);
    var b = deduplicator.dedupe("get_issue", ISSUE, () -> CompletableFuture.completedFuture("unused"));
    source.completeExceptionally(failure);

    assertThat(assertThrows(ExecutionException.class, a::get).getCause(), sameInstance(failure));
    assertThat(assertThrows(ExecutionException.class, b::get).getCause(), sameInstance(failure));
    assertThat(deduplicator.getPendingCount(), is(0));

    var retry = deduplicator.dedupe("get_issue", ISSUE, () -> CompletableFuture.completedFuture("recovered"));
    assertThat(retry.get(5, TimeUnit.SECONDS), is("recovered"));
  }

  @Test
  void executorThatThrowsFailsTheRequest() {
    var failure = new IllegalStateException("no client");
    var result = deduplicator.<String>dedupe("get_issue", ISSUE, () -> {
      throw failure;
    });

    assertThat(assertThrows(ExecutionException.class, result::get).getCause(), sameInstance(failure));
    assertThat(deduplicator.getPendingCount(), is(0));
  }

  @Test
  void settledRequestsAreForgotten() throws Exception {
    var executions = new AtomicInteger(0);
    for (var i = 0; i < 3; i++) {
      deduplicator.dedupe("get_issue", ISSUE, () -> CompletableFuture.completedFuture(executions.incrementAndGet()))
          .get(5, TimeUnit.SECONDS);
    }
    assertThat(executions.get(), is(3));
  }

  @Test
  void staleRequestsAreSwept() throws Exception {
    var stuck = new CompletableFuture<String>();
    var original = deduplicator.dedupe("get_issue", ISSUE, () -> stuck);
    assertThat(deduplicator.sweepStale(), is(0));

    instantAnswer.plusSeconds(6);
    assertThat(deduplicator.sweepStale(), is(1));
    assertThat(deduplicator.getPendingCount(), is(0));

    var fresh = deduplicator.dedupe("get_issue", ISSUE, () -> CompletableFuture.completedFuture("fresh"));
    assertThat(fresh.get(5, TimeUnit.SECONDS), is("fresh"));

    // The original caller is still attached to the original execution
    assertThat(original.isDone(), is(false));
    stuck.complete("late");
    assertThat(original.get(5, TimeUnit.SECONDS), is("late"));
  }

  @Test
  void newRequestsSweepOpportunistically() {
    deduplicator.dedupe("get_issue", ISSUE, CompletableFuture::new);
    instantAnswer.plusSeconds(6);

    var executions = new AtomicInteger(0);
    deduplicator.dedupe("get_issue", ISSUE, () -> {
      executions.incrementAndGet();
      return new CompletableFuture<String>();
    });
    assertThat(executions.get(), is(1));
  }

  @Test
  void cancellingOneCallerLeavesTheOthers() throws Exception {
    var source = new CompletableFuture<String>();
    var a = deduplicator.dedupe("get_issue", ISSUE, () -> source);
    var b = deduplicator.dedupe("get_issue", ISSUE, () -> source);

    a.cancel(true);
    source.complete("issue #1");

    assertThat(source.isCancelled(), is(false));
    assertThat(b.get(5, TimeUnit.SECONDS), is("issue #1"));
  }

  @Test
  void metricsCountRequests() {
    var source = new CompletableFuture<String>();
    deduplicator.dedupe("get_issue", ISSUE, () -> source);
    deduplicator.dedupe("get_issue", ISSUE, () -> source);
    deduplicator.dedupe("get_issue", ISSUE, () -> source);

    assertThat(deduplicator.getMetrics(), equalTo(new DeduplicationMetrics(3, 2, 1)));
    source.complete("done");
    assertThat(deduplicator.getMetrics(), equalTo(new DeduplicationMetrics(3, 2, 0)));
  }

  @Test
  void metricsCanBeTurnedOff() {
    var quiet = new RequestDeduplicator(DeduplicationSettings.defaults().withMetrics(false), InstantSource.system(),
        null);
    quiet.dedupe("get_issue", ISSUE, CompletableFuture::new);
    assertThat(quiet.getMetrics(), equalTo(new DeduplicationMetrics(0, 0, 1)));
  }

  @Test
  void clearForgetsInFlightRequests() {
    var executions = new AtomicInteger(0);
    deduplicator.dedupe("get_issue", ISSUE, () -> {
      executions.incrementAndGet();
      return new CompletableFuture<String>();
    });
    deduplicator.clear();
    assertThat(deduplicator.getPendingCount(), is(0));

    deduplicator.dedupe("get_issue", ISSUE, () -> {
      executions.incrementAndGet();
      return new CompletableFuture<String>();
    });
    assertThat(executions.get(), is(2));
  }

  @Test
  void scheduledSweepRunsOnItsOwn() throws Exception {
    var settings = DeduplicationSettings.defaults().withMaxPendingAge(Duration.ofMillis(50));
    try (var swept = new RequestDeduplicator(settings)) {
      swept.dedupe("get_issue", ISSUE, CompletableFuture::new);
      var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
      while (swept.getPendingCount() > 0 && System.nanoTime() < deadline) {
        Thread.sleep(10);
      }
      assertThat(swept.getPendingCount(), is(0));
    }
  }

  private static class InstantAnswer implements Answer<Instant> {
    public void plusSeconds(int i) {
      now = now.plusSeconds(i);
    }

    public Instant now = Instant.parse("2024-01-01T00:00:00Z");

    @Override
    public Instant answer(InvocationOnMock invocation) {
      return now;
    }
  }
}
