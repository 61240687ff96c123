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

package eu.aylett.quotaguard.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import eu.aylett.quotaguard.admission.AdmissionStatus;
import eu.aylett.quotaguard.admission.RateAdmissionController;
import eu.aylett.quotaguard.cost.CostBreakdown;
import eu.aylett.quotaguard.cost.QueryCostEstimator;
import eu.aylett.quotaguard.dedup.RequestDeduplicator;
import eu.aylett.quotaguard.shaping.ResponseShaper;
import eu.aylett.quotaguard.shaping.ShapeResult;
import eu.aylett.quotaguard.spi.ApiTransport;
import eu.aylett.quotaguard.spi.Page;
import eu.aylett.quotaguard.spi.PageCall;
import eu.aylett.quotaguard.spi.PaginationOptions;
import eu.aylett.quotaguard.spi.Paginator;
import eu.aylett.quotaguard.spi.PerformanceMonitor;
import eu.aylett.quotaguard.spi.ResponseCache;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * The single call path for talking to a rate-limited API.
 * <p>
 * Each call passes through, from the outside in: performance measurement,
 * the cache, deduplication of identical in-flight calls, and admission
 * control, before the fetcher itself runs. Any layer can be turned off. None
 * of them change the outcome of the fetcher: its value or its error reaches
 * the caller as it was.
 * </p>
 * <p>
 * The orchestrator owns the controller and deduplicator it's built with, and
 * closes them when it is closed.
 * </p>
 */
public class AccessOrchestrator implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(AccessOrchestrator.class);

  private final RateAdmissionController admission;
  private final @Nullable RequestDeduplicator deduplicator;
  private final @Nullable ResponseCache cache;
  private final @Nullable PerformanceMonitor monitor;
  private final @Nullable Paginator paginator;
  private final @Nullable ApiTransport transport;
  private final QueryCostEstimator estimator;
  private final ResponseShaper shaper;
  private final CacheTtlTable cacheTtls;

  private AccessOrchestrator(Builder builder) {
    this.admission = builder.admission != null ? builder.admission : new RateAdmissionController();
    if (builder.enableDeduplication) {
      this.deduplicator = builder.deduplicator != null ? builder.deduplicator : new RequestDeduplicator();
    } else {
      this.deduplicator = null;
    }
    this.cache = builder.enableCache ? builder.cache : null;
    this.monitor = builder.enablePerformanceMonitoring ? builder.monitor : null;
    this.paginator = builder.paginator;
    this.transport = builder.transport;
    this.estimator = builder.estimator;
    this.shaper = builder.shaper;
    this.cacheTtls = builder.cacheTtls;
  }

  public static Builder builder() {
    return new Builder();
  }

  public <T> CompletableFuture<T> execute(String operation, Map<String, ? extends @Nullable Object> params,
      Supplier<? extends CompletionStage<T>> fetcher) {
    return execute(operation, params, fetcher, CallOptions.defaults());
  }

  /**
   * Make a call through every enabled layer.
   *
   * @param operation
   *          names the remote operation; used for cache keys, cache TTLs,
   *          deduplication and measurement
   * @param params
   *          the call's parameters; null values are ignored when building keys
   * @param fetcher
   *          makes the remote call
   * @param options
   *          per-call overrides
   * @return the fetcher's outcome, or a cached one; parameters that can't be
   *         turned into a key fail the returned future
   * @throws IllegalArgumentException
   *           if the operation name is blank
   */
  public <T> CompletableFuture<T> execute(String operation, Map<String, ? extends @Nullable Object> params,
      Supplier<? extends CompletionStage<T>> fetcher, CallOptions options) {
    Preconditions.checkArgument(!operation.isBlank(), "operation must not be blank");

    Supplier<CompletableFuture<T>> admitted = admission.decorate(options.resourceClass(), options.priority(),
        fetcher);

    var dedup = deduplicator;
    Supplier<CompletableFuture<T>> deduplicated = admitted;
    if (dedup != null && !options.skipDeduplication()) {
      deduplicated = () -> dedup.dedupe(operation, params, admitted);
    }

    var responses = cache;
    Supplier<CompletableFuture<T>> cached = deduplicated;
    if (responses != null && !options.skipCache()) {
      var ttl = cacheTtls.resolve(operation, options.cacheTtl());
      if (ttl.isZero()) {
        LOG.debug("Not caching {}", operation);
      } else {
        var inner = deduplicated;
        cached = () -> responses.get(operation, params, inner, ttl);
      }
    }

    var measuring = monitor;
    try {
      if (measuring != null) {
        return measuring.measure(operation, cached);
      }
      return cached.get();
    } catch (RuntimeException e) {
      LOG.debug("Call to {} failed before it was started", operation, e);
      return CompletableFuture.failedFuture(e);
    }
  }

  /**
   * Fetch a file or directory listing from a repository.
   *
   * @param ref
   *          branch, tag or commit; null for the default branch
   */
  public CompletableFuture<JsonNode> getFileContents(String owner, String repo, String path, @Nullable String ref) {
    var api = requireTransport();
    var params = new LinkedHashMap<String, @Nullable Object>();
    params.put("owner", owner);
    params.put("repo", repo);
    params.put("path", path);
    params.put("ref", ref);
    return execute("repos.getContent", params, () -> api.getContent(owner, repo, path, ref));
  }

  public CompletableFuture<JsonNode> getRepository(String owner, String repo) {
    var api = requireTransport();
    return execute("repos.get", Map.of("owner", owner, "repo", repo), () -> api.getRepository(owner, repo));
  }

  /**
   * Fetch a user's profile.
   *
   * @param username
   *          the user to look up, or null for the authenticated user
   */
  public CompletableFuture<JsonNode> getUser(@Nullable String username) {
    var api = requireTransport();
    if (username == null) {
      return execute("users.getAuthenticated", Map.of(), api::getAuthenticatedUser);
    }
    return execute("users.get", Map.of("username", username), () -> api.getUser(username));
  }

  /**
   * Fetch a paged listing.
   * <p>
   * A single page goes through {@link #execute}, so it can be cached and
   * deduplicated. More than one page is handed to the paginator, with each
   * page admitted separately and nothing cached.
   * </p>
   *
   * @param operation
   *          names the listing operation
   * @param baseParams
   *          the listing's parameters, without the paging ones
   * @param pageCall
   *          fetches one page
   */
  public <T> CompletableFuture<List<T>> listPaged(String operation, Map<String, ?> baseParams, PageCall<T> pageCall,
      ListOptions options) {
    if (options.maxPages() == 1) {
      var params = new LinkedHashMap<String, Object>(baseParams);
      params.put("per_page", options.perPage());
      return execute(operation, params, () -> pageCall.call(params).thenApply(Page::items));
    }

    var pages = paginator;
    Preconditions.checkState(pages != null, "Fetching more than one page needs a paginator");
    PageCall<T> admitted = pageParams -> admission.wrap(() -> pageCall.call(pageParams));
    var fetcher = pages.createFetcher(admitted, baseParams);
    return pages.paginateSmart(fetcher, new PaginationOptions(options.maxPages(), options.perPage()));
  }

  public <T> CompletableFuture<List<T>> listPaged(String operation, Map<String, ?> baseParams,
      PageCall<T> pageCall) {
    return listPaged(operation, baseParams, pageCall, ListOptions.defaults());
  }

  /**
   * Run a batch of calls, at most {@code concurrency} at a time.
   * <p>
   * The returned future never fails: each call's error is reported in its own
   * result, in the same position as the call.
   * </p>
   */
  public <T> CompletableFuture<List<BatchResult<T>>> executeAll(List<BatchCall<T>> calls, int concurrency) {
    Preconditions.checkArgument(concurrency > 0, "concurrency must be positive");
    var results = new AtomicReferenceArray<BatchResult<T>>(calls.size());
    var next = new AtomicInteger(0);
    var workers = new ArrayList<CompletableFuture<Void>>();
    for (var i = 0; i < Math.min(concurrency, calls.size()); i++) {
      workers.add(runBatch(calls, results, next));
    }
    return CompletableFuture.allOf(workers.toArray(new CompletableFuture<?>[0])).thenApply(ignored -> {
      var collected = new ArrayList<BatchResult<T>>(calls.size());
      for (var i = 0; i < calls.size(); i++) {
        collected.add(results.get(i));
      }
      return collected;
    });
  }

  public <T> CompletableFuture<List<BatchResult<T>>> executeAll(List<BatchCall<T>> calls) {
    return executeAll(calls, 5);
  }

  private <T> CompletableFuture<Void> runBatch(List<BatchCall<T>> calls, AtomicReferenceArray<BatchResult<T>> results,
      AtomicInteger next) {
    var index = next.getAndIncrement();
    if (index >= calls.size()) {
      return CompletableFuture.completedFuture(null);
    }
    var call = calls.get(index);
    CompletableFuture<T> outcome;
    try {
      outcome = execute(call.operation(), call.params(), call.fetcher(), call.options());
    } catch (RuntimeException e) {
      outcome = CompletableFuture.failedFuture(e);
    }
    return outcome.handle((value, error) -> {
      results.set(index, error == null
          ? BatchResult.success(call.operation(), value)
          : BatchResult.failure(call.operation(), unwrap(error)));
      return index;
    }).thenCompose(ignored -> runBatch(calls, results, next));
  }

  public CostBreakdown estimate(String query, Map<String, ? extends @Nullable Object> variables) {
    return estimator.estimate(query, variables);
  }

  public AdmissionStatus getStatus() {
    return admission.getStatus();
  }

  public <T> ShapeResult<T> shape(T data) {
    return shaper.shape(data);
  }

  public <T> ShapeResult<T> shape(T data, long maxBytes, int maxItems) {
    return shaper.shape(data, maxBytes, maxItems);
  }

  /**
   * @return how many cache entries were dropped
   */
  public int invalidateCache(Pattern keyPattern) {
    if (cache == null) {
      return 0;
    }
    var dropped = cache.invalidate(keyPattern);
    LOG.debug("Invalidated {} cache entries matching {}", dropped, keyPattern);
    return dropped;
  }

  public OrchestratorMetrics getMetrics() {
    return new OrchestratorMetrics(deduplicator == null ? null : deduplicator.getMetrics(), admission.getStatus());
  }

  /**
   * Forget everything cached or in flight.
   */
  public void clearAll() {
    if (cache != null) {
      cache.clear();
    }
    if (deduplicator != null) {
      deduplicator.clear();
    }
  }

  @Override
  public void close() {
    clearAll();
    if (deduplicator != null) {
      deduplicator.close();
    }
    admission.close();
  }

  private ApiTransport requireTransport() {
    var api = transport;
    Preconditions.checkState(api != null, "No transport configured");
    return api;
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }

  public static final class Builder {
    private @Nullable RateAdmissionController admission;
    private @Nullable RequestDeduplicator deduplicator;
    private @Nullable ResponseCache cache;
    private @Nullable PerformanceMonitor monitor;
    private @Nullable Paginator paginator;
    private @Nullable ApiTransport transport;
    private QueryCostEstimator estimator = new QueryCostEstimator();
    private ResponseShaper shaper = new ResponseShaper();
    private CacheTtlTable cacheTtls = CacheTtlTable.defaults();
    private boolean enableCache = true;
    private boolean enableDeduplication = true;
    private boolean enablePerformanceMonitoring = true;

    private Builder() {
    }

    public Builder admission(RateAdmissionController value) {
      this.admission = value;
      return this;
    }

    public Builder deduplicator(RequestDeduplicator value) {
      this.deduplicator = value;
      return this;
    }

    public Builder cache(ResponseCache value) {
      this.cache = value;
      return this;
    }

    public Builder monitor(PerformanceMonitor value) {
      this.monitor = value;
      return this;
    }

    public Builder paginator(Paginator value) {
      this.paginator = value;
      return this;
    }

    public Builder transport(ApiTransport value) {
      this.transport = value;
      return this;
    }

    public Builder estimator(QueryCostEstimator value) {
      this.estimator = value;
      return this;
    }

    public Builder shaper(ResponseShaper value) {
      this.shaper = value;
      return this;
    }

    public Builder cacheTtls(CacheTtlTable value) {
      this.cacheTtls = value;
      return this;
    }

    public Builder enableCache(boolean value) {
      this.enableCache = value;
      return this;
    }

    public Builder enableDeduplication(boolean value) {
      this.enableDeduplication = value;
      return this;
    }

    public Builder enablePerformanceMonitoring(boolean value) {
      this.enablePerformanceMonitoring = value;
      return this;
    }

    public AccessOrchestrator build() {
      return new AccessOrchestrator(this);
    }
  }
}
