package cafe.woden.audience.directory;

import cafe.woden.audience.config.AudienceProperties;
import cafe.woden.audience.config.ExecutorConfig;
import io.reactivex.rxjava3.core.Scheduler;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Batched directory lookups that fill {@link DirectoryCache}.
 *
 * <p>Keys already cached are skipped. The rest are split into chunks of at most 100 and fetched one
 * chunk at a time on the directory scheduler, with a pause between chunks. A rate-limited chunk is
 * retried as a whole after the retry delay and the chunks behind it wait for it; any other failed
 * chunk is logged and skipped.
 */
@Service
public class DirectoryLookupService {
  private static final Logger log = LoggerFactory.getLogger(DirectoryLookupService.class);

  private final DirectoryCache cache;
  private final DirectoryApi api;
  private final AudienceProperties.Directory settings;
  private final Scheduler scheduler;

  public DirectoryLookupService(
      DirectoryCache cache,
      DirectoryApi api,
      AudienceProperties props,
      @Qualifier(ExecutorConfig.DIRECTORY_RX_SCHEDULER) Scheduler scheduler) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.api = Objects.requireNonNull(api, "api");
    this.settings = Objects.requireNonNull(props, "props").directory();
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  /**
   * Looks up every uncached key.
   *
   * @return completes once every chunk has been fetched, skipped or abandoned; never exceptionally
   */
  public CompletableFuture<Void> lookup(Collection<String> keys, LookupKind kind) {
    Objects.requireNonNull(kind, "kind");
    List<String> pending = uncached(keys, kind);
    if (pending.isEmpty()) return CompletableFuture.completedFuture(null);

    List<List<String>> chunks = chunk(pending, settings.chunkSize());
    log.debug("Looking up {} {} key(s) in {} chunk(s)", pending.size(), kind, chunks.size());
    CompletableFuture<Void> done = new CompletableFuture<>();
    schedule(() -> runChunk(chunks, 0, kind, done), 0, done);
    return done;
  }

  /** Same as {@link #lookup} but starts after {@code delayMs}. */
  public CompletableFuture<Void> lookupLater(Collection<String> keys, LookupKind kind, long delayMs) {
    List<String> copy = (keys == null) ? List.of() : List.copyOf(keys);
    CompletableFuture<Void> done = new CompletableFuture<>();
    schedule(
        () -> lookup(copy, kind).whenComplete((v, err) -> done.complete(null)),
        Math.max(0, delayMs),
        done);
    return done;
  }

  /** Resolves one login, going to the API only when it is not cached. */
  public CompletableFuture<Optional<UserRecord>> resolveLogin(String login) {
    Optional<UserRecord> cached = cache.byLogin(login);
    if (cached.isPresent()) return CompletableFuture.completedFuture(cached);
    return lookup(List.of(Objects.toString(login, "")), LookupKind.LOGIN)
        .thenApply(v -> cache.byLogin(login));
  }

  private void runChunk(
      List<List<String>> chunks, int index, LookupKind kind, CompletableFuture<Void> done) {
    if (index >= chunks.size()) {
      done.complete(null);
      return;
    }
    List<String> chunk = chunks.get(index);
    ApiOutcome<List<UserRecord>> outcome;
    try {
      outcome = api.fetchUsers(kind, chunk);
    } catch (RuntimeException e) {
      log.warn("Directory lookup chunk {}/{} failed", index + 1, chunks.size(), e);
      outcome = ApiOutcome.failed(-1, e.toString());
    }

    if (outcome instanceof ApiOutcome.RateLimited<?>) {
      log.info(
          "Directory rate limited; retrying chunk {}/{} in {}ms",
          index + 1,
          chunks.size(),
          settings.rateLimitRetryMs());
      schedule(() -> runChunk(chunks, index, kind, done), settings.rateLimitRetryMs(), done);
      return;
    }
    if (outcome instanceof ApiOutcome.Failed<List<UserRecord>> failed) {
      log.warn(
          "Directory lookup of {} {} key(s) failed: HTTP {} {}",
          chunk.size(),
          kind,
          failed.status(),
          failed.detail());
    } else if (outcome instanceof ApiOutcome.Success<List<UserRecord>> ok) {
      cache.putAll(ok.value());
      log.debug("Cached {} of {} {} key(s)", ok.value().size(), chunk.size(), kind);
    }

    int next = index + 1;
    if (next >= chunks.size()) {
      done.complete(null);
      return;
    }
    schedule(() -> runChunk(chunks, next, kind, done), settings.chunkDelayMs(), done);
  }

  private void schedule(Runnable task, long delayMs, CompletableFuture<Void> done) {
    try {
      scheduler.scheduleDirect(task, delayMs, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      log.debug("Directory scheduling rejected (likely shutdown)");
      done.complete(null);
    }
  }

  private List<String> uncached(Collection<String> keys, LookupKind kind) {
    if (keys == null || keys.isEmpty()) return List.of();
    LinkedHashSet<String> out = new LinkedHashSet<>();
    for (String key : keys) {
      String k = kind.normalize(key);
      if (!k.isEmpty() && !cache.contains(kind, k)) out.add(k);
    }
    return new ArrayList<>(out);
  }

  static List<List<String>> chunk(List<String> keys, int size) {
    List<List<String>> out = new ArrayList<>();
    for (int i = 0; i < keys.size(); i += size) {
      out.add(List.copyOf(keys.subList(i, Math.min(keys.size(), i + size))));
    }
    return out;
  }
}
