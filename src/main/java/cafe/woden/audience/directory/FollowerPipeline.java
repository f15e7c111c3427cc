package cafe.woden.audience.directory;

import cafe.woden.audience.channel.Channel;
import cafe.woden.audience.config.AudienceProperties;
import cafe.woden.audience.config.ExecutorConfig;
import io.reactivex.rxjava3.core.Scheduler;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Pages through a channel owner's followers, adding each page to the channel's follower set and
 * queueing the ids for a delayed directory lookup.
 *
 * <p>After each page, in order: a rate-limited page is retried with the same cursor; an empty page
 * ends the run; so does exceeding the follower cap; so does a missing next cursor.
 */
@Service
public class FollowerPipeline {
  private static final Logger log = LoggerFactory.getLogger(FollowerPipeline.class);

  private final DirectoryApi api;
  private final DirectoryLookupService lookups;
  private final AudienceProperties.Directory settings;
  private final Scheduler scheduler;

  public FollowerPipeline(
      DirectoryApi api,
      DirectoryLookupService lookups,
      AudienceProperties props,
      @Qualifier(ExecutorConfig.DIRECTORY_RX_SCHEDULER) Scheduler scheduler) {
    this.api = Objects.requireNonNull(api, "api");
    this.lookups = Objects.requireNonNull(lookups, "lookups");
    this.settings = Objects.requireNonNull(props, "props").directory();
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  /** @return completes when pagination stops, for whatever reason */
  public CompletableFuture<Void> start(Channel channel, UserRecord owner) {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(owner, "owner");
    CompletableFuture<Void> done = new CompletableFuture<>();
    log.info("[{}] fetching followers of {} ({})", channel.name(), owner.login(), owner.id());
    schedule(() -> fetchPage(channel, owner, null, done), 0, done);
    return done;
  }

  private void fetchPage(
      Channel channel, UserRecord owner, String cursor, CompletableFuture<Void> done) {
    ApiOutcome<FollowerPage> outcome;
    try {
      outcome = api.fetchFollowers(owner.id(), cursor, settings.followerPageSize());
    } catch (RuntimeException e) {
      log.warn("[{}] follower page fetch failed", channel.name(), e);
      done.complete(null);
      return;
    }

    if (outcome instanceof ApiOutcome.RateLimited<?>) {
      log.info(
          "[{}] follower fetch rate limited; retrying in {}ms",
          channel.name(),
          settings.rateLimitRetryMs());
      schedule(() -> fetchPage(channel, owner, cursor, done), settings.rateLimitRetryMs(), done);
      return;
    }
    if (outcome instanceof ApiOutcome.Failed<FollowerPage> failed) {
      log.warn(
          "[{}] follower fetch stopped: HTTP {} {}",
          channel.name(),
          failed.status(),
          failed.detail());
      done.complete(null);
      return;
    }

    FollowerPage page = ((ApiOutcome.Success<FollowerPage>) outcome).value();
    if (page.followerIds().isEmpty()) {
      log.info("[{}] follower fetch done ({} followers)", channel.name(), channel.followerCount());
      done.complete(null);
      return;
    }

    channel.addFollowers(page.followerIds());
    lookups.lookupLater(page.followerIds(), LookupKind.ID, settings.followerLookupDelayMs());

    int count = channel.followerCount();
    if (count > settings.followerCap()) {
      log.info("[{}] follower cap {} exceeded ({}); stopping", channel.name(), settings.followerCap(), count);
      done.complete(null);
      return;
    }
    if (!page.hasNext()) {
      log.info("[{}] follower fetch done ({} followers)", channel.name(), count);
      done.complete(null);
      return;
    }
    String next = page.cursor();
    schedule(() -> fetchPage(channel, owner, next, done), settings.followerPageDelayMs(), done);
  }

  private void schedule(Runnable task, long delayMs, CompletableFuture<Void> done) {
    try {
      scheduler.scheduleDirect(task, delayMs, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      log.debug("Follower scheduling rejected (likely shutdown)");
      done.complete(null);
    }
  }
}
