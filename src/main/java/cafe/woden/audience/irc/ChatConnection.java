package cafe.woden.audience.irc;

import cafe.woden.audience.config.AudienceProperties;
import cafe.woden.audience.config.ExecutorConfig;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Connection state machine for the chat endpoint.
 *
 * <p>{@code DISCONNECTED -> AUTHENTICATING} once the transport is open and the handshake is
 * written, {@code AUTHENTICATING -> AUTHENTICATED} on {@link #onAuthenticated()}, and back to
 * {@code DISCONNECTED} whenever the transport closes or fails. Each disconnection schedules the
 * next attempt after {@link ReconnectBackoff#delaySeconds(int, int)}.
 *
 * <p>While a session is open an idle watchdog runs on its own scheduler. A session that has
 * received nothing for {@code idle-timeout-ms} is closed, which ends the serve call and so
 * feeds the normal reconnect path.
 *
 * <p>Outbound lines sent while not authenticated are kept in a FIFO backlog and flushed on
 * authentication. Parsed inbound lines are published on {@link #lines()} in arrival order.
 */
@Service
public class ChatConnection {
  private static final Logger log = LoggerFactory.getLogger(ChatConnection.class);

  private final AudienceProperties.Chat settings;
  private final ChatTransport transport;
  private final ScheduledExecutorService connectionExec;
  private final Scheduler heartbeatScheduler;

  private final FlowableProcessor<IrcLine> lines = PublishProcessor.<IrcLine>create().toSerialized();

  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

  private final AtomicLong lastInboundMs = new AtomicLong();
  private final AtomicReference<Disposable> heartbeat = new AtomicReference<>();

  // Guards state, retryCount, backlog, session and username.
  private final Object lock = new Object();
  private ChatConnectionState state = ChatConnectionState.DISCONNECTED;
  private int retryCount;
  private final Deque<String> backlog = new ArrayDeque<>();
  private ChatSession session;
  private String username;

  public ChatConnection(
      AudienceProperties props,
      ChatTransport transport,
      @Qualifier(ExecutorConfig.CHAT_RECONNECT_SCHEDULER) ScheduledExecutorService connectionExec,
      @Qualifier(ExecutorConfig.CHAT_HEARTBEAT_RX_SCHEDULER) Scheduler heartbeatScheduler) {
    this.settings = Objects.requireNonNull(props, "props").chat();
    this.transport = Objects.requireNonNull(transport, "transport");
    this.connectionExec = Objects.requireNonNull(connectionExec, "connectionExec");
    this.heartbeatScheduler = Objects.requireNonNull(heartbeatScheduler, "heartbeatScheduler");
  }

  /** Parsed inbound lines, one per protocol line, in arrival order. */
  public Flowable<IrcLine> lines() {
    return lines.onBackpressureBuffer();
  }

  /** Starts the connect/reconnect loop. The first attempt is made right away. */
  public void start() {
    if (!started.compareAndSet(false, true)) return;
    scheduleCycle(0);
  }

  @PreDestroy
  void shutdown() {
    shuttingDown.set(true);
    stopHeartbeat();
    ChatSession s;
    synchronized (lock) {
      s = session;
    }
    if (s != null) s.close();
  }

  public ChatConnectionState state() {
    synchronized (lock) {
      return state;
    }
  }

  public int retryCount() {
    synchronized (lock) {
      return retryCount;
    }
  }

  /** Username assigned by the welcome reply, lowercased; null before the first welcome. */
  public String username() {
    synchronized (lock) {
      return username;
    }
  }

  public boolean isSelf(String login) {
    String me = username();
    return me != null && login != null && me.equalsIgnoreCase(login);
  }

  public List<String> backlogSnapshot() {
    synchronized (lock) {
      return List.copyOf(backlog);
    }
  }

  /** Writes now when authenticated; otherwise queues behind earlier unsent lines. */
  public void send(String line) {
    if (line == null || line.isBlank()) return;
    synchronized (lock) {
      if (state == ChatConnectionState.AUTHENTICATED && session != null) {
        writeLocked(line);
        return;
      }
      backlog.addLast(line);
      log.debug("Queued outbound line while {}: {}", state, redact(line));
    }
  }

  /**
   * Writes ahead of the backlog whenever a session is open, authenticated or not. Used for
   * heartbeat replies; dropped when there is no session.
   */
  public void sendImmediate(String line) {
    if (line == null || line.isBlank()) return;
    synchronized (lock) {
      if (session == null) {
        log.debug("Dropping {} (no open session)", redact(line));
        return;
      }
      writeLocked(line);
    }
  }

  public void join(String channel) {
    send(IrcCommands.JOIN + " " + channel);
  }

  public void part(String channel) {
    send(IrcCommands.PART + " " + channel);
  }

  public void say(String channel, String text) {
    send(IrcCommands.PRIVMSG + " " + channel + " :" + text);
  }

  /** Welcome numeric: remembers the name the endpoint assigned to us. */
  public void onWelcome(String assignedUsername) {
    if (assignedUsername == null || assignedUsername.isBlank()) return;
    synchronized (lock) {
      username = assignedUsername.trim().toLowerCase(Locale.ROOT);
    }
    log.info("Welcomed as {}", assignedUsername);
  }

  /** Global user state: the session is authenticated, so the backlog is flushed in order. */
  public void onAuthenticated() {
    synchronized (lock) {
      if (session == null) return;
      state = ChatConnectionState.AUTHENTICATED;
      retryCount = 0;
      int flushed = 0;
      while (!backlog.isEmpty() && session != null) {
        String next = backlog.pollFirst();
        if (!writeLocked(next)) {
          backlog.addFirst(next);
          break;
        }
        flushed++;
      }
      log.info("Authenticated; flushed {} backlogged line(s)", flushed);
    }
  }

  private void scheduleCycle(long delaySeconds) {
    if (shuttingDown.get()) return;
    try {
      connectionExec.schedule(this::runCycle, delaySeconds, TimeUnit.SECONDS);
    } catch (RejectedExecutionException rejected) {
      log.debug("Connection scheduling rejected (likely shutdown)");
    }
  }

  void runCycle() {
    if (shuttingDown.get()) return;
    log.info("Connecting to {}", settings.uri());
    try {
      transport.connectAndServe(new SessionListener());
      log.info("Chat connection closed");
    } catch (IOException e) {
      log.warn("Chat transport error: {}", e.toString());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      markDisconnected();
      return;
    } catch (RuntimeException e) {
      log.warn("Chat connection failed unexpectedly", e);
    }

    int retries = markDisconnected();
    long delay = ReconnectBackoff.delaySeconds(retries, settings.maxBackoffSeconds());
    if (!shuttingDown.get()) {
      log.info("Reconnecting in {}s (retry {})", delay, retries);
    }
    scheduleCycle(delay);
  }

  private int markDisconnected() {
    stopHeartbeat();
    synchronized (lock) {
      session = null;
      state = ChatConnectionState.DISCONNECTED;
      retryCount++;
      return retryCount;
    }
  }

  private void onOpen(ChatSession opened) {
    synchronized (lock) {
      session = opened;
      state = ChatConnectionState.AUTHENTICATING;
      startHeartbeat(opened);
      for (String line : handshake()) {
        if (!writeLocked(line)) return;
      }
    }
    log.info("Transport open; handshake sent for {}", settings.username());
  }

  private List<String> handshake() {
    String token = settings.oauthToken();
    if (!token.startsWith("oauth:")) token = "oauth:" + token;
    String nick = settings.username().toLowerCase(Locale.ROOT);
    return List.of(
        IrcCommands.CAP + " REQ :" + settings.capabilities(),
        IrcCommands.PASS + " " + token,
        IrcCommands.NICK + " " + nick,
        IrcCommands.USER + " " + nick + " 8 * :" + nick);
  }

  private void startHeartbeat(ChatSession watched) {
    lastInboundMs.set(nowMs());
    long periodMs = settings.heartbeatCheckMs();
    Disposable d =
        Flowable.interval(periodMs, periodMs, TimeUnit.MILLISECONDS, heartbeatScheduler)
            .subscribe(
                tick -> checkHeartbeat(watched),
                err -> log.debug("Heartbeat stream error: {}", err.toString()));
    Disposable prev = heartbeat.getAndSet(d);
    if (prev != null) prev.dispose();
  }

  private void stopHeartbeat() {
    Disposable prev = heartbeat.getAndSet(null);
    if (prev != null) prev.dispose();
  }

  private void checkHeartbeat(ChatSession watched) {
    long idleMs = nowMs() - lastInboundMs.get();
    if (idleMs <= settings.idleTimeoutMs()) return;
    synchronized (lock) {
      if (session != watched) return;
      session = null;
    }
    stopHeartbeat();
    log.warn("Ping timeout (no inbound traffic for {}s); closing session", idleMs / 1000);
    watched.close();
  }

  private long nowMs() {
    return heartbeatScheduler.now(TimeUnit.MILLISECONDS);
  }

  private void onFrame(String frame) {
    lastInboundMs.set(nowMs());
    for (String raw : IrcLine.splitFrame(frame)) {
      IrcLine line;
      try {
        line = IrcLine.parse(raw);
      } catch (MalformedLineException e) {
        log.warn("Skipping malformed line ({}): {}", e.getMessage(), raw);
        continue;
      }
      log.debug("<< {}", raw);
      lines.onNext(line);
    }
  }

  private boolean writeLocked(String line) {
    ChatSession s = session;
    if (s == null) return false;
    try {
      s.sendLine(line);
      log.debug(">> {}", redact(line));
      return true;
    } catch (IOException e) {
      log.warn("Write failed, closing session: {}", e.toString());
      session = null;
      s.close();
      return false;
    }
  }

  static String redact(String line) {
    if (line != null && line.regionMatches(true, 0, IrcCommands.PASS + " ", 0, 5)) {
      return IrcCommands.PASS + " ***";
    }
    return line;
  }

  private final class SessionListener implements ChatTransport.Listener {
    @Override
    public void onOpen(ChatSession opened) {
      ChatConnection.this.onOpen(opened);
    }

    @Override
    public void onFrame(String frame) {
      ChatConnection.this.onFrame(frame);
    }
  }
}
