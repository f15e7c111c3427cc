package cafe.woden.audience.dispatch;

import cafe.woden.audience.irc.ChatConnection;
import cafe.woden.audience.irc.IrcCommands;
import cafe.woden.audience.irc.IrcLine;
import io.reactivex.rxjava3.disposables.Disposable;
import jakarta.annotation.PreDestroy;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Routes parsed inbound lines to their handler by command token.
 *
 * <p>Commands without a handler are logged and ignored. A handler that throws is logged; the next
 * line is still dispatched.
 */
@Component
public class ChatEventDispatcher {
  private static final Logger log = LoggerFactory.getLogger(ChatEventDispatcher.class);

  private final Map<String, CommandHandler> handlers;
  private final Disposable linesSub;

  public ChatEventDispatcher(ChatConnection connection, ChatEventHandlers h) {
    Objects.requireNonNull(connection, "connection");
    Objects.requireNonNull(h, "handlers");

    Map<String, CommandHandler> table = new LinkedHashMap<>();
    table.put(IrcCommands.WELCOME, h::onWelcome);
    table.put(IrcCommands.PING, h::onPing);
    table.put(IrcCommands.GLOBAL_USER_STATE, h::onGlobalUserState);
    table.put(IrcCommands.JOIN, h::onJoin);
    table.put(IrcCommands.PART, h::onPart);
    table.put(IrcCommands.PRIVMSG, h::onPrivmsg);
    table.put(IrcCommands.NAMES_REPLY, h::onNamesReply);
    table.put(IrcCommands.END_OF_NAMES, h::onEndOfNames);
    this.handlers = Map.copyOf(table);

    this.linesSub =
        connection
            .lines()
            .subscribe(this::dispatch, err -> log.error("Inbound line stream failed", err));
  }

  @PreDestroy
  void shutdown() {
    if (linesSub != null && !linesSub.isDisposed()) linesSub.dispose();
  }

  public Set<String> handledCommands() {
    return handlers.keySet();
  }

  public void dispatch(IrcLine line) {
    if (line == null) return;
    CommandHandler handler = handlers.get(line.command().toUpperCase(Locale.ROOT));
    if (handler == null) {
      log.info("Unhandled command {} {}", line.command(), line.parameters());
      return;
    }
    try {
      handler.handle(line.origin(), line.parameters());
    } catch (RuntimeException e) {
      log.warn("Handler for {} failed", line.command(), e);
    }
  }
}
