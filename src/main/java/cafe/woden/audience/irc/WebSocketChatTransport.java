package cafe.woden.audience.irc;

import cafe.woden.audience.config.AudienceProperties;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link ChatTransport} over the JDK WebSocket client.
 *
 * <p>Text messages may arrive in fragments; they are reassembled before being handed to the
 * listener as one frame.
 */
@Component
public class WebSocketChatTransport implements ChatTransport {
  private static final Logger log = LoggerFactory.getLogger(WebSocketChatTransport.class);

  private static final String LINE_TERMINATOR = "\r\n";

  private final URI uri;
  private final Duration connectTimeout;
  private final Duration sendTimeout;
  private final HttpClient http;

  public WebSocketChatTransport(AudienceProperties props) {
    AudienceProperties.Chat chat = Objects.requireNonNull(props, "props").chat();
    this.uri = URI.create(chat.uri());
    this.connectTimeout = Duration.ofMillis(chat.connectTimeoutMs());
    this.sendTimeout = Duration.ofMillis(chat.sendTimeoutMs());
    this.http = HttpClient.newBuilder().connectTimeout(connectTimeout).build();
  }

  @Override
  public void connectAndServe(Listener listener) throws IOException, InterruptedException {
    Objects.requireNonNull(listener, "listener");
    CompletableFuture<Void> closed = new CompletableFuture<>();
    FrameAssembler assembler = new FrameAssembler(listener, closed);

    WebSocket ws;
    try {
      ws =
          http.newWebSocketBuilder()
              .connectTimeout(connectTimeout)
              .buildAsync(uri, assembler)
              .get(connectTimeout.toMillis() * 2, TimeUnit.MILLISECONDS);
    } catch (ExecutionException e) {
      throw new IOException("Connect to " + uri + " failed", e.getCause());
    } catch (TimeoutException e) {
      throw new IOException("Connect to " + uri + " timed out", e);
    }

    Session session = new Session(ws, sendTimeout, closed);
    try {
      listener.onOpen(session);
      // Frames are held back until the handshake has been written.
      ws.request(1);
      closed.get();
    } catch (ExecutionException e) {
      throw new IOException("Chat transport failed", e.getCause());
    } finally {
      session.close();
    }
  }

  private static final class FrameAssembler implements WebSocket.Listener {
    private final Listener listener;
    private final CompletableFuture<Void> closed;
    private final StringBuilder partial = new StringBuilder();

    FrameAssembler(Listener listener, CompletableFuture<Void> closed) {
      this.listener = listener;
      this.closed = closed;
    }

    @Override
    public void onOpen(WebSocket webSocket) {
      // Demand is signalled by connectAndServe once the session is handed out.
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
      partial.append(data);
      if (last) {
        String frame = partial.toString();
        partial.setLength(0);
        try {
          listener.onFrame(frame);
        } catch (RuntimeException e) {
          log.warn("Frame handler failed", e);
        }
      }
      webSocket.request(1);
      return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
      log.info("Chat endpoint closed the connection ({} {})", statusCode, reason);
      closed.complete(null);
      return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
      closed.completeExceptionally(error);
    }
  }

  private static final class Session implements ChatSession {
    private final WebSocket ws;
    private final Duration sendTimeout;
    private final CompletableFuture<Void> closed;

    Session(WebSocket ws, Duration sendTimeout, CompletableFuture<Void> closed) {
      this.ws = ws;
      this.sendTimeout = sendTimeout;
      this.closed = closed;
    }

    @Override
    public synchronized void sendLine(String line) throws IOException {
      if (ws.isOutputClosed()) throw new IOException("Session output is closed");
      try {
        ws.sendText(line + LINE_TERMINATOR, true)
            .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IOException("Interrupted while sending", e);
      } catch (ExecutionException e) {
        throw new IOException("Send failed", e.getCause());
      } catch (TimeoutException e) {
        throw new IOException("Send timed out", e);
      }
    }

    @Override
    public void close() {
      if (ws.isOutputClosed()) {
        ws.abort();
      } else {
        ws.sendClose(WebSocket.NORMAL_CLOSURE, "").whenComplete((w, err) -> ws.abort());
      }
      // Unblocks connectAndServe even when the endpoint never acknowledges the close.
      closed.complete(null);
    }
  }
}
