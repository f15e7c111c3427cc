package cafe.woden.audience.irc;

import java.io.IOException;

/**
 * Long-lived transport to the chat endpoint.
 *
 * <p>{@link #connectAndServe(Listener)} blocks the caller for the life of the connection. It
 * returns normally when the remote side closes and throws when the transport fails.
 */
public interface ChatTransport {

  void connectAndServe(Listener listener) throws IOException, InterruptedException;

  /** Receives session events in arrival order. */
  interface Listener {

    /** Called once the session is usable, before any frame is delivered. */
    void onOpen(ChatSession session);

    /** A raw frame, possibly holding several CRLF-separated lines. */
    void onFrame(String frame);
  }
}
