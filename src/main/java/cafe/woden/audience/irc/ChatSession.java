package cafe.woden.audience.irc;

import java.io.IOException;

/** Outbound half of an open transport session. */
public interface ChatSession {

  /** Writes one protocol line; the terminator is added by the session. */
  void sendLine(String line) throws IOException;

  /** Closes the session; the blocking serve call then returns. */
  void close();
}
