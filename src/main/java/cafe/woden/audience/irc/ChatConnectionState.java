package cafe.woden.audience.irc;

/** Lifecycle of the chat endpoint connection. */
public enum ChatConnectionState {
  DISCONNECTED,
  AUTHENTICATING,
  AUTHENTICATED
}
