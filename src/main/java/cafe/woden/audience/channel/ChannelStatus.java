package cafe.woden.audience.channel;

/** Whether a channel's membership snapshot is complete. */
public enum ChannelStatus {
  /** Joined (or rejoined); membership snapshot still arriving. */
  CONNECTING,
  /** End of the membership snapshot seen; audience is fully known. */
  CONNECTED
}
