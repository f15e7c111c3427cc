package cafe.woden.audience.app.api;

import cafe.woden.audience.channel.ChannelStatus;
import java.util.List;
import java.util.Optional;
import org.jmolecules.architecture.layered.ApplicationLayer;

/** Read operations over tracked channels. */
@ApplicationLayer
public interface AudienceQueryPort {

  /**
   * Chatters first, then followers not in chat, each resolved through the directory cache; users
   * without a cached record are left out. Waits (bounded) while the view is still empty.
   */
  List<AudienceEntry> getAudienceSnapshot(String channel);

  /** Same view as {@link #getAudienceSnapshot} without waiting. */
  List<AudienceEntry> currentAudience(String channel);

  Optional<ChannelStatus> channelStatus(String channel);

  List<String> trackedChannels();
}
