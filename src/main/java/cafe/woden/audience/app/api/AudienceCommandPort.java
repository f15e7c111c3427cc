package cafe.woden.audience.app.api;

import java.util.List;
import org.jmolecules.architecture.layered.ApplicationLayer;

/** Mutating operations: channel membership and the news queue. */
@ApplicationLayer
public interface AudienceCommandPort {

  /** Queues a join; sent immediately when authenticated, otherwise on the next authentication. */
  void joinChannel(String channel);

  void leaveChannel(String channel);

  /** Returns queued news oldest-first and empties the queue; empty for untracked channels. */
  List<String> drainMessages(String channel);
}
