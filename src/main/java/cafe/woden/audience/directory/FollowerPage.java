package cafe.woden.audience.directory;

import java.util.List;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * One page of a channel owner's followers.
 *
 * @param followerIds follower ids in the order returned
 * @param cursor cursor for the next page, or null when this is the last page
 */
@ValueObject
public record FollowerPage(List<String> followerIds, String cursor) {
  public FollowerPage {
    followerIds = (followerIds == null) ? List.of() : List.copyOf(followerIds);
    if (cursor != null && cursor.isBlank()) cursor = null;
  }

  public boolean hasNext() {
    return cursor != null;
  }
}
