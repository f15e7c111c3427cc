package cafe.woden.audience.directory;

import java.util.List;

/** The companion REST API, as seen by the lookup pipelines. */
public interface DirectoryApi {

  /** One call carrying every key as a repeated query parameter (at most 100 keys). */
  ApiOutcome<List<UserRecord>> fetchUsers(LookupKind kind, List<String> keys);

  /** One page of followers of {@code toId}, starting after {@code cursor} (null for the first). */
  ApiOutcome<FollowerPage> fetchFollowers(String toId, String cursor, int pageSize);
}
