package cafe.woden.audience.app.api;

import org.jmolecules.ddd.annotation.ValueObject;

/** One row of a channel's audience view. */
@ValueObject
public record AudienceEntry(String login, String displayName, boolean inChat, boolean isFollower) {}
