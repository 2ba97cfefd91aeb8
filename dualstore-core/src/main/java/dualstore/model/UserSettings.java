package dualstore.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Per-user preferences.
 *
 * @param userId           user id
 * @param dmNotifications  whether direct-message notifications are on
 * @param levelUpMessages  whether level-up announcements are on
 * @param timezone         IANA zone id, {@value #DEFAULT_TIMEZONE} when unset
 * @param updatedAt        last write time, or {@code null} for a default row
 */
public record UserSettings(
    String userId,
    boolean dmNotifications,
    boolean levelUpMessages,
    String timezone,
    Instant updatedAt
) {
  public static final String DEFAULT_TIMEZONE = "UTC";

  public UserSettings {
    Objects.requireNonNull(userId, "userId");
    timezone = timezone != null && !timezone.isEmpty() ? timezone : DEFAULT_TIMEZONE;
  }

  public static UserSettings defaults(String userId) {
    return new UserSettings(userId, true, true, DEFAULT_TIMEZONE, null);
  }

  /**
   * Copy carrying the given write time.
   */
  public UserSettings withUpdatedAt(Instant updatedAt) {
    return new UserSettings(userId, dmNotifications, levelUpMessages, timezone, updatedAt);
  }
}
