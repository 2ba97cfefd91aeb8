package dualstore.model;

import java.time.Instant;

/**
 * Experience row. {@code level} follows {@link #levelForXp(long)} and is never lowered.
 */
public record LevelRecord(String userId, long xp, int level, Instant updatedAt) {

  /** Experience needed per level. */
  public static final long XP_PER_LEVEL = 1000L;

  public static LevelRecord empty(String userId) {
    return new LevelRecord(userId, 0L, 1, null);
  }

  /**
   * {@code floor(xp / 1000) + 1}; negative experience maps to level 1.
   */
  public static int levelForXp(long xp) {
    if (xp <= 0) {
      return 1;
    }
    return (int) Math.min(Integer.MAX_VALUE, xp / XP_PER_LEVEL + 1);
  }
}
