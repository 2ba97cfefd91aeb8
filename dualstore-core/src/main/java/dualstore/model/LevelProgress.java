package dualstore.model;

/**
 * Result of adding experience.
 *
 * @param levelUp whether the stored level was raised by this call
 * @param xp      experience after the addition
 * @param level   level after the addition; the new level when {@code levelUp} is true
 */
public record LevelProgress(boolean levelUp, long xp, int level) {

  /**
   * The level reached by this call. Same as {@link #level()}; named for level-up handlers.
   */
  public int newLevel() {
    return level;
  }
}
