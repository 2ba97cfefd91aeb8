package dualstore.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Per-guild settings row. Created on first write and never deleted.
 *
 * @param guildId          guild id
 * @param lang             language code, {@value #DEFAULT_LANG} when unset
 * @param prefix           command prefix, {@value #DEFAULT_PREFIX} when unset
 * @param welcomeChannelId welcome channel, or {@code null}
 * @param updatedAt        last write time, or {@code null} for a default (never stored) row
 */
public record GuildSettings(
    String guildId,
    String lang,
    String prefix,
    String welcomeChannelId,
    Instant updatedAt
) {
  public static final String DEFAULT_LANG = "en";
  public static final String DEFAULT_PREFIX = "r!";

  public GuildSettings {
    Objects.requireNonNull(guildId, "guildId");
    lang = lang != null ? lang : DEFAULT_LANG;
    prefix = prefix != null ? prefix : DEFAULT_PREFIX;
  }

  /**
   * Settings for a guild that has never been written.
   */
  public static GuildSettings defaults(String guildId) {
    return new GuildSettings(guildId, DEFAULT_LANG, DEFAULT_PREFIX, null, null);
  }
}
