package playlog.jdbc;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import playlog.TrackInfo;
import playlog.model.GuildAggregate;
import playlog.model.TrackAggregate;
import playlog.model.UserAggregate;
import playlog.model.UserTotals;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class StatisticsRepositoryTest {

  private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

  private PlayStore store;
  private StatisticsRepository statistics;
  private MutableClock clock;

  @BeforeEach
  void setUp() {
    store = new PlayStore(TestDataSources.h2("statistics")).initialize();
    statistics = new StatisticsRepository(store);
    clock = new MutableClock(START);
    AggregateRecorder recorder = new AggregateRecorder(store, clock);

    play(recorder, "g1", "u1", "https://t/a", 100);
    play(recorder, "g1", "u1", "https://t/b", 200);
    play(recorder, "g1", "u2", "https://t/a", 300);
    play(recorder, "g2", "u1", "https://t/c", 400);
    play(recorder, "g3", "u3", "https://t/a", 500);
    play(recorder, "g1", "u3", "https://t/c", 600);
  }

  @Test
  void missingRowsReturnNull() {
    assertNull(statistics.guild("nope"));
    assertNull(statistics.user("u1", "nope"));
    assertNull(statistics.track("https://t/none"));
  }

  @Test
  void topGuildsOrderedByPlays() {
    List<GuildAggregate> top = statistics.topGuilds(2);
    assertEquals(List.of("g1", "g2"), top.stream().map(GuildAggregate::guildId).toList());
    assertEquals(4, top.get(0).tracksPlayed());
  }

  @Test
  void topUsersInGuild() {
    List<UserAggregate> top = statistics.topUsersInGuild("g1", 10);
    assertEquals(List.of("u1", "u2", "u3"), top.stream().map(UserAggregate::userId).toList());
    assertEquals(300, top.get(0).listeningTimeMs());
  }

  @Test
  void userTotalsSpanGuilds() {
    UserTotals totals = statistics.userTotals("u1");
    assertEquals(2, totals.guildCount());
    assertEquals(3, totals.tracksPlayed());
    assertEquals(700, totals.listeningTimeMs());
    assertEquals(START, totals.firstPlayedAt());
    assertEquals(START.plus(Duration.ofMinutes(3)), totals.lastPlayedAt());
  }

  @Test
  void userTotalsForUnknownUserAreZero() {
    UserTotals totals = statistics.userTotals("ghost");
    assertEquals(0, totals.guildCount());
    assertEquals(0, totals.tracksPlayed());
    assertNull(totals.firstPlayedAt());
  }

  @Test
  void mostAndRecentlyPlayedTracks() {
    List<TrackAggregate> most = statistics.mostPlayedTracks(1);
    assertEquals("https://t/a", most.get(0).trackUrl());
    assertEquals(3, most.get(0).totalPlays());

    List<TrackAggregate> recent = statistics.recentlyPlayedTracks(2);
    assertEquals(List.of("https://t/c", "https://t/a"),
      recent.stream().map(TrackAggregate::trackUrl).toList());
  }

  @Test
  void limitMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> statistics.topGuilds(0));
  }

  @Test
  void historyCountReadsHistoryTable() {
    assertEquals(0L, statistics.historyCount("g1"));
    store.execute("INSERT INTO history (guild_id, user_id, track_title) VALUES (?,?,?)", "g1", "u1", "x");
    assertEquals(1L, statistics.historyCount("g1"));
  }

  private void play(AggregateRecorder recorder, String guild, String user, String url, long durationMs) {
    recorder.recordPlay(guild, user, TrackInfo.of("Title", "Artist", url, durationMs));
    clock.advance(Duration.ofMinutes(1));
  }

  static final class MutableClock extends Clock {
    private Instant now;

    MutableClock(Instant start) {
      this.now = start;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
