package playlog.jdbc;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import playlog.PlayEvent;
import playlog.TrackInfo;
import playlog.model.GuildAggregate;
import playlog.model.TrackAggregate;
import playlog.model.UserAggregate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AggregateRecorderTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  private PlayStore store;
  private AggregateRecorder recorder;
  private StatisticsRepository statistics;

  @BeforeEach
  void setUp() {
    store = new PlayStore(TestDataSources.h2("recorder")).initialize();
    recorder = new AggregateRecorder(store, Clock.fixed(NOW, ZoneOffset.UTC));
    statistics = new StatisticsRepository(store);
  }

  @Test
  void firstPlayCreatesAllThreeRows() {
    assertTrue(recorder.recordPlay("g1", "u1", TrackInfo.of("Song", "Artist", "https://t/1", 1000)));

    GuildAggregate guild = statistics.guild("g1");
    assertEquals(1, guild.tracksPlayed());
    assertEquals(1000, guild.listeningTimeMs());
    assertEquals(NOW, guild.lastActivityAt());
    assertEquals(NOW, guild.createdAt());

    UserAggregate user = statistics.user("u1", "g1");
    assertEquals(1, user.tracksPlayed());
    assertEquals(1000, user.listeningTimeMs());
    assertEquals(NOW, user.firstPlayedAt());

    TrackAggregate track = statistics.track("https://t/1");
    assertEquals("Song", track.trackTitle());
    assertEquals("Artist", track.trackAuthor());
    assertEquals(1000, track.durationMs());
    assertEquals(1, track.totalPlays());
  }

  @Test
  void repeatedPlaysAccumulate() {
    recorder.recordPlay("g1", "u1", TrackInfo.of("A", "X", "https://t/a", 1200));
    recorder.recordPlay("g1", "u1", TrackInfo.of("B", "Y", "https://t/b", 3400));

    UserAggregate user = statistics.user("u1", "g1");
    assertEquals(2, user.tracksPlayed());
    assertEquals(4600, user.listeningTimeMs());
    assertEquals(2, statistics.guild("g1").tracksPlayed());
    assertEquals(4600, statistics.guild("g1").listeningTimeMs());
  }

  @Test
  void trackKeepsFirstTitleAndCountsPlays() {
    recorder.recordPlay("g1", "u1", TrackInfo.of("Original", "X", "https://t/a", 1000));
    recorder.recordPlay("g2", "u2", TrackInfo.of("Renamed", "X", "https://t/a", 1000));

    TrackAggregate track = statistics.track("https://t/a");
    assertEquals("Original", track.trackTitle());
    assertEquals(2, track.totalPlays());
  }

  @Test
  void nullUrlSkipsTrackAggregate() {
    assertTrue(recorder.recordPlay("g1", "u1", TrackInfo.of("Stream", "X", null, 0)));

    assertEquals(1, statistics.guild("g1").tracksPlayed());
    assertEquals(1, statistics.user("u1", "g1").tracksPlayed());
    assertEquals(0L, store.tableRowCounts().get(TableNames.TRACK_STATISTICS));
  }

  @Test
  void failedUpsertRollsBackAllCounters() {
    String tooLongUrl = "https://t/" + "x".repeat(800);

    assertFalse(recorder.recordPlay("g1", "u1", TrackInfo.of("Song", "X", tooLongUrl, 1000)));

    assertNull(statistics.guild("g1"));
    assertNull(statistics.user("u1", "g1"));
  }

  @Test
  void recordPropagatesFailure() {
    PlayEvent event = new PlayEvent("g1", "u1", "Song", "X", "https://t/" + "x".repeat(800), 1000, 0);
    assertThrows(PlayStoreException.class, () -> recorder.record(event));
    assertNull(statistics.guild("g1"));
  }

  @Test
  void userCountersAreScopedPerGuild() {
    recorder.recordPlay("g1", "u1", TrackInfo.of("A", "X", "https://t/a", 100));
    recorder.recordPlay("g2", "u1", TrackInfo.of("A", "X", "https://t/a", 100));

    assertEquals(1, statistics.user("u1", "g1").tracksPlayed());
    assertEquals(1, statistics.user("u1", "g2").tracksPlayed());
    assertEquals(2, statistics.userTotals("u1").guildCount());
  }
}
