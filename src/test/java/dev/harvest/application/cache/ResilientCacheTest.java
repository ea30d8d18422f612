package dev.harvest.application.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import dev.harvest.application.port.CacheException;
import dev.harvest.application.port.CachePort;
import dev.harvest.domain.cache.CacheEntry;
import dev.harvest.domain.cache.Fingerprint;
import dev.harvest.support.RecordingMetricsPort;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ResilientCacheTest {
  private static final Fingerprint KEY = Fingerprints.ofBytes(new byte[] {42});

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(ResilientCache.class);
    originalLevel = logger.getLevel();
    logger.setLevel(Level.WARN);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setLevel(originalLevel);
  }

  @Test
  void backendFailuresDegradeToMissesAndWarnings() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    ResilientCache cache = new ResilientCache(new BrokenCache(), metrics);

    Optional<CacheEntry> read = cache.get(KEY);
    cache.put(new CacheEntry(KEY, new byte[] {1}, "text/plain", Instant.EPOCH, Instant.EPOCH.plusSeconds(5), "s"));
    boolean removed = cache.invalidate(KEY);
    int evicted = cache.evictTag("s");

    assertTrue(read.isEmpty());
    assertFalse(removed);
    assertEquals(0, evicted);
    assertEquals(4, metrics.count("cache.error"));
    assertEquals(1, metrics.count("cache.miss"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.WARN
            && event.getFormattedMessage().contains("disk full")));
  }

  private static final class BrokenCache implements CachePort {
    @Override
    public Optional<CacheEntry> get(Fingerprint key) throws CacheException {
      throw new CacheException("disk full");
    }

    @Override
    public void put(CacheEntry entry) throws CacheException {
      throw new CacheException("disk full");
    }

    @Override
    public boolean invalidate(Fingerprint key) throws CacheException {
      throw new CacheException("disk full");
    }

    @Override
    public int evictTag(String tag) throws CacheException {
      throw new CacheException("disk full");
    }
  }
}
