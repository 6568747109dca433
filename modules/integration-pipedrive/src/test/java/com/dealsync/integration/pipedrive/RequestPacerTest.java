package com.dealsync.integration.pipedrive;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class RequestPacerTest {
  private static final Clock FIXED_CLOCK =
      Clock.fixed(Instant.parse("2026-03-02T09:00:00Z"), ZoneOffset.UTC);

  @Test
  void shouldWaitForRemainderOfMinimumInterval() {
    List<Duration> waits = new ArrayList<>();
    RequestPacer pacer =
        new RequestPacer(
            new PipedriveConnectorProperties.Pacing(), FIXED_CLOCK, waits::add, new SimpleMeterRegistry());

    pacer.acquire();
    pacer.acquire();

    assertEquals(List.of(Duration.ofMillis(100L)), waits);
    assertEquals(2L, pacer.status().requestCount());
    assertEquals(FIXED_CLOCK.millis(), pacer.status().lastRequestAtMs());
  }

  @Test
  void shouldAddProgressiveDelayPastThresholds() {
    List<Duration> waits = new ArrayList<>();
    PipedriveConnectorProperties.Pacing pacing = new PipedriveConnectorProperties.Pacing();
    pacing.setMinIntervalMs(0L);
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    RequestPacer pacer = new RequestPacer(pacing, FIXED_CLOCK, waits::add, registry);

    for (int i = 0; i < 52; i++) {
      pacer.acquire();
    }

    long mediumDelays = waits.stream().filter(Duration.ofMillis(200L)::equals).count();
    long longDelays = waits.stream().filter(Duration.ofMillis(500L)::equals).count();
    assertEquals(20L, mediumDelays);
    assertEquals(2L, longDelays);
    assertEquals(22.0d, registry.get("connector.pipedrive.pacer.delay").counter().count());
  }

  @Test
  void shouldStartOverAfterReset() {
    List<Duration> waits = new ArrayList<>();
    RequestPacer pacer =
        new RequestPacer(
            new PipedriveConnectorProperties.Pacing(), FIXED_CLOCK, waits::add, new SimpleMeterRegistry());

    pacer.acquire();
    pacer.reset();
    pacer.acquire();

    assertTrue(waits.isEmpty());
    assertEquals(1L, pacer.status().requestCount());
  }
}
