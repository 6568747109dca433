package com.dealsync.fix.orchestrator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.dealsync.fix.session.FixStep;
import com.dealsync.fix.session.FixStepStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class FixStepStreamTest {
  private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

  @Test
  void shouldDeliverSnapshotsToAnotherThreadInOrder() throws Exception {
    FixStepStream stream = new FixStepStream();
    FixStep running = FixWorkflowStep.APPLY_FIXES.pending().running(NOW);

    CompletableFuture<List<FixStep>> consumer =
        CompletableFuture.supplyAsync(
            () -> {
              try {
                FixStep first = stream.poll(Duration.ofSeconds(5)).orElseThrow();
                FixStep second = stream.poll(Duration.ofSeconds(5)).orElseThrow();
                return List.of(first, second);
              } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(ex);
              }
            });
    stream.onStep(running);
    stream.onStep(running.completed(NOW.plusSeconds(1), "1 batch(es) executed"));

    List<FixStep> received = consumer.get(5, TimeUnit.SECONDS);
    assertEquals(FixStepStatus.RUNNING, received.get(0).status());
    assertEquals(FixStepStatus.COMPLETED, received.get(1).status());
    assertEquals(100, received.get(1).progress());
  }

  @Test
  void shouldReturnEmptyWhenNothingArrivesBeforeTimeout() throws InterruptedException {
    FixStepStream stream = new FixStepStream();

    Optional<FixStep> polled = stream.poll(Duration.ofMillis(10));

    assertTrue(polled.isEmpty());
    assertTrue(stream.drain().isEmpty());
  }
}
