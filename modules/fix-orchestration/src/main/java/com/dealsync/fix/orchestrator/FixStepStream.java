package com.dealsync.fix.orchestrator;

import com.dealsync.fix.session.FixStep;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Progress listener backed by an unbounded queue. The workflow thread publishes; any other thread
 * consumes the snapshots in the order they were produced.
 */
public class FixStepStream implements FixProgressListener {
  private final BlockingQueue<FixStep> queue = new LinkedBlockingQueue<>();

  @Override
  public void onStep(FixStep step) {
    queue.add(step);
  }

  public Optional<FixStep> poll(Duration timeout) throws InterruptedException {
    return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
  }

  public List<FixStep> drain() {
    List<FixStep> drained = new ArrayList<>();
    queue.drainTo(drained);
    return drained;
  }
}
