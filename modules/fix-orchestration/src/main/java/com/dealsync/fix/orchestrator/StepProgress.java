package com.dealsync.fix.orchestrator;

import com.dealsync.fix.session.FixStep;

/** Emits the single halfway snapshot of a running step once half of its items are processed. */
final class StepProgress {
  private final FixStep running;
  private final FixProgressListener listener;
  private int total;
  private int processed;
  private boolean halfwayEmitted;

  StepProgress(FixStep running, FixProgressListener listener) {
    this.running = running;
    this.listener = listener;
  }

  void begin(int itemCount) {
    total = itemCount;
    processed = 0;
  }

  void advance() {
    processed++;
    if (!halfwayEmitted && total > 0 && processed * 2 >= total) {
      emitHalfway();
    }
  }

  /** Steps with nothing to process still report the halfway mark before completing. */
  void finish() {
    if (!halfwayEmitted) {
      emitHalfway();
    }
  }

  private void emitHalfway() {
    halfwayEmitted = true;
    listener.onStep(running.withProgress(50));
  }
}
