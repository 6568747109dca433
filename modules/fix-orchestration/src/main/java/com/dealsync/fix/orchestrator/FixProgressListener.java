package com.dealsync.fix.orchestrator;

import com.dealsync.fix.session.FixStep;

/** Receives step snapshots on the thread running the workflow. */
@FunctionalInterface
public interface FixProgressListener {
  FixProgressListener NO_OP = step -> {};

  void onStep(FixStep step);
}
