package com.dealsync.fix.session;

import java.util.EnumSet;
import java.util.Map;

public final class FixSessionStateMachine {
  private static final Map<FixSessionStatus, EnumSet<FixSessionStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          FixSessionStatus.PENDING,
              EnumSet.of(FixSessionStatus.RUNNING, FixSessionStatus.CANCELLED),
          FixSessionStatus.RUNNING,
              EnumSet.of(
                  FixSessionStatus.COMPLETED, FixSessionStatus.FAILED, FixSessionStatus.CANCELLED),
          FixSessionStatus.COMPLETED, EnumSet.noneOf(FixSessionStatus.class),
          FixSessionStatus.FAILED, EnumSet.noneOf(FixSessionStatus.class),
          FixSessionStatus.CANCELLED, EnumSet.noneOf(FixSessionStatus.class));

  private FixSessionStateMachine() {}

  public static boolean canTransition(FixSessionStatus from, FixSessionStatus to) {
    if (from == null || to == null) {
      return false;
    }
    EnumSet<FixSessionStatus> allowed = ALLOWED_TRANSITIONS.get(from);
    return allowed != null && allowed.contains(to);
  }

  public static void validateTransition(FixSessionStatus from, FixSessionStatus to) {
    if (!canTransition(from, to)) {
      throw new FixSessionException(
          "Invalid fix session status transition from " + from + " to " + to);
    }
  }
}
