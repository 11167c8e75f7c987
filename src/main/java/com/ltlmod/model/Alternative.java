package com.ltlmod.model;

import static com.google.common.base.Preconditions.checkNotNull;

import javax.annotation.Nullable;

/**
 * One way of satisfying a formula at the current step: apply {@code now} (or nothing, if it is
 * {@code null}) and satisfy {@code later} from the next step onwards.
 */
public record Alternative<M>(@Nullable M now, Formula<M> later) {
  public Alternative {
    checkNotNull(later);
  }

  @Override
  public String toString() {
    return (now == null ? "-" : now.toString()) + " / " + later;
  }
}
