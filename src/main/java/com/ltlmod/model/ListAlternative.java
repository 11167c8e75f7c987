package com.ltlmod.model;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;
import javax.annotation.Nullable;

/**
 * {@link Alternative} for a list of formulas, one per open scope, innermost first.
 */
public record ListAlternative<M>(@Nullable M now, List<Formula<M>> later) {
  public ListAlternative {
    later = List.copyOf(checkNotNull(later));
  }

  @Override
  public String toString() {
    return (now == null ? "-" : now.toString()) + " / " + later;
  }
}
