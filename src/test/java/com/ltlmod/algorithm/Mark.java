package com.ltlmod.algorithm;

import com.google.common.collect.ImmutableList;
import com.ltlmod.model.Composable;
import java.util.List;

/**
 * Modification that remembers the order in which its parts are applied.
 */
record Mark(List<String> names) implements Composable<Mark> {
  static Mark of(String... names) {
    return new Mark(List.of(names));
  }

  @Override
  public Mark compose(Mark other) {
    return new Mark(ImmutableList.<String>builder().addAll(other.names).addAll(names).build());
  }

  @Override
  public String toString() {
    return String.join("+", names);
  }
}
