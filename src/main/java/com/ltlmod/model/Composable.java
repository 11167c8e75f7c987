package com.ltlmod.model;

import javax.annotation.Nullable;

/**
 * An atomic modification that can be combined with another one applied at the same time step.
 * {@code a.compose(b)} applies {@code b} first and then {@code a}. Composition must be associative,
 * it need not be commutative.
 */
public interface Composable<M extends Composable<M>> {
  M compose(M other);

  @Nullable
  static <M extends Composable<M>> M compose(@Nullable M first, @Nullable M second) {
    if (first == null) {
      return second;
    }
    if (second == null) {
      return first;
    }
    return first.compose(second);
  }
}
