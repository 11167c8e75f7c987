package com.ltlmod.program;

import static com.google.common.base.Preconditions.checkNotNull;

import com.ltlmod.model.Formula;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * How a single operation kind is modified. Atomic operations are {@link Direct}: they consume one
 * time step and apply the modification chosen for it. Structural operations are {@link Nested}:
 * they consume no time step themselves, their nested programs are interpreted against the active
 * formulas and the results are reassembled into the operation's result.
 */
public interface ModificationSemantics<C, M, A> {
  static <C, M, A> ModificationSemantics<C, M, A> direct(DirectHandler<C, M, A> handler) {
    return new Direct<>(handler);
  }

  /**
   * Semantics of an operation no modification applies to.
   */
  static <C, M, A> ModificationSemantics<C, M, A> inapplicable() {
    return new Direct<>((modification, context) -> Optional.empty());
  }

  /**
   * Structural operation with any number of nested programs, chosen from the active formulas.
   * {@code rewrap} receives one {@link NestedRun} per program, in the order returned by
   * {@code unwrap}, and decides which formulas each of them starts from.
   */
  static <C, M, X, A> ModificationSemantics<C, M, A> nestedAll(
      Function<List<Formula<M>>, List<Program<X>>> unwrap, Rewrap<C, M, X, A> rewrap) {
    return new Nested<>(unwrap, rewrap);
  }

  /**
   * Structural operation with exactly one nested program.
   */
  static <C, M, X, A> ModificationSemantics<C, M, A> nested(
      Program<X> inner, BiFunction<C, NestedRun<C, M, X>, List<Branch<C, M, A>>> rewrap) {
    checkNotNull(inner);
    return new Nested<C, M, X, A>(
        formulas -> List.of(inner),
        (context, runs) -> rewrap.apply(context, runs.get(0)));
  }

  @FunctionalInterface
  interface DirectHandler<C, M, A> {
    /**
     * Applies the modification to the operation; empty if it does not apply.
     */
    Optional<Result<C, A>> apply(M modification, C context);
  }

  @FunctionalInterface
  interface Rewrap<C, M, X, A> {
    List<Branch<C, M, A>> rewrap(C context, List<NestedRun<C, M, X>> nested);
  }

  record Direct<C, M, A>(DirectHandler<C, M, A> handler) implements ModificationSemantics<C, M, A> {
    public Direct {
      checkNotNull(handler);
    }
  }

  record Nested<C, M, X, A>(Function<List<Formula<M>>, List<Program<X>>> unwrap, Rewrap<C, M, X, A> rewrap)
      implements ModificationSemantics<C, M, A> {
    public Nested {
      checkNotNull(unwrap);
      checkNotNull(rewrap);
    }
  }
}
