package com.ltlmod.program;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.function.Function;
import javax.annotation.Nullable;

/**
 * A sequence of operations where later operations may depend on the values produced by earlier
 * ones. A program is a finished value, a single operation, or a program followed by a
 * continuation. Composing programs never runs any of them; use {@link Cursor} to walk one.
 */
public interface Program<A> {
  static <A> Program<A> pure(@Nullable A value) {
    return new Pure<>(value);
  }

  static <A> Program<A> perform(Operation<A> operation) {
    return new Perform<>(operation);
  }

  default <B> Program<B> flatMap(Function<? super A, ? extends Program<B>> next) {
    return new Bind<A, B>(this, next);
  }

  default <B> Program<B> map(Function<? super A, ? extends B> function) {
    checkNotNull(function);
    return flatMap(value -> pure(function.apply(value)));
  }

  default <B> Program<B> then(Program<B> next) {
    checkNotNull(next);
    return flatMap(value -> next);
  }

  record Pure<A>(@Nullable A value) implements Program<A> {}

  record Perform<A>(Operation<A> operation) implements Program<A> {
    public Perform {
      checkNotNull(operation);
    }
  }

  record Bind<X, A>(Program<X> source, Function<? super X, ? extends Program<A>> continuation)
      implements Program<A> {
    public Bind {
      checkNotNull(source);
      checkNotNull(continuation);
    }
  }
}
