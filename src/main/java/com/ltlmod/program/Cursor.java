package com.ltlmod.program;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.function.Function;
import javax.annotation.Nullable;

/**
 * A position within a program: either the next operation to perform or the final value, together
 * with the continuations still pending. Advancing runs in a loop, so neither long sequences nor
 * deeply left-nested compositions grow the call stack. Cursors are immutable; branches forking
 * at the same operation share their pending continuations.
 */
public final class Cursor<A> {
  private record Frame(Function<Object, Program<?>> continuation, @Nullable Frame next) {}

  @Nullable
  private final Operation<?> operation;
  @Nullable
  private final Object value;
  @Nullable
  private final Frame frames;

  private Cursor(@Nullable Operation<?> operation, @Nullable Object value, @Nullable Frame frames) {
    this.operation = operation;
    this.value = value;
    this.frames = frames;
  }

  public static <A> Cursor<A> start(Program<A> program) {
    return advance(checkNotNull(program), null);
  }

  @SuppressWarnings("unchecked")
  private static <A> Cursor<A> advance(Program<?> program, @Nullable Frame frames) {
    Program<?> current = program;
    @Nullable
    Frame pending = frames;
    while (true) {
      if (current instanceof Program.Perform<?> perform) {
        return new Cursor<>(perform.operation(), null, pending);
      }
      if (current instanceof Program.Bind<?, ?> bind) {
        pending = new Frame((Function<Object, Program<?>>) (Function<?, ?>) bind.continuation(), pending);
        current = bind.source();
      } else if (current instanceof Program.Pure<?> pure) {
        if (pending == null) {
          return new Cursor<>(null, pure.value(), null);
        }
        current = checkNotNull(pending.continuation().apply(pure.value()), "Continuation returned null");
        pending = pending.next();
      } else {
        throw new IllegalArgumentException("Unsupported program " + current);
      }
    }
  }

  public boolean done() {
    return operation == null;
  }

  /**
   * The operation the program is suspended at.
   */
  public Operation<?> operation() {
    checkState(operation != null, "Program is done");
    return operation;
  }

  @Nullable
  @SuppressWarnings("unchecked")
  public A value() {
    checkState(done(), "Program is suspended at %s", operation);
    return (A) value;
  }

  /**
   * Continues the program with {@code result} as the value of the current operation.
   */
  public Cursor<A> resume(@Nullable Object result) {
    checkState(!done(), "Program is done");
    return advance(Program.pure(result), frames);
  }
}
