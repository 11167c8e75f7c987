package com.ltlmod.algorithm;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.ltlmod.program.Cursor;
import com.ltlmod.program.DefaultInterpreter;
import com.ltlmod.program.Operation;
import com.ltlmod.program.Program;
import com.ltlmod.program.ProgramRunner;
import com.ltlmod.program.Result;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Runs programs with their default semantics only. Modification scopes are transparent: their
 * inner program runs as if it was not tagged.
 */
public final class UnmodifiedRunner<C> implements ProgramRunner<C> {
  private final DefaultInterpreter<C> defaults;

  public UnmodifiedRunner(DefaultInterpreter<C> defaults) {
    this.defaults = checkNotNull(defaults);
  }

  @Override
  public <A> List<Result<C, A>> run(Program<A> program, C context) {
    checkNotNull(context);
    ImmutableList.Builder<Result<C, A>> results = ImmutableList.builder();
    Deque<Position<C, A>> pending = new ArrayDeque<>();
    pending.push(new Position<>(Cursor.start(program), context));
    while (!pending.isEmpty()) {
      Position<C, A> position = pending.pop();
      Cursor<A> cursor = position.cursor();
      if (cursor.done()) {
        results.add(new Result<>(cursor.value(), position.context()));
        continue;
      }
      List<? extends Result<C, ?>> steps = execute(cursor.operation(), position.context());
      for (int i = steps.size() - 1; i >= 0; i--) {
        Result<C, ?> step = steps.get(i);
        pending.push(new Position<>(cursor.resume(step.value()), step.context()));
      }
    }
    return results.build();
  }

  private <X> List<Result<C, X>> execute(Operation<X> operation, C context) {
    if (operation instanceof ModifyScope<?, X> scope) {
      return run(scope.inner(), context);
    }
    return defaults.execute(operation, context, this);
  }

  private record Position<C, A>(Cursor<A> cursor, C context) {}
}
