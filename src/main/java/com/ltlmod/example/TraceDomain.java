package com.ltlmod.example;

import com.ltlmod.example.WriterOperation.Censored;
import com.ltlmod.example.WriterOperation.Listened;
import com.ltlmod.program.Branch;
import com.ltlmod.program.DefaultInterpreter;
import com.ltlmod.program.ModificationInterpreter;
import com.ltlmod.program.ModificationSemantics;
import com.ltlmod.program.NestedRun;
import com.ltlmod.program.Operation;
import com.ltlmod.program.ProgramRunner;
import com.ltlmod.program.Result;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Semantics of {@link StateOperation} and {@link WriterOperation} over a {@link TraceContext}.
 *
 * <p>{@link Modification#A} on a put logs {@code [old-->new]} before writing, {@link Modification#B}
 * on a put leaves the state untouched. No other atomic modification applies. {@code listen} and
 * {@code pass} are structural: the formulas are threaded through their interior.
 */
public final class TraceDomain<S>
    implements DefaultInterpreter<TraceContext<S>>, ModificationInterpreter<TraceContext<S>, Modification> {

  @SuppressWarnings("unchecked")
  private static <C, A> List<Result<C, A>> single(@Nullable Object value, C context) {
    return List.of(new Result<>((A) value, context));
  }

  @Override
  @SuppressWarnings("unchecked")
  public <A> List<Result<TraceContext<S>, A>> execute(
      Operation<A> operation, TraceContext<S> context, ProgramRunner<TraceContext<S>> runner) {
    if (operation instanceof StateOperation<?, ?> state) {
      return switch (state.kind()) {
        case GET -> single(context.state(), context);
        case PUT -> single(null, context.withState(((StateOperation.Put<S>) state).value()));
      };
    }
    if (operation instanceof WriterOperation<?> writer) {
      List<?> results = switch (writer.kind()) {
        case TELL -> single(null, context.tell(((WriterOperation.Tell) writer).message()));
        case LISTEN -> listen((WriterOperation.Listen<?>) writer, context, runner);
        case PASS -> pass((WriterOperation.Pass<?>) writer, context, runner);
      };
      return (List<Result<TraceContext<S>, A>>) results;
    }
    throw new IllegalArgumentException("Unsupported operation " + operation);
  }

  private <X> List<Result<TraceContext<S>, Listened<X>>> listen(
      WriterOperation.Listen<X> listen, TraceContext<S> context, ProgramRunner<TraceContext<S>> runner) {
    return runner.run(listen.inner(), context.withLog("")).stream()
        .map(result -> new Result<TraceContext<S>, Listened<X>>(
            new Listened<>(result.value(), result.context().log()),
            result.context().withLog(context.log() + result.context().log())))
        .toList();
  }

  private <X> List<Result<TraceContext<S>, X>> pass(
      WriterOperation.Pass<X> pass, TraceContext<S> context, ProgramRunner<TraceContext<S>> runner) {
    return runner.run(pass.inner(), context.withLog("")).stream()
        .map(result -> {
          Censored<X> censored = censored(result.value());
          return new Result<TraceContext<S>, X>(
              censored.value(),
              result.context().withLog(context.log() + censored.censor().apply(result.context().log())));
        })
        .toList();
  }

  private static <X> Censored<X> censored(@Nullable Censored<X> censored) {
    if (censored == null) {
      throw new IllegalStateException("pass requires its interior to return a censor");
    }
    return censored;
  }

  @Override
  @SuppressWarnings("unchecked")
  public <A> ModificationSemantics<TraceContext<S>, Modification, A> semantics(Operation<A> operation) {
    if (operation instanceof StateOperation<?, ?> state) {
      return switch (state.kind()) {
        case GET -> ModificationSemantics.inapplicable();
        case PUT -> {
          S value = ((StateOperation.Put<S>) state).value();
          yield ModificationSemantics.direct((modification, context) -> modifyPut(value, modification, context));
        }
      };
    }
    if (operation instanceof WriterOperation<?> writer) {
      ModificationSemantics<?, ?, ?> semantics = switch (writer.kind()) {
        case TELL -> ModificationSemantics.inapplicable();
        case LISTEN -> listenSemantics((WriterOperation.Listen<?>) writer);
        case PASS -> passSemantics((WriterOperation.Pass<?>) writer);
      };
      return (ModificationSemantics<TraceContext<S>, Modification, A>) semantics;
    }
    throw new IllegalArgumentException("Unsupported operation " + operation);
  }

  private <R> Optional<Result<TraceContext<S>, R>> modifyPut(
      @Nullable S value, Modification modification, TraceContext<S> context) {
    return switch (modification) {
      case A -> Optional.of(new Result<TraceContext<S>, R>(
          null, context.tell("[%s-->%s]".formatted(context.state(), value)).withState(value)));
      case B -> Optional.of(new Result<TraceContext<S>, R>(null, context));
      case AB -> Optional.empty();
    };
  }

  private <X> ModificationSemantics<TraceContext<S>, Modification, Listened<X>> listenSemantics(
      WriterOperation.Listen<X> listen) {
    return ModificationSemantics.nested(listen.inner(),
        (TraceContext<S> context, NestedRun<TraceContext<S>, Modification, X> run) ->
            run.run(context.withLog("")).stream()
                .map(branch -> new Branch<TraceContext<S>, Modification, Listened<X>>(
                    new Listened<>(branch.value(), branch.context().log()),
                    branch.context().withLog(context.log() + branch.context().log()),
                    branch.formulas()))
                .toList());
  }

  private <X> ModificationSemantics<TraceContext<S>, Modification, X> passSemantics(
      WriterOperation.Pass<X> pass) {
    return ModificationSemantics.nested(pass.inner(),
        (TraceContext<S> context, NestedRun<TraceContext<S>, Modification, Censored<X>> run) ->
            run.run(context.withLog("")).stream()
                .map(branch -> {
                  Censored<X> censored = censored(branch.value());
                  return new Branch<TraceContext<S>, Modification, X>(
                      censored.value(),
                      branch.context().withLog(context.log() + censored.censor().apply(branch.context().log())),
                      branch.formulas());
                })
                .toList());
  }
}
