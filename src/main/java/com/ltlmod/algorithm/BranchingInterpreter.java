package com.ltlmod.algorithm;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.ltlmod.model.Composable;
import com.ltlmod.model.Formula;
import com.ltlmod.model.FormulaVisitor;
import com.ltlmod.model.ListAlternative;
import com.ltlmod.program.Branch;
import com.ltlmod.program.Cursor;
import com.ltlmod.program.DefaultInterpreter;
import com.ltlmod.program.ModificationInterpreter;
import com.ltlmod.program.ModificationSemantics;
import com.ltlmod.program.NestedRun;
import com.ltlmod.program.Operation;
import com.ltlmod.program.Program;
import com.ltlmod.program.ProgramRunner;
import com.ltlmod.program.Result;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Interprets a program under a list of active formulas, one per open scope, and enumerates every
 * way of applying modifications that is consistent with them. Each atomic operation consumes one
 * time step: the formulas are stepped, and every alternative either runs the operation unmodified
 * or applies the chosen modification. Alternatives where the modification does not apply are
 * pruned, as are scopes that close with an unfinished formula.
 *
 * <p>Branches are enumerated eagerly and in a deterministic order.
 */
public final class BranchingInterpreter<C, M extends Composable<M>> {
  private static final Logger logger = Logger.getLogger(BranchingInterpreter.class.getName());

  private final Class<M> modificationType;
  private final DefaultInterpreter<C> defaults;
  private final ModificationInterpreter<C, M> modifications;
  private final ProgramRunner<C> unmodified;

  /**
   * Scopes opened by the interpreted programs must range over {@code modificationType}; opening a
   * scope with atoms of another type fails with an {@link IllegalArgumentException}.
   */
  public BranchingInterpreter(Class<M> modificationType, DefaultInterpreter<C> defaults,
      ModificationInterpreter<C, M> modifications) {
    this.modificationType = checkNotNull(modificationType);
    this.defaults = checkNotNull(defaults);
    this.modifications = checkNotNull(modifications);
    this.unmodified = new ProgramRunner<>() {
      @Override
      public <A> List<Result<C, A>> run(Program<A> program, C context) {
        return interpret(program, context, List.of()).stream().map(Branch::result).toList();
      }
    };
  }

  /**
   * Interprets {@code program} from {@code initialFormulas} and keeps the branches where every
   * remaining formula is finished. An empty result means no placement of modifications satisfies
   * the formulas.
   */
  public <A> List<Result<C, A>> run(List<Formula<M>> initialFormulas, Program<A> program, C context) {
    List<Branch<C, M, A>> branches = interpret(program, context, initialFormulas);
    List<Result<C, A>> results = branches.stream()
        .filter(branch -> branch.formulas().stream().allMatch(Formula::finished))
        .map(Branch::result)
        .toList();
    logger.log(Level.FINE, () -> "%d of %d branches satisfy their formulas"
        .formatted(results.size(), branches.size()));
    return results;
  }

  public <A> List<Result<C, A>> runDefault(Program<A> program, C context) {
    return run(List.of(), program, context);
  }

  /**
   * All branches of {@code program}, together with the formulas left over at its end. No
   * finishedness check is done on the leftover formulas.
   */
  public <A> List<Branch<C, M, A>> interpret(Program<A> program, C context, List<Formula<M>> formulas) {
    checkNotNull(context);
    ImmutableList.Builder<Branch<C, M, A>> branches = ImmutableList.builder();
    Deque<Position<C, M, A>> pending = new ArrayDeque<>();
    pending.push(new Position<>(Cursor.start(program), context, formulas));
    while (!pending.isEmpty()) {
      Position<C, M, A> position = pending.pop();
      Cursor<A> cursor = position.cursor();
      if (cursor.done()) {
        branches.add(new Branch<>(cursor.value(), position.context(), position.formulas()));
        continue;
      }
      List<? extends Branch<C, M, ?>> steps =
          interpretOperation(cursor.operation(), position.context(), position.formulas());
      // Depth first, earlier alternatives first.
      for (int i = steps.size() - 1; i >= 0; i--) {
        Branch<C, M, ?> step = steps.get(i);
        pending.push(new Position<>(cursor.resume(step.value()), step.context(), step.formulas()));
      }
    }
    return branches.build();
  }

  private <X> List<Branch<C, M, X>> interpretOperation(
      Operation<X> operation, C context, List<Formula<M>> formulas) {
    if (operation instanceof ModifyScope<?, X> scope) {
      return interpretScope(scope, context, formulas);
    }
    ModificationSemantics<C, M, X> semantics = modifications.semantics(operation);
    if (semantics instanceof ModificationSemantics.Nested<C, M, ?, X> nested) {
      return interpretNested(nested, context, formulas);
    }
    if (semantics instanceof ModificationSemantics.Direct<C, M, X> direct) {
      return interpretDirect(operation, direct, context, formulas);
    }
    throw new IllegalStateException("No modification semantics for " + operation);
  }

  private <X> List<Branch<C, M, X>> interpretScope(
      ModifyScope<?, X> scope, C context, List<Formula<M>> formulas) {
    Formula<M> formula = typed(scope.formula());
    List<Formula<M>> opened = ImmutableList.<Formula<M>>builderWithExpectedSize(formulas.size() + 1)
        .add(formula)
        .addAll(formulas)
        .build();

    List<Branch<C, M, X>> inner = interpret(scope.inner(), context, opened);
    ImmutableList.Builder<Branch<C, M, X>> closed = ImmutableList.builder();
    for (Branch<C, M, X> branch : inner) {
      List<Formula<M>> remaining = branch.formulas();
      checkState(!remaining.isEmpty(), "Scope of %s lost its formula", formula);
      if (remaining.get(0).finished()) {
        closed.add(new Branch<>(branch.value(), branch.context(), remaining.subList(1, remaining.size())));
      }
    }
    List<Branch<C, M, X>> result = closed.build();
    logger.log(Level.FINE, () -> "Scope %s: %d of %d branches finished"
        .formatted(formula, result.size(), inner.size()));
    return result;
  }

  @SuppressWarnings("unchecked")
  private <N> Formula<M> typed(Formula<N> formula) {
    formula.accept(new AtomTypeCheck<>(formula));
    return (Formula<M>) formula;
  }

  private <Y, X> List<Branch<C, M, X>> interpretNested(
      ModificationSemantics.Nested<C, M, Y, X> nested, C context, List<Formula<M>> formulas) {
    ImmutableList.Builder<NestedRun<C, M, Y>> runs = ImmutableList.builder();
    for (Program<Y> program : nested.unwrap().apply(formulas)) {
      runs.add(new NestedProgram<>(program, formulas));
    }
    return nested.rewrap().rewrap(context, runs.build());
  }

  private <X> List<Branch<C, M, X>> interpretDirect(Operation<X> operation,
      ModificationSemantics.Direct<C, M, X> direct, C context, List<Formula<M>> formulas) {
    List<ListAlternative<M>> alternatives = FormulaStepper.stepList(formulas);
    logger.log(Level.FINER, () -> "%s: %s".formatted(operation, alternatives));

    @Nullable
    List<Result<C, X>> executed = null;
    ImmutableList.Builder<Branch<C, M, X>> branches = ImmutableList.builder();
    int pruned = 0;
    for (ListAlternative<M> alternative : alternatives) {
      @Nullable
      M now = alternative.now();
      if (now == null) {
        if (executed == null) {
          executed = defaults.execute(operation, context, unmodified);
        }
        for (Result<C, X> result : executed) {
          branches.add(new Branch<>(result.value(), result.context(), alternative.later()));
        }
      } else {
        var modified = direct.handler().apply(now, context);
        if (modified.isPresent()) {
          branches.add(new Branch<>(modified.get().value(), modified.get().context(), alternative.later()));
        } else {
          pruned++;
        }
      }
    }
    if (pruned > 0) {
      int count = pruned;
      logger.log(Level.FINER, () -> "%s: %d modifications inapplicable".formatted(operation, count));
    }
    return branches.build();
  }

  private final class AtomTypeCheck<N> implements FormulaVisitor<N, Void> {
    private final Formula<N> scope;

    AtomTypeCheck(Formula<N> scope) {
      this.scope = scope;
    }

    @Override
    public Void visitTruth(Formula.Truth<N> truth) {
      return null;
    }

    @Override
    public Void visitFalsity(Formula.Falsity<N> falsity) {
      return null;
    }

    @Override
    public Void visitAtom(Formula.Atom<N> atom) {
      checkArgument(modificationType.isInstance(atom.modification()),
          "Scope %s modifies with %s, expected a %s", scope, atom.modification(), modificationType.getSimpleName());
      return null;
    }

    @Override
    public Void visitOr(Formula.Or<N> or) {
      or.left().accept(this);
      return or.right().accept(this);
    }

    @Override
    public Void visitAnd(Formula.And<N> and) {
      and.left().accept(this);
      return and.right().accept(this);
    }

    @Override
    public Void visitNext(Formula.Next<N> next) {
      return next.operand().accept(this);
    }

    @Override
    public Void visitUntil(Formula.Until<N> until) {
      until.left().accept(this);
      return until.right().accept(this);
    }

    @Override
    public Void visitRelease(Formula.Release<N> release) {
      release.left().accept(this);
      return release.right().accept(this);
    }
  }

  private record Position<C, M, A>(Cursor<A> cursor, C context, List<Formula<M>> formulas) {}

  private final class NestedProgram<Y> implements NestedRun<C, M, Y> {
    private final Program<Y> program;
    private final List<Formula<M>> formulas;

    NestedProgram(Program<Y> program, List<Formula<M>> formulas) {
      this.program = checkNotNull(program);
      this.formulas = formulas;
    }

    @Override
    public List<Formula<M>> formulas() {
      return formulas;
    }

    @Override
    public List<Branch<C, M, Y>> run(C context, List<Formula<M>> formulas) {
      return interpret(program, context, formulas);
    }
  }
}
