package com.ltlmod.algorithm;

import com.google.common.collect.ImmutableList;
import com.ltlmod.model.Alternative;
import com.ltlmod.model.Composable;
import com.ltlmod.model.Formula;
import com.ltlmod.model.FormulaSimplifier;
import com.ltlmod.model.FormulaVisitor;
import com.ltlmod.model.ListAlternative;
import java.util.List;

/**
 * Progresses formulas by one time step. Every alternative states which modification to apply now
 * and what remains to be satisfied afterwards. The order of alternatives is deterministic:
 * disjunctions enumerate the left operand first, conjunctions and lists pair alternatives with the
 * left operand (or head) as the outer loop.
 */
public final class FormulaStepper {
  private FormulaStepper() {}

  public static <M extends Composable<M>> List<Alternative<M>> step(Formula<M> formula) {
    return formula.accept(new StepVisitor<>());
  }

  /**
   * Steps a list of independent formulas at once. A modification demanded by a later element of
   * the list is composed on top of the modification demanded by an earlier one.
   */
  public static <M extends Composable<M>> List<ListAlternative<M>> stepList(List<Formula<M>> formulas) {
    if (formulas.isEmpty()) {
      return List.of(new ListAlternative<M>(null, List.of()));
    }
    List<Alternative<M>> head = step(formulas.get(0));
    if (head.isEmpty()) {
      return List.of();
    }
    List<ListAlternative<M>> tail = stepList(formulas.subList(1, formulas.size()));
    ImmutableList.Builder<ListAlternative<M>> alternatives =
        ImmutableList.builderWithExpectedSize(head.size() * tail.size());
    for (Alternative<M> first : head) {
      for (ListAlternative<M> rest : tail) {
        List<Formula<M>> later = ImmutableList.<Formula<M>>builderWithExpectedSize(rest.later().size() + 1)
            .add(first.later())
            .addAll(rest.later())
            .build();
        alternatives.add(new ListAlternative<>(Composable.compose(rest.now(), first.now()), later));
      }
    }
    return alternatives.build();
  }

  private static final class StepVisitor<M extends Composable<M>> implements FormulaVisitor<M, List<Alternative<M>>> {
    @Override
    public List<Alternative<M>> visitTruth(Formula.Truth<M> truth) {
      return List.of(new Alternative<M>(null, truth));
    }

    @Override
    public List<Alternative<M>> visitFalsity(Formula.Falsity<M> falsity) {
      return List.of();
    }

    @Override
    public List<Alternative<M>> visitAtom(Formula.Atom<M> atom) {
      return List.of(new Alternative<M>(atom.modification(), Formula.truth()));
    }

    @Override
    public List<Alternative<M>> visitOr(Formula.Or<M> or) {
      return ImmutableList.<Alternative<M>>builder()
          .addAll(or.left().accept(this))
          .addAll(or.right().accept(this))
          .build();
    }

    @Override
    public List<Alternative<M>> visitAnd(Formula.And<M> and) {
      List<Alternative<M>> left = and.left().accept(this);
      if (left.isEmpty()) {
        return List.of();
      }
      List<Alternative<M>> right = and.right().accept(this);
      ImmutableList.Builder<Alternative<M>> alternatives =
          ImmutableList.builderWithExpectedSize(left.size() * right.size());
      for (Alternative<M> first : left) {
        for (Alternative<M> second : right) {
          alternatives.add(new Alternative<>(
              Composable.compose(first.now(), second.now()),
              FormulaSimplifier.simplify(Formula.and(first.later(), second.later()))));
        }
      }
      return alternatives.build();
    }

    @Override
    public List<Alternative<M>> visitNext(Formula.Next<M> next) {
      return List.of(new Alternative<M>(null, next.operand()));
    }

    @Override
    public List<Alternative<M>> visitUntil(Formula.Until<M> until) {
      return Formula.or(until.right(), Formula.and(until.left(), Formula.next(until)))
          .accept(this);
    }

    @Override
    public List<Alternative<M>> visitRelease(Formula.Release<M> release) {
      return Formula.and(release.right(), Formula.or(release.left(), Formula.next(release)))
          .accept(this);
    }
  }
}
