package com.ltlmod.model;

/**
 * Eliminates {@code tt} and {@code ff} below conjunctions and disjunctions in a single bottom-up
 * pass. This is not a normal form; it only keeps the formulas produced by repeated stepping from
 * growing. A formula that cannot be simplified is returned as the same instance.
 */
public final class FormulaSimplifier<M> implements FormulaVisitor<M, Formula<M>> {
  private static final FormulaSimplifier<?> INSTANCE = new FormulaSimplifier<>();

  private FormulaSimplifier() {}

  @SuppressWarnings("unchecked")
  public static <M> Formula<M> simplify(Formula<M> formula) {
    return formula.accept((FormulaSimplifier<M>) INSTANCE);
  }

  @Override
  public Formula<M> visitTruth(Formula.Truth<M> truth) {
    return truth;
  }

  @Override
  public Formula<M> visitFalsity(Formula.Falsity<M> falsity) {
    return falsity;
  }

  @Override
  public Formula<M> visitAtom(Formula.Atom<M> atom) {
    return atom;
  }

  @Override
  public Formula<M> visitOr(Formula.Or<M> or) {
    Formula<M> left = or.left().accept(this);
    Formula<M> right = or.right().accept(this);
    if (left instanceof Formula.Truth<M> || right instanceof Formula.Truth<M>) {
      return Formula.truth();
    }
    if (left instanceof Formula.Falsity<M>) {
      return right;
    }
    if (right instanceof Formula.Falsity<M>) {
      return left;
    }
    return left == or.left() && right == or.right() ? or : Formula.or(left, right);
  }

  @Override
  public Formula<M> visitAnd(Formula.And<M> and) {
    Formula<M> left = and.left().accept(this);
    Formula<M> right = and.right().accept(this);
    if (left instanceof Formula.Truth<M>) {
      return right;
    }
    if (right instanceof Formula.Truth<M>) {
      return left;
    }
    if (left instanceof Formula.Falsity<M> || right instanceof Formula.Falsity<M>) {
      return Formula.falsity();
    }
    return left == and.left() && right == and.right() ? and : Formula.and(left, right);
  }

  @Override
  public Formula<M> visitNext(Formula.Next<M> next) {
    Formula<M> operand = next.operand().accept(this);
    return operand == next.operand() ? next : Formula.next(operand);
  }

  @Override
  public Formula<M> visitUntil(Formula.Until<M> until) {
    Formula<M> left = until.left().accept(this);
    Formula<M> right = until.right().accept(this);
    return left == until.left() && right == until.right() ? until : Formula.until(left, right);
  }

  @Override
  public Formula<M> visitRelease(Formula.Release<M> release) {
    Formula<M> left = release.left().accept(this);
    Formula<M> right = release.right().accept(this);
    return left == release.left() && right == release.right() ? release : Formula.release(left, right);
  }
}
