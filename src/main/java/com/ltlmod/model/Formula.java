package com.ltlmod.model;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * LTL formulas over atomic modifications of type {@code M}. A formula describes where (at which
 * time steps) modifications are applied. Negation and implication are absent, since a negated
 * modification has no obvious meaning.
 */
public interface Formula<M> {
  <R> R accept(FormulaVisitor<M, R> visitor);

  /**
   * Whether the formula is satisfied if no further step happens.
   */
  boolean finished();

  @SuppressWarnings("unchecked")
  static <M> Formula<M> truth() {
    return (Formula<M>) Truth.INSTANCE;
  }

  @SuppressWarnings("unchecked")
  static <M> Formula<M> falsity() {
    return (Formula<M>) Falsity.INSTANCE;
  }

  static <M> Formula<M> atom(M modification) {
    return new Atom<>(modification);
  }

  static <M> Formula<M> or(Formula<M> left, Formula<M> right) {
    return new Or<>(left, right);
  }

  static <M> Formula<M> and(Formula<M> left, Formula<M> right) {
    return new And<>(left, right);
  }

  static <M> Formula<M> next(Formula<M> operand) {
    return new Next<>(operand);
  }

  static <M> Formula<M> until(Formula<M> left, Formula<M> right) {
    return new Until<>(left, right);
  }

  static <M> Formula<M> release(Formula<M> left, Formula<M> right) {
    return new Release<>(left, right);
  }

  /**
   * Apply the modification at exactly one time step.
   */
  static <M> Formula<M> somewhere(M modification) {
    return until(truth(), atom(modification));
  }

  /**
   * Apply the modification at every time step from now on.
   */
  static <M> Formula<M> everywhere(M modification) {
    return release(falsity(), atom(modification));
  }

  /**
   * The modification that does nothing and never fails.
   */
  record Truth<M>() implements Formula<M> {
    private static final Truth<?> INSTANCE = new Truth<>();

    @Override
    public <R> R accept(FormulaVisitor<M, R> visitor) {
      return visitor.visitTruth(this);
    }

    @Override
    public boolean finished() {
      return true;
    }

    @Override
    public String toString() {
      return FormulaPrinter.print(this);
    }
  }

  /**
   * The modification that never applies.
   */
  record Falsity<M>() implements Formula<M> {
    private static final Falsity<?> INSTANCE = new Falsity<>();

    @Override
    public <R> R accept(FormulaVisitor<M, R> visitor) {
      return visitor.visitFalsity(this);
    }

    @Override
    public boolean finished() {
      return false;
    }

    @Override
    public String toString() {
      return FormulaPrinter.print(this);
    }
  }

  record Atom<M>(M modification) implements Formula<M> {
    public Atom {
      checkNotNull(modification);
    }

    @Override
    public <R> R accept(FormulaVisitor<M, R> visitor) {
      return visitor.visitAtom(this);
    }

    @Override
    public boolean finished() {
      return false;
    }

    @Override
    public String toString() {
      return FormulaPrinter.print(this);
    }
  }

  /**
   * Branches into the timeline where the left operand holds and the one where the right operand
   * holds. There is no branch where both hold.
   */
  record Or<M>(Formula<M> left, Formula<M> right) implements Formula<M> {
    public Or {
      checkNotNull(left);
      checkNotNull(right);
    }

    @Override
    public <R> R accept(FormulaVisitor<M, R> visitor) {
      return visitor.visitOr(this);
    }

    @Override
    public boolean finished() {
      return left.finished() || right.finished();
    }

    @Override
    public String toString() {
      return FormulaPrinter.print(this);
    }
  }

  /**
   * Both operands hold. Modifications demanded by both at the same step are composed, left on top
   * of right, so conjunction is only commutative if composition is.
   */
  record And<M>(Formula<M> left, Formula<M> right) implements Formula<M> {
    public And {
      checkNotNull(left);
      checkNotNull(right);
    }

    @Override
    public <R> R accept(FormulaVisitor<M, R> visitor) {
      return visitor.visitAnd(this);
    }

    @Override
    public boolean finished() {
      return left.finished() && right.finished();
    }

    @Override
    public String toString() {
      return FormulaPrinter.print(this);
    }
  }

  record Next<M>(Formula<M> operand) implements Formula<M> {
    public Next {
      checkNotNull(operand);
    }

    @Override
    public <R> R accept(FormulaVisitor<M, R> visitor) {
      return visitor.visitNext(this);
    }

    @Override
    public boolean finished() {
      return false;
    }

    @Override
    public String toString() {
      return FormulaPrinter.print(this);
    }
  }

  /**
   * The left operand holds at least until the right one begins to hold, which must happen
   * eventually. Equivalent to {@code right | (left & X (left U right))}.
   */
  record Until<M>(Formula<M> left, Formula<M> right) implements Formula<M> {
    public Until {
      checkNotNull(left);
      checkNotNull(right);
    }

    @Override
    public <R> R accept(FormulaVisitor<M, R> visitor) {
      return visitor.visitUntil(this);
    }

    @Override
    public boolean finished() {
      return false;
    }

    @Override
    public String toString() {
      return FormulaPrinter.print(this);
    }
  }

  /**
   * The right operand holds up to and including the point where the left one becomes true; if
   * that never happens, the right operand holds forever. Equivalent to
   * {@code right & (left | X (left R right))}.
   */
  record Release<M>(Formula<M> left, Formula<M> right) implements Formula<M> {
    public Release {
      checkNotNull(left);
      checkNotNull(right);
    }

    @Override
    public <R> R accept(FormulaVisitor<M, R> visitor) {
      return visitor.visitRelease(this);
    }

    @Override
    public boolean finished() {
      return true;
    }

    @Override
    public String toString() {
      return FormulaPrinter.print(this);
    }
  }
}
