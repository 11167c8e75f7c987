package com.ltlmod.model;

public final class FormulaPrinter<M> implements FormulaVisitor<M, String> {
  private static final FormulaPrinter<?> INSTANCE = new FormulaPrinter<>();

  private FormulaPrinter() {}

  @SuppressWarnings("unchecked")
  public static <M> String print(Formula<M> formula) {
    return formula.accept((FormulaPrinter<M>) INSTANCE);
  }

  private String operand(Formula<M> formula) {
    String printed = formula.accept(this);
    return isBinary(formula) ? "(" + printed + ")" : printed;
  }

  private static boolean isBinary(Formula<?> formula) {
    return formula instanceof Formula.Or<?>
        || formula instanceof Formula.And<?>
        || formula instanceof Formula.Until<?>
        || formula instanceof Formula.Release<?>;
  }

  private String binary(Formula<M> left, String operator, Formula<M> right) {
    return "%s %s %s".formatted(operand(left), operator, operand(right));
  }

  @Override
  public String visitTruth(Formula.Truth<M> truth) {
    return "tt";
  }

  @Override
  public String visitFalsity(Formula.Falsity<M> falsity) {
    return "ff";
  }

  @Override
  public String visitAtom(Formula.Atom<M> atom) {
    return String.valueOf(atom.modification());
  }

  @Override
  public String visitOr(Formula.Or<M> or) {
    return binary(or.left(), "|", or.right());
  }

  @Override
  public String visitAnd(Formula.And<M> and) {
    return binary(and.left(), "&", and.right());
  }

  @Override
  public String visitNext(Formula.Next<M> next) {
    return "X " + operand(next.operand());
  }

  @Override
  public String visitUntil(Formula.Until<M> until) {
    return binary(until.left(), "U", until.right());
  }

  @Override
  public String visitRelease(Formula.Release<M> release) {
    return binary(release.left(), "R", release.right());
  }
}
