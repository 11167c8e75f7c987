package com.ltlmod.model;

public interface FormulaVisitor<M, R> {
  R visitTruth(Formula.Truth<M> truth);

  R visitFalsity(Formula.Falsity<M> falsity);

  R visitAtom(Formula.Atom<M> atom);

  R visitOr(Formula.Or<M> or);

  R visitAnd(Formula.And<M> and);

  R visitNext(Formula.Next<M> next);

  R visitUntil(Formula.Until<M> until);

  R visitRelease(Formula.Release<M> release);
}
