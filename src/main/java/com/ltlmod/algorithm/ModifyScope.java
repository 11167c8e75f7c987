package com.ltlmod.algorithm;

import static com.google.common.base.Preconditions.checkNotNull;

import com.ltlmod.model.Formula;
import com.ltlmod.program.Operation;
import com.ltlmod.program.Program;

/**
 * Opens a scope in which {@code formula} has to be satisfied by the modifications applied to
 * {@code inner}.
 */
public record ModifyScope<M, A>(Formula<M> formula, Program<A> inner) implements Operation<A> {
  public ModifyScope {
    checkNotNull(formula);
    checkNotNull(inner);
  }
}
