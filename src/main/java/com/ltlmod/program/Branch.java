package com.ltlmod.program;

import static com.google.common.base.Preconditions.checkNotNull;

import com.ltlmod.model.Formula;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A surviving branch of the interpretation: the produced value, the context and the formulas that
 * still have to be satisfied, innermost scope first.
 */
public record Branch<C, M, A>(@Nullable A value, C context, List<Formula<M>> formulas) {
  public Branch {
    checkNotNull(context);
    formulas = List.copyOf(formulas);
  }

  public Result<C, A> result() {
    return new Result<>(value, context);
  }
}
