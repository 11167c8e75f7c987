package com.ltlmod.program;

import com.ltlmod.model.Formula;
import java.util.List;

/**
 * A nested program of a structural operation, ready to be interpreted against the formulas that
 * were active when the operation was reached.
 */
public interface NestedRun<C, M, X> {
  List<Formula<M>> formulas();

  List<Branch<C, M, X>> run(C context, List<Formula<M>> formulas);

  default List<Branch<C, M, X>> run(C context) {
    return run(context, formulas());
  }
}
