package com.ltlmod.algorithm;

import com.ltlmod.model.Formula;
import com.ltlmod.program.Program;

public final class Ltl {
  private Ltl() {}

  /**
   * Tags {@code program} with a formula that has to be satisfied by the modifications applied
   * within it. Branches where it is not satisfied once the program ends are pruned. The formula's
   * modifications must be of the type the interpreting {@link BranchingInterpreter} was built for.
   */
  public static <M, A> Program<A> modify(Formula<M> formula, Program<A> program) {
    return Program.perform(new ModifyScope<>(formula, program));
  }

  public static <M> Formula<M> somewhere(M modification) {
    return Formula.somewhere(modification);
  }

  public static <M> Formula<M> everywhere(M modification) {
    return Formula.everywhere(modification);
  }
}
