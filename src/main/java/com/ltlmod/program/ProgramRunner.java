package com.ltlmod.program;

import java.util.List;

/**
 * Runs nested programs of a structural operation without any modification.
 */
public interface ProgramRunner<C> {
  <A> List<Result<C, A>> run(Program<A> program, C context);
}
