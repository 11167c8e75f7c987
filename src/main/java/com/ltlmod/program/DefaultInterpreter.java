package com.ltlmod.program;

import java.util.List;

/**
 * The ordinary semantics of an operation set. Returning no result means the operation failed in
 * the given context, returning several results means it chose nondeterministically.
 */
public interface DefaultInterpreter<C> {
  <A> List<Result<C, A>> execute(Operation<A> operation, C context, ProgramRunner<C> runner);
}
