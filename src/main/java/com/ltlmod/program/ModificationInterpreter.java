package com.ltlmod.program;

/**
 * Describes how an operation reacts to atomic modifications of type {@code M}.
 */
public interface ModificationInterpreter<C, M> {
  <A> ModificationSemantics<C, M, A> semantics(Operation<A> operation);
}
