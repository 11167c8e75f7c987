package com.ltlmod.program;

/**
 * A single effectful operation producing a value of type {@code A}. Concrete operation sets are
 * closed families of records, dispatched by their interpreters.
 */
public interface Operation<A> {}
