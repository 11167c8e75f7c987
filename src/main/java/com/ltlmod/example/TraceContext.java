package com.ltlmod.example;

import static com.google.common.base.Preconditions.checkNotNull;

import javax.annotation.Nullable;

/**
 * Context of the example domain: a single state value and the log written so far.
 */
public record TraceContext<S>(@Nullable S state, String log) {
  public TraceContext {
    checkNotNull(log);
  }

  public static <S> TraceContext<S> initial(@Nullable S state) {
    return new TraceContext<>(state, "");
  }

  public TraceContext<S> withState(@Nullable S state) {
    return new TraceContext<>(state, log);
  }

  public TraceContext<S> withLog(String log) {
    return new TraceContext<>(state, log);
  }

  public TraceContext<S> tell(String message) {
    return new TraceContext<>(state, log + message);
  }
}
