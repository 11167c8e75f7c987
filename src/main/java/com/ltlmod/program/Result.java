package com.ltlmod.program;

import static com.google.common.base.Preconditions.checkNotNull;

import javax.annotation.Nullable;

/**
 * The value an operation or program produced, together with the context it left behind.
 */
public record Result<C, A>(@Nullable A value, C context) {
  public Result {
    checkNotNull(context);
  }
}
