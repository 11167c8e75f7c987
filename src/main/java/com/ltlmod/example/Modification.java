package com.ltlmod.example;

import com.ltlmod.model.Composable;

/**
 * Example modifications. They have no intrinsic meaning, {@link TraceDomain} gives them one.
 */
public enum Modification implements Composable<Modification> {
  A, B, AB;

  @Override
  public Modification compose(Modification other) {
    return this == other ? this : AB;
  }
}
