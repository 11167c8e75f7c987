package com.ltlmod.example;

import com.ltlmod.program.Operation;
import com.ltlmod.program.Program;
import javax.annotation.Nullable;

public interface StateOperation<S, A> extends Operation<A> {
  enum Kind {
    GET, PUT
  }

  Kind kind();

  static <S> Program<S> get() {
    return Program.perform(new Get<>());
  }

  static <S> Program<Void> put(@Nullable S value) {
    return Program.perform(new Put<>(value));
  }

  record Get<S>() implements StateOperation<S, S> {
    @Override
    public Kind kind() {
      return Kind.GET;
    }

    @Override
    public String toString() {
      return "get";
    }
  }

  record Put<S>(@Nullable S value) implements StateOperation<S, Void> {
    @Override
    public Kind kind() {
      return Kind.PUT;
    }

    @Override
    public String toString() {
      return "put " + value;
    }
  }
}
