package com.ltlmod.example;

import static com.google.common.base.Preconditions.checkNotNull;

import com.ltlmod.program.Operation;
import com.ltlmod.program.Program;
import java.util.function.UnaryOperator;
import javax.annotation.Nullable;

public interface WriterOperation<A> extends Operation<A> {
  enum Kind {
    TELL, LISTEN, PASS
  }

  Kind kind();

  static Program<Void> tell(String message) {
    return Program.perform(new Tell(message));
  }

  /**
   * Runs {@code inner} and additionally returns the log it wrote.
   */
  static <X> Program<Listened<X>> listen(Program<X> inner) {
    return Program.perform(new Listen<>(inner));
  }

  /**
   * Runs {@code inner} and rewrites the log it wrote with the function it returned.
   */
  static <X> Program<X> pass(Program<Censored<X>> inner) {
    return Program.perform(new Pass<>(inner));
  }

  record Listened<X>(@Nullable X value, String output) {}

  record Censored<X>(@Nullable X value, UnaryOperator<String> censor) {
    public Censored {
      checkNotNull(censor);
    }
  }

  record Tell(String message) implements WriterOperation<Void> {
    public Tell {
      checkNotNull(message);
    }

    @Override
    public Kind kind() {
      return Kind.TELL;
    }

    @Override
    public String toString() {
      return "tell " + message;
    }
  }

  record Listen<X>(Program<X> inner) implements WriterOperation<Listened<X>> {
    public Listen {
      checkNotNull(inner);
    }

    @Override
    public Kind kind() {
      return Kind.LISTEN;
    }

    @Override
    public String toString() {
      return "listen";
    }
  }

  record Pass<X>(Program<Censored<X>> inner) implements WriterOperation<X> {
    public Pass {
      checkNotNull(inner);
    }

    @Override
    public Kind kind() {
      return Kind.PASS;
    }

    @Override
    public String toString() {
      return "pass";
    }
  }
}
