package com.ltlmod.example;

import static com.ltlmod.example.StateOperation.put;
import static com.ltlmod.example.WriterOperation.listen;

import com.ltlmod.example.WriterOperation.Listened;
import com.ltlmod.program.Program;

/**
 * Example traces over an integer state and a string log.
 */
public final class Traces {
  public static final int COUNT = 4;

  private Traces() {}

  /**
   * Writes the current state to the log.
   */
  public static Program<Void> printState() {
    return StateOperation.<Integer>get().flatMap(state -> WriterOperation.tell(String.valueOf(state)));
  }

  public static Program<Void> trace1() {
    return put(1).then(printState()).then(put(2)).then(printState());
  }

  public static Program<Listened<Void>> trace2() {
    return listen(put(1).then(printState()));
  }

  public static Program<Listened<Void>> trace3() {
    return put(1).then(printState()).then(listen(put(2).then(printState())));
  }

  public static Program<Listened<Void>> trace4() {
    return listen(trace1());
  }

  public static Program<?> trace(int number) {
    return switch (number) {
      case 1 -> trace1();
      case 2 -> trace2();
      case 3 -> trace3();
      case 4 -> trace4();
      default -> throw new IllegalArgumentException("No trace %d, valid are 1 to %d".formatted(number, COUNT));
    };
  }
}
