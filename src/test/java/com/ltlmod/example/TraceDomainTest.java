package com.ltlmod.example;

import static com.ltlmod.example.StateOperation.put;
import static com.ltlmod.example.Traces.printState;
import static com.ltlmod.example.WriterOperation.listen;
import static com.ltlmod.example.WriterOperation.pass;
import static com.ltlmod.example.WriterOperation.tell;
import static org.junit.jupiter.api.Assertions.*;

import com.ltlmod.algorithm.BranchingInterpreter;
import com.ltlmod.algorithm.Ltl;
import com.ltlmod.algorithm.UnmodifiedRunner;
import com.ltlmod.example.WriterOperation.Censored;
import com.ltlmod.example.WriterOperation.Listened;
import com.ltlmod.model.Formula;
import com.ltlmod.program.Program;
import com.ltlmod.program.Result;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TraceDomainTest {
  private static final TraceContext<Integer> START = TraceContext.initial(-1);

  private TraceDomain<Integer> domain;
  private BranchingInterpreter<TraceContext<Integer>, Modification> interpreter;

  @BeforeEach
  void setUp() {
    domain = new TraceDomain<>();
    interpreter = new BranchingInterpreter<>(Modification.class, domain, domain);
  }

  private <A> List<Result<TraceContext<Integer>, A>> explore(Formula<Modification> formula, Program<A> program) {
    return interpreter.runDefault(Ltl.modify(formula, program), START);
  }

  private static List<String> logs(List<? extends Result<TraceContext<Integer>, ?>> results) {
    return results.stream().map(result -> result.context().log()).toList();
  }

  private static Program<Censored<Void>> censored(Program<Void> program) {
    return program.map(value -> new Censored<Void>(value, log -> "<" + log + ">"));
  }

  @Nested
  @DisplayName("modifications")
  class ModificationTests {

    @Test
    @DisplayName("equal modifications compose to themselves")
    void composeEqual() {
      assertEquals(Modification.A, Modification.A.compose(Modification.A));
      assertEquals(Modification.B, Modification.B.compose(Modification.B));
      assertEquals(Modification.AB, Modification.AB.compose(Modification.AB));
    }

    @Test
    @DisplayName("different modifications compose to AB")
    void composeDifferent() {
      assertEquals(Modification.AB, Modification.A.compose(Modification.B));
      assertEquals(Modification.AB, Modification.B.compose(Modification.A));
      assertEquals(Modification.AB, Modification.AB.compose(Modification.A));
    }
  }

  @Nested
  @DisplayName("default semantics")
  class DefaultSemanticsTests {

    @Test
    @DisplayName("state and log operations")
    void stateAndLog() {
      List<Result<TraceContext<Integer>, Void>> results = new UnmodifiedRunner<>(domain).run(Traces.trace1(), START);
      assertEquals(List.of(new Result<TraceContext<Integer>, Void>(null, new TraceContext<>(2, "12"))), results);
    }

    @Test
    @DisplayName("get returns the current state")
    void getReturnsState() {
      var results = new UnmodifiedRunner<>(domain).run(StateOperation.<Integer>get(), START);
      assertEquals(-1, results.get(0).value());
    }

    @Test
    @DisplayName("listen returns the log of its interior and keeps it")
    void listenCapturesLog() {
      Program<Listened<Void>> program = tell("x").then(listen(put(1).then(printState())));
      var results = new UnmodifiedRunner<>(domain).run(program, START);
      assertEquals(1, results.size());
      assertEquals(new Listened<Void>(null, "1"), results.get(0).value());
      assertEquals("x1", results.get(0).context().log());
    }

    @Test
    @DisplayName("pass rewrites the log of its interior")
    void passRewritesLog() {
      Program<Void> program = tell("x").then(pass(censored(put(1).then(printState())))).then(tell("y"));
      var results = new UnmodifiedRunner<>(domain).run(program, START);
      assertEquals(List.of("x<1>y"), logs(results));
    }

    @Test
    @DisplayName("interpreter without formulas agrees with the default semantics")
    void interpreterAgrees() {
      for (int trace = 1; trace <= Traces.COUNT; trace++) {
        Program<?> program = Traces.trace(trace);
        assertEquals(
            logs(new UnmodifiedRunner<>(domain).run(program, START)),
            logs(interpreter.runDefault(program, START)));
      }
    }

    @Test
    @DisplayName("rejects unknown traces")
    void unknownTrace() {
      assertThrows(IllegalArgumentException.class, () -> Traces.trace(0));
      assertThrows(IllegalArgumentException.class, () -> Traces.trace(Traces.COUNT + 1));
    }
  }

  @Nested
  @DisplayName("somewhere")
  class SomewhereTests {

    @Test
    @DisplayName("A lands on exactly one of the two puts")
    void somewhereA() {
      var results = explore(Ltl.somewhere(Modification.A), Traces.trace1());
      assertEquals(List.of("[-1-->1]12", "1[1-->2]2"), logs(results));
      assertEquals(List.of(2, 2), results.stream().map(result -> result.context().state()).toList());
    }

    @Test
    @DisplayName("B skips exactly one of the two puts")
    void somewhereB() {
      var results = explore(Ltl.somewhere(Modification.B), Traces.trace1());
      assertEquals(List.of("-12", "11"), logs(results));
    }

    @Test
    @DisplayName("AB applies nowhere")
    void somewhereAB() {
      assertEquals(List.of(), explore(Ltl.somewhere(Modification.AB), Traces.trace1()));
    }

    @Test
    @DisplayName("B inside listen keeps the state seen by the interior")
    void insideListenB() {
      var results = explore(Ltl.somewhere(Modification.B), Traces.trace2());
      assertEquals(List.of("-1"), logs(results));
      assertEquals(List.of(new Listened<Void>(null, "-1")), results.stream().map(Result::value).toList());
    }

    @Test
    @DisplayName("B before and inside listen")
    void aroundListenB() {
      var results = explore(Ltl.somewhere(Modification.B), Traces.trace3());
      assertEquals(List.of("-12", "11"), logs(results));
      assertEquals(
          List.of(new Listened<Void>(null, "2"), new Listened<Void>(null, "1")),
          results.stream().map(Result::value).toList());
    }

    @Test
    @DisplayName("A inside a listen around the whole trace")
    void listenAroundA() {
      var results = explore(Ltl.somewhere(Modification.A), Traces.trace4());
      assertEquals(List.of("[-1-->1]12", "1[1-->2]2"), logs(results));
      assertEquals(
          List.of(new Listened<Void>(null, "[-1-->1]12"), new Listened<Void>(null, "1[1-->2]2")),
          results.stream().map(Result::value).toList());
    }

    @Test
    @DisplayName("listen sees the modification of its interior")
    void insideListen() {
      var results = explore(Ltl.somewhere(Modification.A), Traces.trace2());
      assertEquals(1, results.size());
      assertEquals(new Listened<Void>(null, "[-1-->1]1"), results.get(0).value());
      assertEquals("[-1-->1]1", results.get(0).context().log());
    }

    @Test
    @DisplayName("modification before and inside listen")
    void aroundListen() {
      var results = explore(Ltl.somewhere(Modification.A), Traces.trace3());
      assertEquals(List.of("[-1-->1]12", "1[1-->2]2"), logs(results));
      assertEquals(
          List.of(new Listened<Void>(null, "2"), new Listened<Void>(null, "[1-->2]2")),
          results.stream().map(Result::value).toList());
    }

    @Test
    @DisplayName("listen around the whole trace")
    void listenAround() {
      var results = explore(Ltl.somewhere(Modification.B), Traces.trace4());
      assertEquals(List.of("-12", "11"), logs(results));
      assertEquals(
          List.of(new Listened<Void>(null, "-12"), new Listened<Void>(null, "11")),
          results.stream().map(Result::value).toList());
    }

    @Test
    @DisplayName("pass rewrites the modified log")
    void insidePass() {
      Program<Void> program = tell("x").then(pass(censored(put(1).then(printState()))));
      var results = explore(Ltl.somewhere(Modification.A), program);
      assertEquals(List.of("x<[-1-->1]1>"), logs(results));
    }
  }

  @Nested
  @DisplayName("everywhere")
  class EverywhereTests {

    @Test
    @DisplayName("B on every put keeps the initial state")
    void everywhereB() {
      Program<Void> program = put(1).then(put(2)).then(put(3)).then(put(4));
      var results = explore(Ltl.everywhere(Modification.B), program);
      assertEquals(1, results.size());
      assertEquals(START, results.get(0).context());
    }

    @Test
    @DisplayName("B on every put of a long sequence yields a single branch")
    void everywhereBLongSequence() {
      int length = 10_000;
      Program<Void> program = Program.pure(null);
      for (int i = 1; i <= length; i++) {
        program = program.then(put(i));
      }
      var results = explore(Ltl.everywhere(Modification.B), program);
      assertEquals(List.of(new Result<TraceContext<Integer>, Void>(null, START)), results);
      var unmodified = new UnmodifiedRunner<>(domain).run(program, START);
      assertEquals(length, unmodified.get(0).context().state());
    }

    @Test
    @DisplayName("A on every put logs every write")
    void everywhereA() {
      Program<Void> program = put(1).then(put(2)).then(put(3));
      var results = explore(Ltl.everywhere(Modification.A), program);
      assertEquals(List.of("[-1-->1][1-->2][2-->3]"), logs(results));
    }

    @Test
    @DisplayName("operations rejecting the modification prune the only branch")
    void everywhereRejected() {
      assertEquals(List.of(), explore(Ltl.everywhere(Modification.B), Traces.trace1()));
    }
  }

  @Nested
  @DisplayName("scope closing")
  class ClosingTests {

    @Test
    @DisplayName("pending next at the end of the scope prunes the branch")
    void pendingNext() {
      Program<Void> program = put(1);
      assertEquals(List.of(), explore(Formula.next(Formula.atom(Modification.A)), program));
    }

    @Test
    @DisplayName("the scope formula does not reach operations after the scope")
    void formulaEndsWithScope() {
      Program<Void> program = Ltl.modify(Ltl.everywhere(Modification.B), put(1)).then(printState());
      var results = interpreter.runDefault(program, START);
      assertEquals(List.of("-1"), logs(results));
    }

    @Test
    @DisplayName("nested scopes with the same modification")
    void nestedScopes() {
      Program<Void> program = Ltl.modify(Ltl.somewhere(Modification.A), put(1).then(put(2)));
      var results = explore(Ltl.somewhere(Modification.A), program);
      assertEquals(List.of("[-1-->1]", "[-1-->1][1-->2]", "[-1-->1][1-->2]", "[1-->2]"), logs(results));
    }
  }
}
