package com.ltlmod.output;

import static org.junit.jupiter.api.Assertions.*;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.ltlmod.example.TraceContext;
import com.ltlmod.example.WriterOperation.Listened;
import com.ltlmod.program.Result;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FormatterTest {

  @Test
  @DisplayName("formats unit and listened values")
  void formatsValues() {
    assertEquals("()", Formatter.value(null));
    assertEquals("3", Formatter.value(3));
    assertEquals("((), \"12\")", Formatter.value(new Listened<Void>(null, "12")));
  }

  @Test
  @DisplayName("formats a result with state and log")
  void formatsResult() {
    var result = new Result<TraceContext<Integer>, Void>(null, new TraceContext<>(2, "[1-->2]2"));
    assertEquals("() state=2 log=\"[1-->2]2\"", Formatter.format(result));
  }

  @Test
  @DisplayName("writes results as JSON")
  void writesJson() {
    var first = new Result<TraceContext<Integer>, Void>(null, new TraceContext<>(2, "12"));
    var second = new Result<TraceContext<Integer>, Void>(null, new TraceContext<>(-1, ""));
    JsonArray array = Formatter.toJson(List.of(first, second));
    assertEquals(2, array.size());
    JsonObject object = array.get(0).getAsJsonObject();
    assertEquals("()", object.get("value").getAsString());
    assertEquals("2", object.get("state").getAsString());
    assertEquals("12", object.get("log").getAsString());
    assertEquals("-1", array.get(1).getAsJsonObject().get("state").getAsString());
  }
}
