package com.ltlmod.output;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.ltlmod.example.TraceContext;
import com.ltlmod.example.WriterOperation.Listened;
import com.ltlmod.program.Result;
import java.util.Collection;
import javax.annotation.Nullable;

public final class Formatter {
  private Formatter() {}

  public static String value(@Nullable Object value) {
    if (value == null) {
      return "()";
    }
    if (value instanceof Listened<?> listened) {
      return "(%s, \"%s\")".formatted(value(listened.value()), listened.output());
    }
    return value.toString();
  }

  public static String format(Result<? extends TraceContext<?>, ?> result) {
    TraceContext<?> context = result.context();
    return "%s state=%s log=\"%s\"".formatted(value(result.value()), context.state(), context.log());
  }

  public static JsonObject toJson(Result<? extends TraceContext<?>, ?> result) {
    JsonObject object = new JsonObject();
    object.addProperty("value", value(result.value()));
    object.addProperty("state", String.valueOf(result.context().state()));
    object.addProperty("log", result.context().log());
    return object;
  }

  public static JsonArray toJson(Collection<? extends Result<? extends TraceContext<?>, ?>> results) {
    JsonArray array = new JsonArray(results.size());
    for (Result<? extends TraceContext<?>, ?> result : results) {
      array.add(toJson(result));
    }
    return array;
  }
}
