package com.ltlmod;

import static org.junit.jupiter.api.Assertions.*;

import com.ltlmod.example.Modification;
import com.ltlmod.model.Formula;
import java.util.logging.Handler;
import java.util.logging.Logger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MainTest {

  @Test
  @DisplayName("maps patterns to formulas")
  void patternFormulas() {
    assertEquals(Formula.truth(), Main.formula(Main.Pattern.NONE, Modification.A));
    assertEquals(Formula.somewhere(Modification.B), Main.formula(Main.Pattern.SOMEWHERE, Modification.B));
    assertEquals(Formula.everywhere(Modification.A), Main.formula(Main.Pattern.EVERYWHERE, Modification.A));
  }

  @Test
  @DisplayName("verbose logging prints every record once")
  void verboseLoggingSingleHandler() {
    Logger root = Logger.getLogger("com.ltlmod");
    try {
      Main.configureLogging();
      Main.configureLogging();
      assertFalse(root.getUseParentHandlers());
      assertEquals(1, root.getHandlers().length);
    } finally {
      for (Handler handler : root.getHandlers()) {
        root.removeHandler(handler);
      }
      root.setUseParentHandlers(true);
      root.setLevel(null);
    }
  }
}
