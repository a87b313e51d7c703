package com.gentoro.reformat;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.reformat.exception.ConfigurationException;
import java.util.List;
import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void parsesOptionsSwitchesAndFiles() {
    StartupParameters params =
        new StartupParameters(
            new String[] {"a.jpg", "--format", "png", "--flip-h", "--width=800", "b.png"});

    assertEquals(List.of("a.jpg", "b.png"), params.positional());
    assertEquals("png", params.getParameter("format", String.class));
    assertTrue(params.has("flip-h"));
    assertEquals(Boolean.TRUE, params.getParameter("flip-h", Boolean.class));
    assertEquals(800, params.getParameter("width", Integer.class));
    assertNull(params.getParameter("height", Integer.class));
    assertEquals(85, params.getParameter("quality-jpg", Integer.class, 85));
    assertNull(params.configFile());
  }

  @Test
  void rejectsBadValues() {
    StartupParameters params = new StartupParameters(new String[] {"--width", "wide"});
    assertThrows(ConfigurationException.class, () -> params.getParameter("width", Integer.class));
    assertThrows(
        ConfigurationException.class, () -> new StartupParameters(new String[] {"--format"}));
  }

  @Test
  void toleratesNullArguments() {
    assertTrue(new StartupParameters(null).positional().isEmpty());
  }
}
