package com.gentoro.endnotemcp.store;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ReferenceTest {

  private static Reference withFile(String filepath) {
    return new Reference(1, "Title", null, "2020", null, null, null, filepath);
  }

  @Test
  void blankFilepathMeansNoDocument() {
    assertFalse(withFile(null).hasDocument());
    assertFalse(withFile("").hasDocument());
    assertFalse(withFile("  \t").hasDocument());
    assertTrue(withFile("internal-pdf://0042/a.pdf").hasDocument());
  }
}
