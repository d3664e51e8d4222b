package dev.jobaggregator;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertTrue;

class ExitManagerTest {

  @Test
  void testExitInTestEnvironment() {
    ExitManager exitManager = new ExitManager();
    exitManager.exit(0);
    exitManager.exit(2);
    assertTrue(exitManager.isTest());
  }
}
