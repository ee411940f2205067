package solver.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

final class MainTest {

  @Test
  void solvesWithExplicitAndImplicitCommand() {
    assertEquals(0, Main.run(new String[] {"solve", "--target", "10", "--numbers", "1,2,3,4"}));
    assertEquals(0, Main.run(new String[] {"--target", "10", "--numbers", "1,2,3,4"}));
  }

  @Test
  void nothingFoundIsStillSuccess() {
    assertEquals(0, Main.run(new String[] {"--target", "1000", "--numbers", "1,1"}));
  }

  @Test
  void invalidArgumentsReturnTwo() {
    assertEquals(2, Main.run(new String[] {}));
    assertEquals(2, Main.run(new String[] {"frobnicate"}));
    assertEquals(2, Main.run(new String[] {"--target", "1", "--numbers", "1", "--tolerance", "0"}));
    assertEquals(2, Main.run(new String[] {"--target", "1", "--numbers", "1", "--operators", "^"}));
    assertEquals(2, Main.run(new String[] {"examples", "--json"}));
  }

  @Test
  void examplesRun() {
    assertEquals(0, Main.run(new String[] {"examples"}));
  }
}
