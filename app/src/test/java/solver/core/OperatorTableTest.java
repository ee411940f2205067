package solver.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

final class OperatorTableTest {

  @Test
  void standardTableKeepsDeclarationOrder() {
    OperatorTable table = Operators.standard();
    assertEquals(List.of("+", "-", "*", "/"), table.symbols(), "Symbols in declaration order");
    assertEquals(4, table.size());
    assertTrue(table.get("*").associative(), "Multiplication is associative");
    assertFalse(table.get("/").associative(), "Division is not associative");
    assertTrue(
        table.get("*").precedence() > table.get("+").precedence(),
        "Multiplication binds tighter than addition");
  }

  @Test
  void divisionByZeroIsADomainFailure() {
    assertTrue(Operators.DIVIDE.apply(1, 0).isEmpty(), "1 / 0 has no value");
    assertTrue(Operators.MODULO.apply(5, 0).isEmpty(), "5 % 0 has no value");
    assertEquals(2.5, Operators.DIVIDE.apply(5, 2).getAsDouble(), 0.0);
    assertEquals(-3.0, Operators.SUBTRACT.apply(1, 4).getAsDouble(), 0.0);
  }

  @Test
  void rejectsDuplicateSymbols() {
    OperatorTable.Builder builder =
        OperatorTable.builder().add(Operators.ADD).add(Operators.ADD);
    assertThrows(IllegalArgumentException.class, builder::build);
  }

  @Test
  void rejectsEmptyTable() {
    assertThrows(IllegalArgumentException.class, () -> OperatorTable.builder().build());
  }

  @Test
  void rejectsSymbolsThatWouldBreakRendering() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new Operator("(", BinaryOperation.total(Double::sum), 1, true));
    assertThrows(
        IllegalArgumentException.class,
        () -> new Operator("a b", BinaryOperation.total(Double::sum), 1, true));
    assertThrows(
        IllegalArgumentException.class,
        () -> new Operator(" ", BinaryOperation.total(Double::sum), 1, true));
  }

  @Test
  void unknownSymbolLookupFailsLoudly() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Operators.standard().get("^"));
    assertTrue(ex.getMessage().contains("^"), "Message should name the unknown symbol");
  }

  @Test
  void selectsCatalogueOperatorsBySymbol() {
    OperatorTable table = Operators.bySymbols(List.of("*", " + ", "%"));
    assertEquals(List.of("*", "+", "%"), table.symbols(), "Requested order is preserved");
    assertThrows(IllegalArgumentException.class, () -> Operators.bySymbols(List.of("**")));
  }

  @Test
  void customOperatorsCanBeRegistered() {
    OperatorTable table =
        OperatorTable.builder()
            .add(Operators.ADD)
            .add("max", BinaryOperation.total(Math::max), 1, true)
            .build();
    assertTrue(table.contains("max"));
    assertEquals(7.0, table.get("max").apply(3, 7).getAsDouble(), 0.0);

    OperatorTable fromList = OperatorTable.of(List.of(Operators.MULTIPLY, Operators.ADD));
    assertEquals(List.of("*", "+"), fromList.symbols());
  }
}
