package dtj;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class FilterExpressionTest {

  private static FilterExpression parse(String text) throws TemplateSyntaxException {
    return FilterExpression.parse(text, Token.Pos.internal());
  }

  @Test
  public void variableWithFilters() throws TemplateSyntaxException {
    FilterExpression expression = parse(" user.name|default:\"x\" | upper ");

    assertThat(expression.source()).isEqualTo("user.name|default:\"x\" | upper");
    assertThat(expression.base().isVariable()).isTrue();
    assertThat(expression.base().value()).isEqualTo("user.name");
    assertThat(expression.filters()).hasSize(2);

    FilterExpression.Filter first = expression.filters().get(0);
    assertThat(first.name()).isEqualTo("default");
    assertThat(first.arg().get().type()).isEqualTo(FilterExpression.Operand.Type.STRING);
    assertThat(first.arg().get().value()).isEqualTo("x");
    assertThat(expression.filters().get(1).name()).isEqualTo("upper");
    assertThat(expression.filters().get(1).arg()).isEmpty();
  }

  @Test
  public void variableArgument() throws TemplateSyntaxException {
    FilterExpression.Operand arg = parse("items|join:separator").filters().get(0).arg().get();

    assertThat(arg.isVariable()).isTrue();
    assertThat(arg.value()).isEqualTo("separator");
  }

  @Test
  public void stringBase() throws TemplateSyntaxException {
    FilterExpression.Operand base = parse("'it\\'s'").base();

    assertThat(base.type()).isEqualTo(FilterExpression.Operand.Type.STRING);
    assertThat(base.source()).isEqualTo("'it\\'s'");
    assertThat(base.value()).isEqualTo("it's");
    assertThat(base.translated()).isFalse();
  }

  @Test
  public void translatedString() throws TemplateSyntaxException {
    FilterExpression.Operand base = parse("_(\"Hello\")").base();

    assertThat(base.translated()).isTrue();
    assertThat(base.value()).isEqualTo("Hello");
  }

  @Test
  public void numbers() throws TemplateSyntaxException {
    assertThat(parse("42").base().type()).isEqualTo(FilterExpression.Operand.Type.NUMBER);
    assertThat(parse("-1.5").base().type()).isEqualTo(FilterExpression.Operand.Type.NUMBER);
    assertThat(parse("x|add:2").filters().get(0).arg().get().type())
        .isEqualTo(FilterExpression.Operand.Type.NUMBER);
  }

  @Test
  public void emptyExpression() {
    assertThrows(TemplateSyntaxException.class, () -> parse("  "));
  }

  @Test
  public void danglingPipe() {
    TemplateSyntaxException ex = assertThrows(TemplateSyntaxException.class, () -> parse("x|"));

    assertThat(ex.errorMsg()).contains("could not parse the remainder");
  }

  @Test
  public void spaceSeparatedWords() {
    assertThrows(TemplateSyntaxException.class, () -> parse("x y"));
  }

  @Test
  public void underscoreAttributes() {
    assertThrows(TemplateSyntaxException.class, () -> parse("_private"));
    assertThrows(TemplateSyntaxException.class, () -> parse("user._meta"));
  }

  @Test
  public void garbageBeforeFilter() {
    TemplateSyntaxException ex =
        assertThrows(TemplateSyntaxException.class, () -> parse("x!|upper"));

    assertThat(ex.errorMsg()).contains("could not parse some characters");
  }
}
