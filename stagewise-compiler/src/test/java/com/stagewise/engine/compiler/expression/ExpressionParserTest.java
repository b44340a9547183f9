package com.stagewise.engine.compiler.expression;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpressionParserTest {

    private ExpressionParser parser;

    @BeforeEach
    void setUp() {
        parser = new ExpressionParser();
    }

    @Test
    @DisplayName("Should treat blank expression as always visible")
    void shouldParseBlankAsTrue() {
        assertThat(parser.parse(null)).isEqualTo(Literal.TRUE);
        assertThat(parser.parse("   ")).isEqualTo(Literal.TRUE);
        assertThat(parser.parse("FALSE")).isEqualTo(Literal.FALSE);
    }

    @Test
    @DisplayName("Should parse comparison with string literal")
    void shouldParseComparison() {
        Expression expr = parser.parse("participant.gender == 'female'");

        assertThat(expr).isEqualTo(new Comparison(
                PathRef.of("participant.gender"), ComparisonOperator.EQ, new Literal("female")));
    }

    @Test
    @DisplayName("Should prefer two-character operators over their one-character prefixes")
    void shouldParseGreaterOrEqual() {
        Expression expr = parser.parse("participant.age >= 18");

        assertThat(expr).isInstanceOf(Comparison.class);
        Comparison comparison = (Comparison) expr;
        assertThat(comparison.operator()).isEqualTo(ComparisonOperator.GE);
        assertThat(comparison.right()).isEqualTo(new Literal(18L));
    }

    @Test
    @DisplayName("Should parse decimal and negative numbers")
    void shouldParseNumbers() {
        Comparison comparison = (Comparison) parser.parse("scores.total < -2.5");

        assertThat(comparison.right()).isEqualTo(new Literal(-2.5));
    }

    @Test
    @DisplayName("Should bind OR tighter than AND")
    void shouldRespectPrecedence() {
        Expression expr = parser.parse("a.x == 1 OR b.y == 2 AND c.z == 3");

        assertThat(expr).isInstanceOf(Logical.class);
        Logical and = (Logical) expr;
        assertThat(and.kind()).isEqualTo(Logical.Kind.AND);
        assertThat(and.operands()).hasSize(2);
        assertThat(and.operands().get(0)).isInstanceOf(Logical.class);
        assertThat(((Logical) and.operands().get(0)).kind()).isEqualTo(Logical.Kind.OR);
        assertThat(and.operands().get(1)).isEqualTo(new Comparison(
                PathRef.of("c.z"), ComparisonOperator.EQ, new Literal(3L)));
    }

    @Test
    @DisplayName("Should split symbolic AND before symbolic OR")
    void shouldRespectSymbolicPrecedence() {
        Logical and = (Logical) parser.parse("a.x || b.y && c.z");

        assertThat(and.kind()).isEqualTo(Logical.Kind.AND);
        assertThat(and.operands().get(0)).isEqualTo(new Logical(Logical.Kind.OR,
                List.of(new Truthy(PathRef.of("a.x")), new Truthy(PathRef.of("b.y")))));
    }

    @Test
    @DisplayName("Should honour parentheses and symbolic operators")
    void shouldParseParenthesizedGroups() {
        Expression expr = parser.parse("(a.x == 1 || a.x == 2) && NOT b.done");

        Logical and = (Logical) expr;
        assertThat(and.kind()).isEqualTo(Logical.Kind.AND);
        assertThat(and.operands().get(0)).isInstanceOf(Logical.class);
        assertThat(and.operands().get(1)).isEqualTo(new Not(new Truthy(PathRef.of("b.done"))));
    }

    @Test
    @DisplayName("Should parse keywords case-insensitively")
    void shouldParseLowercaseKeywords() {
        Expression expr = parser.parse("a.x == 1 and not b.y");

        assertThat(expr).isInstanceOf(Logical.class);
        assertThat(((Logical) expr).operands().get(1)).isInstanceOf(Not.class);
    }

    @Test
    @DisplayName("Should parse bang prefix but not confuse it with !=")
    void shouldParseBang() {
        assertThat(parser.parse("!consent.agreed")).isEqualTo(new Not(new Truthy(PathRef.of("consent.agreed"))));
        assertThat(parser.parse("a.b != 'x'")).isInstanceOf(Comparison.class);
    }

    @Test
    @DisplayName("Should parse membership with inline list")
    void shouldParseInList() {
        Expression expr = parser.parse("url_params.group in ['A', 'B']");

        assertThat(expr).isEqualTo(new Membership(
                PathRef.of("url_params.group"), MembershipOperator.IN,
                new ListLiteral(List.of(new Literal("A"), new Literal("B")))));
    }

    @Test
    @DisplayName("Should parse not_in and contains")
    void shouldParseOtherMembershipOperators() {
        assertThat(((Membership) parser.parse("participant.country not_in ['US']")).operator())
                .isEqualTo(MembershipOperator.NOT_IN);
        assertThat(((Membership) parser.parse("survey.hobbies contains 'chess'")).operator())
                .isEqualTo(MembershipOperator.CONTAINS);
    }

    @Test
    @DisplayName("Should not split on operators inside quotes")
    void shouldIgnoreOperatorsInQuotes() {
        Expression expr = parser.parse("survey.answer == 'yes AND no'");

        assertThat(expr).isEqualTo(new Comparison(
                PathRef.of("survey.answer"), ComparisonOperator.EQ, new Literal("yes AND no")));
    }

    @Test
    @DisplayName("Should collect every path reference")
    void shouldCollectPaths() {
        Expression expr = parser.parse("consent.agreed == true AND (demo.age > 30 OR participant.vip)");

        assertThat(expr.paths()).extracting(PathRef::raw)
                .containsExactly("consent.agreed", "demo.age", "participant.vip");
    }

    @Test
    @DisplayName("Should reject unbalanced quotes and parentheses")
    void shouldRejectUnbalanced() {
        assertThatThrownBy(() -> parser.parse("a.b == 'x"))
                .isInstanceOf(ExpressionSyntaxException.class)
                .hasMessageContaining("Unbalanced quotes");
        assertThatThrownBy(() -> parser.parse("(a.b == 1"))
                .isInstanceOf(ExpressionSyntaxException.class)
                .hasMessageContaining("Unbalanced parentheses");
    }

    @Test
    @DisplayName("Should reject dangling operators")
    void shouldRejectMissingOperand() {
        assertThatThrownBy(() -> parser.parse("a.b == "))
                .isInstanceOf(ExpressionSyntaxException.class);
        assertThatThrownBy(() -> parser.parse("a.b = 1"))
                .isInstanceOf(ExpressionSyntaxException.class);
    }

    @Test
    @DisplayName("Should turn malformed input into an invalid node in lenient mode")
    void shouldParseLeniently() {
        Expression expr = parser.parseLenient("a.b == 'x");

        assertThat(expr).isInstanceOf(Invalid.class);
        assertThat(((Invalid) expr).source()).isEqualTo("a.b == 'x");
    }
}
