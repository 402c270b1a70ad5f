package com.prettyprinter.printer;

import com.prettyprinter.ast.ChannelDir;
import com.prettyprinter.ast.Expr;
import com.prettyprinter.ast.Field;
import com.prettyprinter.ast.Signature;
import com.prettyprinter.ast.Token;
import com.prettyprinter.config.FormattingConfig;

import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static com.prettyprinter.ast.Nodes.binary;
import static com.prettyprinter.ast.Nodes.block;
import static com.prettyprinter.ast.Nodes.id;
import static com.prettyprinter.ast.Nodes.intLit;
import static com.prettyprinter.ast.Nodes.list;
import static com.prettyprinter.ast.Nodes.stringLit;
import static com.prettyprinter.ast.Nodes.unary;
import static org.assertj.core.api.Assertions.assertThat;

class ExpressionPrinterTest {
    private static final FormattingConfig SPACES = FormattingConfig.builder().useTabs(false).build();

    private static String print(Expr x) {
        return PrettyPrinter.printExpression(x, SPACES);
    }

    static Stream<Arguments> operatorSpacing() {
        return Stream.of(
                Arguments.of("x + y*z", binary(Token.ADD, id("x"), binary(Token.MUL, id("y"), id("z")))),
                Arguments.of("x*y + z", binary(Token.ADD, binary(Token.MUL, id("x"), id("y")), id("z"))),
                Arguments.of("a + b + c", binary(Token.ADD, binary(Token.ADD, id("a"), id("b")), id("c"))),
                Arguments.of("a * b * c", binary(Token.MUL, binary(Token.MUL, id("a"), id("b")), id("c"))),
                Arguments.of("a == b+c", binary(Token.EQL, id("a"), binary(Token.ADD, id("b"), id("c")))),
                Arguments.of("a || b && c", binary(Token.LOR, id("a"), binary(Token.LAND, id("b"), id("c")))),
                Arguments.of("a < b && c > d",
                        binary(Token.LAND, binary(Token.LSS, id("a"), id("b")), binary(Token.GTR, id("c"), id("d")))),
                Arguments.of("i := j*2 + 1",
                        binary(Token.DEFINE, id("i"),
                                binary(Token.ADD, binary(Token.MUL, id("j"), intLit("2")), intLit("1"))))
        );
    }

    @ParameterizedTest
    @MethodSource("operatorSpacing")
    void binary_spacingFollowsPrecedence(String expected, Expr x) {
        assertThat(print(x)).isEqualTo(expected);
    }

    static Stream<Arguments> parenthesization() {
        return Stream.of(
                Arguments.of("(x + y) * z", binary(Token.MUL, binary(Token.ADD, id("x"), id("y")), id("z"))),
                Arguments.of("x * (y + z)", binary(Token.MUL, id("x"), binary(Token.ADD, id("y"), id("z")))),
                Arguments.of("(a || b) && c", binary(Token.LAND, binary(Token.LOR, id("a"), id("b")), id("c"))),
                // equal precedence is never parenthesized
                Arguments.of("a - b - c", binary(Token.SUB, id("a"), binary(Token.SUB, id("b"), id("c")))),
                Arguments.of("(*p).f", new Expr.Selector(0, unary(Token.MUL, id("p")), id("f"))),
                Arguments.of("-a * b", binary(Token.MUL, unary(Token.SUB, id("a")), id("b")))
        );
    }

    @ParameterizedTest
    @MethodSource("parenthesization")
    void binary_parenthesizesOnlyLooserOperands(String expected, Expr x) {
        assertThat(print(x)).isEqualTo(expected);
    }

    @Test
    void group_keepsExplicitParentheses() {
        Expr x = binary(Token.MUL, new Expr.Group(0, binary(Token.ADD, id("x"), id("y"))), id("z"));

        assertThat(print(x)).isEqualTo("(x + y) * z");
    }

    @Test
    void call_printsArgumentList() {
        Expr call = new Expr.Call(0, new Expr.Selector(0, id("fmt"), id("Println")),
                list(stringLit(0, "\"a\""), id("b"), binary(Token.ADD, id("c"), intLit("1"))));

        assertThat(print(call)).isEqualTo("fmt.Println(\"a\", b, c + 1)");
        assertThat(print(new Expr.Call(0, id("f"), null))).isEqualTo("f()");
    }

    @Test
    void index_andTypeGuard() {
        assertThat(print(new Expr.Index(0, id("a"), binary(Token.ADD, id("i"), intLit("1")))))
                .isEqualTo("a[i + 1]");
        assertThat(print(new Expr.TypeGuard(0, id("v"), id("T")))).isEqualTo("v.(T)");
    }

    @Test
    void unary_rangeIsFollowedByBlank() {
        assertThat(print(unary(Token.RANGE, id("list")))).isEqualTo("range list");
        assertThat(print(unary(Token.NOT, id("ok")))).isEqualTo("!ok");
        assertThat(print(unary(Token.ARROW, id("ch")))).isEqualTo("<-ch");
    }

    @Test
    void types_arrayPointerMapAndChannel() {
        assertThat(print(new Expr.ArrayType(0, null, id("int")))).isEqualTo("[]int");
        assertThat(print(new Expr.ArrayType(0, intLit("10"), id("byte")))).isEqualTo("[10]byte");
        assertThat(print(new Expr.ArrayType(0, new Expr.Ellipsis(0), id("int")))).isEqualTo("[...]int");
        assertThat(print(new Expr.PointerType(0, id("T")))).isEqualTo("*T");
        assertThat(print(new Expr.MapType(0, id("string"), id("int")))).isEqualTo("map [string]int");
        assertThat(print(new Expr.ChannelType(0, ChannelDir.BOTH, id("int")))).isEqualTo("chan int");
        assertThat(print(new Expr.ChannelType(0, ChannelDir.RECV, id("int")))).isEqualTo("<-chan int");
        assertThat(print(new Expr.ChannelType(0, ChannelDir.SEND, id("int")))).isEqualTo("chan <- int");
    }

    @Test
    void functionType_signatureForms() {
        Signature noResult = new Signature(List.of(Field.named(id("int"), id("a"), id("b"))), null);
        assertThat(print(new Expr.FunctionType(0, noResult))).isEqualTo("func(a, b int)");

        Signature single = new Signature(
                List.of(Field.named(id("int"), id("a")), Field.named(id("string"), id("s"))),
                List.of(Field.anonymous(id("bool"))));
        assertThat(print(new Expr.FunctionType(0, single))).isEqualTo("func(a int, s string) bool");

        Signature named = new Signature(List.of(), List.of(Field.named(id("error"), id("err"))));
        assertThat(print(new Expr.FunctionType(0, named))).isEqualTo("func() (err error)");

        Signature returnsFunc = new Signature(List.of(),
                List.of(Field.anonymous(new Expr.FunctionType(0, new Signature(List.of(), null)))));
        assertThat(print(new Expr.FunctionType(0, returnsFunc))).isEqualTo("func() (func())");
    }

    @Test
    void functionLit_withEmptyBody() {
        Expr lit = new Expr.FunctionLit(0, new Signature(List.of(), null), block());

        assertThat(print(lit)).isEqualTo("func() {}");
    }

    @Test
    void structType_withoutBody() {
        assertThat(print(new Expr.StructType(0, List.of(), 0))).isEqualTo("struct");
    }

    @Test
    void badExpr_printsPlaceholder() {
        assertThat(print(new Expr.BadExpr(0))).isEqualTo("BadExpr");
    }

    @Test
    void printToken_printsTokenText() {
        assertThat(PrettyPrinter.printToken(Token.AND_NOT_ASSIGN, SPACES)).isEqualTo("&^=");
        assertThat(PrettyPrinter.printToken(Token.FUNC, SPACES)).isEqualTo("func");
    }

    @Test
    void html_escapesOperatorsAndLiterals() {
        FormattingConfig html = SPACES.withHtml(true);

        assertThat(PrettyPrinter.printExpression(binary(Token.LSS, id("a"), id("b")), html))
                .isEqualTo("a &lt; b");
        assertThat(PrettyPrinter.printExpression(stringLit(0, "\"a<b&c\""), html))
                .isEqualTo("\"a&lt;b&amp;c\"");
        assertThat(PrettyPrinter.printToken(Token.LAND, html)).isEqualTo("&amp;&amp;");
    }
}
