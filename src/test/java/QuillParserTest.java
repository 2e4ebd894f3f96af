import org.junit.jupiter.api.Test;

import com.quill.script.parser.AstPrinter;
import com.quill.script.parser.ErrorKind;
import com.quill.script.parser.Lexer;
import com.quill.script.parser.ParseException;
import com.quill.script.parser.Parser;
import com.quill.script.parser.Statement.Block;

import static org.junit.jupiter.api.Assertions.*;

public class QuillParserTest {

    private static Block parse(String src) {
        return new Parser(new Lexer(src).tokenize()).parse();
    }

    private static String ast(String src) {
        return new AstPrinter().print(parse(src));
    }

    private static ParseException parseError(String src) {
        return assertThrows(ParseException.class, () -> parse(src));
    }

    @Test
    void multiplication_binds_tighter_than_addition() {
        assertEquals("(block (expr (+ 1 (* 2 3))))", ast("1 + 2 * 3"));
        assertEquals("(block (expr (* (+ 1 2) 3)))", ast("(1 + 2) * 3"));
        assertEquals("(block (expr (- (- 10 4) 3)))", ast("10 - 4 - 3"));
    }

    @Test
    void power_is_right_associative_and_below_unary_minus() {
        assertEquals("(block (expr (^ 2 (^ 3 2))))", ast("2 ^ 3 ^ 2"));
        assertEquals("(block (expr (^ (- 2) 2)))", ast("-2 ^ 2"));
        assertEquals("(block (expr (* 2 (^ 3 2))))", ast("2 * 3 ^ 2"));
    }

    @Test
    void logical_and_comparison_precedence() {
        assertEquals("(block (expr (or (and (not a) b) c)))", ast("not a and b or c"));
        assertEquals("(block (expr (== (< a b) true)))", ast("a < b == true"));
        assertEquals("(block (expr (not (== a b))))", ast("not a == b"));
    }

    @Test
    void calls_and_nested_calls() {
        assertEquals("(block (expr (call f 1 (call g 2))))", ast("f(1, g(2))"));
        assertEquals("(block (expr (call pi)))", ast("pi()"));
    }

    @Test
    void declarations_and_assignment() {
        assertEquals("(block (var x))", ast("var x"));
        assertEquals("(block (var x 1) (var y \"s\") (= x (+ x 1)))", ast("var x = 1\nlet y = \"s\"\nx = x + 1"));
    }

    @Test
    void else_if_chain_nests_in_else_block() {
        assertEquals(
                "(block (if x (block (expr (call fd 1))) (block (if y (block (expr (call fd 2))) (block (expr (call fd 3)))))))",
                ast("if x { fd(1) } else if y { fd(2) } else { fd(3) }"));
    }

    @Test
    void loops_and_functions() {
        assertEquals("(block (for i 1 10 2 (block)))", ast("for i = 1 to 10 step 2 { }"));
        assertEquals("(block (while (> n 0) (block (= n (- n 1)))))", ast("while n > 0 {\n  n = n - 1\n}"));
        assertEquals("(block (function sq (n) (block (return (* n n)))))", ast("function sq(n) { return n * n }"));
        assertEquals("(block (function f () (block (return))))", ast("function f() { return }"));
    }

    @Test
    void extra_semicolons_are_empty_statements() {
        assertEquals("(block (expr (call fd 1)))", ast(";;fd(1);;;"));
    }

    @Test
    void formatting_does_not_change_the_tree() {
        String compact = "var a=1;b=a+2;if a<b{fd(a)}";
        String spaced = "var a = 1\n\nb = a + 2   # sum\nif a < b {\n  fd(a)\n}\n";
        assertEquals(ast(compact), ast(spaced));
        assertEquals(ast(spaced), ast(spaced));
    }

    @Test
    void missing_close_paren_at_end_of_input() {
        ParseException e = parseError("fd(1");
        assertEquals(ErrorKind.MISSING_TOKEN, e.kind());
        assertEquals("')' after arguments to fd()", e.expected());
        assertEquals("end of input", e.found());
        assertEquals(1, e.line());
        assertEquals(5, e.column());
    }

    @Test
    void two_statements_on_one_line_need_a_semicolon() {
        ParseException e = parseError("fd(1) rt(2)");
        assertEquals(ErrorKind.MISSING_TOKEN, e.kind());
        assertEquals(7, e.column());
        assertEquals("'rt'", e.found());
        assertTrue(e.expected().contains("newline"));

        assertDoesNotThrow(() -> parse("fd(1); rt(2)"));
    }

    @Test
    void name_expected() {
        ParseException e = parseError("var 5 = 3");
        assertEquals(ErrorKind.UNEXPECTED_TOKEN, e.kind());
        assertEquals(5, e.column());
    }

    @Test
    void expression_expected() {
        ParseException e = parseError("x = * 2");
        assertEquals(ErrorKind.INVALID_EXPRESSION, e.kind());
        assertEquals(5, e.column());
        assertEquals("'*'", e.found());
    }

    @Test
    void block_structure_errors() {
        assertEquals("'{' after if condition", parseError("if x fd(1)").expected());
        assertEquals("'to' after loop start value", parseError("for i = 1 10 { }").expected());

        ParseException unclosed = parseError("{\n  fd(1)\n");
        assertEquals(ErrorKind.MISSING_TOKEN, unclosed.kind());
        assertEquals("'}' to close block opened at line 1", unclosed.expected());
    }

    @Test
    void duplicate_parameter_names() {
        ParseException e = parseError("function f(a, a) { }");
        assertEquals(ErrorKind.UNEXPECTED_TOKEN, e.kind());
        assertEquals(15, e.column());
    }

    @Test
    void error_message_names_kind_and_position() {
        ParseException e = parseError("var x = 1\nvar y = (2");
        assertEquals("MissingToken at 2:11: Expected ')' after expression but found end of input", e.getMessage());
        assertEquals("Parser error at line 2, column 11: Expected ')' after expression but found end of input", e.report());
    }

    @Test
    void line_break_ends_an_expression_outside_parentheses() {
        assertEquals("(block (var x 1) (expr (- 2)) (expr x))", ast("var x = 1\n-2\nx"));
        assertEquals("(block (var pi2 3) (expr pi2) (expr 1))", ast("var pi2 = 3\npi2\n(1)"));
        assertEquals("(block (expr (- 1 2)))", ast("1 \\\n- 2"));
        assertEquals("(block (expr (+ 1 2)))", ast("1 +\n2"));
        assertEquals("(block (expr (call f (+ 1 2))))", ast("f(1\n+ 2)"));
        assertEquals("(block (expr (* (+ 1 2) 3)))", ast("(1\n+ 2) * 3"));
    }

    @Test
    void nesting_is_capped() {
        int n = Parser.MAX_NESTING * 100;
        assertEquals(ErrorKind.INVALID_EXPRESSION, parseError("(".repeat(n) + "1" + ")".repeat(n)).kind());
        assertEquals(ErrorKind.INVALID_EXPRESSION, parseError("-".repeat(n) + "1").kind());
        assertEquals(ErrorKind.INVALID_EXPRESSION, parseError("not ".repeat(n) + "true").kind());
        assertEquals(ErrorKind.INVALID_EXPRESSION, parseError("2 ^ ".repeat(n) + "2").kind());
        assertEquals(ErrorKind.INVALID_EXPRESSION, parseError("if true { ".repeat(n) + "}".repeat(n)).kind());

        assertEquals("(block (expr 1))", ast("(".repeat(50) + "1" + ")".repeat(50)));
    }
}
