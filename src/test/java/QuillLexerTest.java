import org.junit.jupiter.api.Test;

import com.quill.script.parser.ErrorKind;
import com.quill.script.parser.LexException;
import com.quill.script.parser.Lexer;
import com.quill.script.parser.Token;
import com.quill.script.parser.TokenType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class QuillLexerTest {

    private static List<Token> lex(String src) {
        return new Lexer(src).tokenize();
    }

    private static List<TokenType> types(List<Token> tokens) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : tokens) out.add(t.type);
        return out;
    }

    private static LexException lexError(String src) {
        return assertThrows(LexException.class, () -> new Lexer(src).tokenize());
    }

    @Test
    void declaration_tokens_and_literals() {
        List<Token> t = lex("var x = 3.25 + .5");

        assertEquals(Arrays.asList(TokenType.VAR, TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.NUMBER,
                TokenType.PLUS, TokenType.NUMBER, TokenType.EOF), types(t));
        assertEquals(3.25, ((Double) t.get(3).literal).doubleValue(), 1e-12);
        assertEquals(0.5, ((Double) t.get(5).literal).doubleValue(), 1e-12);
        assertEquals(TokenType.Kind.KEYWORD, t.get(0).kind());
        assertEquals(TokenType.Kind.IDENTIFIER, t.get(1).kind());
        assertEquals(TokenType.Kind.OPERATOR, t.get(2).kind());
        assertEquals(TokenType.Kind.NUMBER, t.get(3).kind());
        assertEquals(TokenType.Kind.EOF, t.get(6).kind());
    }

    @Test
    void operators_longest_match() {
        List<Token> t = lex("a <= b >= c == d != e < f > g ^ h % i");
        assertEquals(TokenType.LESS_EQUAL, t.get(1).type);
        assertEquals(TokenType.GREATER_EQUAL, t.get(3).type);
        assertEquals(TokenType.EQUAL_EQUAL, t.get(5).type);
        assertEquals(TokenType.BANG_EQUAL, t.get(7).type);
        assertEquals(TokenType.LESS, t.get(9).type);
        assertEquals(TokenType.GREATER, t.get(11).type);
        assertEquals(TokenType.CARET, t.get(13).type);
        assertEquals(TokenType.PERCENT, t.get(15).type);
    }

    @Test
    void keywords_are_case_sensitive_and_booleans_carry_values() {
        List<Token> t = lex("true False while While");
        assertEquals(TokenType.TRUE, t.get(0).type);
        assertEquals(Boolean.TRUE, t.get(0).literal);
        assertEquals(TokenType.IDENTIFIER, t.get(1).type);
        assertEquals(TokenType.WHILE, t.get(2).type);
        assertEquals(TokenType.IDENTIFIER, t.get(3).type);
    }

    @Test
    void positions_and_line_breaks() {
        List<Token> t = lex("fd(10)\n  rt(90)");

        Token rt = t.get(4);
        assertEquals("rt", rt.lexeme);
        assertEquals(2, rt.line);
        assertEquals(3, rt.column);
        assertTrue(rt.newlineBefore);
        assertFalse(t.get(1).newlineBefore);
        assertEquals(1, t.get(0).column);
        assertEquals(4, t.get(2).column);
    }

    @Test
    void comments_run_to_end_of_line() {
        List<Token> t = lex("fd(1) # go up\n# whole line\nrt(2)");

        assertEquals(Arrays.asList(TokenType.IDENTIFIER, TokenType.LEFT_PAREN, TokenType.NUMBER,
                TokenType.RIGHT_PAREN, TokenType.IDENTIFIER, TokenType.LEFT_PAREN, TokenType.NUMBER,
                TokenType.RIGHT_PAREN, TokenType.EOF), types(t));
        assertEquals(3, t.get(4).line);
        assertTrue(t.get(4).newlineBefore);
    }

    @Test
    void backslash_joins_lines_but_keeps_line_numbers() {
        List<Token> t = lex("forward(1 + \\\n  2)\nx");

        Token two = t.get(4);
        assertEquals("2", two.lexeme);
        assertEquals(2, two.line);
        assertFalse(two.newlineBefore);

        Token x = t.get(6);
        assertEquals("x", x.lexeme);
        assertEquals(3, x.line);
        assertTrue(x.newlineBefore);
    }

    @Test
    void string_escapes() {
        List<Token> t = lex("color(\"a\\tb\\\"c\\\\\")");
        Token s = t.get(2);
        assertEquals(TokenType.STRING, s.type);
        assertEquals("a\tb\"c\\", s.literal);
    }

    @Test
    void unterminated_string_reports_opening_quote() {
        LexException e = lexError("x = \"abc\nfoo");
        assertEquals(ErrorKind.UNTERMINATED_STRING, e.kind());
        assertEquals(1, e.line());
        assertEquals(5, e.column());

        LexException atEnd = lexError("  \"abc");
        assertEquals(ErrorKind.UNTERMINATED_STRING, atEnd.kind());
        assertEquals(3, atEnd.column());
    }

    @Test
    void malformed_numbers_report_number_start() {
        for (String src : new String[] { "x = 3.", "x = 1.2.3", "x = 12abc", "x = .5.3" }) {
            LexException e = lexError(src);
            assertEquals(ErrorKind.MALFORMED_NUMBER, e.kind(), src);
            assertEquals(1, e.line(), src);
            assertEquals(5, e.column(), src);
        }
    }

    @Test
    void invalid_characters() {
        LexException e = lexError("fd(1) @");
        assertEquals(ErrorKind.INVALID_CHARACTER, e.kind());
        assertEquals(7, e.column());
        assertTrue(e.getMessage().startsWith("InvalidCharacter at 1:7"), e.getMessage());
        assertTrue(e.detail().contains("@"));

        assertEquals(ErrorKind.INVALID_CHARACTER, lexError("!done").kind());
        assertEquals(ErrorKind.INVALID_CHARACTER, lexError("fd(1) \\ fd(2)").kind());
    }

    @Test
    void empty_input_is_just_eof() {
        List<Token> t = lex("");
        assertEquals(1, t.size());
        assertEquals(TokenType.EOF, t.get(0).type);
        assertEquals("", t.get(0).lexeme);
    }

    @Test
    void same_input_same_tokens() {
        String src = "function sq(n) { return n * n }\nsq(4)";
        List<Token> a = lex(src);
        List<Token> b = lex(src);
        assertEquals(a.size(), b.size());
        for (int i = 0; i < a.size(); i++) {
            assertEquals(a.get(i).toString(), b.get(i).toString());
        }
    }
}
