package com.quill.script.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.quill.debug.Debug;
import com.quill.script.parser.Expr.Binary;
import com.quill.script.parser.Expr.BooleanLiteral;
import com.quill.script.parser.Expr.Call;
import com.quill.script.parser.Expr.Identifier;
import com.quill.script.parser.Expr.NumberLiteral;
import com.quill.script.parser.Expr.StringLiteral;
import com.quill.script.parser.Expr.Unary;
import com.quill.script.parser.Statement.Block;
import com.quill.script.parser.Statement.ExprStmt;
import com.quill.script.parser.Statement.FunctionStmt;
import com.quill.script.parser.Statement.Stmt;
import com.quill.script.parser.Statement.While;

/**
 * Recursive-descent parser.
 *
 * Statements end at ';', at a line break, before '}' or at end of input. A line
 * break also ends an expression, so an operator or '(' starting the next line does
 * not continue it; inside parentheses line breaks are ignored.
 * Expression precedence, lowest first:
 * or, and, not, == !=, &lt; &gt; &lt;= &gt;=, + -, * / %, ^ (right-assoc), unary -, primary.
 *
 * The first error aborts parsing; there is no recovery. Nesting of blocks,
 * parentheses and prefix operators is capped at {@link #MAX_NESTING} levels.
 */
public class Parser {
    private static final String TAG = "Parser";

    public static final int MAX_NESTING = 200;

    private final List<Token> tokens;
    private int current = 0;
    private int parenDepth = 0;
    private int nesting = 0;

    public Parser(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty() || tokens.get(tokens.size() - 1).type != TokenType.EOF) {
            throw new IllegalArgumentException("token list must end with EOF");
        }
        this.tokens = tokens;
    }

    public Block parse() {
        List<Stmt> statements = new ArrayList<Stmt>();
        skipSemicolons();
        while (!isAtEnd()) {
            statements.add(statement());
            skipSemicolons();
        }
        Debug.get().t(TAG, "parsed " + statements.size() + " top-level statement(s)");
        return new Block(null, statements);
    }

    private Stmt statement() {
        if (match(TokenType.VAR, TokenType.LET)) return varDeclaration();
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.WHILE)) return whileStatement();
        if (match(TokenType.FOR)) return forStatement();
        if (match(TokenType.FUNCTION)) return functionDeclaration();
        if (match(TokenType.RETURN)) return returnStatement();
        if (check(TokenType.LEFT_BRACE)) return block("block");
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.EQUAL)) return assignment();
        return exprStatement();
    }

    private Stmt varDeclaration() {
        Token keyword = previous();
        Token name = consumeName("variable name after '" + keyword.lexeme + "'");
        Expr.ExprInterface initializer = null;
        if (match(TokenType.EQUAL)) {
            initializer = expression();
        }
        endStatement("variable declaration");
        return new Statement.VarStmt(keyword, name, initializer);
    }

    private Stmt assignment() {
        Token name = advance();
        advance(); // '='
        Expr.ExprInterface value = expression();
        endStatement("assignment");
        return new Statement.AssignStmt(name, value);
    }

    private Stmt ifStatement() {
        Token keyword = previous();
        Expr.ExprInterface condition = expression();
        Block thenBranch = block("if condition");
        Block elseBranch = null;
        if (match(TokenType.ELSE)) {
            if (match(TokenType.IF)) {
                Token elseIf = previous();
                List<Stmt> chained = new ArrayList<>();
                chained.add(ifStatement());
                elseBranch = new Block(elseIf, chained);
            } else {
                elseBranch = block("'else'");
            }
        }
        return new Statement.If(keyword, condition, thenBranch, elseBranch);
    }

    private Stmt whileStatement() {
        Token keyword = previous();
        Expr.ExprInterface condition = expression();
        Block body = block("while condition");
        return new While(keyword, condition, body);
    }

    // for i = <from> to <to> [step <step>] { body }
    private Stmt forStatement() {
        Token keyword = previous();
        Token variable = consumeName("loop variable after 'for'");
        consume(TokenType.EQUAL, "'=' after loop variable");
        Expr.ExprInterface from = expression();
        consume(TokenType.TO, "'to' after loop start value");
        Expr.ExprInterface to = expression();
        Expr.ExprInterface step = null;
        if (match(TokenType.STEP)) {
            step = expression();
        }
        Block body = block("for range");
        return new Statement.ForRange(keyword, variable, from, to, step, body);
    }

    private Stmt functionDeclaration() {
        Token name = consumeName("function name");
        consume(TokenType.LEFT_PAREN, "'(' after function name");

        List<Token> params = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                Token param = consumeName("parameter name");
                if (!seen.add(param.lexeme)) {
                    throw new ParseException(ErrorKind.UNEXPECTED_TOKEN, param,
                            "a parameter name not already used in " + name.lexeme + "()");
                }
                params.add(param);
            } while (match(TokenType.COMMA));
        }

        consume(TokenType.RIGHT_PAREN, "')' after parameters");
        Block body = block("function parameters");
        return new FunctionStmt(name, params, body);
    }

    private Stmt returnStatement() {
        Token keyword = previous();
        Expr.ExprInterface value = null;
        if (!atBoundary()) {
            value = expression();
        }
        endStatement("return");
        return new Statement.ReturnStmt(keyword, value);
    }

    private Block block(String after) {
        Token brace = consume(TokenType.LEFT_BRACE, "'{' after " + after);
        enterNesting(brace);
        try {
            List<Stmt> statements = new ArrayList<Stmt>();
            skipSemicolons();
            while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
                statements.add(statement());
                skipSemicolons();
            }
            consume(TokenType.RIGHT_BRACE, "'}' to close block opened at line " + brace.line);
            return new Block(brace, statements);
        } finally {
            nesting--;
        }
    }

    private Stmt exprStatement() {
        Expr.ExprInterface expr = expression();
        endStatement("expression");
        return new ExprStmt(expr);
    }

    private void endStatement(String what) {
        if (match(TokenType.SEMICOLON)) return;
        if (atBoundary()) return;
        throw new ParseException(ErrorKind.MISSING_TOKEN, peek(), "';' or newline after " + what);
    }

    private boolean atBoundary() {
        return isAtEnd() || check(TokenType.SEMICOLON) || check(TokenType.RIGHT_BRACE) || peek().newlineBefore;
    }

    private void skipSemicolons() {
        while (match(TokenType.SEMICOLON)) {
            // empty statement
        }
    }

    private Expr.ExprInterface expression() {
        enterNesting(peek());
        try {
            return or();
        } finally {
            nesting--;
        }
    }

    private Expr.ExprInterface or() {
        Expr.ExprInterface expr = and();
        while (matchSameLine(TokenType.OR)) {
            Token op = previous();
            Expr.ExprInterface right = and();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface and() {
        Expr.ExprInterface expr = not();
        while (matchSameLine(TokenType.AND)) {
            Token op = previous();
            Expr.ExprInterface right = not();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface not() {
        if (match(TokenType.NOT)) {
            Token op = previous();
            enterNesting(op);
            try {
                return new Unary(op, not());
            } finally {
                nesting--;
            }
        }
        return equality();
    }

    private Expr.ExprInterface equality() {
        Expr.ExprInterface expr = comparison();
        while (matchSameLine(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
            Token op = previous();
            Expr.ExprInterface right = comparison();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface comparison() {
        Expr.ExprInterface expr = term();
        while (matchSameLine(TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
            Token op = previous();
            Expr.ExprInterface right = term();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface term() {
        Expr.ExprInterface expr = factor();
        while (matchSameLine(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Expr.ExprInterface right = factor();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface factor() {
        Expr.ExprInterface expr = power();
        while (matchSameLine(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token op = previous();
            Expr.ExprInterface right = power();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    // Right-associative: 2 ^ 3 ^ 2 == 2 ^ (3 ^ 2)
    private Expr.ExprInterface power() {
        Expr.ExprInterface base = negation();
        if (matchSameLine(TokenType.CARET)) {
            Token op = previous();
            enterNesting(op);
            try {
                return new Binary(base, op, power());
            } finally {
                nesting--;
            }
        }
        return base;
    }

    private Expr.ExprInterface negation() {
        if (match(TokenType.MINUS)) {
            Token op = previous();
            enterNesting(op);
            try {
                return new Unary(op, negation());
            } finally {
                nesting--;
            }
        }
        return primary();
    }

    private Expr.ExprInterface primary() {
        if (match(TokenType.FALSE)) return new BooleanLiteral(previous(), false);
        if (match(TokenType.TRUE)) return new BooleanLiteral(previous(), true);
        if (match(TokenType.NUMBER)) return new NumberLiteral(previous(), (Double) previous().literal);
        if (match(TokenType.STRING)) return new StringLiteral(previous(), (String) previous().literal);

        if (match(TokenType.IDENTIFIER)) {
            Token name = previous();
            if (matchSameLine(TokenType.LEFT_PAREN)) return finishCall(name);
            return new Identifier(name);
        }

        if (match(TokenType.LEFT_PAREN)) {
            parenDepth++;
            try {
                Expr.ExprInterface expr = expression();
                consume(TokenType.RIGHT_PAREN, "')' after expression");
                return expr;
            } finally {
                parenDepth--;
            }
        }

        throw new ParseException(ErrorKind.INVALID_EXPRESSION, peek(), "an expression");
    }

    private Expr.ExprInterface finishCall(Token name) {
        List<Expr.ExprInterface> arguments = new ArrayList<>();
        parenDepth++;
        try {
            if (!check(TokenType.RIGHT_PAREN)) {
                do {
                    arguments.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_PAREN, "')' after arguments to " + name.lexeme + "()");
        } finally {
            parenDepth--;
        }
        return new Call(name, arguments);
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    /** Like {@link #match} but refuses a token that starts a new line outside parentheses. */
    private boolean matchSameLine(TokenType... types) {
        if (parenDepth == 0 && !isAtEnd() && peek().newlineBefore) return false;
        return match(types);
    }

    private void enterNesting(Token at) {
        if (++nesting > MAX_NESTING) {
            throw new ParseException(ErrorKind.INVALID_EXPRESSION, at,
                    "at most " + MAX_NESTING + " levels of nesting");
        }
    }

    private Token consume(TokenType type, String expected) {
        if (check(type)) return advance();
        throw new ParseException(ErrorKind.MISSING_TOKEN, peek(), expected);
    }

    private Token consumeName(String expected) {
        if (check(TokenType.IDENTIFIER)) return advance();
        throw new ParseException(ErrorKind.UNEXPECTED_TOKEN, peek(), expected);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }
}
