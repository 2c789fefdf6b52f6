package com.eqtree.parse;

import com.eqtree.expr.ExpressionNode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigDecimal;

/**
 * Recursive-descent parser for one normalized operand. Precedence from lowest to highest:
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/') unary)*
 * unary      := ('-' | '+') unary | power
 * power      := atom ('**' unary)?          right-associative
 * atom       := number | identifier | identifier '(' expression (',' expression)* ')' | '(' expression ')'
 * </pre>
 * {@code a - b} is built as {@code Sum(a, Product(-1, b))}. The tree is not canonicalized here.
 */
public class ExpressionParser {

    enum TokenType { NUMBER, IDENTIFIER, PLUS, MINUS, STAR, SLASH, POWER, LPAREN, RPAREN, COMMA, END }

    record Token(TokenType type, String text, int position) {}

    public ExpressionNode parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ExpressionParseException("Empty operand");
        }
        Cursor cursor = new Cursor(tokenize(text));
        ExpressionNode node = expression(cursor);
        Token trailing = cursor.peek();
        if (trailing.type() != TokenType.END) {
            throw unexpected(trailing);
        }
        return node;
    }

    private ExpressionNode expression(Cursor cursor) {
        MutableList<ExpressionNode> terms = Lists.mutable.with(term(cursor));
        while (cursor.peek().type() == TokenType.PLUS || cursor.peek().type() == TokenType.MINUS) {
            boolean subtract = cursor.next().type() == TokenType.MINUS;
            ExpressionNode right = term(cursor);
            terms.add(subtract ? ExpressionNode.Product.negate(right) : right);
        }
        return terms.size() == 1 ? terms.getFirst() : new ExpressionNode.Sum(terms.toImmutable());
    }

    private ExpressionNode term(Cursor cursor) {
        ExpressionNode left = unary(cursor);
        while (cursor.peek().type() == TokenType.STAR || cursor.peek().type() == TokenType.SLASH) {
            boolean divide = cursor.next().type() == TokenType.SLASH;
            ExpressionNode right = unary(cursor);
            left = divide ? new ExpressionNode.Quotient(left, right) : ExpressionNode.Product.of(left, right);
        }
        return left;
    }

    private ExpressionNode unary(Cursor cursor) {
        TokenType type = cursor.peek().type();
        if (type == TokenType.PLUS) {
            cursor.next();
            return unary(cursor);
        }
        if (type == TokenType.MINUS) {
            cursor.next();
            ExpressionNode operand = unary(cursor);
            if (operand instanceof ExpressionNode.Constant c) {
                return c.negate();
            }
            return ExpressionNode.Product.negate(operand);
        }
        return power(cursor);
    }

    private ExpressionNode power(Cursor cursor) {
        ExpressionNode base = atom(cursor);
        if (cursor.peek().type() == TokenType.POWER) {
            cursor.next();
            return new ExpressionNode.Power(base, unary(cursor));
        }
        return base;
    }

    private ExpressionNode atom(Cursor cursor) {
        Token token = cursor.next();
        switch (token.type()) {
            case NUMBER:
                return new ExpressionNode.Constant(new BigDecimal(token.text()));
            case IDENTIFIER:
                if (cursor.peek().type() == TokenType.LPAREN) {
                    cursor.next();
                    return call(token, arguments(cursor));
                }
                return new ExpressionNode.Variable(token.text());
            case LPAREN:
                ExpressionNode inner = expression(cursor);
                expect(cursor, TokenType.RPAREN);
                return inner;
            case END:
                throw new ExpressionParseException("Unexpected end of expression", token.position());
            default:
                throw unexpected(token);
        }
    }

    private ImmutableList<ExpressionNode> arguments(Cursor cursor) {
        MutableList<ExpressionNode> arguments = Lists.mutable.with(expression(cursor));
        while (cursor.peek().type() == TokenType.COMMA) {
            cursor.next();
            arguments.add(expression(cursor));
        }
        expect(cursor, TokenType.RPAREN);
        return arguments.toImmutable();
    }

    private static ExpressionNode call(Token name, ImmutableList<ExpressionNode> arguments) {
        switch (name.text()) {
            case Normalizer.ABSOLUTE_VALUE, "Abs", "abs":
                requireArity(name, arguments, 1);
                return new ExpressionNode.AbsoluteValue(arguments.getFirst());
            case "sqrt":
                requireArity(name, arguments, 1);
                return new ExpressionNode.Power(arguments.getFirst(), ExpressionNode.Constant.of("0.5"));
            case "ln":
                requireArity(name, arguments, 1);
                return new ExpressionNode.FunctionCall("log", arguments);
            default:
                return new ExpressionNode.FunctionCall(name.text(), arguments);
        }
    }

    private static void requireArity(Token name, ImmutableList<ExpressionNode> arguments, int expected) {
        if (arguments.size() != expected) {
            throw new ExpressionParseException(name.text() + "() takes " + expected + " argument(s), got "
                    + arguments.size(), name.position());
        }
    }

    private static void expect(Cursor cursor, TokenType type) {
        Token token = cursor.next();
        if (token.type() != type) {
            if (token.type() == TokenType.END) {
                throw new ExpressionParseException("Unbalanced parentheses: missing " + type, token.position());
            }
            throw unexpected(token);
        }
    }

    private static ExpressionParseException unexpected(Token token) {
        return new ExpressionParseException("Unexpected token '" + token.text() + "'", token.position());
    }

    static MutableList<Token> tokenize(String text) {
        MutableList<Token> tokens = Lists.mutable.empty();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c) || (c == '.' && i + 1 < text.length() && Character.isDigit(text.charAt(i + 1)))) {
                int start = i;
                while (i < text.length() && Character.isDigit(text.charAt(i))) {
                    i++;
                }
                if (i < text.length() && text.charAt(i) == '.') {
                    i++;
                    while (i < text.length() && Character.isDigit(text.charAt(i))) {
                        i++;
                    }
                }
                tokens.add(new Token(TokenType.NUMBER, text.substring(start, i), start));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
                    i++;
                }
                tokens.add(new Token(TokenType.IDENTIFIER, text.substring(start, i), start));
            } else if (c == '*' && i + 1 < text.length() && text.charAt(i + 1) == '*') {
                tokens.add(new Token(TokenType.POWER, "**", i));
                i += 2;
            } else {
                TokenType type = switch (c) {
                    case '+' -> TokenType.PLUS;
                    case '-' -> TokenType.MINUS;
                    case '*' -> TokenType.STAR;
                    case '/' -> TokenType.SLASH;
                    case '(' -> TokenType.LPAREN;
                    case ')' -> TokenType.RPAREN;
                    case ',' -> TokenType.COMMA;
                    default -> throw new ExpressionParseException("Unexpected character '" + c + "'", i);
                };
                tokens.add(new Token(type, String.valueOf(c), i));
                i++;
            }
        }
        tokens.add(new Token(TokenType.END, "", text.length()));
        return tokens;
    }

    private static final class Cursor {
        private final MutableList<Token> tokens;
        private int index;

        Cursor(MutableList<Token> tokens) {
            this.tokens = tokens;
        }

        Token peek() {
            return tokens.get(index);
        }

        Token next() {
            Token token = tokens.get(index);
            if (token.type() != TokenType.END) {
                index++;
            }
            return token;
        }
    }
}
