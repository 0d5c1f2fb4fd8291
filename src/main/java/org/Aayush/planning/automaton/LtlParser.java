package org.Aayush.planning.automaton;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Recursive-descent parser for mission formulas.
 * <p>
 * Grammar, loosest binding first:
 * </p>
 * <pre>
 *   iff     := implies ('&lt;-&gt;' implies)*
 *   implies := or ('-&gt;' implies)?
 *   or      := and (('||' | '|') and)*
 *   and     := binary (('&amp;&amp;' | '&amp;') binary)*
 *   binary  := unary (('U' | 'R' | 'V' | 'W') binary)?
 *   unary   := ('!' | '~' | 'X' | 'F' | '&lt;&gt;' | 'G' | '[]') unary | primary
 *   primary := 'true' | 'false' | identifier | '"' quoted '"' | '(' iff ')'
 * </pre>
 * <p>
 * The single letters {@code X F G U R V W} are operators; every other identifier (including
 * other single capitals such as {@code A}) is an atomic proposition. Quote a proposition to
 * use a reserved letter as its name.
 * </p>
 */
public final class LtlParser {
    private static final Set<String> RESERVED = Set.of("X", "F", "G", "U", "R", "V", "W");

    private final List<Token> tokens;
    private int position;

    private enum TokenType {
        IDENT, QUOTED, TRUE, FALSE, LPAREN, RPAREN, NOT, AND, OR, IMPLIES, IFF,
        NEXT, EVENTUALLY, ALWAYS, UNTIL, RELEASE, WEAK_UNTIL, END
    }

    private record Token(TokenType type, String text, int offset) {
    }

    private LtlParser(String input) {
        this.tokens = tokenize(input);
    }

    /**
     * Parses a formula.
     *
     * @param formula formula text.
     * @return syntax tree.
     * @throws FormulaException on lexical or syntax errors.
     */
    public static LtlFormula parse(String formula) {
        Objects.requireNonNull(formula, "formula");
        LtlParser parser = new LtlParser(formula);
        if (parser.peek().type() == TokenType.END) {
            throw new FormulaException(FormulaException.REASON_UNEXPECTED_END, "formula is empty", 0, null);
        }
        LtlFormula result = parser.parseIff();
        Token trailing = parser.peek();
        if (trailing.type() != TokenType.END) {
            throw new FormulaException(
                    FormulaException.REASON_PARSE_ERROR,
                    "unexpected trailing input",
                    trailing.offset(),
                    trailing.text()
            );
        }
        return result;
    }

    private LtlFormula parseIff() {
        LtlFormula left = parseImplies();
        while (accept(TokenType.IFF)) {
            left = LtlFormula.iff(left, parseImplies());
        }
        return left;
    }

    private LtlFormula parseImplies() {
        LtlFormula left = parseOr();
        if (accept(TokenType.IMPLIES)) {
            return LtlFormula.implies(left, parseImplies());
        }
        return left;
    }

    private LtlFormula parseOr() {
        LtlFormula left = parseAnd();
        while (accept(TokenType.OR)) {
            left = LtlFormula.or(left, parseAnd());
        }
        return left;
    }

    private LtlFormula parseAnd() {
        LtlFormula left = parseBinary();
        while (accept(TokenType.AND)) {
            left = LtlFormula.and(left, parseBinary());
        }
        return left;
    }

    private LtlFormula parseBinary() {
        LtlFormula left = parseUnary();
        TokenType type = peek().type();
        if (type == TokenType.UNTIL || type == TokenType.RELEASE || type == TokenType.WEAK_UNTIL) {
            position++;
            LtlFormula right = parseBinary();
            return switch (type) {
                case UNTIL -> LtlFormula.until(left, right);
                case RELEASE -> LtlFormula.release(left, right);
                default -> LtlFormula.weakUntil(left, right);
            };
        }
        return left;
    }

    private LtlFormula parseUnary() {
        Token token = peek();
        switch (token.type()) {
            case NOT -> {
                position++;
                return LtlFormula.not(parseUnary());
            }
            case NEXT -> {
                position++;
                return LtlFormula.next(parseUnary());
            }
            case EVENTUALLY -> {
                position++;
                return LtlFormula.eventually(parseUnary());
            }
            case ALWAYS -> {
                position++;
                return LtlFormula.always(parseUnary());
            }
            default -> {
                return parsePrimary();
            }
        }
    }

    private LtlFormula parsePrimary() {
        Token token = peek();
        switch (token.type()) {
            case TRUE -> {
                position++;
                return LtlFormula.TRUE;
            }
            case FALSE -> {
                position++;
                return LtlFormula.FALSE;
            }
            case IDENT, QUOTED -> {
                position++;
                return LtlFormula.atom(token.text());
            }
            case LPAREN -> {
                position++;
                LtlFormula inner = parseIff();
                Token closing = peek();
                if (closing.type() != TokenType.RPAREN) {
                    throw unexpected(closing, "expected ')'");
                }
                position++;
                return inner;
            }
            default -> throw unexpected(token, "expected a proposition, constant or '('");
        }
    }

    private FormulaException unexpected(Token token, String message) {
        if (token.type() == TokenType.END) {
            return new FormulaException(FormulaException.REASON_UNEXPECTED_END, message, token.offset(), null);
        }
        return new FormulaException(FormulaException.REASON_PARSE_ERROR, message, token.offset(), token.text());
    }

    private boolean accept(TokenType type) {
        if (peek().type() == type) {
            position++;
            return true;
        }
        return false;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private static List<Token> tokenize(String input) {
        List<Token> out = new ArrayList<>();
        int i = 0;
        int n = input.length();
        while (i < n) {
            char c = input.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            int start = i;
            if (Character.isLetter(c) || c == '_') {
                while (i < n && (Character.isLetterOrDigit(input.charAt(i)) || input.charAt(i) == '_')) {
                    i++;
                }
                String word = input.substring(start, i);
                out.add(new Token(wordType(word), word, start));
                continue;
            }
            if (c == '"') {
                int close = input.indexOf('"', i + 1);
                if (close < 0) {
                    throw new FormulaException(
                            FormulaException.REASON_UNEXPECTED_END,
                            "unterminated quoted proposition",
                            start,
                            input.substring(start)
                    );
                }
                String name = input.substring(i + 1, close);
                if (name.isBlank()) {
                    throw new FormulaException(FormulaException.REASON_PARSE_ERROR, "empty quoted proposition", start, "\"\"");
                }
                out.add(new Token(TokenType.QUOTED, name, start));
                i = close + 1;
                continue;
            }
            TokenType symbol;
            int length;
            if (input.startsWith("<->", i)) {
                symbol = TokenType.IFF;
                length = 3;
            } else if (input.startsWith("->", i)) {
                symbol = TokenType.IMPLIES;
                length = 2;
            } else if (input.startsWith("<>", i)) {
                symbol = TokenType.EVENTUALLY;
                length = 2;
            } else if (input.startsWith("[]", i)) {
                symbol = TokenType.ALWAYS;
                length = 2;
            } else if (input.startsWith("&&", i)) {
                symbol = TokenType.AND;
                length = 2;
            } else if (input.startsWith("||", i)) {
                symbol = TokenType.OR;
                length = 2;
            } else {
                length = 1;
                symbol = switch (c) {
                    case '!', '~' -> TokenType.NOT;
                    case '&' -> TokenType.AND;
                    case '|' -> TokenType.OR;
                    case '(' -> TokenType.LPAREN;
                    case ')' -> TokenType.RPAREN;
                    default -> throw new FormulaException(
                            FormulaException.REASON_PARSE_ERROR,
                            "unexpected character",
                            start,
                            String.valueOf(c)
                    );
                };
            }
            out.add(new Token(symbol, input.substring(start, start + length), start));
            i += length;
        }
        out.add(new Token(TokenType.END, "", n));
        return out;
    }

    private static TokenType wordType(String word) {
        if (RESERVED.contains(word)) {
            return switch (word) {
                case "X" -> TokenType.NEXT;
                case "F" -> TokenType.EVENTUALLY;
                case "G" -> TokenType.ALWAYS;
                case "U" -> TokenType.UNTIL;
                case "R", "V" -> TokenType.RELEASE;
                default -> TokenType.WEAK_UNTIL;
            };
        }
        if (word.equals("true")) {
            return TokenType.TRUE;
        }
        if (word.equals("false")) {
            return TokenType.FALSE;
        }
        return TokenType.IDENT;
    }
}
