package org.asma.assembler.frontend;

import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.diagnostics.StatementException;
import org.asma.assembler.symbols.SymbolAttribute;

import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts one operand into tokens.
 */
public class Lexer {

    /** Character constants and C'x' terms are EBCDIC. */
    public static final Charset EBCDIC = Charset.forName("IBM037");

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    /**
     * Creates a new Lexer.
     * @param source The operand text.
     */
    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Performs the tokenization of the operand.
     * @return The tokens, ending with {@link TokenType#END}.
     * @throws StatementException on characters that cannot start a token.
     */
    public List<Token> scanTokens() throws StatementException {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.END, "", null, current));
        return tokens;
    }

    private void scanToken() throws StatementException {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN, null); break;
            case ')': addToken(TokenType.RIGHT_PAREN, null); break;
            case ',': addToken(TokenType.COMMA, null); break;
            case '+': addToken(TokenType.PLUS, null); break;
            case '-': addToken(TokenType.MINUS, null); break;
            case '*': addToken(TokenType.STAR, null); break;
            case '/': addToken(TokenType.SLASH, null); break;
            case ' ', '\t':
                break;
            default:
                if (Character.isDigit(c)) {
                    number();
                } else if (SymbolNames.isSymbolStart(c)) {
                    identifier();
                } else {
                    throw new StatementException(AssemblerErrorCode.SYNTAX_ERROR,
                            "unexpected character '" + c + "' in operand " + source);
                }
                break;
        }
    }

    private void number() throws StatementException {
        while (Character.isDigit(peek())) advance();
        String text = source.substring(start, current);
        try {
            addToken(TokenType.NUMBER, Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw new StatementException(AssemblerErrorCode.VALUE_OUT_OF_RANGE, "number too large: " + text, e);
        }
    }

    private void identifier() throws StatementException {
        if (peek() == '\'' && current - start == 1) {
            if (SymbolNames.isAttributeQuote(source, current)) {
                attribute();
                return;
            }
            selfDefining(Character.toUpperCase(source.charAt(start)));
            return;
        }
        while (SymbolNames.isSymbolPart(peek())) advance();
        addToken(TokenType.IDENTIFIER, null);
    }

    private void attribute() throws StatementException {
        char letter = source.charAt(start);
        advance(); // quote
        int nameStart = current;
        while (SymbolNames.isSymbolPart(peek())) advance();
        SymbolAttribute attribute = SymbolAttribute.fromLetter(letter)
                .orElseThrow(() -> new StatementException(AssemblerErrorCode.SYNTAX_ERROR, "unknown attribute " + letter));
        tokens.add(new Token(TokenType.ATTRIBUTE, source.substring(nameStart, current), attribute, start));
    }

    private void selfDefining(char type) throws StatementException {
        advance(); // opening quote
        StringBuilder body = new StringBuilder();
        while (true) {
            if (isAtEnd()) {
                throw new StatementException(AssemblerErrorCode.SYNTAX_ERROR, "unterminated self-defining term in " + source);
            }
            char c = advance();
            if (c == '\'') {
                if (peek() == '\'') {
                    advance();
                    body.append('\'');
                    continue;
                }
                break;
            }
            body.append(c);
        }
        addToken(TokenType.SELF_DEFINING, selfDefiningValue(type, body.toString()));
    }

    /**
     * Computes the value of a quoted self-defining term.
     *
     * @param type The type letter, X, B or C.
     * @param body The text between the quotes.
     * @return The value.
     * @throws StatementException if the term is malformed or longer than four bytes.
     */
    static long selfDefiningValue(char type, String body) throws StatementException {
        try {
            switch (type) {
                case 'X':
                    checkWidth(body.length() * 4, body);
                    return Long.parseLong(body, 16);
                case 'B':
                    checkWidth(body.length(), body);
                    return Long.parseLong(body, 2);
                case 'C': {
                    byte[] bytes = body.getBytes(EBCDIC);
                    checkWidth(bytes.length * 8, body);
                    long value = 0;
                    for (byte b : bytes) {
                        value = (value << 8) | (b & 0xFF);
                    }
                    return value;
                }
                default:
                    throw new StatementException(AssemblerErrorCode.SYNTAX_ERROR,
                            "unknown self-defining term type " + type);
            }
        } catch (NumberFormatException e) {
            throw new StatementException(AssemblerErrorCode.INVALID_CONSTANT,
                    "invalid " + type + "'" + body + "'", e);
        }
    }

    private static void checkWidth(int bits, String body) throws StatementException {
        if (bits == 0 || bits > 32) {
            throw new StatementException(AssemblerErrorCode.INVALID_CONSTANT,
                    "self-defining term '" + body + "' must have 1 to 4 bytes");
        }
    }

    private char advance() {
        current++;
        return source.charAt(current - 1);
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private void addToken(TokenType type, Object value) {
        tokens.add(new Token(type, source.substring(start, current), value, start));
    }
}
