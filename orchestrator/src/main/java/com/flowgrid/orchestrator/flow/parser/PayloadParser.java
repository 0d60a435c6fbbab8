package com.flowgrid.orchestrator.flow.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BigIntegerNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Recursive-descent parser for the structured literals that appear inside
 * FLOW step bodies, e.g.
 * <pre>
 *   RUN AGENT "planner" WITH { goal: "ship it", limits: [1, 2.5], dryRun: false }
 *   APX_EXEC "billing.charge" WITH amount = 42, currency = "EUR"
 * </pre>
 *
 * Values come back as Jackson trees so they can be resolved, stored as job
 * params and compared without a second representation:
 * <ul>
 *   <li>strings and bare identifiers → {@link TextNode}</li>
 *   <li>integers → Int/Long/BigInteger node by magnitude, decimals → {@link DecimalNode}</li>
 *   <li>{@code true}/{@code false}/{@code null} → Boolean/Null node</li>
 *   <li>{@code { k: v }} and top-level {@code k = v, ...} → {@link ObjectNode}</li>
 * </ul>
 *
 * Pure and deterministic: the same text always yields an equal tree.
 */
public final class PayloadParser {

    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);

    private PayloadParser() {}

    /**
     * Parse a payload literal. Blank input yields an empty object.
     *
     * @throws PayloadParseException on any syntax error, including
     *                               unterminated objects, arrays and strings
     */
    public static JsonNode parse(String source) {
        Tokenizer tokens = new Tokenizer(source == null ? "" : source);
        Token first = tokens.peek();
        if (first.type() == TokenType.EOF) {
            return NODES.objectNode();
        }
        JsonNode value = first.type() == TokenType.IDENTIFIER && tokens.peekSecond().type() == TokenType.EQUALS
                ? parseAssignments(tokens)
                : parseValue(tokens);
        Token trailing = tokens.next();
        if (trailing.type() != TokenType.EOF) {
            throw new PayloadParseException("Unexpected " + trailing.describe() + " after literal", trailing.offset());
        }
        return value;
    }

    private static ObjectNode parseAssignments(Tokenizer tokens) {
        ObjectNode result = NODES.objectNode();
        while (true) {
            Token key = tokens.next();
            if (key.type() != TokenType.IDENTIFIER && key.type() != TokenType.STRING) {
                throw new PayloadParseException("Expected assignment key, found " + key.describe(), key.offset());
            }
            tokens.expect(TokenType.EQUALS);
            result.set(key.text(), parseValue(tokens));
            if (tokens.peek().type() != TokenType.COMMA) {
                return result;
            }
            tokens.next();
            if (tokens.peek().type() == TokenType.EOF) {
                return result;   // trailing comma
            }
        }
    }

    private static JsonNode parseValue(Tokenizer tokens) {
        Token token = tokens.next();
        return switch (token.type()) {
            case STRING, IDENTIFIER -> TextNode.valueOf(token.text());
            case NUMBER -> numberNode(token.text());
            case TRUE -> BooleanNode.TRUE;
            case FALSE -> BooleanNode.FALSE;
            case NULL -> NullNode.getInstance();
            case BRACE_OPEN -> parseObject(tokens, token.offset());
            case BRACKET_OPEN -> parseArray(tokens, token.offset());
            case EOF -> throw new PayloadParseException("Unexpected end of payload", token.offset());
            default -> throw new PayloadParseException("Unexpected " + token.describe(), token.offset());
        };
    }

    private static ObjectNode parseObject(Tokenizer tokens, int openedAt) {
        ObjectNode result = NODES.objectNode();
        if (tokens.peek().type() == TokenType.BRACE_CLOSE) {
            tokens.next();
            return result;
        }
        while (true) {
            Token key = tokens.next();
            if (key.type() == TokenType.EOF) {
                throw new PayloadParseException("Unterminated object literal", openedAt);
            }
            if (key.type() != TokenType.IDENTIFIER && key.type() != TokenType.STRING) {
                throw new PayloadParseException(
                        "Object keys must be identifiers or string literals, found " + key.describe(), key.offset());
            }
            tokens.expect(TokenType.COLON);
            if (tokens.peek().type() == TokenType.EOF) {
                throw new PayloadParseException("Unterminated object literal", openedAt);
            }
            result.set(key.text(), parseValue(tokens));

            Token delimiter = tokens.next();
            switch (delimiter.type()) {
                case COMMA -> {
                    if (tokens.peek().type() == TokenType.BRACE_CLOSE) {
                        tokens.next();
                        return result;
                    }
                }
                case BRACE_CLOSE -> {
                    return result;
                }
                case EOF -> throw new PayloadParseException("Unterminated object literal", openedAt);
                default -> throw new PayloadParseException(
                        "Expected ',' or '}' in object, found " + delimiter.describe(), delimiter.offset());
            }
        }
    }

    private static ArrayNode parseArray(Tokenizer tokens, int openedAt) {
        ArrayNode result = NODES.arrayNode();
        if (tokens.peek().type() == TokenType.BRACKET_CLOSE) {
            tokens.next();
            return result;
        }
        while (true) {
            if (tokens.peek().type() == TokenType.EOF) {
                throw new PayloadParseException("Unterminated array literal", openedAt);
            }
            result.add(parseValue(tokens));

            Token delimiter = tokens.next();
            switch (delimiter.type()) {
                case COMMA -> {
                    if (tokens.peek().type() == TokenType.BRACKET_CLOSE) {
                        tokens.next();
                        return result;
                    }
                }
                case BRACKET_CLOSE -> {
                    return result;
                }
                case EOF -> throw new PayloadParseException("Unterminated array literal", openedAt);
                default -> throw new PayloadParseException(
                        "Expected ',' or ']' in array, found " + delimiter.describe(), delimiter.offset());
            }
        }
    }

    private static JsonNode numberNode(String raw) {
        if (raw.indexOf('.') >= 0) {
            return DecimalNode.valueOf(new BigDecimal(raw));
        }
        BigInteger value = new BigInteger(raw);
        if (value.bitLength() < 32) return IntNode.valueOf(value.intValue());
        if (value.bitLength() < 64) return LongNode.valueOf(value.longValue());
        return BigIntegerNode.valueOf(value);
    }

    // ------------------------------------------------------------------
    // Lexer
    // ------------------------------------------------------------------

    private enum TokenType {
        BRACE_OPEN, BRACE_CLOSE, BRACKET_OPEN, BRACKET_CLOSE, COLON, COMMA, EQUALS,
        STRING, NUMBER, IDENTIFIER, TRUE, FALSE, NULL, EOF
    }

    private record Token(TokenType type, String text, int offset) {
        String describe() {
            return switch (type) {
                case EOF -> "end of payload";
                case STRING -> "string \"" + text + "\"";
                case IDENTIFIER, NUMBER -> "'" + text + "'";
                default -> type.name().toLowerCase().replace('_', ' ');
            };
        }
    }

    private static final class Tokenizer {

        private final String source;
        private int index;

        Tokenizer(String source) {
            this.source = source;
        }

        Token peek() {
            int saved = index;
            Token token = next();
            index = saved;
            return token;
        }

        Token peekSecond() {
            int saved = index;
            next();
            Token token = next();
            index = saved;
            return token;
        }

        void expect(TokenType type) {
            Token token = next();
            if (token.type() != type) {
                throw new PayloadParseException(
                        "Expected " + type.name().toLowerCase() + ", found " + token.describe(), token.offset());
            }
        }

        Token next() {
            skipWhitespaceAndComments();
            if (index >= source.length()) {
                return new Token(TokenType.EOF, "", index);
            }
            int start = index;
            char c = source.charAt(index);
            switch (c) {
                case '{': index++; return new Token(TokenType.BRACE_OPEN, "{", start);
                case '}': index++; return new Token(TokenType.BRACE_CLOSE, "}", start);
                case '[': index++; return new Token(TokenType.BRACKET_OPEN, "[", start);
                case ']': index++; return new Token(TokenType.BRACKET_CLOSE, "]", start);
                case ':': index++; return new Token(TokenType.COLON, ":", start);
                case ',': index++; return new Token(TokenType.COMMA, ",", start);
                case '=': index++; return new Token(TokenType.EQUALS, "=", start);
                case '"':
                case '\'':
                    return readString(c);
                default:
                    break;
            }
            if (isDigit(c) || (c == '-' && index + 1 < source.length() && isDigit(source.charAt(index + 1)))) {
                return readNumber();
            }
            if (Character.isLetter(c) || c == '_') {
                return readIdentifier();
            }
            throw new PayloadParseException("Unexpected character '" + c + "'", start);
        }

        private void skipWhitespaceAndComments() {
            while (index < source.length()) {
                char c = source.charAt(index);
                if (Character.isWhitespace(c)) {
                    index++;
                } else if (c == '/' && index + 1 < source.length() && source.charAt(index + 1) == '/') {
                    while (index < source.length() && source.charAt(index) != '\n') {
                        index++;
                    }
                } else {
                    return;
                }
            }
        }

        private Token readString(char quote) {
            int start = index;
            index++;
            StringBuilder value = new StringBuilder();
            while (index < source.length()) {
                char c = source.charAt(index);
                if (c == '\\' && index + 1 < source.length()) {
                    char escaped = source.charAt(index + 1);
                    value.append(switch (escaped) {
                        case 'n' -> '\n';
                        case 't' -> '\t';
                        case 'r' -> '\r';
                        default -> escaped;
                    });
                    index += 2;
                    continue;
                }
                if (c == quote) {
                    index++;
                    return new Token(TokenType.STRING, value.toString(), start);
                }
                value.append(c);
                index++;
            }
            throw new PayloadParseException("Unterminated string literal", start);
        }

        private Token readNumber() {
            int start = index;
            if (source.charAt(index) == '-') {
                index++;
            }
            while (index < source.length() && isDigit(source.charAt(index))) {
                index++;
            }
            if (index + 1 < source.length() && source.charAt(index) == '.' && isDigit(source.charAt(index + 1))) {
                index++;
                while (index < source.length() && isDigit(source.charAt(index))) {
                    index++;
                }
            }
            return new Token(TokenType.NUMBER, source.substring(start, index), start);
        }

        /**
         * Identifiers may carry dotted and indexed paths ({@code load.rows[0]})
         * so that references survive as one token; a ']' only belongs to the
         * identifier when it closes a '[' opened inside it.
         */
        private Token readIdentifier() {
            int start = index;
            int openBrackets = 0;
            index++;
            while (index < source.length()) {
                char c = source.charAt(index);
                if (Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '-') {
                    index++;
                } else if (c == '[') {
                    openBrackets++;
                    index++;
                } else if (c == ']' && openBrackets > 0) {
                    openBrackets--;
                    index++;
                } else {
                    break;
                }
            }
            String raw = source.substring(start, index);
            return switch (raw) {
                case "true" -> new Token(TokenType.TRUE, raw, start);
                case "false" -> new Token(TokenType.FALSE, raw, start);
                case "null" -> new Token(TokenType.NULL, raw, start);
                default -> new Token(TokenType.IDENTIFIER, raw, start);
            };
        }

        private static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }
    }
}
