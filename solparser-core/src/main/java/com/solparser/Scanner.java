package com.solparser;

import com.solparser.ast.SourceLocation;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reference scanner. The whole input is tokenized up front; the cursor then walks
 * the token list, which makes lookahead and rollback trivial. Token offsets are
 * UTF-8 byte offsets into the source.
 */
public class Scanner implements TokenSource {

    private static final Map<String, TokenType> OPERATORS = new HashMap<>();

    static {
        for (TokenType type : TokenType.values()) {
            if (type.text() != null && !Character.isLetter(type.text().charAt(0))) {
                OPERATORS.put(type.text(), type);
            }
        }
    }

    private final String source;
    private final String sourceName;
    private final char[] buffer;
    private final byte[] utf8;
    // byteOffsets[i] is the UTF-8 offset of buffer[i]; one extra entry for the end
    private final int[] byteOffsets;
    private final List<Token> tokens;
    private int current = 0;

    // Lexer state, only used while tokenizing
    private int pos;
    private String pendingComment = "";
    private int pendingCommentStart = -1;
    private int pendingCommentEnd = -1;
    private boolean lastWasLineDocComment = false;

    public Scanner(String source, String sourceName) {
        this.source = source;
        this.sourceName = sourceName;
        this.buffer = source.toCharArray();
        this.utf8 = source.getBytes(StandardCharsets.UTF_8);
        this.byteOffsets = computeByteOffsets(buffer);
        this.tokens = tokenize();
    }

    public Scanner(String source) {
        this(source, "<stdin>");
    }

    /**
     * All tokens of the source, ending with {@link TokenType#EOS}.
     */
    public List<Token> tokens() {
        return Collections.unmodifiableList(tokens);
    }

    // ========================================================================
    // TokenSource
    // ========================================================================

    @Override
    public TokenType currentToken() {
        return tokens.get(current).type();
    }

    @Override
    public String currentLiteral() {
        return tokens.get(current).literal();
    }

    @Override
    public String currentCommentLiteral() {
        return tokens.get(current).comment();
    }

    @Override
    public SourceLocation currentCommentLocation() {
        Token token = tokens.get(current);
        return new SourceLocation(token.commentStart(), token.commentEnd(), sourceName);
    }

    @Override
    public ElementaryTypeNameToken currentElementaryTypeNameToken() {
        Token token = tokens.get(current);
        return new ElementaryTypeNameToken(token.type(), token.firstSize(), token.secondSize());
    }

    @Override
    public ScannerError currentError() {
        return tokens.get(current).error();
    }

    @Override
    public SourceLocation currentLocation() {
        Token token = tokens.get(current);
        return new SourceLocation(token.start(), token.end(), sourceName);
    }

    @Override
    public int previousTokenEnd() {
        return current == 0 ? tokens.get(0).start() : tokens.get(current - 1).end();
    }

    @Override
    public TokenType peekNextToken() {
        return tokens.get(Math.min(current + 1, tokens.size() - 1)).type();
    }

    @Override
    public TokenType peekNextNextToken() {
        return tokens.get(Math.min(current + 2, tokens.size() - 1)).type();
    }

    @Override
    public TokenType next() {
        if (current < tokens.size() - 1) {
            current++;
        }
        return currentToken();
    }

    @Override
    public void setPosition(int offset) {
        int index = 0;
        while (index < tokens.size() - 1 && tokens.get(index).start() < offset) {
            index++;
        }
        current = index;
    }

    @Override
    public String source() {
        return source;
    }

    @Override
    public String sourceName() {
        return sourceName;
    }

    @Override
    public String text(int start, int end) {
        return new String(utf8, start, end - start, StandardCharsets.UTF_8);
    }

    // ========================================================================
    // Tokenizer
    // ========================================================================

    private List<Token> tokenize() {
        List<Token> result = new ArrayList<>();
        pos = 0;
        while (true) {
            Token token = toByteOffsets(scanToken());
            result.add(token);
            if (token.type() == TokenType.EOS) {
                return result;
            }
        }
    }

    private Token scanToken() {
        Token illegalComment = skipWhitespaceAndComments();
        if (illegalComment != null) {
            return illegalComment;
        }
        int start = pos;
        if (pos >= buffer.length) {
            return token(TokenType.EOS, "", start, start);
        }

        char c = buffer[pos];
        if (isIdentifierStart(c)) {
            return scanIdentifierOrKeyword();
        }
        if (isDecimalDigit(c) || (c == '.' && isDecimalDigit(peekChar(1)))) {
            return scanNumber();
        }
        if (c == '"' || c == '\'') {
            return scanString(start, pos, false);
        }

        for (int length = 4; length >= 1; length--) {
            if (pos + length <= buffer.length) {
                TokenType type = OPERATORS.get(new String(buffer, pos, length));
                if (type != null) {
                    pos += length;
                    return token(type, "", start, pos);
                }
            }
        }

        pos++;
        return illegal(ScannerError.ILLEGAL_TOKEN, start, pos);
    }

    /**
     * Skips blanks and comments, remembering doc comments for the next token.
     * Returns an illegal token for an unterminated block comment.
     */
    private Token skipWhitespaceAndComments() {
        while (pos < buffer.length) {
            char c = buffer[pos];
            if (Character.isWhitespace(c)) {
                if (c == '\n') {
                    // A blank line separates consecutive /// comments
                    if (lineIsBlankAhead()) {
                        lastWasLineDocComment = false;
                    }
                }
                pos++;
            } else if (c == '/' && peekChar(1) == '/') {
                int commentStart = pos;
                boolean isDoc = peekChar(2) == '/' && peekChar(3) != '/';
                while (pos < buffer.length && buffer[pos] != '\n') {
                    pos++;
                }
                if (isDoc) {
                    String text = stripLeadingBlank(new String(buffer, commentStart + 3, pos - commentStart - 3));
                    if (lastWasLineDocComment && !pendingComment.isEmpty()) {
                        pendingComment = pendingComment + "\n" + text;
                        pendingCommentEnd = pos;
                    } else {
                        pendingComment = text;
                        pendingCommentStart = commentStart;
                        pendingCommentEnd = pos;
                    }
                    lastWasLineDocComment = true;
                }
            } else if (c == '/' && peekChar(1) == '*') {
                int commentStart = pos;
                boolean isDoc = peekChar(2) == '*' && peekChar(3) != '/';
                pos += 2;
                while (pos < buffer.length && !(buffer[pos] == '*' && peekChar(1) == '/')) {
                    pos++;
                }
                if (pos >= buffer.length) {
                    return illegal(ScannerError.ILLEGAL_COMMENT_TERMINATOR, commentStart, pos);
                }
                pos += 2;
                if (isDoc) {
                    pendingComment = cleanBlockDocComment(new String(buffer, commentStart + 3, pos - commentStart - 5));
                    pendingCommentStart = commentStart;
                    pendingCommentEnd = pos;
                }
                lastWasLineDocComment = false;
            } else {
                return null;
            }
        }
        return null;
    }

    private boolean lineIsBlankAhead() {
        int i = pos + 1;
        while (i < buffer.length && buffer[i] != '\n') {
            if (!Character.isWhitespace(buffer[i])) {
                return false;
            }
            i++;
        }
        return true;
    }

    private static String stripLeadingBlank(String text) {
        int i = 0;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return text.substring(i).stripTrailing();
    }

    private static String cleanBlockDocComment(String body) {
        StringBuilder sb = new StringBuilder();
        String[] lines = body.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.startsWith("*")) {
                line = stripLeadingBlank(line.substring(1));
            }
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(line);
        }
        return sb.toString().strip();
    }

    private Token scanIdentifierOrKeyword() {
        int start = pos;
        while (pos < buffer.length && isIdentifierPart(buffer[pos])) {
            pos++;
        }
        String word = new String(buffer, start, pos - start);

        if (pos < buffer.length && (buffer[pos] == '"' || buffer[pos] == '\'')) {
            if (word.equals("hex")) {
                return scanHexString(start);
            }
            if (word.equals("unicode")) {
                return scanString(start, pos, true);
            }
        }

        TokenType keyword = TokenType.keywordOrIdentifier(word);
        if (keyword != TokenType.IDENTIFIER) {
            return token(keyword, word, start, pos);
        }
        Token sized = sizedElementaryType(word, start);
        if (sized != null) {
            return sized;
        }
        return token(TokenType.IDENTIFIER, word, start, pos);
    }

    private Token sizedElementaryType(String word, int start) {
        TokenType type;
        String rest;
        if (word.startsWith("uint")) {
            type = TokenType.UINT_M;
            rest = word.substring(4);
        } else if (word.startsWith("int")) {
            type = TokenType.INT_M;
            rest = word.substring(3);
        } else if (word.startsWith("bytes")) {
            type = TokenType.BYTES_M;
            rest = word.substring(5);
        } else if (word.startsWith("ufixed")) {
            type = TokenType.UFIXED_MXN;
            rest = word.substring(6);
        } else if (word.startsWith("fixed")) {
            type = TokenType.FIXED_MXN;
            rest = word.substring(5);
        } else {
            return null;
        }

        if (type == TokenType.FIXED_MXN || type == TokenType.UFIXED_MXN) {
            int x = rest.indexOf('x');
            if (x <= 0) {
                return null;
            }
            int m = parseSize(rest.substring(0, x));
            int n = parseSize(rest.substring(x + 1));
            if (m < 8 || m > 256 || m % 8 != 0 || n < 0 || n > 80) {
                return null;
            }
            int commentStart = pendingCommentStart;
            int commentEnd = pendingCommentEnd;
            return new Token(type, word, start, pos, m, n, ScannerError.NO_ERROR, takeComment(), commentStart, commentEnd);
        }

        int m = parseSize(rest);
        boolean valid = type == TokenType.BYTES_M
            ? m >= 1 && m <= 32
            : m >= 8 && m <= 256 && m % 8 == 0;
        if (!valid) {
            return null;
        }
        int commentStart = pendingCommentStart;
        int commentEnd = pendingCommentEnd;
        return new Token(type, word, start, pos, m, 0, ScannerError.NO_ERROR, takeComment(), commentStart, commentEnd);
    }

    private static int parseSize(String digits) {
        if (digits.isEmpty() || digits.length() > 3 || (digits.length() > 1 && digits.charAt(0) == '0')) {
            return -1;
        }
        for (int i = 0; i < digits.length(); i++) {
            if (!isDecimalDigit(digits.charAt(i))) {
                return -1;
            }
        }
        return Integer.parseInt(digits);
    }

    private Token scanNumber() {
        int start = pos;
        if (buffer[pos] == '0' && (peekChar(1) == 'x' || peekChar(1) == 'X')) {
            pos += 2;
            int digitsStart = pos;
            while (pos < buffer.length && (isHexDigit(buffer[pos]) || buffer[pos] == '_')) {
                pos++;
            }
            if (pos == digitsStart) {
                return illegal(ScannerError.ILLEGAL_HEX_DIGIT, start, pos);
            }
            return finishNumber(start, digitsStart);
        }

        if (buffer[pos] == '0' && isDecimalDigit(peekChar(1))) {
            while (pos < buffer.length && isDecimalDigit(buffer[pos])) {
                pos++;
            }
            return illegal(ScannerError.OCTAL_NOT_ALLOWED, start, pos);
        }

        scanDecimalDigits();
        if (pos < buffer.length && buffer[pos] == '.' && isDecimalDigit(peekChar(1))) {
            pos++;
            scanDecimalDigits();
        }
        if (pos < buffer.length && (buffer[pos] == 'e' || buffer[pos] == 'E')) {
            int exponentStart = pos;
            pos++;
            if (pos < buffer.length && buffer[pos] == '-') {
                pos++;
            }
            if (pos >= buffer.length || !isDecimalDigit(buffer[pos])) {
                return illegal(ScannerError.ILLEGAL_EXPONENT, start, Math.max(pos, exponentStart + 1));
            }
            scanDecimalDigits();
        }
        return finishNumber(start, start);
    }

    private void scanDecimalDigits() {
        while (pos < buffer.length && (isDecimalDigit(buffer[pos]) || buffer[pos] == '_')) {
            pos++;
        }
    }

    private Token finishNumber(int start, int digitsStart) {
        if (pos < buffer.length && isIdentifierStart(buffer[pos])) {
            while (pos < buffer.length && isIdentifierPart(buffer[pos])) {
                pos++;
            }
            return illegal(ScannerError.ILLEGAL_NUMBER_END, start, pos);
        }
        String text = new String(buffer, start, pos - start);
        String digits = new String(buffer, digitsStart, pos - digitsStart);
        if (digits.startsWith("_") || digits.endsWith("_") || digits.contains("__")
            || digits.contains("_.") || digits.contains("._")
            || digits.contains("_e") || digits.contains("_E")) {
            return illegal(ScannerError.ILLEGAL_NUMBER_SEPARATOR, start, pos);
        }
        return token(TokenType.NUMBER, text, start, pos);
    }

    /**
     * Scans a quoted string. {@code quotePos} points at the opening quote, {@code start}
     * at the token start (which includes a {@code unicode} prefix).
     */
    private Token scanString(int start, int quotePos, boolean isUnicode) {
        char quote = buffer[quotePos];
        pos = quotePos + 1;
        StringBuilder value = new StringBuilder();
        while (pos < buffer.length && buffer[pos] != quote) {
            char c = buffer[pos];
            if (c == '\n' || c == '\r') {
                return illegal(ScannerError.ILLEGAL_STRING_END_QUOTE, start, pos);
            }
            if (c == '\\') {
                pos++;
                if (pos >= buffer.length) {
                    return illegal(ScannerError.ILLEGAL_STRING_END_QUOTE, start, pos);
                }
                if (!scanEscape(value)) {
                    return illegal(ScannerError.ILLEGAL_ESCAPE_SEQUENCE, start, pos);
                }
                continue;
            }
            if (!isUnicode && c > 0x7f) {
                return illegal(ScannerError.UNICODE_CHARACTER_IN_NON_UNICODE_STRING, start, pos);
            }
            if (!isUnicode && c < 0x20) {
                return illegal(ScannerError.ILLEGAL_CHARACTER_IN_STRING, start, pos);
            }
            value.append(c);
            pos++;
        }
        if (pos >= buffer.length) {
            return illegal(ScannerError.ILLEGAL_STRING_END_QUOTE, start, pos);
        }
        pos++;
        return token(isUnicode ? TokenType.UNICODE_STRING_LITERAL : TokenType.STRING_LITERAL, value.toString(), start, pos);
    }

    private boolean scanEscape(StringBuilder value) {
        char c = buffer[pos];
        switch (c) {
            case '\'', '"', '\\' -> value.append(c);
            case 'b' -> value.append('\b');
            case 'f' -> value.append('\f');
            case 'n' -> value.append('\n');
            case 'r' -> value.append('\r');
            case 't' -> value.append('\t');
            case 'v' -> value.append('\u000b');
            case '\n' -> {
                // line continuation
            }
            case 'x' -> {
                int code = hexValue(pos + 1, 2);
                if (code < 0) {
                    return false;
                }
                value.append((char) code);
                pos += 2;
            }
            case 'u' -> {
                int code = hexValue(pos + 1, 4);
                if (code < 0) {
                    return false;
                }
                value.append((char) code);
                pos += 4;
            }
            default -> {
                return false;
            }
        }
        pos++;
        return true;
    }

    private int hexValue(int from, int count) {
        if (from + count > buffer.length) {
            return -1;
        }
        int result = 0;
        for (int i = from; i < from + count; i++) {
            int digit = Character.digit(buffer[i], 16);
            if (digit < 0) {
                return -1;
            }
            result = result * 16 + digit;
        }
        return result;
    }

    private Token scanHexString(int start) {
        char quote = buffer[pos];
        pos++;
        StringBuilder value = new StringBuilder();
        boolean expectSeparatorOrPair = false;
        while (pos < buffer.length && buffer[pos] != quote) {
            if (buffer[pos] == '_' && expectSeparatorOrPair) {
                expectSeparatorOrPair = false;
                pos++;
                if (pos < buffer.length && buffer[pos] == quote) {
                    return illegal(ScannerError.ILLEGAL_HEX_STRING, start, pos);
                }
                continue;
            }
            int code = hexValue(pos, 2);
            if (code < 0) {
                return illegal(ScannerError.ILLEGAL_HEX_STRING, start, pos);
            }
            value.append((char) code);
            pos += 2;
            expectSeparatorOrPair = true;
        }
        if (pos >= buffer.length) {
            return illegal(ScannerError.ILLEGAL_STRING_END_QUOTE, start, pos);
        }
        pos++;
        return token(TokenType.HEX_STRING_LITERAL, value.toString(), start, pos);
    }

    private static int[] computeByteOffsets(char[] chars) {
        int[] offsets = new int[chars.length + 1];
        for (int i = 0; i < chars.length; i++) {
            char c = chars[i];
            int size;
            if (c < 0x80) {
                size = 1;
            } else if (c < 0x800) {
                size = 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < chars.length && Character.isLowSurrogate(chars[i + 1])) {
                size = 4;
            } else if (Character.isLowSurrogate(c) && i > 0 && Character.isHighSurrogate(chars[i - 1])) {
                // counted with its high surrogate
                size = 0;
            } else if (Character.isSurrogate(c)) {
                // unpaired, encoded as '?'
                size = 1;
            } else {
                size = 3;
            }
            offsets[i + 1] = offsets[i] + size;
        }
        return offsets;
    }

    private Token toByteOffsets(Token token) {
        return new Token(token.type(), token.literal(),
            byteOffsets[token.start()], byteOffsets[token.end()],
            token.firstSize(), token.secondSize(), token.error(), token.comment(),
            token.commentStart() < 0 ? -1 : byteOffsets[token.commentStart()],
            token.commentEnd() < 0 ? -1 : byteOffsets[token.commentEnd()]);
    }

    private Token token(TokenType type, String literal, int start, int end) {
        int commentStart = pendingCommentStart;
        int commentEnd = pendingCommentEnd;
        return new Token(type, literal, start, end, 0, 0, ScannerError.NO_ERROR, takeComment(), commentStart, commentEnd);
    }

    private Token illegal(ScannerError error, int start, int end) {
        int commentStart = pendingCommentStart;
        int commentEnd = pendingCommentEnd;
        return new Token(TokenType.ILLEGAL, new String(buffer, start, end - start), start, end, 0, 0, error, takeComment(), commentStart, commentEnd);
    }

    private String takeComment() {
        String comment = pendingComment;
        pendingComment = "";
        pendingCommentStart = -1;
        pendingCommentEnd = -1;
        lastWasLineDocComment = false;
        return comment;
    }

    private char peekChar(int offset) {
        int index = pos + offset;
        return index < buffer.length ? buffer[index] : '\0';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDecimalDigit(c);
    }

    private static boolean isDecimalDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return Character.digit(c, 16) >= 0;
    }
}
