package com.solparser;

import java.util.HashMap;
import java.util.Map;

/**
 * Token kinds produced by the scanner. Binary operators carry their binding
 * precedence; every other kind has precedence 0.
 */
public enum TokenType {
    EOS(null, Category.SPECIAL),

    // Punctuators
    LPAREN("(", Category.PUNCTUATION),
    RPAREN(")", Category.PUNCTUATION),
    LBRACK("[", Category.PUNCTUATION),
    RBRACK("]", Category.PUNCTUATION),
    LBRACE("{", Category.PUNCTUATION),
    RBRACE("}", Category.PUNCTUATION),
    COLON(":", Category.PUNCTUATION),
    SEMICOLON(";", Category.PUNCTUATION),
    PERIOD(".", Category.PUNCTUATION),
    CONDITIONAL("?", 3, Category.PUNCTUATION),
    DOUBLE_ARROW("=>", Category.PUNCTUATION),
    RIGHT_ARROW("->", Category.PUNCTUATION),

    // Assignment operators
    ASSIGN("=", 2, Category.ASSIGNMENT),
    ASSIGN_BIT_OR("|=", 2, Category.ASSIGNMENT),
    ASSIGN_BIT_XOR("^=", 2, Category.ASSIGNMENT),
    ASSIGN_BIT_AND("&=", 2, Category.ASSIGNMENT),
    ASSIGN_SHL("<<=", 2, Category.ASSIGNMENT),
    ASSIGN_SAR(">>=", 2, Category.ASSIGNMENT),
    ASSIGN_SHR(">>>=", 2, Category.ASSIGNMENT),
    ASSIGN_ADD("+=", 2, Category.ASSIGNMENT),
    ASSIGN_SUB("-=", 2, Category.ASSIGNMENT),
    ASSIGN_MUL("*=", 2, Category.ASSIGNMENT),
    ASSIGN_DIV("/=", 2, Category.ASSIGNMENT),
    ASSIGN_MOD("%=", 2, Category.ASSIGNMENT),

    // Binary operators
    COMMA(",", 1, Category.OPERATOR),
    OR("||", 4, Category.OPERATOR),
    AND("&&", 5, Category.OPERATOR),
    BIT_OR("|", 8, Category.OPERATOR),
    BIT_XOR("^", 9, Category.OPERATOR),
    BIT_AND("&", 10, Category.OPERATOR),
    SHL("<<", 11, Category.OPERATOR),
    SAR(">>", 11, Category.OPERATOR),
    SHR(">>>", 11, Category.OPERATOR),
    ADD("+", 12, Category.OPERATOR),
    SUB("-", 12, Category.OPERATOR),
    MUL("*", 13, Category.OPERATOR),
    DIV("/", 13, Category.OPERATOR),
    MOD("%", 13, Category.OPERATOR),
    EXP("**", 14, Category.OPERATOR),

    // Comparison operators
    EQUAL("==", 6, Category.OPERATOR),
    NOT_EQUAL("!=", 6, Category.OPERATOR),
    LESS_THAN("<", 7, Category.OPERATOR),
    GREATER_THAN(">", 7, Category.OPERATOR),
    LESS_THAN_OR_EQUAL("<=", 7, Category.OPERATOR),
    GREATER_THAN_OR_EQUAL(">=", 7, Category.OPERATOR),

    // Unary operators
    NOT("!", Category.OPERATOR),
    BIT_NOT("~", Category.OPERATOR),
    INC("++", Category.OPERATOR),
    DEC("--", Category.OPERATOR),
    DELETE("delete", Category.KEYWORD),

    // Keywords
    ABSTRACT("abstract", Category.KEYWORD),
    ANONYMOUS("anonymous", Category.KEYWORD),
    AS("as", Category.KEYWORD),
    ASSEMBLY("assembly", Category.KEYWORD),
    BREAK("break", Category.KEYWORD),
    CALLDATA("calldata", Category.KEYWORD),
    CATCH("catch", Category.KEYWORD),
    CONSTANT("constant", Category.KEYWORD),
    CONSTRUCTOR("constructor", Category.KEYWORD),
    CONTINUE("continue", Category.KEYWORD),
    CONTRACT("contract", Category.KEYWORD),
    DO("do", Category.KEYWORD),
    ELSE("else", Category.KEYWORD),
    EMIT("emit", Category.KEYWORD),
    ENUM("enum", Category.KEYWORD),
    EVENT("event", Category.KEYWORD),
    EXTERNAL("external", Category.KEYWORD),
    FALLBACK("fallback", Category.KEYWORD),
    FOR("for", Category.KEYWORD),
    FUNCTION("function", Category.KEYWORD),
    HEX("hex", Category.KEYWORD),
    IF("if", Category.KEYWORD),
    IMMUTABLE("immutable", Category.KEYWORD),
    IMPORT("import", Category.KEYWORD),
    INDEXED("indexed", Category.KEYWORD),
    INTERFACE("interface", Category.KEYWORD),
    INTERNAL("internal", Category.KEYWORD),
    IS("is", Category.KEYWORD),
    LIBRARY("library", Category.KEYWORD),
    MAPPING("mapping", Category.KEYWORD),
    MEMORY("memory", Category.KEYWORD),
    MODIFIER("modifier", Category.KEYWORD),
    NEW("new", Category.KEYWORD),
    OVERRIDE("override", Category.KEYWORD),
    PAYABLE("payable", Category.KEYWORD),
    PRAGMA("pragma", Category.KEYWORD),
    PRIVATE("private", Category.KEYWORD),
    PUBLIC("public", Category.KEYWORD),
    PURE("pure", Category.KEYWORD),
    RECEIVE("receive", Category.KEYWORD),
    RETURN("return", Category.KEYWORD),
    RETURNS("returns", Category.KEYWORD),
    STORAGE("storage", Category.KEYWORD),
    STRUCT("struct", Category.KEYWORD),
    THROW("throw", Category.KEYWORD),
    TRY("try", Category.KEYWORD),
    TYPE("type", Category.KEYWORD),
    USING("using", Category.KEYWORD),
    VIEW("view", Category.KEYWORD),
    VIRTUAL("virtual", Category.KEYWORD),
    WHILE("while", Category.KEYWORD),

    // Unit suffixes
    SUB_WEI("wei", Category.ETHER_SUBDENOMINATION),
    SUB_GWEI("gwei", Category.ETHER_SUBDENOMINATION),
    SUB_SZABO("szabo", Category.ETHER_SUBDENOMINATION),
    SUB_FINNEY("finney", Category.ETHER_SUBDENOMINATION),
    SUB_ETHER("ether", Category.ETHER_SUBDENOMINATION),
    SUB_SECOND("seconds", Category.TIME_SUBDENOMINATION),
    SUB_MINUTE("minutes", Category.TIME_SUBDENOMINATION),
    SUB_HOUR("hours", Category.TIME_SUBDENOMINATION),
    SUB_DAY("days", Category.TIME_SUBDENOMINATION),
    SUB_WEEK("weeks", Category.TIME_SUBDENOMINATION),
    SUB_YEAR("years", Category.TIME_SUBDENOMINATION),

    // Elementary type names. The *_M variants carry their sizes in the token info.
    INT("int", Category.ELEMENTARY_TYPE),
    UINT("uint", Category.ELEMENTARY_TYPE),
    BYTES("bytes", Category.ELEMENTARY_TYPE),
    BYTE("byte", Category.ELEMENTARY_TYPE),
    STRING("string", Category.ELEMENTARY_TYPE),
    ADDRESS("address", Category.ELEMENTARY_TYPE),
    BOOL("bool", Category.ELEMENTARY_TYPE),
    FIXED("fixed", Category.ELEMENTARY_TYPE),
    UFIXED("ufixed", Category.ELEMENTARY_TYPE),
    INT_M("int", Category.SIZED_ELEMENTARY_TYPE),
    UINT_M("uint", Category.SIZED_ELEMENTARY_TYPE),
    BYTES_M("bytes", Category.SIZED_ELEMENTARY_TYPE),
    FIXED_MXN("fixed", Category.SIZED_ELEMENTARY_TYPE),
    UFIXED_MXN("ufixed", Category.SIZED_ELEMENTARY_TYPE),

    // Literals
    TRUE_LITERAL("true", Category.KEYWORD),
    FALSE_LITERAL("false", Category.KEYWORD),
    NUMBER(null, Category.LITERAL),
    STRING_LITERAL(null, Category.LITERAL),
    UNICODE_STRING_LITERAL(null, Category.LITERAL),
    HEX_STRING_LITERAL(null, Category.LITERAL),
    IDENTIFIER(null, Category.LITERAL),

    // Keywords reserved for future use
    AFTER("after", Category.RESERVED),
    ALIAS("alias", Category.RESERVED),
    APPLY("apply", Category.RESERVED),
    AUTO("auto", Category.RESERVED),
    CASE("case", Category.RESERVED),
    COPYOF("copyof", Category.RESERVED),
    DEFAULT("default", Category.RESERVED),
    DEFINE("define", Category.RESERVED),
    FINAL("final", Category.RESERVED),
    IMPLEMENTS("implements", Category.RESERVED),
    IN("in", Category.RESERVED),
    INLINE("inline", Category.RESERVED),
    LET("let", Category.RESERVED),
    MACRO("macro", Category.RESERVED),
    MATCH("match", Category.RESERVED),
    MUTABLE("mutable", Category.RESERVED),
    NULL_LITERAL("null", Category.RESERVED),
    OF("of", Category.RESERVED),
    PARTIAL("partial", Category.RESERVED),
    PROMISE("promise", Category.RESERVED),
    REFERENCE("reference", Category.RESERVED),
    RELOCATABLE("relocatable", Category.RESERVED),
    SEALED("sealed", Category.RESERVED),
    SIZEOF("sizeof", Category.RESERVED),
    STATIC("static", Category.RESERVED),
    SUPPORTS("supports", Category.RESERVED),
    SWITCH("switch", Category.RESERVED),
    TYPEDEF("typedef", Category.RESERVED),
    TYPEOF("typeof", Category.RESERVED),
    UNCHECKED("unchecked", Category.RESERVED),

    ILLEGAL(null, Category.SPECIAL);

    enum Category {
        SPECIAL,
        PUNCTUATION,
        ASSIGNMENT,
        OPERATOR,
        KEYWORD,
        RESERVED,
        ETHER_SUBDENOMINATION,
        TIME_SUBDENOMINATION,
        ELEMENTARY_TYPE,
        SIZED_ELEMENTARY_TYPE,
        LITERAL
    }

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        for (TokenType type : values()) {
            switch (type.category) {
                case KEYWORD, RESERVED, ETHER_SUBDENOMINATION, TIME_SUBDENOMINATION, ELEMENTARY_TYPE ->
                    KEYWORDS.put(type.text, type);
                default -> {
                }
            }
        }
    }

    private final String text;
    private final int precedence;
    private final Category category;

    TokenType(String text, Category category) {
        this(text, 0, category);
    }

    TokenType(String text, int precedence, Category category) {
        this.text = text;
        this.precedence = precedence;
        this.category = category;
    }

    /**
     * Returns the fixed source text of this token kind, or null for kinds whose
     * text varies (identifiers, literals, end of source).
     */
    public String text() {
        return text;
    }

    public int precedence() {
        return precedence;
    }

    /**
     * Name used in diagnostics: the source text where there is one, otherwise a
     * lower-case spelling of the kind such as {@code string literal}.
     */
    public String friendlyName() {
        return text != null ? text : name().toLowerCase(java.util.Locale.ROOT).replace('_', ' ');
    }

    /**
     * Looks up a keyword by its spelling. Returns {@link #IDENTIFIER} for anything else,
     * including sized elementary type names, which the scanner resolves itself.
     */
    public static TokenType keywordOrIdentifier(String word) {
        return KEYWORDS.getOrDefault(word, IDENTIFIER);
    }

    public boolean isElementaryTypeName() {
        return category == Category.ELEMENTARY_TYPE || category == Category.SIZED_ELEMENTARY_TYPE;
    }

    public boolean isAssignmentOp() {
        return category == Category.ASSIGNMENT;
    }

    public boolean isBinaryOp() {
        return category == Category.OPERATOR && precedence > 0;
    }

    public boolean isUnaryOp() {
        return this == NOT || this == BIT_NOT || this == DELETE || this == ADD || this == SUB;
    }

    public boolean isCountOp() {
        return this == INC || this == DEC;
    }

    public boolean isVisibilitySpecifier() {
        return isVariableVisibilitySpecifier() || this == EXTERNAL;
    }

    public boolean isVariableVisibilitySpecifier() {
        return this == PUBLIC || this == PRIVATE || this == INTERNAL;
    }

    public boolean isStateMutabilitySpecifier() {
        return this == PAYABLE || this == VIEW || this == PURE;
    }

    public boolean isLocationSpecifier() {
        return this == STORAGE || this == MEMORY || this == CALLDATA;
    }

    public boolean isEtherSubdenomination() {
        return category == Category.ETHER_SUBDENOMINATION;
    }

    public boolean isTimeSubdenomination() {
        return category == Category.TIME_SUBDENOMINATION;
    }

    public boolean isReservedKeyword() {
        return category == Category.RESERVED;
    }

    public boolean isStringLiteral() {
        return this == STRING_LITERAL || this == UNICODE_STRING_LITERAL || this == HEX_STRING_LITERAL;
    }
}
