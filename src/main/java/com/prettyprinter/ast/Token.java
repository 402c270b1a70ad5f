package com.prettyprinter.ast;

/**
 * Lexemes known to the printer, with their source text and binary operator precedence.
 */
public enum Token {
    ILLEGAL("ILLEGAL"),

    // literal kinds
    IDENT("identifier"),
    INT("int"),
    FLOAT("float"),
    CHAR("char"),
    STRING("string"),

    // operators
    ADD("+", 5),
    SUB("-", 5),
    MUL("*", 6),
    QUO("/", 6),
    REM("%", 6),

    AND("&", 6),
    OR("|", 5),
    XOR("^", 5),
    SHL("<<", 6),
    SHR(">>", 6),
    AND_NOT("&^", 6),

    ADD_ASSIGN("+="),
    SUB_ASSIGN("-="),
    MUL_ASSIGN("*="),
    QUO_ASSIGN("/="),
    REM_ASSIGN("%="),
    AND_ASSIGN("&="),
    OR_ASSIGN("|="),
    XOR_ASSIGN("^="),
    SHL_ASSIGN("<<="),
    SHR_ASSIGN(">>="),
    AND_NOT_ASSIGN("&^="),

    LAND("&&", 2),
    LOR("||", 1),
    ARROW("<-", 3),
    INC("++"),
    DEC("--"),

    EQL("==", 4),
    LSS("<", 4),
    GTR(">", 4),
    ASSIGN("="),
    NOT("!"),

    NEQ("!=", 4),
    LEQ("<=", 4),
    GEQ(">=", 4),
    DEFINE(":="),
    ELLIPSIS("..."),

    // delimiters
    LPAREN("("),
    LBRACK("["),
    LBRACE("{"),
    COMMA(","),
    PERIOD("."),

    RPAREN(")"),
    RBRACK("]"),
    RBRACE("}"),
    SEMICOLON(";"),
    COLON(":", 0),

    // keywords
    BREAK("break"),
    CASE("case"),
    CHAN("chan"),
    CONST("const"),
    CONTINUE("continue"),

    DEFAULT("default"),
    DEFER("defer"),
    ELSE("else"),
    FALLTHROUGH("fallthrough"),
    FOR("for"),

    FUNC("func"),
    GO("go"),
    GOTO("goto"),
    IF("if"),
    IMPORT("import"),

    INTERFACE("interface"),
    MAP("map"),
    PACKAGE("package"),
    RANGE("range"),
    RETURN("return"),

    SELECT("select"),
    STRUCT("struct"),
    SWITCH("switch"),
    TYPE("type"),
    VAR("var");

    /** Precedence of tokens that are not binary operators. */
    public static final int LOWEST_PREC = -1;
    public static final int UNARY_PREC = 7;
    public static final int HIGHEST_PREC = 8;

    /** Precedence of the additive operators; tighter operators may print without blanks. */
    public static final int ADDITIVE_PREC = 5;

    private final String text;
    private final int precedence;

    Token(String text) {
        this(text, LOWEST_PREC);
    }

    Token(String text, int precedence) {
        this.text = text;
        this.precedence = precedence;
    }

    public String getText() {
        return text;
    }

    /**
     * Returns the binary operator precedence, or {@link #LOWEST_PREC} for
     * tokens that are not binary operators.
     */
    public int getPrecedence() {
        return precedence;
    }
}
