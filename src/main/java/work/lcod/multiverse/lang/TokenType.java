package work.lcod.multiverse.lang;

public enum TokenType {
    NUMBER,
    STRING,
    IDENT,
    TRUE,
    FALSE,
    NULL,
    IF,
    IN,
    BRANCH,
    ASSIGN,
    EQUALS,
    EQ,
    NE,
    LT,
    LE,
    GT,
    GE,
    AND,
    OR,
    NOT,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,
    ARROW,
    TILDE,
    WHEN,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    COMMA,
    DOT,
    SEMICOLON,
    NEWLINE,
    EOF
}
