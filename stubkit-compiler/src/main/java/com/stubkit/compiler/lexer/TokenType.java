package com.stubkit.compiler.lexer;

/**
 * 存根语言词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    INT_LITERAL("NUMBER"),
    FLOAT_LITERAL("NUMBER"),
    STRING_LITERAL("STRING"),

    // === 标识符 ===
    NAME("NAME"),

    // === 关键词 ===
    KW_DEF("DEF"), KW_CLASS("CLASS"), KW_IMPORT("IMPORT"), KW_FROM("FROM"), KW_AS("AS"),
    KW_IF("IF"), KW_ELIF("ELIF"), KW_ELSE("ELSE"), KW_OR("OR"), KW_AND("AND"),
    KW_PASS("PASS"), KW_RAISE("RAISE"), KW_PYTHONCODE("PYTHONCODE"),

    // === 类型注释 ===
    TYPECOMMENT("TYPECOMMENT"),     // # type:

    // === 操作符 ===
    ELLIPSIS("ELLIPSIS"),           // ...
    ARROW("ARROW"),                 // ->
    COLONEQUALS("COLONEQUALS"),     // :=
    EQ("EQ"),                       // ==
    NE("NE"),                       // !=
    LT("'<'"),                      // <
    GT("'>'"),                      // >
    LE("LE"),                       // <=
    GE("GE"),                       // >=
    ASSIGN("'='"),                  // =
    QUESTION("'?'"),                // ?
    STAR("'*'"),                    // *
    DOUBLE_STAR("'**'"),            // **
    AT("'@'"),                      // @

    // === 分隔符 ===
    LPAREN("'('"),
    RPAREN("')'"),
    LBRACKET("'['"),
    RBRACKET("']'"),
    COMMA("','"),
    DOT("'.'"),
    COLON("':'"),

    // === 结构 ===
    NEWLINE("NEWLINE"),
    INDENT("INDENT"),
    DEDENT("DEDENT"),
    EOF("end of file");

    private final String displayName;

    TokenType(String displayName) {
        this.displayName = displayName;
    }

    /**
     * 语法错误消息中使用的名称（如 NAME、':'）
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * 是否为关键词
     */
    public boolean isKeyword() {
        return name().startsWith("KW_");
    }

    /**
     * 是否为比较操作符
     */
    public boolean isComparisonOp() {
        switch (this) {
            case EQ:
            case NE:
            case LT:
            case GT:
            case LE:
            case GE:
                return true;
            default:
                return false;
        }
    }
}
