package org.dxworks.lolmark.error;

public class CompilationException extends Exception {

    private final ErrorKind kind;
    private final int line;
    private final String detail;

    public CompilationException(ErrorKind kind, int line, String detail) {
        super(kind.getLabel() + " error on line " + line + ": " + detail);
        this.kind = kind;
        this.line = line;
        this.detail = detail;
    }

    public static CompilationException lexical(int line, String lexeme) {
        return new CompilationException(ErrorKind.LEXICAL, line,
                "'" + lexeme + "' is not a recognized token");
    }

    public static CompilationException syntax(int line, String detail) {
        return new CompilationException(ErrorKind.SYNTAX, line, detail);
    }

    public static CompilationException semantic(int line, String detail) {
        return new CompilationException(ErrorKind.SEMANTIC, line, detail);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public int getLine() {
        return line;
    }

    public String getDetail() {
        return detail;
    }
}
