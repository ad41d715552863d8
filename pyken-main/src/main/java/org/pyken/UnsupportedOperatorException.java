package org.pyken;

public class UnsupportedOperatorException extends PyKenException {

    private final String operator;
    private final int line;
    private final int column;

    public UnsupportedOperatorException(String operator, int line, int column) {
        super("Operator '" + operator + "' has no Aiken equivalent");
        this.operator = operator;
        this.line = line;
        this.column = column;
    }

    public String getOperator() {
        return operator;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
