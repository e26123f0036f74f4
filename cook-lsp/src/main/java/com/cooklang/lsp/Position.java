package com.cooklang.lsp;

/**
 * LSP 位置：0-based 行号与 UTF-16 代码单元列号
 */
public final class Position {
    private final int line;
    private final int character;

    public Position(int line, int character) {
        this.line = line;
        this.character = character;
    }

    public int getLine() {
        return line;
    }

    public int getCharacter() {
        return character;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Position)) return false;
        Position other = (Position) o;
        return line == other.line && character == other.character;
    }

    @Override
    public int hashCode() {
        return 31 * line + character;
    }

    @Override
    public String toString() {
        return line + ":" + character;
    }
}
