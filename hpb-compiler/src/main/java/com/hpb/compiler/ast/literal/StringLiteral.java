package com.hpb.compiler.ast.literal;

import com.hpb.compiler.printer.LiteralFormatter;

import java.util.Objects;

/**
 * 字符串字面量（保存未转义的原始文本）
 */
public final class StringLiteral {
    private final String value;

    public StringLiteral(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StringLiteral)) return false;
        return value.equals(((StringLiteral) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    /** 带引号并转义后的源码形式 */
    @Override
    public String toString() {
        return LiteralFormatter.quote(value);
    }
}
