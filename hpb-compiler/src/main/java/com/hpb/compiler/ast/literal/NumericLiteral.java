package com.hpb.compiler.ast.literal;

import com.hpb.compiler.printer.LiteralFormatter;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 整数字面量（任意精度非负整数 + 书写进制）
 */
public final class NumericLiteral {
    private final Base base;
    private final BigInteger value;

    public NumericLiteral(Base base, BigInteger value) {
        this.base = Objects.requireNonNull(base, "base");
        this.value = Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Numeric literal must be non-negative: " + value);
        }
    }

    public static NumericLiteral decimal(long value) {
        return new NumericLiteral(Base.DECIMAL, BigInteger.valueOf(value));
    }

    public static NumericLiteral of(Base base, long value) {
        return new NumericLiteral(base, BigInteger.valueOf(value));
    }

    public Base getBase() {
        return base;
    }

    public BigInteger getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NumericLiteral)) return false;
        NumericLiteral other = (NumericLiteral) o;
        return base == other.base && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, value);
    }

    /** 源码形式，与打印器输出一致 */
    @Override
    public String toString() {
        return LiteralFormatter.formatNumber(this);
    }

    /**
     * 字面量进制
     */
    public enum Base {
        OCTAL(8, "0"),
        DECIMAL(10, ""),
        HEXADECIMAL(16, "0x");

        private final int radix;
        private final String prefix;

        Base(int radix, String prefix) {
            this.radix = radix;
            this.prefix = prefix;
        }

        public int radix() {
            return radix;
        }

        /** 打印时固定添加的前缀（零值也添加） */
        public String prefix() {
            return prefix;
        }
    }
}
