package com.hpb.compiler.printer;

import com.hpb.compiler.ast.literal.NumericLiteral;
import com.hpb.compiler.ast.literal.NumericLiteral.Base;
import com.hpb.compiler.ast.literal.StringLiteral;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 字面量格式化单元测试
 */
class LiteralFormatterTest {

    private static String number(Base base, long value) {
        return LiteralFormatter.formatNumber(NumericLiteral.of(base, value));
    }

    @Nested
    @DisplayName("整数字面量")
    class NumberTests {

        @Test
        @DisplayName("零值仍带进制前缀")
        void testZero() {
            assertEquals("0", number(Base.DECIMAL, 0));
            assertEquals("0x0", number(Base.HEXADECIMAL, 0));
            assertEquals("00", number(Base.OCTAL, 0));
        }

        @Test
        @DisplayName("十进制")
        void testDecimal() {
            assertEquals("255", number(Base.DECIMAL, 255));
            assertEquals("100", number(Base.DECIMAL, 100));
        }

        @Test
        @DisplayName("八进制")
        void testOctal() {
            assertEquals("010", number(Base.OCTAL, 8));
            assertEquals("0777", number(Base.OCTAL, 511));
        }

        @Test
        @DisplayName("十六进制每位输出余数的十进制文本")
        void testHexadecimalDigits() {
            assertEquals("0x1", number(Base.HEXADECIMAL, 1));
            assertEquals("0x10", number(Base.HEXADECIMAL, 16));
            assertEquals("0x1515", number(Base.HEXADECIMAL, 255));
            assertEquals("0x110", number(Base.HEXADECIMAL, 26));
        }

        @Test
        @DisplayName("任意精度")
        void testBigValue() {
            BigInteger big = BigInteger.ONE.shiftLeft(64);
            assertEquals("18446744073709551616",
                    LiteralFormatter.formatNumber(new NumericLiteral(Base.DECIMAL, big)));
        }

        @Test
        @DisplayName("toString 与打印结果一致")
        void testToString() {
            assertEquals("0x0", NumericLiteral.of(Base.HEXADECIMAL, 0).toString());
        }
    }

    @Nested
    @DisplayName("字符串字面量")
    class StringTests {

        @Test
        @DisplayName("转义双引号和反斜杠")
        void testEscapes() {
            assertEquals("\"a\\\"b\\\\c\"", new StringLiteral("a\"b\\c").toString());
        }

        @Test
        @DisplayName("控制字符与非 ASCII 原样输出")
        void testPassThrough() {
            assertEquals("\"x\ny\t中文\"", LiteralFormatter.quote("x\ny\t中文"));
        }

        @Test
        @DisplayName("空字符串")
        void testEmpty() {
            assertEquals("\"\"", LiteralFormatter.quote(""));
        }
    }
}
