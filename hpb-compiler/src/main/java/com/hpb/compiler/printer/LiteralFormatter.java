package com.hpb.compiler.printer;

import com.hpb.compiler.ast.CompoundName;
import com.hpb.compiler.ast.literal.NumericLiteral;

import java.math.BigInteger;

/**
 * 字面量与名称的源码格式化工具
 */
public final class LiteralFormatter {

    private LiteralFormatter() {}

    /**
     * 格式化整数字面量：进制前缀 + 数字串。
     *
     * <p>数字串由反复对进制取商/余得到，每一位写出余数的十进制文本。
     * 十六进制的 10-15 因此输出为 "10".."15" 而不是 a-f，与配套解析器的约定保持一致。</p>
     */
    public static String formatNumber(NumericLiteral literal) {
        NumericLiteral.Base base = literal.getBase();
        return base.prefix() + formatDigits(literal.getValue(), base.radix());
    }

    static String formatDigits(BigInteger value, int radix) {
        if (value.signum() == 0) {
            return "0";
        }
        BigInteger divisor = BigInteger.valueOf(radix);
        StringBuilder sb = new StringBuilder();
        BigInteger n = value;
        while (n.signum() != 0) {
            BigInteger[] qr = n.divideAndRemainder(divisor);
            sb.insert(0, qr[1].toString());
            n = qr[0];
        }
        return sb.toString();
    }

    /**
     * 加双引号并转义。只转义反斜杠和双引号，控制字符与非 ASCII 字符原样输出。
     */
    public static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                default: sb.append(c);
            }
        }
        sb.append('"');
        return sb.toString();
    }

    /** 复合名称：各分量以 . 连接 */
    public static String formatName(CompoundName name) {
        return name.getFullName();
    }

    public static String formatBool(boolean value) {
        return value ? "true" : "false";
    }
}
