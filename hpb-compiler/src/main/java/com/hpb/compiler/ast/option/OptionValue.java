package com.hpb.compiler.ast.option;

/**
 * 选项值：数字、标识符、字符串或布尔
 */
public abstract class OptionValue {

    OptionValue() {
    }

    public abstract <R> R accept(OptionValueVisitor<R> visitor);
}
