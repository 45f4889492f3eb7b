package com.hpb.compiler.ast.option;

/**
 * 选项名：内置选项或括号包裹的扩展选项
 */
public abstract class OptionName {

    OptionName() {
    }

    public abstract <R> R accept(OptionNameVisitor<R> visitor);
}
