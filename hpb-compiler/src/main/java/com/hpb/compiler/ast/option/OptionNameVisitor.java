package com.hpb.compiler.ast.option;

/**
 * OptionName 轻量访问者接口
 */
public interface OptionNameVisitor<R> {
    R visitKnown(KnownOptionName name);
    R visitCustom(CustomOptionName name);
}
