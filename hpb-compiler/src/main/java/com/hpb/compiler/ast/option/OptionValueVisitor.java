package com.hpb.compiler.ast.option;

/**
 * OptionValue 轻量访问者接口
 */
public interface OptionValueVisitor<R> {
    R visitNumeric(NumericValue value);
    R visitIdentifier(IdentifierValue value);
    R visitString(StringValue value);
    R visitBool(BoolValue value);
}
