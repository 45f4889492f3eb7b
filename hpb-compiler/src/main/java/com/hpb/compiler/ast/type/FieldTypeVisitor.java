package com.hpb.compiler.ast.type;

/**
 * FieldType 轻量访问者接口，用于替代 instanceof 分派。
 */
public interface FieldTypeVisitor<R> {
    R visitScalar(ScalarFieldType type);
    R visitLocal(LocalTypeName type);
    R visitGlobal(GlobalTypeName type);
}
