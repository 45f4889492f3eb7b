package com.hpb.compiler.ast.type;

/**
 * 字段类型：标量、相对限定名或全局限定名（前导点）
 */
public abstract class FieldType {

    FieldType() {
    }

    public abstract <R> R accept(FieldTypeVisitor<R> visitor);
}
