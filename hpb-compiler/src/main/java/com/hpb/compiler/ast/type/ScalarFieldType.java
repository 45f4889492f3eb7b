package com.hpb.compiler.ast.type;

import java.util.Objects;

/**
 * 标量字段类型（如 int32, string）
 */
public final class ScalarFieldType extends FieldType {
    private final ScalarType scalarType;

    public ScalarFieldType(ScalarType scalarType) {
        this.scalarType = Objects.requireNonNull(scalarType, "scalarType");
    }

    public ScalarType getScalarType() {
        return scalarType;
    }

    @Override
    public <R> R accept(FieldTypeVisitor<R> visitor) {
        return visitor.visitScalar(this);
    }
}
