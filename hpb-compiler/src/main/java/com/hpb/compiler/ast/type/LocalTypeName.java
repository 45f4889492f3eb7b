package com.hpb.compiler.ast.type;

import com.hpb.compiler.ast.CompoundName;

import java.util.Objects;

/**
 * 相对当前作用域解析的消息/枚举类型名（如 Outer.Inner）
 */
public final class LocalTypeName extends FieldType {
    private final CompoundName name;

    public LocalTypeName(CompoundName name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public CompoundName getName() {
        return name;
    }

    @Override
    public <R> R accept(FieldTypeVisitor<R> visitor) {
        return visitor.visitLocal(this);
    }
}
