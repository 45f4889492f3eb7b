package com.hpb.compiler.ast.type;

import com.hpb.compiler.ast.CompoundName;

import java.util.Objects;

/**
 * 从根包开始解析的类型名（源码中以 . 开头，如 .pkg.Message）
 */
public final class GlobalTypeName extends FieldType {
    private final CompoundName name;

    public GlobalTypeName(CompoundName name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public CompoundName getName() {
        return name;
    }

    @Override
    public <R> R accept(FieldTypeVisitor<R> visitor) {
        return visitor.visitGlobal(this);
    }
}
