package com.hpb.compiler.ast.option;

import com.hpb.compiler.ast.Identifier;

import java.util.Objects;

/**
 * 内置选项名（如 deprecated, java_package）
 */
public final class KnownOptionName extends OptionName {
    private final Identifier name;

    public KnownOptionName(Identifier name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public Identifier getName() {
        return name;
    }

    @Override
    public <R> R accept(OptionNameVisitor<R> visitor) {
        return visitor.visitKnown(this);
    }
}
