package com.hpb.compiler.ast.option;

import com.hpb.compiler.ast.Identifier;

import java.util.Objects;

/**
 * 标识符选项值（如 optimize_for = SPEED 中的 SPEED）
 */
public final class IdentifierValue extends OptionValue {
    private final Identifier identifier;

    public IdentifierValue(Identifier identifier) {
        this.identifier = Objects.requireNonNull(identifier, "identifier");
    }

    public Identifier getIdentifier() {
        return identifier;
    }

    @Override
    public <R> R accept(OptionValueVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
