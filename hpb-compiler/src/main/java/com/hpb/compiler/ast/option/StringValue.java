package com.hpb.compiler.ast.option;

import com.hpb.compiler.ast.literal.StringLiteral;

import java.util.Objects;

public final class StringValue extends OptionValue {
    private final StringLiteral literal;

    public StringValue(StringLiteral literal) {
        this.literal = Objects.requireNonNull(literal, "literal");
    }

    public StringLiteral getLiteral() {
        return literal;
    }

    @Override
    public <R> R accept(OptionValueVisitor<R> visitor) {
        return visitor.visitString(this);
    }
}
