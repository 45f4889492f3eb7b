package com.hpb.compiler.ast.option;

import com.hpb.compiler.ast.literal.NumericLiteral;

import java.util.Objects;

public final class NumericValue extends OptionValue {
    private final NumericLiteral literal;

    public NumericValue(NumericLiteral literal) {
        this.literal = Objects.requireNonNull(literal, "literal");
    }

    public NumericLiteral getLiteral() {
        return literal;
    }

    @Override
    public <R> R accept(OptionValueVisitor<R> visitor) {
        return visitor.visitNumeric(this);
    }
}
