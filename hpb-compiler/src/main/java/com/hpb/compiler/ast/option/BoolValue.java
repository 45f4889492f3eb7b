package com.hpb.compiler.ast.option;

public final class BoolValue extends OptionValue {
    public static final BoolValue TRUE = new BoolValue(true);
    public static final BoolValue FALSE = new BoolValue(false);

    private final boolean value;

    private BoolValue(boolean value) {
        this.value = value;
    }

    public static BoolValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public <R> R accept(OptionValueVisitor<R> visitor) {
        return visitor.visitBool(this);
    }
}
