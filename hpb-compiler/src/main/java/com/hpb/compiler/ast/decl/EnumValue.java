package com.hpb.compiler.ast.decl;

import com.hpb.compiler.ast.AstNode;
import com.hpb.compiler.ast.AstVisitor;
import com.hpb.compiler.ast.Identifier;
import com.hpb.compiler.ast.Located;
import com.hpb.compiler.ast.literal.NumericLiteral;

import java.util.Objects;

/**
 * 枚举值：{@code NAME = 1;}
 */
public class EnumValue extends AstNode implements EnumField {
    private final Located<Identifier> name;
    private final NumericLiteral number;

    public EnumValue(Located<Identifier> name, NumericLiteral number) {
        this.name = Objects.requireNonNull(name, "name");
        this.number = Objects.requireNonNull(number, "number");
    }

    public Located<Identifier> getName() {
        return name;
    }

    public NumericLiteral getNumber() {
        return number;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEnumValue(this, context);
    }
}
