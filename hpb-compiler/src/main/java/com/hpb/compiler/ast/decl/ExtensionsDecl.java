package com.hpb.compiler.ast.decl;

import com.hpb.compiler.ast.AstNode;
import com.hpb.compiler.ast.AstVisitor;
import com.hpb.compiler.ast.Located;
import com.hpb.compiler.ast.SourcePos;
import com.hpb.compiler.ast.literal.NumericLiteral;

import java.util.Objects;

/**
 * 扩展范围：{@code extensions low to high}
 */
public class ExtensionsDecl extends AstNode implements MessageField {
    private final SourcePos position;  // extensions 关键字位置
    private final Located<NumericLiteral> low;
    private final Located<NumericLiteral> high;

    public ExtensionsDecl(SourcePos position, Located<NumericLiteral> low, Located<NumericLiteral> high) {
        this.position = Objects.requireNonNull(position, "position");
        this.low = Objects.requireNonNull(low, "low");
        this.high = Objects.requireNonNull(high, "high");
    }

    public SourcePos getPosition() {
        return position;
    }

    public Located<NumericLiteral> getLow() {
        return low;
    }

    public Located<NumericLiteral> getHigh() {
        return high;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExtensionsDecl(this, context);
    }
}
