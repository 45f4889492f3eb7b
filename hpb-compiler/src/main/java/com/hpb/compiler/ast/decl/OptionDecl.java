package com.hpb.compiler.ast.decl;

import com.hpb.compiler.ast.AstNode;
import com.hpb.compiler.ast.AstVisitor;
import com.hpb.compiler.ast.Located;
import com.hpb.compiler.ast.option.OptionName;
import com.hpb.compiler.ast.option.OptionValue;

import java.util.Objects;

/**
 * 选项声明
 *
 * <p>既可单独成句（文件、消息、枚举、服务、rpc 中的 {@code option x = y;}），
 * 也可作为字段的内联选项（{@code [x = y]}）。</p>
 */
public class OptionDecl extends AstNode implements Decl, MessageField, EnumField, ServiceField {
    private final Located<OptionName> name;
    private final Located<OptionValue> value;

    public OptionDecl(Located<OptionName> name, Located<OptionValue> value) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = Objects.requireNonNull(value, "value");
    }

    public Located<OptionName> getName() {
        return name;
    }

    public Located<OptionValue> getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitOptionDecl(this, context);
    }
}
