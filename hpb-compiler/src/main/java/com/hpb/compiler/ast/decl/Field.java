package com.hpb.compiler.ast.decl;

import com.hpb.compiler.ast.AstNode;
import com.hpb.compiler.ast.AstVisitor;
import com.hpb.compiler.ast.Identifier;
import com.hpb.compiler.ast.Located;
import com.hpb.compiler.ast.literal.NumericLiteral;
import com.hpb.compiler.ast.type.FieldType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 字段（不含规则）：{@code type name = tag [options];}
 *
 * <p>oneof 内直接使用；消息和 extend 中由 {@link FieldDecl} 附加规则。</p>
 */
public class Field extends AstNode {
    private final Located<FieldType> type;
    private final Located<Identifier> name;
    private final Located<NumericLiteral> tag;
    private final List<OptionDecl> options;

    public Field(Located<FieldType> type, Located<Identifier> name,
                 Located<NumericLiteral> tag, List<OptionDecl> options) {
        this.type = Objects.requireNonNull(type, "type");
        this.name = Objects.requireNonNull(name, "name");
        this.tag = Objects.requireNonNull(tag, "tag");
        this.options = Collections.unmodifiableList(new ArrayList<>(options));
    }

    public Located<FieldType> getType() {
        return type;
    }

    public Located<Identifier> getName() {
        return name;
    }

    public Located<NumericLiteral> getTag() {
        return tag;
    }

    public List<OptionDecl> getOptions() {
        return options;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitField(this, context);
    }
}
