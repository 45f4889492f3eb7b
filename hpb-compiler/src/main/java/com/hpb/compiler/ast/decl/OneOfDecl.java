package com.hpb.compiler.ast.decl;

import com.hpb.compiler.ast.AstNode;
import com.hpb.compiler.ast.AstVisitor;
import com.hpb.compiler.ast.Identifier;
import com.hpb.compiler.ast.Located;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * oneof 分组，内部字段没有规则
 */
public class OneOfDecl extends AstNode implements MessageField {
    private final Located<Identifier> name;
    private final List<Field> fields;

    public OneOfDecl(Located<Identifier> name, List<Field> fields) {
        this.name = Objects.requireNonNull(name, "name");
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public Located<Identifier> getName() {
        return name;
    }

    public List<Field> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitOneOfDecl(this, context);
    }
}
