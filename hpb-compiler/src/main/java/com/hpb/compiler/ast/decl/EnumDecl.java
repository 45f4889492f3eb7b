package com.hpb.compiler.ast.decl;

import com.hpb.compiler.ast.AstNode;
import com.hpb.compiler.ast.AstVisitor;
import com.hpb.compiler.ast.Identifier;
import com.hpb.compiler.ast.Located;
import com.hpb.compiler.ast.SourcePos;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 枚举声明
 */
public class EnumDecl extends AstNode implements Decl, MessageField {
    private final Located<Identifier> name;
    private final List<EnumField> fields;

    public EnumDecl(Located<Identifier> name, List<EnumField> fields) {
        this.name = Objects.requireNonNull(name, "name");
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public Located<Identifier> getName() {
        return name;
    }

    public List<EnumField> getFields() {
        return fields;
    }

    /** 枚举名所在位置 */
    public SourcePos getPosition() {
        return name.getPos();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEnumDecl(this, context);
    }
}
