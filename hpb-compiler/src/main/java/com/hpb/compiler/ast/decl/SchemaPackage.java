package com.hpb.compiler.ast.decl;

import com.hpb.compiler.ast.AstNode;
import com.hpb.compiler.ast.AstVisitor;
import com.hpb.compiler.ast.CompoundName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 包（一个 schema 文件的完整语法树）
 */
public class SchemaPackage extends AstNode {
    private final CompoundName name;  // 可选
    private final List<Decl> declarations;

    public SchemaPackage(CompoundName name, List<Decl> declarations) {
        this.name = name;
        this.declarations = Collections.unmodifiableList(new ArrayList<>(declarations));
    }

    public CompoundName getName() {
        return name;
    }

    public boolean hasName() {
        return name != null;
    }

    public List<Decl> getDeclarations() {
        return declarations;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPackage(this, context);
    }
}
