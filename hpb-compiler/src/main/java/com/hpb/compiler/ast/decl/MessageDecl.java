package com.hpb.compiler.ast.decl;

import com.hpb.compiler.ast.AstNode;
import com.hpb.compiler.ast.AstVisitor;
import com.hpb.compiler.ast.Identifier;
import com.hpb.compiler.ast.Located;
import com.hpb.compiler.ast.literal.NumericLiteral;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 消息声明，可任意层级嵌套 message/enum/extend
 */
public class MessageDecl extends AstNode implements Decl, MessageField {

    /** 字段编号上限 2^29 - 1，{@code extensions N to max} 的上界 */
    public static final NumericLiteral EXTENSION_MAX = NumericLiteral.decimal((1L << 29) - 1);

    private final Located<Identifier> name;
    private final List<MessageField> fields;

    public MessageDecl(Located<Identifier> name, List<MessageField> fields) {
        this.name = Objects.requireNonNull(name, "name");
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public Located<Identifier> getName() {
        return name;
    }

    public List<MessageField> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMessageDecl(this, context);
    }
}
