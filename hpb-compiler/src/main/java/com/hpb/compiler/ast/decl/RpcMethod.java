package com.hpb.compiler.ast.decl;

import com.hpb.compiler.ast.AstNode;
import com.hpb.compiler.ast.AstVisitor;
import com.hpb.compiler.ast.Identifier;
import com.hpb.compiler.ast.Located;
import com.hpb.compiler.ast.type.FieldType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * rpc 方法：{@code rpc Name(In, ...) returns (Out, ...)}，可带选项块
 */
public class RpcMethod extends AstNode implements ServiceField {
    private final Located<Identifier> name;
    private final List<Located<FieldType>> inputs;
    private final List<Located<FieldType>> outputs;
    private final List<OptionDecl> options;

    public RpcMethod(Located<Identifier> name, List<Located<FieldType>> inputs,
                     List<Located<FieldType>> outputs, List<OptionDecl> options) {
        this.name = Objects.requireNonNull(name, "name");
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        this.outputs = Collections.unmodifiableList(new ArrayList<>(outputs));
        this.options = Collections.unmodifiableList(new ArrayList<>(options));
    }

    public Located<Identifier> getName() {
        return name;
    }

    public List<Located<FieldType>> getInputs() {
        return inputs;
    }

    public List<Located<FieldType>> getOutputs() {
        return outputs;
    }

    public List<OptionDecl> getOptions() {
        return options;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRpcMethod(this, context);
    }
}
