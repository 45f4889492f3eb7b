package com.hpb.compiler.printer;

import com.hpb.compiler.ast.Identifier;
import com.hpb.compiler.ast.Located;
import com.hpb.compiler.ast.decl.OptionDecl;
import com.hpb.compiler.ast.option.*;
import com.hpb.compiler.ast.type.FieldType;
import com.hpb.compiler.ast.type.FieldTypeVisitor;
import com.hpb.compiler.ast.type.GlobalTypeName;
import com.hpb.compiler.ast.type.LocalTypeName;
import com.hpb.compiler.ast.type.ScalarFieldType;

/**
 * 单行片段格式化：字段类型、选项名、选项值
 */
final class TermFormatter implements FieldTypeVisitor<String>, OptionNameVisitor<String>, OptionValueVisitor<String> {

    static final TermFormatter INSTANCE = new TermFormatter();

    private TermFormatter() {}

    String formatType(FieldType type) {
        return type.accept(this);
    }

    /** 内联选项：{@code name = value} */
    String formatInlineOption(OptionDecl option) {
        return option.getName().getValue().accept(this)
                + " = "
                + option.getValue().getValue().accept(this);
    }

    // ============ 字段类型 ============

    @Override
    public String visitScalar(ScalarFieldType type) {
        return type.getScalarType().getKeyword();
    }

    @Override
    public String visitLocal(LocalTypeName type) {
        return LiteralFormatter.formatName(type.getName());
    }

    @Override
    public String visitGlobal(GlobalTypeName type) {
        return "." + LiteralFormatter.formatName(type.getName());
    }

    // ============ 选项名 ============

    @Override
    public String visitKnown(KnownOptionName name) {
        return name.getName().getText();
    }

    @Override
    public String visitCustom(CustomOptionName name) {
        StringBuilder sb = new StringBuilder();
        sb.append('(').append(name.getExtensionName()).append(')');
        for (Located<Identifier> part : name.getFieldPath()) {
            sb.append('.').append(part.getValue().getText());
        }
        return sb.toString();
    }

    // ============ 选项值 ============

    @Override
    public String visitNumeric(NumericValue value) {
        return LiteralFormatter.formatNumber(value.getLiteral());
    }

    @Override
    public String visitIdentifier(IdentifierValue value) {
        return value.getIdentifier().getText();
    }

    @Override
    public String visitString(StringValue value) {
        return LiteralFormatter.quote(value.getLiteral().getValue());
    }

    @Override
    public String visitBool(BoolValue value) {
        return LiteralFormatter.formatBool(value.getValue());
    }
}
