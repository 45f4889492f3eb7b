package com.hpb.compiler;

import com.hpb.compiler.ast.Identifier;
import com.hpb.compiler.ast.Located;
import com.hpb.compiler.ast.decl.Field;
import com.hpb.compiler.ast.decl.FieldDecl;
import com.hpb.compiler.ast.decl.FieldRule;
import com.hpb.compiler.ast.decl.OptionDecl;
import com.hpb.compiler.ast.literal.NumericLiteral;
import com.hpb.compiler.ast.option.BoolValue;
import com.hpb.compiler.ast.option.KnownOptionName;
import com.hpb.compiler.ast.option.OptionValue;
import com.hpb.compiler.ast.type.FieldType;
import com.hpb.compiler.ast.type.ScalarFieldType;
import com.hpb.compiler.ast.type.ScalarType;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 测试用语法树构造辅助
 */
public final class TestTrees {

    private TestTrees() {}

    public static Located<Identifier> ident(String name) {
        return Located.unknown(new Identifier(name));
    }

    public static Located<FieldType> scalar(ScalarType type) {
        return Located.unknown(new ScalarFieldType(type));
    }

    public static Located<NumericLiteral> tag(long value) {
        return Located.unknown(NumericLiteral.decimal(value));
    }

    public static Field field(ScalarType type, String name, long tag, OptionDecl... options) {
        return new Field(scalar(type), ident(name), tag(tag), Arrays.asList(options));
    }

    public static FieldDecl fieldDecl(FieldRule rule, ScalarType type, String name, long tag) {
        return new FieldDecl(rule, field(type, name, tag));
    }

    public static OptionDecl option(String name, OptionValue value) {
        return new OptionDecl(Located.unknown(new KnownOptionName(new Identifier(name))), Located.unknown(value));
    }

    public static OptionDecl option(String name, boolean value) {
        return option(name, BoolValue.of(value));
    }

    public static <T> List<T> none() {
        return Collections.emptyList();
    }
}
