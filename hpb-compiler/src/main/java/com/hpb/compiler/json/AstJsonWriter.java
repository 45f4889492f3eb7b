package com.hpb.compiler.json;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.hpb.compiler.ast.AstVisitor;
import com.hpb.compiler.ast.CompoundName;
import com.hpb.compiler.ast.Identifier;
import com.hpb.compiler.ast.Located;
import com.hpb.compiler.ast.SourcePos;
import com.hpb.compiler.ast.decl.*;
import com.hpb.compiler.ast.literal.NumericLiteral;
import com.hpb.compiler.ast.option.*;
import com.hpb.compiler.ast.type.FieldType;
import com.hpb.compiler.ast.type.FieldTypeVisitor;
import com.hpb.compiler.ast.type.GlobalTypeName;
import com.hpb.compiler.ast.type.LocalTypeName;
import com.hpb.compiler.ast.type.ScalarFieldType;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 语法树 → JSON
 */
class AstJsonWriter implements AstVisitor<JsonObject, Void>,
        FieldTypeVisitor<JsonObject>, OptionNameVisitor<JsonObject>, OptionValueVisitor<JsonObject> {

    JsonObject writePackage(SchemaPackage pkg) {
        return visitPackage(pkg, null);
    }

    // ============ 顶层 ============

    @Override
    public JsonObject visitPackage(SchemaPackage node, Void ctx) {
        JsonObject obj = new JsonObject();
        if (node.hasName()) {
            obj.add("package", writeName(node.getName()));
        }
        obj.add("declarations", writeList(node.getDeclarations(), decl -> decl.accept(this, null)));
        return obj;
    }

    @Override
    public JsonObject visitImportDecl(ImportDecl node, Void ctx) {
        JsonObject obj = kind("import");
        if (node.isPublic()) {
            obj.addProperty("public", true);
        }
        obj.add("path", writeLocated(node.getPath(), path -> new JsonPrimitive(path.getValue())));
        return obj;
    }

    @Override
    public JsonObject visitOptionDecl(OptionDecl node, Void ctx) {
        JsonObject obj = kind("option");
        obj.add("name", writeLocated(node.getName(), name -> name.accept(this)));
        obj.add("value", writeLocated(node.getValue(), value -> value.accept(this)));
        return obj;
    }

    // ============ 枚举 ============

    @Override
    public JsonObject visitEnumDecl(EnumDecl node, Void ctx) {
        JsonObject obj = kind("enum");
        obj.add("name", writeIdentifier(node.getName()));
        obj.add("fields", writeList(node.getFields(), field -> field.accept(this, null)));
        return obj;
    }

    @Override
    public JsonObject visitEnumValue(EnumValue node, Void ctx) {
        JsonObject obj = kind("enumValue");
        obj.add("name", writeIdentifier(node.getName()));
        obj.add("number", writeNumber(node.getNumber()));
        return obj;
    }

    // ============ 消息 ============

    @Override
    public JsonObject visitMessageDecl(MessageDecl node, Void ctx) {
        JsonObject obj = kind("message");
        obj.add("name", writeIdentifier(node.getName()));
        obj.add("fields", writeList(node.getFields(), field -> field.accept(this, null)));
        return obj;
    }

    @Override
    public JsonObject visitFieldDecl(FieldDecl node, Void ctx) {
        JsonObject obj = kind("field");
        obj.addProperty("rule", node.getRule().name());
        for (Map.Entry<String, JsonElement> entry : visitField(node.getField(), null).entrySet()) {
            obj.add(entry.getKey(), entry.getValue());
        }
        return obj;
    }

    @Override
    public JsonObject visitField(Field node, Void ctx) {
        JsonObject obj = new JsonObject();
        obj.add("type", writeLocated(node.getType(), type -> type.accept(this)));
        obj.add("name", writeIdentifier(node.getName()));
        obj.add("tag", writeLocated(node.getTag(), this::writeNumber));
        if (!node.getOptions().isEmpty()) {
            obj.add("options", writeList(node.getOptions(), option -> visitOptionDecl(option, null)));
        }
        return obj;
    }

    @Override
    public JsonObject visitOneOfDecl(OneOfDecl node, Void ctx) {
        JsonObject obj = kind("oneof");
        obj.add("name", writeIdentifier(node.getName()));
        obj.add("fields", writeList(node.getFields(), field -> visitField(field, null)));
        return obj;
    }

    @Override
    public JsonObject visitExtensionsDecl(ExtensionsDecl node, Void ctx) {
        JsonObject obj = kind("extensions");
        if (!SourcePos.UNKNOWN.equals(node.getPosition())) {
            obj.add("pos", writePos(node.getPosition()));
        }
        obj.add("low", writeLocated(node.getLow(), this::writeNumber));
        obj.add("high", writeLocated(node.getHigh(), this::writeNumber));
        return obj;
    }

    @Override
    public JsonObject visitExtendDecl(ExtendDecl node, Void ctx) {
        JsonObject obj = kind("extend");
        obj.add("target", writeIdentifier(node.getTarget()));
        obj.add("fields", writeList(node.getFields(), field -> visitFieldDecl(field, null)));
        return obj;
    }

    // ============ 服务 ============

    @Override
    public JsonObject visitServiceDecl(ServiceDecl node, Void ctx) {
        JsonObject obj = kind("service");
        obj.add("name", writeIdentifier(node.getName()));
        obj.add("fields", writeList(node.getFields(), field -> field.accept(this, null)));
        return obj;
    }

    @Override
    public JsonObject visitRpcMethod(RpcMethod node, Void ctx) {
        JsonObject obj = kind("rpc");
        obj.add("name", writeIdentifier(node.getName()));
        obj.add("inputs", writeList(node.getInputs(), type -> writeLocated(type, t -> t.accept(this))));
        obj.add("outputs", writeList(node.getOutputs(), type -> writeLocated(type, t -> t.accept(this))));
        if (!node.getOptions().isEmpty()) {
            obj.add("options", writeList(node.getOptions(), option -> visitOptionDecl(option, null)));
        }
        return obj;
    }

    // ============ 字段类型 ============

    @Override
    public JsonObject visitScalar(ScalarFieldType type) {
        JsonObject obj = new JsonObject();
        obj.addProperty("scalar", type.getScalarType().getKeyword());
        return obj;
    }

    @Override
    public JsonObject visitLocal(LocalTypeName type) {
        JsonObject obj = new JsonObject();
        obj.add("local", writeName(type.getName()));
        return obj;
    }

    @Override
    public JsonObject visitGlobal(GlobalTypeName type) {
        JsonObject obj = new JsonObject();
        obj.add("global", writeName(type.getName()));
        return obj;
    }

    // ============ 选项名/值 ============

    @Override
    public JsonObject visitKnown(KnownOptionName name) {
        JsonObject obj = new JsonObject();
        obj.addProperty("known", name.getName().getText());
        return obj;
    }

    @Override
    public JsonObject visitCustom(CustomOptionName name) {
        JsonObject obj = new JsonObject();
        obj.addProperty("custom", name.getExtensionName());
        obj.add("path", writeList(name.getFieldPath(), this::writeIdentifier));
        return obj;
    }

    @Override
    public JsonObject visitNumeric(NumericValue value) {
        JsonObject obj = new JsonObject();
        obj.add("number", writeNumber(value.getLiteral()));
        return obj;
    }

    @Override
    public JsonObject visitIdentifier(IdentifierValue value) {
        JsonObject obj = new JsonObject();
        obj.addProperty("ident", value.getIdentifier().getText());
        return obj;
    }

    @Override
    public JsonObject visitString(StringValue value) {
        JsonObject obj = new JsonObject();
        obj.addProperty("string", value.getLiteral().getValue());
        return obj;
    }

    @Override
    public JsonObject visitBool(BoolValue value) {
        JsonObject obj = new JsonObject();
        obj.addProperty("bool", value.getValue());
        return obj;
    }

    // ============ 辅助方法 ============

    private static JsonObject kind(String kind) {
        JsonObject obj = new JsonObject();
        obj.addProperty("kind", kind);
        return obj;
    }

    private <T> JsonObject writeLocated(Located<T> located, Function<T, JsonElement> valueWriter) {
        JsonObject obj = new JsonObject();
        obj.add("value", valueWriter.apply(located.getValue()));
        if (!SourcePos.UNKNOWN.equals(located.getPos())) {
            obj.add("pos", writePos(located.getPos()));
        }
        return obj;
    }

    private JsonObject writeIdentifier(Located<Identifier> identifier) {
        return writeLocated(identifier, id -> new JsonPrimitive(id.getText()));
    }

    private JsonArray writeName(CompoundName name) {
        return writeList(name.getComponents(), this::writeIdentifier);
    }

    private JsonObject writeNumber(NumericLiteral literal) {
        JsonObject obj = new JsonObject();
        obj.addProperty("base", literal.getBase().name());
        obj.addProperty("value", literal.getValue().toString());
        return obj;
    }

    private static JsonObject writePos(SourcePos pos) {
        JsonObject obj = new JsonObject();
        obj.addProperty("file", pos.getFile());
        obj.addProperty("line", pos.getLine());
        obj.addProperty("column", pos.getColumn());
        return obj;
    }

    private static <T> JsonArray writeList(List<T> items, Function<T, ? extends JsonElement> writer) {
        JsonArray array = new JsonArray();
        for (T item : items) {
            array.add(writer.apply(item));
        }
        return array;
    }
}
