package com.hpb.compiler.json;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.hpb.compiler.ast.CompoundName;
import com.hpb.compiler.ast.Identifier;
import com.hpb.compiler.ast.Located;
import com.hpb.compiler.ast.MalformedNameException;
import com.hpb.compiler.ast.SourcePos;
import com.hpb.compiler.ast.decl.*;
import com.hpb.compiler.ast.literal.NumericLiteral;
import com.hpb.compiler.ast.literal.StringLiteral;
import com.hpb.compiler.ast.option.*;
import com.hpb.compiler.ast.type.FieldType;
import com.hpb.compiler.ast.type.GlobalTypeName;
import com.hpb.compiler.ast.type.LocalTypeName;
import com.hpb.compiler.ast.type.ScalarFieldType;
import com.hpb.compiler.ast.type.ScalarType;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;

/**
 * JSON → 语法树
 *
 * <p>每个读取方法都带上当前 JSON 路径，出错时抛出 {@link AstJsonException} 指明位置。</p>
 */
class AstJsonReader {

    SchemaPackage readPackage(JsonElement json) {
        JsonObject obj = asObject(json, "$");
        CompoundName name = null;
        if (has(obj, "package")) {
            name = readName(obj.get("package"), "$.package");
        }
        List<Decl> decls = readList(obj, "declarations", "$", this::readDecl);
        return new SchemaPackage(name, decls);
    }

    // ============ 声明 ============

    private Decl readDecl(JsonElement json, String path) {
        JsonObject obj = asObject(json, path);
        String kind = requireString(obj, "kind", path);
        switch (kind) {
            case "import":  return readImport(obj, path);
            case "option":  return readOption(obj, path);
            case "enum":    return readEnum(obj, path);
            case "message": return readMessage(obj, path);
            case "extend":  return readExtend(obj, path);
            case "service": return readService(obj, path);
            default:
                throw new AstJsonException("Unknown declaration kind '" + kind + "'", path + ".kind");
        }
    }

    private ImportDecl readImport(JsonObject obj, String path) {
        boolean isPublic = has(obj, "public") && requireBoolean(obj, "public", path);
        Located<StringLiteral> importPath = readLocated(obj, "path", path,
                (value, p) -> new StringLiteral(asString(value, p)));
        return new ImportDecl(isPublic ? ImportVisibility.PUBLIC : ImportVisibility.PRIVATE, importPath);
    }

    private OptionDecl readOption(JsonObject obj, String path) {
        Located<OptionName> name = readLocated(obj, "name", path, this::readOptionName);
        Located<OptionValue> value = readLocated(obj, "value", path, this::readOptionValue);
        return new OptionDecl(name, value);
    }

    private EnumDecl readEnum(JsonObject obj, String path) {
        Located<Identifier> name = readIdentifier(obj, "name", path);
        List<EnumField> fields = readList(obj, "fields", path, this::readEnumField);
        return new EnumDecl(name, fields);
    }

    private EnumField readEnumField(JsonElement json, String path) {
        JsonObject obj = asObject(json, path);
        String kind = requireString(obj, "kind", path);
        switch (kind) {
            case "enumValue":
                return new EnumValue(readIdentifier(obj, "name", path),
                        readNumber(require(obj, "number", path), path + ".number"));
            case "option":
                return readOption(obj, path);
            default:
                throw new AstJsonException("Unknown enum member kind '" + kind + "'", path + ".kind");
        }
    }

    private MessageDecl readMessage(JsonObject obj, String path) {
        Located<Identifier> name = readIdentifier(obj, "name", path);
        List<MessageField> fields = readList(obj, "fields", path, this::readMessageField);
        return new MessageDecl(name, fields);
    }

    private MessageField readMessageField(JsonElement json, String path) {
        JsonObject obj = asObject(json, path);
        String kind = requireString(obj, "kind", path);
        switch (kind) {
            case "field":      return readFieldDecl(obj, path);
            case "option":     return readOption(obj, path);
            case "oneof":      return readOneOf(obj, path);
            case "extensions": return readExtensions(obj, path);
            case "enum":       return readEnum(obj, path);
            case "message":    return readMessage(obj, path);
            case "extend":     return readExtend(obj, path);
            default:
                throw new AstJsonException("Unknown message member kind '" + kind + "'", path + ".kind");
        }
    }

    private FieldDecl readFieldDecl(JsonObject obj, String path) {
        String rule = requireString(obj, "rule", path);
        FieldRule fieldRule;
        try {
            fieldRule = FieldRule.valueOf(rule);
        } catch (IllegalArgumentException e) {
            throw new AstJsonException("Unknown field rule '" + rule + "'", path + ".rule", e);
        }
        return new FieldDecl(fieldRule, readField(obj, path));
    }

    private Field readField(JsonElement json, String path) {
        JsonObject obj = asObject(json, path);
        Located<FieldType> type = readLocated(obj, "type", path, this::readFieldType);
        Located<Identifier> name = readIdentifier(obj, "name", path);
        Located<NumericLiteral> tag = readLocated(obj, "tag", path, this::readNumber);
        List<OptionDecl> options = readList(obj, "options", path,
                (element, p) -> readOption(asObject(element, p), p));
        return new Field(type, name, tag, options);
    }

    private OneOfDecl readOneOf(JsonObject obj, String path) {
        Located<Identifier> name = readIdentifier(obj, "name", path);
        List<Field> fields = readList(obj, "fields", path, this::readField);
        return new OneOfDecl(name, fields);
    }

    private ExtensionsDecl readExtensions(JsonObject obj, String path) {
        SourcePos pos = has(obj, "pos") ? readPos(obj.get("pos"), path + ".pos") : SourcePos.UNKNOWN;
        Located<NumericLiteral> low = readLocated(obj, "low", path, this::readNumber);
        Located<NumericLiteral> high = readLocated(obj, "high", path, this::readNumber);
        return new ExtensionsDecl(pos, low, high);
    }

    private ExtendDecl readExtend(JsonObject obj, String path) {
        Located<Identifier> target = readIdentifier(obj, "target", path);
        List<FieldDecl> fields = readList(obj, "fields", path,
                (element, p) -> readFieldDecl(asObject(element, p), p));
        return new ExtendDecl(target, fields);
    }

    private ServiceDecl readService(JsonObject obj, String path) {
        Located<Identifier> name = readIdentifier(obj, "name", path);
        List<ServiceField> fields = readList(obj, "fields", path, this::readServiceField);
        return new ServiceDecl(name, fields);
    }

    private ServiceField readServiceField(JsonElement json, String path) {
        JsonObject obj = asObject(json, path);
        String kind = requireString(obj, "kind", path);
        switch (kind) {
            case "rpc":    return readRpc(obj, path);
            case "option": return readOption(obj, path);
            default:
                throw new AstJsonException("Unknown service member kind '" + kind + "'", path + ".kind");
        }
    }

    private RpcMethod readRpc(JsonObject obj, String path) {
        Located<Identifier> name = readIdentifier(obj, "name", path);
        List<Located<FieldType>> inputs = readList(obj, "inputs", path,
                (element, p) -> readLocatedValue(element, p, this::readFieldType));
        List<Located<FieldType>> outputs = readList(obj, "outputs", path,
                (element, p) -> readLocatedValue(element, p, this::readFieldType));
        List<OptionDecl> options = readList(obj, "options", path,
                (element, p) -> readOption(asObject(element, p), p));
        return new RpcMethod(name, inputs, outputs, options);
    }

    // ============ 类型/选项/字面量 ============

    private FieldType readFieldType(JsonElement json, String path) {
        JsonObject obj = asObject(json, path);
        if (has(obj, "scalar")) {
            String keyword = requireString(obj, "scalar", path);
            ScalarType scalar = ScalarType.fromKeyword(keyword);
            if (scalar == null) {
                throw new AstJsonException("Unknown scalar type '" + keyword + "'", path + ".scalar");
            }
            return new ScalarFieldType(scalar);
        }
        if (has(obj, "local")) {
            return new LocalTypeName(readName(obj.get("local"), path + ".local"));
        }
        if (has(obj, "global")) {
            return new GlobalTypeName(readName(obj.get("global"), path + ".global"));
        }
        throw new AstJsonException("Field type needs one of 'scalar', 'local', 'global'", path);
    }

    private OptionName readOptionName(JsonElement json, String path) {
        JsonObject obj = asObject(json, path);
        if (has(obj, "known")) {
            return new KnownOptionName(new Identifier(requireString(obj, "known", path)));
        }
        if (has(obj, "custom")) {
            List<Located<Identifier>> fieldPath = readList(obj, "path", path,
                    (element, p) -> readLocatedValue(element, p, (v, vp) -> new Identifier(asString(v, vp))));
            return new CustomOptionName(requireString(obj, "custom", path), fieldPath);
        }
        throw new AstJsonException("Option name needs one of 'known', 'custom'", path);
    }

    private OptionValue readOptionValue(JsonElement json, String path) {
        JsonObject obj = asObject(json, path);
        if (has(obj, "number")) {
            return new NumericValue(readNumber(obj.get("number"), path + ".number"));
        }
        if (has(obj, "ident")) {
            return new IdentifierValue(new Identifier(requireString(obj, "ident", path)));
        }
        if (has(obj, "string")) {
            return new StringValue(new StringLiteral(requireString(obj, "string", path)));
        }
        if (has(obj, "bool")) {
            return BoolValue.of(requireBoolean(obj, "bool", path));
        }
        throw new AstJsonException("Option value needs one of 'number', 'ident', 'string', 'bool'", path);
    }

    private NumericLiteral readNumber(JsonElement json, String path) {
        JsonObject obj = asObject(json, path);
        String base = requireString(obj, "base", path);
        NumericLiteral.Base numBase;
        try {
            numBase = NumericLiteral.Base.valueOf(base);
        } catch (IllegalArgumentException e) {
            throw new AstJsonException("Unknown numeric base '" + base + "'", path + ".base", e);
        }
        String digits = requireString(obj, "value", path);
        try {
            return new NumericLiteral(numBase, new BigInteger(digits));
        } catch (IllegalArgumentException e) {
            // NumberFormatException 亦在此列
            throw new AstJsonException("Invalid numeric value '" + digits + "'", path + ".value", e);
        }
    }

    private CompoundName readName(JsonElement json, String path) {
        List<Located<Identifier>> components = readArray(json, path,
                (element, p) -> readLocatedValue(element, p, (v, vp) -> new Identifier(asString(v, vp))));
        try {
            return CompoundName.of(components);
        } catch (MalformedNameException e) {
            throw new AstJsonException(e.getMessage(), path, e);
        }
    }

    // ============ 位置 ============

    private Located<Identifier> readIdentifier(JsonObject obj, String member, String path) {
        return readLocated(obj, member, path, (value, p) -> new Identifier(asString(value, p)));
    }

    private <T> Located<T> readLocated(JsonObject obj, String member, String path,
                                       BiFunction<JsonElement, String, T> valueReader) {
        return readLocatedValue(require(obj, member, path), path + "." + member, valueReader);
    }

    private <T> Located<T> readLocatedValue(JsonElement json, String path,
                                            BiFunction<JsonElement, String, T> valueReader) {
        JsonObject obj = asObject(json, path);
        T value = valueReader.apply(require(obj, "value", path), path + ".value");
        SourcePos pos = has(obj, "pos") ? readPos(obj.get("pos"), path + ".pos") : SourcePos.UNKNOWN;
        return new Located<>(value, pos);
    }

    private SourcePos readPos(JsonElement json, String path) {
        JsonObject obj = asObject(json, path);
        return new SourcePos(requireString(obj, "file", path),
                requireInt(obj, "line", path),
                requireInt(obj, "column", path));
    }

    // ============ 基础读取 ============

    private <T> List<T> readList(JsonObject obj, String member, String path,
                                 BiFunction<JsonElement, String, T> itemReader) {
        if (!has(obj, member)) {
            return Collections.emptyList();
        }
        return readArray(obj.get(member), path + "." + member, itemReader);
    }

    private <T> List<T> readArray(JsonElement json, String path,
                                  BiFunction<JsonElement, String, T> itemReader) {
        if (!json.isJsonArray()) {
            throw new AstJsonException("Expected array", path);
        }
        JsonArray array = json.getAsJsonArray();
        List<T> items = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            items.add(itemReader.apply(array.get(i), path + "[" + i + "]"));
        }
        return items;
    }

    private static boolean has(JsonObject obj, String member) {
        return obj.has(member) && !obj.get(member).isJsonNull();
    }

    private static JsonElement require(JsonObject obj, String member, String path) {
        if (!has(obj, member)) {
            throw new AstJsonException("Missing member '" + member + "'", path);
        }
        return obj.get(member);
    }

    private static JsonObject asObject(JsonElement json, String path) {
        if (!json.isJsonObject()) {
            throw new AstJsonException("Expected object", path);
        }
        return json.getAsJsonObject();
    }

    private static String asString(JsonElement json, String path) {
        if (!json.isJsonPrimitive() || !json.getAsJsonPrimitive().isString()) {
            throw new AstJsonException("Expected string", path);
        }
        return json.getAsString();
    }

    private static String requireString(JsonObject obj, String member, String path) {
        return asString(require(obj, member, path), path + "." + member);
    }

    private static boolean requireBoolean(JsonObject obj, String member, String path) {
        JsonElement json = require(obj, member, path);
        if (!json.isJsonPrimitive() || !json.getAsJsonPrimitive().isBoolean()) {
            throw new AstJsonException("Expected boolean", path + "." + member);
        }
        return json.getAsBoolean();
    }

    private static int requireInt(JsonObject obj, String member, String path) {
        JsonElement json = require(obj, member, path);
        if (!json.isJsonPrimitive() || !json.getAsJsonPrimitive().isNumber()) {
            throw new AstJsonException("Expected number", path + "." + member);
        }
        JsonPrimitive primitive = json.getAsJsonPrimitive();
        try {
            return primitive.getAsBigDecimal().intValueExact();
        } catch (ArithmeticException e) {
            throw new AstJsonException("Expected integer", path + "." + member, e);
        }
    }
}
