package com.hpb.compiler.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.hpb.compiler.ast.decl.SchemaPackage;

import java.io.IOException;
import java.io.StringReader;
import java.util.logging.Logger;

/**
 * 语法树与 JSON 之间的编解码
 *
 * <p>外部解析器（可用任意语言实现）以 JSON 形式交出语法树，本类将其还原为
 * {@link SchemaPackage} 供打印器使用；反方向用于生成测试夹具。</p>
 *
 * <p>格式约定：</p>
 * <ul>
 *   <li>带位置的值写作 {@code {"value": ..., "pos": {"file", "line", "column"}}}，
 *       {@code pos} 可省略（即未知位置）</li>
 *   <li>声明与成员以 {@code "kind"} 区分：import, option, enum, enumValue, message,
 *       field, oneof, extensions, extend, service, rpc</li>
 *   <li>整数字面量写作 {@code {"base": "HEXADECIMAL", "value": "255"}}，值为十进制字符串</li>
 * </ul>
 */
public class AstJson {
    private static final Logger LOG = Logger.getLogger(AstJson.class.getName());

    private final Gson gson;

    public AstJson() {
        this.gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
    }

    public JsonObject encode(SchemaPackage pkg) {
        return new AstJsonWriter().writePackage(pkg);
    }

    /**
     * @throws AstJsonException 结构不符合约定
     */
    public SchemaPackage decode(JsonElement json) {
        SchemaPackage pkg = new AstJsonReader().readPackage(json);
        LOG.fine("Decoded schema package: " + pkg.getDeclarations().size() + " declarations");
        return pkg;
    }

    public String toJson(SchemaPackage pkg) {
        return gson.toJson(encode(pkg));
    }

    /**
     * 严格解析：不接受未加引号的名称、注释或多余的尾随内容
     *
     * @throws AstJsonException 文本不是合法 JSON，或结构不符合约定
     */
    public SchemaPackage fromJson(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new AstJsonException("Empty document", "$");
        }
        JsonElement json;
        try (JsonReader reader = new JsonReader(new StringReader(text))) {
            reader.setLenient(false);
            json = gson.getAdapter(JsonElement.class).read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new AstJsonException("Invalid JSON: trailing content", "$");
            }
        } catch (IOException | JsonParseException e) {
            throw new AstJsonException("Invalid JSON: " + e.getMessage(), "$", e);
        }
        return decode(json);
    }
}
