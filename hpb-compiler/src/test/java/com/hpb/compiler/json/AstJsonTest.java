package com.hpb.compiler.json;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.hpb.compiler.ast.MalformedNameException;
import com.hpb.compiler.ast.SourcePos;
import com.hpb.compiler.ast.decl.*;
import com.hpb.compiler.ast.type.GlobalTypeName;
import com.hpb.compiler.printer.SchemaPrinter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

/**
 * AstJson 编解码测试
 */
class AstJsonTest {

    private final AstJson json = new AstJson();

    private static String resource(String name) throws IOException {
        try (InputStream in = AstJsonTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertThat(in).as("fixture %s", name).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Nested
    @DisplayName("解码")
    class DecodeTests {

        @Test
        @DisplayName("夹具解码后打印为规范源码")
        void testFixtureRendersCanonicalText() throws IOException {
            SchemaPackage pkg = json.fromJson(resource("addressbook.json"));
            String expected = resource("addressbook.proto");
            assertThat(new SchemaPrinter().render(pkg)).isEqualTo(expected);
        }

        @Test
        @DisplayName("位置信息被保留，缺省为未知位置")
        void testPositions() throws IOException {
            SchemaPackage pkg = json.fromJson(resource("addressbook.json"));
            assertThat(pkg.getName().getPosition()).isEqualTo(new SourcePos("addressbook.proto", 1, 8));

            MessageDecl person = (MessageDecl) pkg.getDeclarations().get(3);
            assertThat(person.getName().getPos()).isEqualTo(new SourcePos("addressbook.proto", 6, 8));
            ExtensionsDecl extensions = (ExtensionsDecl) person.getFields().get(person.getFields().size() - 1);
            assertThat(extensions.getPosition()).isEqualTo(new SourcePos("addressbook.proto", 26, 2));
            assertThat(extensions.getHigh().getValue()).isEqualTo(MessageDecl.EXTENSION_MAX);

            ImportDecl imp = (ImportDecl) pkg.getDeclarations().get(0);
            assertThat(imp.getPath().getPos()).isEqualTo(SourcePos.UNKNOWN);
        }

        @Test
        @DisplayName("结构细节")
        void testStructure() throws IOException {
            SchemaPackage pkg = json.fromJson(resource("addressbook.json"));
            assertThat(pkg.getDeclarations()).hasSize(6);
            assertThat(((ImportDecl) pkg.getDeclarations().get(1)).isPublic()).isTrue();

            MessageDecl person = (MessageDecl) pkg.getDeclarations().get(3);
            OneOfDecl contact = (OneOfDecl) person.getFields().get(6);
            assertThat(contact.getFields()).hasSize(2);
            assertThat(contact.getFields().get(1).getType().getValue()).isInstanceOf(GlobalTypeName.class);

            ServiceDecl service = (ServiceDecl) pkg.getDeclarations().get(5);
            RpcMethod batch = (RpcMethod) service.getFields().get(2);
            assertThat(batch.getInputs()).hasSize(2);
            assertThat(batch.getOptions()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("编码")
    class EncodeTests {

        @Test
        @DisplayName("解码再编码得到相同 JSON")
        void testStable() throws IOException {
            String source = resource("addressbook.json");
            SchemaPackage pkg = json.fromJson(source);
            JsonObject encoded = json.encode(pkg);
            assertThat(encoded).isEqualTo(JsonParser.parseString(source));
        }

        @Test
        @DisplayName("编码结果可再次解码并打印出相同文本")
        void testReencodedRenders() throws IOException {
            SchemaPackage pkg = json.fromJson(resource("addressbook.json"));
            SchemaPackage again = json.fromJson(json.toJson(pkg));
            SchemaPrinter printer = new SchemaPrinter();
            assertThat(printer.render(again)).isEqualTo(printer.render(pkg));
        }

        @Test
        @DisplayName("私有 import 不写出 public 成员")
        void testPrivateImportOmitsPublic() {
            String source = "{\"declarations\": [{\"kind\": \"import\", \"path\": {\"value\": \"a.proto\"}}]}";
            JsonObject encoded = json.encode(json.fromJson(source));
            assertThat(encoded).isEqualTo(JsonParser.parseString(source));
            assertThat(encoded.getAsJsonArray("declarations").get(0).getAsJsonObject().has("public")).isFalse();
        }
    }

    @Nested
    @DisplayName("错误")
    class ErrorTests {

        @Test
        @DisplayName("非法 JSON")
        void testInvalidJson() {
            assertThatThrownBy(() -> json.fromJson("{\"declarations\": ["))
                    .isInstanceOf(AstJsonException.class)
                    .hasMessageContaining("Invalid JSON");
        }

        @Test
        @DisplayName("宽松语法不被接受")
        void testLenientSyntaxRejected() {
            assertThatThrownBy(() -> json.fromJson("{declarations: [{kind: message, name: {value: M}}]}"))
                    .isInstanceOfSatisfying(AstJsonException.class, e -> {
                        assertThat(e.getPath()).isEqualTo("$");
                        assertThat(e.getMessage()).contains("Invalid JSON");
                    });
            assertThatThrownBy(() -> json.fromJson("{\"declarations\": []} {}"))
                    .isInstanceOf(AstJsonException.class)
                    .hasMessageContaining("Invalid JSON");
        }

        @Test
        @DisplayName("空文档")
        void testEmptyDocument() {
            assertThatThrownBy(() -> json.fromJson(""))
                    .isInstanceOf(AstJsonException.class)
                    .hasMessageContaining("Empty document");
        }

        @Test
        @DisplayName("缺少成员时报告路径")
        void testMissingMember() {
            String text = "{\"declarations\": [{\"kind\": \"message\", \"fields\": []}]}";
            assertThatThrownBy(() -> json.fromJson(text))
                    .isInstanceOfSatisfying(AstJsonException.class, e -> {
                        assertThat(e.getPath()).isEqualTo("$.declarations[0]");
                        assertThat(e.getMessage()).contains("Missing member 'name'");
                    });
        }

        @Test
        @DisplayName("未知声明类型")
        void testUnknownKind() {
            String text = "{\"declarations\": [{\"kind\": \"struct\"}]}";
            assertThatThrownBy(() -> json.fromJson(text))
                    .isInstanceOfSatisfying(AstJsonException.class,
                            e -> assertThat(e.getPath()).isEqualTo("$.declarations[0].kind"));
        }

        @Test
        @DisplayName("空复合名称以 MalformedNameException 为原因")
        void testEmptyCompoundName() {
            String text = "{\"package\": [], \"declarations\": []}";
            assertThatThrownBy(() -> json.fromJson(text))
                    .hasCauseInstanceOf(MalformedNameException.class)
                    .isInstanceOfSatisfying(AstJsonException.class,
                            e -> assertThat(e.getPath()).isEqualTo("$.package"));
        }

        @Test
        @DisplayName("负数与非法数字")
        void testBadNumbers() {
            String negative = "{\"declarations\": [{\"kind\": \"enum\", \"name\": {\"value\": \"E\"}, \"fields\": ["
                    + "{\"kind\": \"enumValue\", \"name\": {\"value\": \"A\"}, \"number\": {\"base\": \"DECIMAL\", \"value\": \"-1\"}}]}]}";
            assertThatThrownBy(() -> json.fromJson(negative))
                    .isInstanceOfSatisfying(AstJsonException.class,
                            e -> assertThat(e.getPath()).isEqualTo("$.declarations[0].fields[0].number.value"));

            String notANumber = negative.replace("\"-1\"", "\"ff\"");
            assertThatThrownBy(() -> json.fromJson(notANumber))
                    .isInstanceOf(AstJsonException.class)
                    .hasMessageContaining("Invalid numeric value 'ff'");
        }

        @Test
        @DisplayName("未知标量类型")
        void testUnknownScalar() {
            String text = "{\"declarations\": [{\"kind\": \"message\", \"name\": {\"value\": \"M\"}, \"fields\": ["
                    + "{\"kind\": \"field\", \"rule\": \"OPTIONAL\", \"type\": {\"value\": {\"scalar\": \"int8\"}},"
                    + " \"name\": {\"value\": \"f\"}, \"tag\": {\"value\": {\"base\": \"DECIMAL\", \"value\": \"1\"}}}]}]}";
            assertThatThrownBy(() -> json.fromJson(text))
                    .isInstanceOfSatisfying(AstJsonException.class,
                            e -> assertThat(e.getPath()).isEqualTo("$.declarations[0].fields[0].type.value.scalar"));
        }

        @Test
        @DisplayName("类型不符时报告路径与期望类型")
        void testWrongJsonType() {
            assertThatThrownBy(() -> json.fromJson("{\"declarations\": {}}"))
                    .isInstanceOfSatisfying(AstJsonException.class, e -> {
                        assertThat(e.getPath()).isEqualTo("$.declarations");
                        assertThat(e.getMessage()).contains("Expected array");
                    });

            String publicAsString = "{\"declarations\": [{\"kind\": \"import\", \"public\": \"yes\","
                    + " \"path\": {\"value\": \"a.proto\"}}]}";
            assertThatThrownBy(() -> json.fromJson(publicAsString))
                    .isInstanceOfSatisfying(AstJsonException.class, e -> {
                        assertThat(e.getPath()).isEqualTo("$.declarations[0].public");
                        assertThat(e.getMessage()).contains("Expected boolean");
                    });

            assertThatThrownBy(() -> json.fromJson("{\"declarations\": [{\"kind\": 3}]}"))
                    .isInstanceOfSatisfying(AstJsonException.class, e -> {
                        assertThat(e.getPath()).isEqualTo("$.declarations[0].kind");
                        assertThat(e.getMessage()).contains("Expected string");
                    });

            assertThatThrownBy(() -> json.fromJson("{\"declarations\": [7]}"))
                    .isInstanceOfSatisfying(AstJsonException.class, e -> {
                        assertThat(e.getPath()).isEqualTo("$.declarations[0]");
                        assertThat(e.getMessage()).contains("Expected object");
                    });
        }

        @Test
        @DisplayName("位置中的行列号必须是 int 范围内的整数")
        void testNonIntegralPosition() {
            String fractional = "{\"package\": [{\"value\": \"a\", \"pos\": "
                    + "{\"file\": \"a\", \"line\": 4294967297.7, \"column\": 1}}], \"declarations\": []}";
            assertThatThrownBy(() -> json.fromJson(fractional))
                    .hasCauseInstanceOf(ArithmeticException.class)
                    .isInstanceOfSatisfying(AstJsonException.class, e -> {
                        assertThat(e.getPath()).isEqualTo("$.package[0].pos.line");
                        assertThat(e.getMessage()).contains("Expected integer");
                    });

            String column = fractional.replace("4294967297.7", "4").replace("\"column\": 1", "\"column\": 1.9");
            assertThatThrownBy(() -> json.fromJson(column))
                    .isInstanceOfSatisfying(AstJsonException.class,
                            e -> assertThat(e.getPath()).isEqualTo("$.package[0].pos.column"));

            String quoted = fractional.replace("4294967297.7", "\"4\"");
            assertThatThrownBy(() -> json.fromJson(quoted))
                    .isInstanceOfSatisfying(AstJsonException.class, e -> {
                        assertThat(e.getPath()).isEqualTo("$.package[0].pos.line");
                        assertThat(e.getMessage()).contains("Expected number");
                    });
        }
    }
}
