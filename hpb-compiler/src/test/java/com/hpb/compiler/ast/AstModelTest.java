package com.hpb.compiler.ast;

import com.hpb.compiler.ast.decl.EnumDecl;
import com.hpb.compiler.ast.decl.MessageDecl;
import com.hpb.compiler.ast.literal.NumericLiteral;
import com.hpb.compiler.ast.type.ScalarType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.*;

/**
 * 语法树模型单元测试
 */
class AstModelTest {

    @Nested
    @DisplayName("源码位置")
    class SourcePosTests {

        @Test
        @DisplayName("nextColumn 只推进列")
        void testNextColumn() {
            SourcePos pos = new SourcePos("a.proto", 3, 7).nextColumn();
            assertThat(pos.getLine()).isEqualTo(3);
            assertThat(pos.getColumn()).isEqualTo(8);
            assertThat(pos.getFile()).isEqualTo("a.proto");
        }

        @Test
        @DisplayName("nextLine 推进行并将列归零")
        void testNextLine() {
            SourcePos pos = new SourcePos("a.proto", 3, 7).nextLine();
            assertThat(pos).isEqualTo(new SourcePos("a.proto", 4, 0));
        }

        @Test
        @DisplayName("toString 为 file:line:column")
        void testToString() {
            assertThat(new SourcePos("a.proto", 1, 2)).hasToString("a.proto:1:2");
        }
    }

    @Nested
    @DisplayName("位置包装")
    class LocatedTests {

        @Test
        @DisplayName("map 保留原位置")
        void testMapKeepsPosition() {
            SourcePos pos = new SourcePos("a.proto", 5, 1);
            Located<String> text = new Located<>("foo", pos);
            Located<Identifier> id = text.map(Identifier::new);
            assertThat(id.getValue()).isEqualTo(new Identifier("foo"));
            assertThat(id.getPos()).isSameAs(pos);
        }

        @Test
        @DisplayName("unknown 使用未知位置")
        void testUnknown() {
            assertThat(Located.unknown(1).getPos()).isEqualTo(SourcePos.UNKNOWN);
        }
    }

    @Nested
    @DisplayName("标识符")
    class IdentifierTests {

        @Test
        @DisplayName("按文本相等与排序")
        void testEqualityAndOrdering() {
            assertThat(new Identifier("a")).isEqualTo(new Identifier("a"));
            assertThat(new Identifier("a").hashCode()).isEqualTo(new Identifier("a").hashCode());
            TreeSet<Identifier> set = new TreeSet<>(Arrays.asList(
                    new Identifier("b"), new Identifier("a"), new Identifier("b")));
            assertThat(set).containsExactly(new Identifier("a"), new Identifier("b"));
        }
    }

    @Nested
    @DisplayName("复合名称")
    class CompoundNameTests {

        @Test
        @DisplayName("空分量列表构造失败")
        void testEmptyRejected() {
            List<Located<Identifier>> empty = Collections.emptyList();
            assertThatThrownBy(() -> CompoundName.of(empty))
                    .isInstanceOf(MalformedNameException.class);
            assertThatThrownBy(() -> CompoundName.ofNames())
                    .isInstanceOf(MalformedNameException.class);
        }

        @Test
        @DisplayName("位置为第一个分量的位置")
        void testPosition() {
            SourcePos first = new SourcePos("a.proto", 2, 9);
            CompoundName name = CompoundName.of(Arrays.asList(
                    new Located<>(new Identifier("pkg"), first),
                    new Located<>(new Identifier("Msg"), first.nextColumn())));
            assertThat(name.getPosition()).isEqualTo(first);
            assertThat(name.getFullName()).isEqualTo("pkg.Msg");
            assertThat(name.getSimpleName()).isEqualTo("Msg");
        }

        @Test
        @DisplayName("构造后不受原列表修改影响")
        void testImmutable() {
            List<Located<Identifier>> parts = new ArrayList<>();
            parts.add(Located.unknown(new Identifier("a")));
            CompoundName name = CompoundName.of(parts);
            parts.add(Located.unknown(new Identifier("b")));
            assertThat(name.getComponents()).hasSize(1);
            assertThatThrownBy(() -> name.getComponents().add(Located.unknown(new Identifier("c"))))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("字面量与类型")
    class LiteralTests {

        @Test
        @DisplayName("负数字面量被拒绝")
        void testNegativeRejected() {
            assertThatThrownBy(() -> new NumericLiteral(NumericLiteral.Base.DECIMAL, BigInteger.valueOf(-1)))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("进制基数")
        void testRadix() {
            assertThat(NumericLiteral.Base.OCTAL.radix()).isEqualTo(8);
            assertThat(NumericLiteral.Base.DECIMAL.radix()).isEqualTo(10);
            assertThat(NumericLiteral.Base.HEXADECIMAL.radix()).isEqualTo(16);
        }

        @Test
        @DisplayName("扩展编号上限为 2^29 - 1")
        void testExtensionMax() {
            assertThat(MessageDecl.EXTENSION_MAX.getValue()).isEqualTo(BigInteger.valueOf(536870911L));
            assertThat(MessageDecl.EXTENSION_MAX).hasToString("536870911");
        }

        @Test
        @DisplayName("标量关键字一一对应")
        void testScalarKeywords() {
            assertThat(ScalarType.values()).hasSize(15);
            for (ScalarType type : ScalarType.values()) {
                assertThat(ScalarType.fromKeyword(type.getKeyword())).isSameAs(type);
            }
            assertThat(ScalarType.fromKeyword("sfixed64")).isSameAs(ScalarType.SFIXED64);
            assertThat(ScalarType.fromKeyword("message")).isNull();
        }

        @Test
        @DisplayName("枚举位置为名称位置")
        void testEnumPosition() {
            SourcePos pos = new SourcePos("a.proto", 10, 5);
            EnumDecl decl = new EnumDecl(new Located<>(new Identifier("Color"), pos), Collections.emptyList());
            assertThat(decl.getPosition()).isEqualTo(pos);
        }
    }
}
