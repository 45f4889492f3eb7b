package com.hpb.compiler.ast.option;

import com.hpb.compiler.ast.Identifier;
import com.hpb.compiler.ast.Located;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 扩展选项名：{@code (my.ext).field.sub}
 *
 * <p>括号内的文本不做解析，原样保存；括号后的字段路径逐项带位置。</p>
 */
public final class CustomOptionName extends OptionName {
    private final String extensionName;
    private final List<Located<Identifier>> fieldPath;

    public CustomOptionName(String extensionName, List<Located<Identifier>> fieldPath) {
        this.extensionName = Objects.requireNonNull(extensionName, "extensionName");
        this.fieldPath = Collections.unmodifiableList(new ArrayList<>(fieldPath));
    }

    public String getExtensionName() {
        return extensionName;
    }

    public List<Located<Identifier>> getFieldPath() {
        return fieldPath;
    }

    @Override
    public <R> R accept(OptionNameVisitor<R> visitor) {
        return visitor.visitCustom(this);
    }
}
