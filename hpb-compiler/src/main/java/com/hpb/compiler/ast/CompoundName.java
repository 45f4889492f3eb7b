package com.hpb.compiler.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 复合名称（如 a.b.c）
 *
 * <p>至少包含一个组成部分：构造器要求第一个分量，空列表在 {@link #of(List)} 处即被拒绝。</p>
 */
public final class CompoundName {
    private final List<Located<Identifier>> components;

    public CompoundName(Located<Identifier> first, List<Located<Identifier>> rest) {
        List<Located<Identifier>> all = new ArrayList<>(rest.size() + 1);
        all.add(Objects.requireNonNull(first, "first"));
        all.addAll(rest);
        this.components = Collections.unmodifiableList(all);
    }

    /**
     * 由分量列表构造
     *
     * @throws MalformedNameException 列表为空
     */
    public static CompoundName of(List<Located<Identifier>> components) {
        if (components.isEmpty()) {
            throw new MalformedNameException("Compound name must have at least one component");
        }
        return new CompoundName(components.get(0), components.subList(1, components.size()));
    }

    /**
     * 由名称文本构造，位置均为 {@link SourcePos#UNKNOWN}
     *
     * @throws MalformedNameException 未给出任何名称
     */
    public static CompoundName ofNames(String... names) {
        List<Located<Identifier>> components = new ArrayList<>(names.length);
        for (String name : names) {
            components.add(Located.unknown(new Identifier(name)));
        }
        return of(components);
    }

    public List<Located<Identifier>> getComponents() {
        return components;
    }

    public Located<Identifier> getFirst() {
        return components.get(0);
    }

    /** 第一个分量的位置 */
    public SourcePos getPosition() {
        return getFirst().getPos();
    }

    public String getFullName() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < components.size(); i++) {
            if (i > 0) {
                sb.append(".");
            }
            sb.append(components.get(i).getValue().getText());
        }
        return sb.toString();
    }

    public String getSimpleName() {
        return components.get(components.size() - 1).getValue().getText();
    }

    @Override
    public String toString() {
        return getFullName();
    }
}
