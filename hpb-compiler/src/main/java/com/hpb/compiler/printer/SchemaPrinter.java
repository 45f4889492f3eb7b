package com.hpb.compiler.printer;

import com.hpb.compiler.ast.AstNode;
import com.hpb.compiler.ast.AstVisitor;
import com.hpb.compiler.ast.Identifier;
import com.hpb.compiler.ast.Located;
import com.hpb.compiler.ast.decl.*;
import com.hpb.compiler.ast.type.FieldType;

import java.util.List;
import java.util.function.BiConsumer;

/**
 * Schema AST 规范打印器
 *
 * <p>遍历 AST，输出可被解析器重新读入的源码文本。打印是纯函数：不修改节点，
 * 每次调用使用独立的 {@link PrinterContext}，对同一棵树重复调用结果完全相同。</p>
 *
 * <p>块结构（message/enum/extend/service/oneof 以及带选项的 rpc）统一为：
 * 首行 {@code keyword name {}，成员每行一个并缩进一级，{@code }} 独占一行。</p>
 */
public class SchemaPrinter implements AstVisitor<Void, PrinterContext> {

    private final TermFormatter terms = TermFormatter.INSTANCE;

    /**
     * 打印整个包
     */
    public String render(SchemaPackage pkg, PrinterConfig config) {
        PrinterContext ctx = new PrinterContext(config);
        visitPackage(pkg, ctx);
        return ctx.getOutput();
    }

    /**
     * 使用规范配置打印整个包
     */
    public String render(SchemaPackage pkg) {
        return render(pkg, new PrinterConfig());
    }

    /**
     * 打印声明列表（不含 package 行），每个声明后换行
     */
    public String renderDecls(List<Decl> decls, PrinterConfig config) {
        PrinterContext ctx = new PrinterContext(config);
        formatDecls(decls, ctx);
        return ctx.getOutput();
    }

    public String renderDecls(List<Decl> decls) {
        return renderDecls(decls, new PrinterConfig());
    }

    /**
     * 打印单个节点，末尾不追加换行（包节点除外，其每个声明均以换行结束）
     */
    public String renderNode(AstNode node) {
        PrinterContext ctx = new PrinterContext(new PrinterConfig());
        node.accept(this, ctx);
        return ctx.getOutput();
    }

    // ============ 顶层 ============

    @Override
    public Void visitPackage(SchemaPackage node, PrinterContext ctx) {
        if (node.hasName()) {
            ctx.append("package ");
            ctx.append(LiteralFormatter.formatName(node.getName()));
            ctx.append(";");
            ctx.newLine();
        }
        formatDecls(node.getDeclarations(), ctx);
        return null;
    }

    @Override
    public Void visitImportDecl(ImportDecl node, PrinterContext ctx) {
        ctx.append("import");
        if (node.isPublic()) {
            ctx.append(" public");
        }
        ctx.space();
        ctx.append(LiteralFormatter.quote(node.getPath().getValue().getValue()));
        ctx.append(";");
        return null;
    }

    @Override
    public Void visitOptionDecl(OptionDecl node, PrinterContext ctx) {
        ctx.append("option ");
        ctx.append(terms.formatInlineOption(node));
        ctx.append(";");
        return null;
    }

    // ============ 枚举 ============

    @Override
    public Void visitEnumDecl(EnumDecl node, PrinterContext ctx) {
        formatBlock("enum", node.getName(), node.getFields(), ctx,
                (field, c) -> field.accept(this, c));
        return null;
    }

    @Override
    public Void visitEnumValue(EnumValue node, PrinterContext ctx) {
        ctx.append(identifierText(node.getName()));
        ctx.append(" = ");
        ctx.append(LiteralFormatter.formatNumber(node.getNumber()));
        ctx.append(";");
        return null;
    }

    // ============ 消息 ============

    @Override
    public Void visitMessageDecl(MessageDecl node, PrinterContext ctx) {
        formatBlock("message", node.getName(), node.getFields(), ctx,
                (field, c) -> field.accept(this, c));
        return null;
    }

    @Override
    public Void visitFieldDecl(FieldDecl node, PrinterContext ctx) {
        ctx.append(node.getRule().getKeyword());
        ctx.space();
        visitField(node.getField(), ctx);
        return null;
    }

    @Override
    public Void visitField(Field node, PrinterContext ctx) {
        ctx.append(terms.formatType(node.getType().getValue()));
        ctx.space();
        ctx.append(identifierText(node.getName()));
        ctx.append(" = ");
        ctx.append(LiteralFormatter.formatNumber(node.getTag().getValue()));
        if (!node.getOptions().isEmpty()) {
            ctx.append(" [");
            formatJoined(node.getOptions(), ctx, ", ",
                    (option, c) -> c.append(terms.formatInlineOption(option)));
            ctx.append("]");
        }
        ctx.append(";");
        return null;
    }

    @Override
    public Void visitOneOfDecl(OneOfDecl node, PrinterContext ctx) {
        formatBlock("oneof", node.getName(), node.getFields(), ctx, this::visitField);
        return null;
    }

    @Override
    public Void visitExtensionsDecl(ExtensionsDecl node, PrinterContext ctx) {
        // 此层不输出分号
        ctx.append("extensions ");
        ctx.append(LiteralFormatter.formatNumber(node.getLow().getValue()));
        ctx.append(" to ");
        ctx.append(LiteralFormatter.formatNumber(node.getHigh().getValue()));
        return null;
    }

    @Override
    public Void visitExtendDecl(ExtendDecl node, PrinterContext ctx) {
        formatBlock("extend", node.getTarget(), node.getFields(), ctx, this::visitFieldDecl);
        return null;
    }

    // ============ 服务 ============

    @Override
    public Void visitServiceDecl(ServiceDecl node, PrinterContext ctx) {
        formatBlock("service", node.getName(), node.getFields(), ctx,
                (field, c) -> field.accept(this, c));
        return null;
    }

    @Override
    public Void visitRpcMethod(RpcMethod node, PrinterContext ctx) {
        ctx.append("rpc ");
        ctx.append(identifierText(node.getName()));
        formatTypeList(node.getInputs(), ctx);
        ctx.append(" returns ");
        formatTypeList(node.getOutputs(), ctx);
        if (node.getOptions().isEmpty()) {
            ctx.append(";");
            return null;
        }
        ctx.append(" {");
        formatBody(node.getOptions(), ctx, this::visitOptionDecl);
        return null;
    }

    // ============ 辅助方法 ============

    /** 每个声明（含最后一个）都以换行结束 */
    private void formatDecls(List<Decl> decls, PrinterContext ctx) {
        for (Decl decl : decls) {
            decl.accept(this, ctx);
            ctx.newLine();
        }
    }

    private <T> void formatBlock(String keyword, Located<Identifier> name, List<T> members,
                                 PrinterContext ctx, BiConsumer<T, PrinterContext> formatter) {
        ctx.append(keyword);
        ctx.space();
        ctx.append(identifierText(name));
        ctx.append(" {");
        formatBody(members, ctx, formatter);
    }

    /** 换行、成员逐行缩进输出、在当前层级闭合 } */
    private <T> void formatBody(List<T> members, PrinterContext ctx, BiConsumer<T, PrinterContext> formatter) {
        ctx.newLine();
        ctx.indent();
        for (T member : members) {
            formatter.accept(member, ctx);
            ctx.newLine();
        }
        ctx.dedent();
        ctx.append("}");
    }

    private void formatTypeList(List<Located<FieldType>> types, PrinterContext ctx) {
        ctx.append("(");
        formatJoined(types, ctx, ", ", (type, c) -> c.append(terms.formatType(type.getValue())));
        ctx.append(")");
    }

    private <T> void formatJoined(List<T> items, PrinterContext ctx, String separator,
                                  BiConsumer<T, PrinterContext> formatter) {
        for (int i = 0; i < items.size(); i++) {
            formatter.accept(items.get(i), ctx);
            if (i < items.size() - 1) {
                ctx.append(separator);
            }
        }
    }

    private static String identifierText(Located<Identifier> name) {
        return name.getValue().getText();
    }
}
