package com.hpb.cli;

import com.hpb.compiler.ast.decl.SchemaPackage;
import com.hpb.compiler.json.AstJson;
import com.hpb.compiler.json.AstJsonException;
import com.hpb.compiler.printer.PrinterConfig;
import com.hpb.compiler.printer.SchemaPrinter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 读取 JSON 语法树并输出
 *
 * <p>所有失败都转换为退出码 1，错误信息写到 err。</p>
 */
public class RenderRunner {
    private static final Logger LOG = Logger.getLogger(RenderRunner.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;

    private final PrintStream out;
    private final PrintStream err;
    private final AstJson json = new AstJson();

    public RenderRunner(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    static RenderRunner forConsole() {
        return new RenderRunner(System.out, System.err);
    }

    /**
     * 打印规范源码到 outputPath，outputPath 为 null 时写标准输出
     */
    public int render(String filePath, String outputPath, int indentSize) {
        if (indentSize < 0) {
            err.println("错误: 缩进空格数不能为负 - " + indentSize);
            return EXIT_ERROR;
        }
        SchemaPackage pkg = load(filePath);
        if (pkg == null) {
            return EXIT_ERROR;
        }

        PrinterConfig config = new PrinterConfig();
        config.setIndentSize(indentSize);
        String text = new SchemaPrinter().render(pkg, config);

        if (outputPath == null) {
            out.print(text);
            out.flush();
            return EXIT_OK;
        }
        try {
            Files.write(Paths.get(outputPath), text.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            LOG.log(Level.WARNING, "写入失败: " + outputPath, e);
            err.println("错误: 写入失败 - " + outputPath + ": " + e.getMessage());
            return EXIT_ERROR;
        }
        LOG.info("Rendered " + filePath + " -> " + outputPath);
        return EXIT_OK;
    }

    /**
     * 解码后重新编码，输出到标准输出
     */
    public int dump(String filePath) {
        SchemaPackage pkg = load(filePath);
        if (pkg == null) {
            return EXIT_ERROR;
        }
        out.println(json.toJson(pkg));
        out.flush();
        return EXIT_OK;
    }

    /**
     * @return 解码结果；失败时已输出错误信息并返回 null
     */
    private SchemaPackage load(String filePath) {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + filePath);
            return null;
        }
        try {
            String source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
            return json.fromJson(source);
        } catch (AstJsonException e) {
            err.println("错误: 语法树格式错误 - " + e.getMessage());
            return null;
        } catch (IOException e) {
            LOG.log(Level.WARNING, "读取失败: " + filePath, e);
            err.println("错误: 读取失败 - " + filePath + ": " + e.getMessage());
            return null;
        }
    }
}
