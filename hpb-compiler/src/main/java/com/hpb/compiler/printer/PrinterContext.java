package com.hpb.compiler.printer;

/**
 * 打印上下文，跟踪输出缓冲区和缩进层级
 *
 * <p>每次打印新建一个实例，不在线程间共享。</p>
 */
public class PrinterContext {
    private final StringBuilder output = new StringBuilder();
    private final PrinterConfig config;
    private final String indentUnit;
    private int indentLevel = 0;
    private boolean atLineStart = true;

    public PrinterContext(PrinterConfig config) {
        this.config = config;
        this.indentUnit = config.getIndentString();
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    /**
     * 追加文本（自动处理行首缩进）
     */
    public void append(String text) {
        if (text == null || text.isEmpty()) return;
        if (atLineStart) {
            for (int i = 0; i < indentLevel; i++) {
                output.append(indentUnit);
            }
            atLineStart = false;
        }
        output.append(text);
    }

    /**
     * 换行
     */
    public void newLine() {
        output.append(config.getLineSeparator());
        atLineStart = true;
    }

    public void space() {
        append(" ");
    }

    /**
     * 获取当前输出
     */
    public String getOutput() {
        return output.toString();
    }
}
