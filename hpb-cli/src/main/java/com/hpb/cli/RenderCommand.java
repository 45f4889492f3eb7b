package com.hpb.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * picocli render 子命令：将 JSON 语法树打印为规范源码
 */
@Command(name = "render", description = "将 JSON 语法树打印为规范 schema 源码")
public class RenderCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "JSON 语法树文件路径")
    String file;

    @Option(names = {"-o", "--output"}, description = "输出文件（默认标准输出）")
    String output;

    @Option(names = "--indent-size", defaultValue = "2", description = "缩进空格数（默认 2）")
    int indentSize;

    @Override
    public Integer call() {
        return RenderRunner.forConsole().render(file, output, indentSize);
    }
}
