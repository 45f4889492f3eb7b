package com.hpb.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * picocli dump 子命令：解码后重新编码 JSON 语法树（规整夹具文件）
 */
@Command(name = "dump", description = "读取 JSON 语法树并以规整格式重新输出")
public class DumpCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "JSON 语法树文件路径")
    String file;

    @Override
    public Integer call() {
        return RenderRunner.forConsole().dump(file);
    }
}
