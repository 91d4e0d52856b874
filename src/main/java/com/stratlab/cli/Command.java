package com.stratlab.cli;

import java.util.List;

/**
 * 回测CLI命令
 */
public interface Command {

    String getName();

    String getDescription();

    /**
     * 执行命令
     *
     * @param args 命令名之后的参数
     * @throws CommandException 参数错误或执行失败
     */
    void execute(String[] args) throws CommandException;

    void printUsage();

    default List<String> getAliases() {
        return List.of();
    }

    default List<String> getExamples() {
        return List.of();
    }
}
