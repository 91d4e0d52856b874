package com.stratlab.cli;

/**
 * 命令执行异常
 * 参数解析失败、策略无效、行情读取失败等都以此异常返回给启动器，进程退出码为1
 */
public class CommandException extends RuntimeException {

    private final String commandName;

    public CommandException(String message) {
        super(message);
        this.commandName = null;
    }

    public CommandException(String commandName, String message) {
        super(String.format("命令 '%s' 执行失败: %s", commandName, message));
        this.commandName = commandName;
    }

    public CommandException(String commandName, String message, Throwable cause) {
        super(String.format("命令 '%s' 执行失败: %s", commandName, message), cause);
        this.commandName = commandName;
    }

    public String getCommandName() {
        return commandName;
    }

    public static CommandException invalidArgument(String commandName, String message) {
        return new CommandException(commandName, "参数错误: " + message);
    }

    public static CommandException missingRequired(String commandName, String paramName) {
        return new CommandException(commandName, "缺少必需参数: " + paramName);
    }

    public static CommandException executionFailed(String commandName, String message, Throwable cause) {
        return new CommandException(commandName, "执行失败: " + message, cause);
    }
}
