package com.stratlab.cli;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.PrintWriter;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * 抽象命令基类
 * 提供基于commons-cli的参数解析、类型转换和控制台输出
 */
public abstract class AbstractCommand implements Command {

    protected static final String ANSI_RESET = "\u001B[0m";
    protected static final String ANSI_GREEN = "\u001B[32m";
    protected static final String ANSI_RED = "\u001B[31m";
    protected static final String ANSI_YELLOW = "\u001B[33m";
    protected static final String ANSI_BOLD = "\u001B[1m";

    /**
     * 命令自身的选项定义，不含 --help
     */
    protected abstract Options buildOptions();

    protected Options createOptions() {
        Options options = buildOptions();
        options.addOption("h", "help", false, "显示帮助信息");
        return options;
    }

    protected CommandLine parseArgs(String[] args) throws CommandException {
        CommandLineParser parser = new DefaultParser();
        try {
            return parser.parse(createOptions(), args);
        } catch (ParseException e) {
            throw CommandException.invalidArgument(getName(), e.getMessage());
        }
    }

    protected boolean shouldShowHelp(CommandLine cmd) {
        return cmd.hasOption("help");
    }

    protected void validateRequired(CommandLine cmd, String... requiredOptions) throws CommandException {
        for (String option : requiredOptions) {
            if (!cmd.hasOption(option)) {
                throw CommandException.missingRequired(getName(), "--" + option);
            }
        }
    }

    protected Double getDoubleOptionValue(CommandLine cmd, String option) {
        if (!cmd.hasOption(option)) {
            return null;
        }
        try {
            return Double.parseDouble(cmd.getOptionValue(option));
        } catch (NumberFormatException e) {
            throw CommandException.invalidArgument(getName(), "选项 --" + option + " 必须是数字");
        }
    }

    protected int getIntOptionValue(CommandLine cmd, String option, int defaultValue) {
        if (!cmd.hasOption(option)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(cmd.getOptionValue(option));
        } catch (NumberFormatException e) {
            throw CommandException.invalidArgument(getName(), "选项 --" + option + " 必须是整数");
        }
    }

    /**
     * 解析日期选项，支持 yyyy-MM-dd 和 yyyy-MM-ddTHH:mm:ss
     */
    protected LocalDateTime getDateOptionValue(CommandLine cmd, String option) {
        if (!cmd.hasOption(option)) {
            return null;
        }
        String value = cmd.getOptionValue(option).trim();
        try {
            if (value.length() == 10) {
                return LocalDate.parse(value).atStartOfDay();
            }
            return LocalDateTime.parse(value);
        } catch (DateTimeParseException e) {
            throw CommandException.invalidArgument(getName(), "选项 --" + option + " 日期格式应为 yyyy-MM-dd: " + value);
        }
    }

    protected Option createOption(String shortName, String longName, String description, boolean hasArg) {
        return Option.builder(shortName)
                .longOpt(longName)
                .desc(description)
                .hasArg(hasArg)
                .build();
    }

    protected void printSuccess(String message) {
        System.out.println(ANSI_GREEN + "✅ " + message + ANSI_RESET);
    }

    protected void printWarning(String message) {
        System.out.println(ANSI_YELLOW + "⚠️  " + message + ANSI_RESET);
    }

    protected void printError(String message) {
        System.err.println(ANSI_RED + "❌ " + message + ANSI_RESET);
    }

    protected void printTableHeader(String title) {
        System.out.println();
        System.out.println(ANSI_BOLD + "=== " + title + " ===" + ANSI_RESET);
    }

    @Override
    public void printUsage() {
        System.out.println(ANSI_BOLD + "用法:" + ANSI_RESET);
        System.out.println("  " + getUsageLine());
        System.out.println();
        System.out.println(ANSI_BOLD + "选项:" + ANSI_RESET);
        HelpFormatter formatter = new HelpFormatter();
        formatter.printOptions(new PrintWriter(System.out, true), 100, createOptions(), 2, 2);
        System.out.println();
        List<String> examples = getExamples();
        if (!examples.isEmpty()) {
            System.out.println(ANSI_BOLD + "示例:" + ANSI_RESET);
            examples.forEach(example -> System.out.println("  " + example));
            System.out.println();
        }
    }

    protected String getUsageLine() {
        return getName() + " [选项]";
    }
}
