package com.stratlab.cli;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 命令注册器
 * 按名称和别名查找命令
 */
@Slf4j
@Component
public class CommandRegistry {

    private final Map<String, Command> commands = new LinkedHashMap<>();
    private final Map<String, Command> aliases = new LinkedHashMap<>();

    private final List<Command> commandList;

    public CommandRegistry(List<Command> commandList) {
        this.commandList = commandList != null ? commandList : Collections.emptyList();
    }

    @PostConstruct
    public void initialize() {
        commandList.forEach(this::register);
        log.info("已注册 {} 个命令，{} 个别名", commands.size(), aliases.size());
    }

    public void register(Command command) {
        if (command == null || command.getName() == null || command.getName().isBlank()) {
            log.warn("命令为空或名称为空，忽略: {}", command);
            return;
        }
        String name = command.getName();
        if (commands.containsKey(name)) {
            log.warn("命令名称冲突，覆盖原有命令: {}", name);
        }
        commands.put(name, command);
        for (String alias : command.getAliases()) {
            if (alias == null || alias.isBlank()) {
                continue;
            }
            if (aliases.containsKey(alias)) {
                log.warn("别名冲突，覆盖原有别名: {} -> {}", alias, name);
            }
            aliases.put(alias, command);
        }
        log.debug("注册命令: {} -> {}", name, command.getClass().getSimpleName());
    }

    /**
     * 根据名称或别名获取命令，不存在时返回 null
     */
    public Command getCommand(String name) {
        if (name == null) {
            return null;
        }
        Command command = commands.get(name);
        return command != null ? command : aliases.get(name);
    }

    public boolean hasCommand(String name) {
        return getCommand(name) != null;
    }

    public Collection<Command> getAllCommands() {
        return new ArrayList<>(commands.values());
    }

    public void printHelp() {
        System.out.println("策略回测引擎 CLI v1.0");
        System.out.println("=====================================");
        System.out.println();
        System.out.println("可用命令:");

        List<Command> sortedCommands = new ArrayList<>(commands.values());
        sortedCommands.sort(Comparator.comparing(Command::getName));
        for (Command command : sortedCommands) {
            String aliasText = command.getAliases().isEmpty()
                    ? ""
                    : " (" + String.join(", ", command.getAliases()) + ")";
            System.out.printf("  %-12s %s%s%n", command.getName(), command.getDescription(), aliasText);
        }

        System.out.println();
        System.out.println("使用示例:");
        System.out.println("  java -jar strategy-backtester.jar backtest --strategy strategies/rsi.json");
        System.out.println("  java -jar strategy-backtester.jar help <command>  # 查看特定命令的帮助");
    }
}
