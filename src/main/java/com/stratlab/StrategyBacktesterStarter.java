package com.stratlab;

import com.stratlab.cli.Command;
import com.stratlab.cli.CommandException;
import com.stratlab.cli.CommandRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Arrays;

/**
 * 策略回测引擎启动器
 * 第一个参数为命令名，其余参数交给对应命令解析
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class StrategyBacktesterStarter implements CommandLineRunner {

    private final CommandRegistry commandRegistry;

    public static void main(String[] args) {
        SpringApplication.run(StrategyBacktesterStarter.class, args);
    }

    @Override
    public void run(String... args) {
        if (args.length == 0) {
            commandRegistry.printHelp();
            return;
        }
        System.exit(dispatch(args));
    }

    /**
     * 执行命令并返回进程退出码
     */
    int dispatch(String[] args) {
        String commandName = args[0];
        if ("help".equals(commandName) || "--help".equals(commandName) || "-h".equals(commandName)) {
            if (args.length > 1) {
                return showCommandHelp(args[1]);
            }
            commandRegistry.printHelp();
            return 0;
        }

        Command command = commandRegistry.getCommand(commandName);
        if (command == null) {
            System.err.println("❌ 未知命令: " + commandName);
            System.err.println("💡 使用 'help' 查看可用命令列表");
            return 1;
        }

        try {
            command.execute(Arrays.copyOfRange(args, 1, args.length));
            return 0;
        } catch (CommandException e) {
            System.err.println("❌ " + e.getMessage());
            log.debug("命令执行失败: {}", commandName, e);
            return 1;
        } catch (RuntimeException e) {
            System.err.println("❌ 系统错误: " + e.getMessage());
            log.error("命令执行异常: {}", commandName, e);
            return 1;
        }
    }

    private int showCommandHelp(String commandName) {
        Command command = commandRegistry.getCommand(commandName);
        if (command == null) {
            System.err.println("❌ 未知命令: " + commandName);
            return 1;
        }
        command.printUsage();
        return 0;
    }
}
