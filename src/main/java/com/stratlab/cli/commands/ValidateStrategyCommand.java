package com.stratlab.cli.commands;

import com.stratlab.cli.AbstractCommand;
import com.stratlab.cli.CommandException;
import com.stratlab.domain.model.Condition;
import com.stratlab.domain.model.PositionSizing;
import com.stratlab.domain.model.RiskManagement;
import com.stratlab.domain.model.TradingStrategy;
import com.stratlab.strategy.StrategyLoader;
import lombok.RequiredArgsConstructor;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Options;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.util.List;

/**
 * 校验策略文件并打印其规则
 */
@Component
@RequiredArgsConstructor
public class ValidateStrategyCommand extends AbstractCommand {

    private final StrategyLoader strategyLoader;

    @Override
    public String getName() {
        return "validate";
    }

    @Override
    public String getDescription() {
        return "校验策略文件的结构并显示规则";
    }

    @Override
    public List<String> getAliases() {
        return List.of("check-strategy");
    }

    @Override
    public List<String> getExamples() {
        return List.of("validate --strategy strategies/rsi_reversal.json");
    }

    @Override
    protected Options buildOptions() {
        Options options = new Options();
        options.addOption(createOption("s", "strategy", "策略JSON文件路径（必需）", true));
        return options;
    }

    @Override
    public void execute(String[] args) throws CommandException {
        CommandLine cmd = parseArgs(args);
        if (shouldShowHelp(cmd)) {
            printUsage();
            return;
        }
        validateRequired(cmd, "strategy");

        TradingStrategy strategy;
        try {
            strategy = strategyLoader.load(Paths.get(cmd.getOptionValue("strategy")));
        } catch (IllegalArgumentException e) {
            throw CommandException.executionFailed(getName(), e.getMessage(), e);
        }

        printTableHeader("策略: " + strategy.getDisplayName());
        System.out.println("标的: " + String.join(", ", strategy.getSymbols()));
        System.out.println("周期: " + strategy.getTimeframe().getCode());
        System.out.println("方向: " + strategy.getDirection().getCode());
        printConditions("入场条件 (全部满足)", strategy.getEntryConditions());
        printConditions("出场条件 (全部满足)", strategy.getExitConditions());

        PositionSizing sizing = strategy.getPositionSizing();
        System.out.printf("仓位: %s %.2f%s%n", sizing.getType().getCode(), sizing.getValue(),
                sizing.getMaxPositionSize() != null ? "，上限 " + sizing.getMaxPositionSize() : "");
        RiskManagement risk = strategy.getRiskManagement();
        if (risk != null) {
            System.out.printf("止损: %s %.2f  止盈: %s %.2f%n",
                    risk.getStopLossType() != null ? risk.getStopLossType().getCode() : "-", risk.getStopLossValue(),
                    risk.getTakeProfitType() != null ? risk.getTakeProfitType().getCode() : "-", risk.getTakeProfitValue());
            if (risk.isTrailingStopEnabled()) {
                System.out.printf("移动止损: %.2f%%%n", risk.getTrailingStopValue());
            }
            if (risk.isDrawdownGuardEnabled()) {
                System.out.printf("最大回撤保护: %.2f%%%n", risk.getMaxDrawdown());
            }
        }
        System.out.println();
        if (strategy.getEntryConditions() == null || strategy.getEntryConditions().isEmpty()) {
            printWarning("策略没有入场条件，回测不会产生任何交易");
        }
        printSuccess("策略校验通过");
    }

    private void printConditions(String title, List<Condition> conditions) {
        System.out.println(title + ":");
        if (conditions == null || conditions.isEmpty()) {
            System.out.println("  (无)");
            return;
        }
        conditions.forEach(condition -> System.out.println("  - " + condition.describe()));
    }
}
