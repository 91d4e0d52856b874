package com.stratlab.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CommandRegistry单元测试")
class CommandRegistryTest {

    @Mock
    private Command backtestCommand;

    @Mock
    private Command validateCommand;

    private CommandRegistry registry;

    @BeforeEach
    void setUp() {
        when(backtestCommand.getName()).thenReturn("backtest");
        when(backtestCommand.getAliases()).thenReturn(List.of("bt"));
        when(validateCommand.getName()).thenReturn("validate");
        when(validateCommand.getAliases()).thenReturn(List.of("check-strategy", ""));

        registry = new CommandRegistry(List.of(backtestCommand, validateCommand));
        registry.initialize();
    }

    @Test
    @DisplayName("按名称和别名查找命令")
    void testLookupByNameAndAlias() {
        assertThat(registry.getCommand("backtest")).isSameAs(backtestCommand);
        assertThat(registry.getCommand("bt")).isSameAs(backtestCommand);
        assertThat(registry.getCommand("check-strategy")).isSameAs(validateCommand);
        assertThat(registry.hasCommand("validate")).isTrue();
    }

    @Test
    @DisplayName("未知命令和空名称返回null")
    void testUnknownCommand() {
        assertThat(registry.getCommand("optimize")).isNull();
        assertThat(registry.getCommand(null)).isNull();
        assertThat(registry.getCommand("")).isNull();
        assertThat(registry.hasCommand("optimize")).isFalse();
    }

    @Test
    @DisplayName("按注册顺序列出所有命令，别名不重复出现")
    void testGetAllCommands() {
        assertThat(registry.getAllCommands()).containsExactly(backtestCommand, validateCommand);
    }
}
