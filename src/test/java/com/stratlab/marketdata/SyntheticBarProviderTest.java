package com.stratlab.marketdata;

import com.stratlab.domain.enums.TimeFrame;
import com.stratlab.domain.model.Bar;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SyntheticBarProvider单元测试")
class SyntheticBarProviderTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 1, 6, 0, 0);
    private static final LocalDateTime END = LocalDateTime.of(2024, 3, 31, 0, 0);

    private final SyntheticBarProvider provider = new SyntheticBarProvider();

    @Test
    @DisplayName("同一标的同一区间生成的数据完全相同")
    void testDeterministic() {
        List<Bar> first = provider.getBars("AAPL", START, END, TimeFrame.DAILY);
        List<Bar> second = provider.getBars("AAPL", START, END, TimeFrame.DAILY);

        assertThat(first).isNotEmpty().isEqualTo(second);
        assertThat(provider.getBars("MSFT", START, END, TimeFrame.DAILY)).isNotEqualTo(first);
    }

    @Test
    @DisplayName("起始价由标的字符之和决定，跳过周末，时间严格递增")
    void testShape() {
        List<Bar> bars = provider.getBars("AAPL", START, END, TimeFrame.DAILY);

        assertThat(SyntheticBarProvider.symbolSeed("AAPL")).isEqualTo('A' + 'A' + 'P' + 'L');
        assertThat(bars.get(0).getTimestamp()).isEqualTo(LocalDateTime.of(2024, 1, 8, 0, 0));
        assertThat(bars.get(0).getOpen()).isEqualTo(100 + SyntheticBarProvider.symbolSeed("AAPL") % 900);
        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            assertThat(bar.getTimestamp().getDayOfWeek()).isNotIn(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY);
            assertThat(bar.getHigh()).isGreaterThanOrEqualTo(Math.max(bar.getOpen(), bar.getClose()));
            assertThat(bar.getLow()).isLessThanOrEqualTo(Math.min(bar.getOpen(), bar.getClose()));
            assertThat(bar.getTimestamp()).isBeforeOrEqualTo(END);
            if (i > 0) {
                assertThat(bar.getTimestamp()).isAfter(bars.get(i - 1).getTimestamp());
                assertThat(bar.getOpen()).isEqualTo(bars.get(i - 1).getClose());
            }
        }
    }

    @Test
    @DisplayName("小时级别按小时步进")
    void testHourlyStep() {
        LocalDateTime monday = LocalDateTime.of(2024, 1, 8, 0, 0);

        List<Bar> bars = provider.getBars("SPY", monday, monday.plusHours(5), TimeFrame.fromCode("1h"));

        assertThat(bars).hasSize(6);
        assertThat(bars.get(1).getTimestamp()).isEqualTo(monday.plusHours(1));
    }
}
