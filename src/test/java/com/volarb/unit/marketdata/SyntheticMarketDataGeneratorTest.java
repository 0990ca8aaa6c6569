package com.volarb.unit.marketdata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.volarb.domain.model.MarketObservation;
import com.volarb.exception.ValidationException;
import com.volarb.marketdata.SyntheticMarketDataGenerator;
import com.volarb.marketdata.SyntheticPathSpec;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SyntheticMarketDataGenerator")
class SyntheticMarketDataGeneratorTest {

    private static final LocalDateTime START = LocalDateTime.of(2025, 1, 1, 0, 0);

    private final SyntheticMarketDataGenerator generator = new SyntheticMarketDataGenerator();

    @Test
    @DisplayName("same seed reproduces the path; a different seed does not")
    void seeded() {
        List<MarketObservation> a = generator.generate("SPY", START, 50, 42);
        List<MarketObservation> b = generator.generate("SPY", START, 50, 42);
        List<MarketObservation> c = generator.generate("SPY", START, 50, 43);

        assertThat(a).extracting(MarketObservation::getClose)
                .containsExactlyElementsOf(b.stream().map(MarketObservation::getClose).toList());
        assertThat(a.get(49).getClose()).isNotEqualTo(c.get(49).getClose());
    }

    @Test
    @DisplayName("bars are consecutive days starting at the start price with consistent ranges")
    void barShape() {
        List<MarketObservation> bars = generator.generate("SPY", START, 30, 1);

        assertThat(bars).hasSize(30);
        assertThat(bars.get(0).getClose()).isEqualTo(100.0);
        assertThat(bars.get(29).getTimestamp()).isEqualTo(START.plusDays(29));
        assertThat(bars).allSatisfy(bar -> {
            assertThat(bar.getHigh()).isGreaterThanOrEqualTo(Math.max(bar.getOpen(), bar.getClose()));
            assertThat(bar.getLow()).isLessThanOrEqualTo(Math.min(bar.getOpen(), bar.getClose()));
            assertThat(bar.getSymbol()).isEqualTo("SPY");
        });
        for (int i = 1; i < bars.size(); i++) {
            assertThat(bars.get(i).getOpen()).isEqualTo(bars.get(i - 1).getClose());
        }
    }

    @Test
    @DisplayName("implied volatility is attached only when configured")
    void impliedVolatility() {
        List<MarketObservation> plain = generator.generate("SPY", START, 5, 1);
        List<MarketObservation> quoted = generator.generate(SyntheticPathSpec.builder()
                .symbol("SPY")
                .start(START)
                .bars(5)
                .impliedVolatility(0.2)
                .build());

        assertThat(plain).noneMatch(bar -> bar.hasAuxiliary(MarketObservation.IMPLIED_VOLATILITY));
        assertThat(quoted).allSatisfy(
                bar -> assertThat(bar.getAuxiliary(MarketObservation.IMPLIED_VOLATILITY)).isEqualTo(0.2));
    }

    @Test
    @DisplayName("rejects non-positive bar counts")
    void validation() {
        assertThatThrownBy(() -> generator.generate("SPY", START, 0, 1)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> generator.generate(null, START, 5, 1)).isInstanceOf(ValidationException.class);
    }
}
