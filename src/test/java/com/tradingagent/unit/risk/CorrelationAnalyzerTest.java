package com.tradingagent.unit.risk;

import static com.tradingagent.support.TestFixtures.alternatingReturns;
import static com.tradingagent.support.TestFixtures.closesFromReturns;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.tradingagent.risk.CorrelationAnalyzer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CorrelationAnalyzerTest {

    private final CorrelationAnalyzer analyzer = new CorrelationAnalyzer();

    private static List<Double> negate(List<Double> returns) {
        List<Double> negated = new ArrayList<>();
        returns.forEach(r -> negated.add(-r));
        return negated;
    }

    @Test
    @DisplayName("Identical return series are perfectly correlated")
    void identicalSeries() {
        List<Double> closes = closesFromReturns(100, alternatingReturns(20, 0.02));

        assertThat(analyzer.correlation(closes, closes).getAsDouble()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("Mirror-image series count as correlated by magnitude")
    void inverseSeriesCount() {
        List<Double> returns = alternatingReturns(20, 0.02);
        Map<String, List<Double>> history = Map.of(
                "BTC-USD", closesFromReturns(100, returns),
                "ETH-USD", closesFromReturns(50, negate(returns)));

        assertThat(analyzer.correlation(history.get("BTC-USD"), history.get("ETH-USD")).getAsDouble())
                .isCloseTo(-1.0, within(1e-9));
        assertThat(analyzer.correlatedPairs("BTC-USD", List.of("ETH-USD"), history, 0.7))
                .containsExactly("ETH-USD");
    }

    @Test
    @DisplayName("Short histories give no correlation")
    void tooShort() {
        List<Double> closes = closesFromReturns(100, alternatingReturns(5, 0.02));

        assertThat(analyzer.correlation(closes, closes)).isEmpty();
    }

    @Test
    @DisplayName("Flat series have no defined correlation")
    void zeroVariance() {
        List<Double> flat = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            flat.add(100.0);
        }

        assertThat(analyzer.correlation(flat, closesFromReturns(100, alternatingReturns(19, 0.02))))
                .isEmpty();
    }

    @Test
    @DisplayName("The candidate itself and pairs without history are skipped")
    void skipsSelfAndUnknown() {
        List<Double> closes = closesFromReturns(100, alternatingReturns(20, 0.02));
        Map<String, List<Double>> history = Map.of("BTC-USD", closes);

        assertThat(analyzer.correlatedPairs("BTC-USD", List.of("BTC-USD", "XRP-USD"), history, 0.7))
                .isEmpty();
    }
}
