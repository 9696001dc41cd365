package com.tradingagent.unit.simulator;

import static com.tradingagent.support.TestFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradingagent.domain.model.MarketSnapshot;
import com.tradingagent.simulator.SimulatedMarketDataProvider;
import com.tradingagent.support.MutableClock;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SimulatedMarketDataProviderTest {

    private SimulatedMarketDataProvider provider(long seed) {
        return new SimulatedMarketDataProvider(seed, 0.02, "BTC-USD:60000, eth-usd:3000", new MutableClock(NOW));
    }

    @Test
    @DisplayName("Seeds enough history for indicators on the first snapshot")
    void firstSnapshotHasIndicators() {
        MarketSnapshot snapshot = provider(42).fetchSnapshot("BTC-USD");

        assertThat(snapshot.getPrice()).isPositive();
        assertThat(snapshot.getSma()).isNotNull();
        assertThat(snapshot.getRsi()).isBetween(0.0, 100.0);
        assertThat(snapshot.getVolatility()).isPositive();
        assertThat(snapshot.getCollectedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("The same seed replays the same walk")
    void deterministic() {
        assertThat(provider(7).fetchSnapshot("BTC-USD").getPrice())
                .isEqualByComparingTo(provider(7).fetchSnapshot("BTC-USD").getPrice());
    }

    @Test
    @DisplayName("Snapshots advance the walk, quotes do not")
    void quotesDoNotAdvance() {
        SimulatedMarketDataProvider provider = provider(42);
        MarketSnapshot snapshot = provider.fetchSnapshot("ETH-USD");

        assertThat(provider.currentPrice("ETH-USD")).isEqualByComparingTo(snapshot.getPrice());
        assertThat(provider.currentPrice("ETH-USD")).isEqualByComparingTo(snapshot.getPrice());
        assertThat(provider.fetchPriceHistory("ETH-USD", 1000)).hasSize(121);
    }

    @Test
    @DisplayName("History starts at the configured initial price")
    void historyStartsAtInitialPrice() {
        List<Double> history = provider(42).fetchPriceHistory("ETH-USD", 500);

        assertThat(history).hasSize(120);
        assertThat(history.get(0)).isEqualTo(3000.0);
        assertThat(provider(42).fetchPriceHistory("SOL-USD", 5)).hasSize(5);
    }

    @Test
    @DisplayName("Malformed initial prices fail fast")
    void malformedInitialPrices() {
        assertThatThrownBy(() -> new SimulatedMarketDataProvider(1, 0.02, "BTC-USD", new MutableClock(NOW)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new SimulatedMarketDataProvider(1, 0.02, "BTC-USD:-5", new MutableClock(NOW)))
                .isInstanceOf(IllegalStateException.class);
    }
}
