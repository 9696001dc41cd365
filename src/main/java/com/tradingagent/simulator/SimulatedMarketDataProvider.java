package com.tradingagent.simulator;

import com.tradingagent.domain.model.MarketSnapshot;
import com.tradingagent.marketdata.MarketDataProvider;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Paper-mode market feed: a seeded geometric random walk per asset pair.
 *
 * <p>Each pair is pre-seeded with {@link #SEED_HISTORY} closes so indicators and VaR have
 * enough history from the first cycle. Every {@link #fetchSnapshot} advances the walk by one
 * step; {@link #currentPrice} reads the last close without advancing.
 */
@Component
@ConditionalOnProperty(name = "tradingagent.mode", havingValue = "PAPER", matchIfMissing = true)
public class SimulatedMarketDataProvider implements MarketDataProvider, QuoteSource {

    private static final Logger log = LoggerFactory.getLogger(SimulatedMarketDataProvider.class);

    static final int SEED_HISTORY = 120;
    static final int MAX_HISTORY = 500;
    static final int SMA_PERIOD = 20;
    static final int RSI_PERIOD = 14;
    static final double DEFAULT_INITIAL_PRICE = 100.0;

    private final Random random;
    private final double stepVolatility;
    private final Map<String, Double> initialPrices;
    private final Clock clock;

    /** Closes per pair, oldest first. Guarded by {@code this}. */
    private final Map<String, List<Double>> closesByPair = new HashMap<>();

    public SimulatedMarketDataProvider(
            @Value("${tradingagent.simulator.seed:42}") long seed,
            @Value("${tradingagent.simulator.step-volatility:0.02}") double stepVolatility,
            @Value("${tradingagent.simulator.initial-prices:BTC-USD:60000}") String initialPrices,
            Clock clock) {
        this.random = new Random(seed);
        this.stepVolatility = stepVolatility;
        this.initialPrices = parseInitialPrices(initialPrices);
        this.clock = clock;
    }

    @Override
    public synchronized MarketSnapshot fetchSnapshot(String assetPair) {
        List<Double> closes = closesFor(assetPair);
        closes.add(nextClose(closes.get(closes.size() - 1)));
        if (closes.size() > MAX_HISTORY) {
            closes.remove(0);
        }

        Double sma = TechnicalIndicators.sma(closes, SMA_PERIOD);
        return MarketSnapshot.builder()
                .assetPair(assetPair)
                .price(toPrice(closes.get(closes.size() - 1)))
                .sma(sma != null ? toPrice(sma) : null)
                .rsi(TechnicalIndicators.rsi(closes, RSI_PERIOD))
                .volatility(TechnicalIndicators.volatility(closes, SMA_PERIOD))
                .collectedAt(clock.instant())
                .build();
    }

    @Override
    public synchronized List<Double> fetchPriceHistory(String assetPair, int days) {
        List<Double> closes = closesFor(assetPair);
        int from = Math.max(0, closes.size() - days);
        return List.copyOf(closes.subList(from, closes.size()));
    }

    @Override
    public synchronized BigDecimal currentPrice(String assetPair) {
        List<Double> closes = closesFor(assetPair);
        return toPrice(closes.get(closes.size() - 1));
    }

    private List<Double> closesFor(String assetPair) {
        return closesByPair.computeIfAbsent(assetPair, this::seedHistory);
    }

    private List<Double> seedHistory(String assetPair) {
        double price = initialPrices.getOrDefault(assetPair, DEFAULT_INITIAL_PRICE);
        List<Double> closes = new ArrayList<>(MAX_HISTORY + 1);
        closes.add(price);
        for (int i = 1; i < SEED_HISTORY; i++) {
            price = nextClose(price);
            closes.add(price);
        }
        log.debug("Seeded {} closes for {} from {}", SEED_HISTORY, assetPair, closes.get(0));
        return closes;
    }

    private double nextClose(double previous) {
        return previous * Math.exp(stepVolatility * random.nextGaussian());
    }

    private static BigDecimal toPrice(double value) {
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP);
    }

    /** Parses {@code "BTC-USD:60000,ETH-USD:3000"}. */
    static Map<String, Double> parseInitialPrices(String raw) {
        Map<String, Double> prices = new HashMap<>();
        if (raw == null || raw.isBlank()) {
            return prices;
        }
        for (String entry : raw.split(",")) {
            String trimmed = entry.trim();
            int colon = trimmed.lastIndexOf(':');
            if (colon <= 0 || colon == trimmed.length() - 1) {
                throw new IllegalStateException("Invalid initial price entry '" + trimmed + "', expected PAIR:PRICE");
            }
            double price = Double.parseDouble(trimmed.substring(colon + 1).trim());
            if (price <= 0) {
                throw new IllegalStateException("Initial price for " + trimmed.substring(0, colon) + " must be positive");
            }
            prices.put(trimmed.substring(0, colon).trim().toUpperCase(Locale.ROOT), price);
        }
        return prices;
    }
}
