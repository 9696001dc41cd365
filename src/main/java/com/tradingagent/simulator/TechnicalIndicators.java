package com.tradingagent.simulator;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;

/**
 * Indicators the simulated feed attaches to each snapshot. All take closes oldest first and
 * return null when there is not enough history.
 */
public final class TechnicalIndicators {

    private static final ZonedDateTime SERIES_START = ZonedDateTime.of(2000, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

    private TechnicalIndicators() {}

    public static Double sma(List<Double> closes, int period) {
        if (closes.size() < period) {
            return null;
        }
        BarSeries series = toSeries(closes);
        return new SMAIndicator(new ClosePriceIndicator(series), period)
                .getValue(series.getEndIndex())
                .doubleValue();
    }

    /** Wilder RSI over {@code period} changes. Only gains gives 100, only losses gives 0. */
    public static Double rsi(List<Double> closes, int period) {
        if (closes.size() < period + 1) {
            return null;
        }
        BarSeries series = toSeries(closes);
        return new RSIIndicator(new ClosePriceIndicator(series), period)
                .getValue(series.getEndIndex())
                .doubleValue();
    }

    /** Sample standard deviation of the last {@code period} simple returns. */
    public static Double volatility(List<Double> closes, int period) {
        if (closes.size() < period + 1) {
            return null;
        }
        double[] returns = new double[period];
        int offset = closes.size() - period;
        for (int i = 0; i < period; i++) {
            double previous = closes.get(offset + i - 1);
            returns[i] = (closes.get(offset + i) - previous) / previous;
        }
        return new StandardDeviation().evaluate(returns);
    }

    /** One-minute bars with open = high = low = close. */
    private static BarSeries toSeries(List<Double> closes) {
        BarSeries series = new BaseBarSeriesBuilder().withName("closes").build();
        ZonedDateTime endTime = SERIES_START;
        for (Double close : closes) {
            endTime = endTime.plusMinutes(1);
            series.addBar(endTime, close, close, close, close);
        }
        return series;
    }
}
