package com.portfolio.riskengine.util;

import com.portfolio.riskengine.domain.model.AssetReturnMatrix;
import com.portfolio.riskengine.domain.model.ReturnSeries;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public final class TestReturnsFactory {

    public static final LocalDate START = LocalDate.of(2023, 1, 2);

    private TestReturnsFactory() {}

    public static List<LocalDate> dates(int count) {
        List<LocalDate> dates = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            dates.add(START.plusDays(i));
        }
        return dates;
    }

    public static double[] gaussian(int count, double mean, double sd, long seed) {
        Random random = new Random(seed);
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = mean + sd * random.nextGaussian();
        }
        return values;
    }

    public static ReturnSeries series(double[] values) {
        return ReturnSeries.of(dates(values.length), values);
    }

    /** Two correlated assets built from a shared gaussian factor. */
    public static AssetReturnMatrix twoAssets(int count, long seed) {
        Random random = new Random(seed);
        double[][] values = new double[count][2];
        for (int i = 0; i < count; i++) {
            double common = random.nextGaussian();
            values[i][0] = 0.0005 + 0.02 * (0.8 * common + 0.6 * random.nextGaussian());
            values[i][1] = 0.0002 + 0.01 * (0.5 * common + 0.866 * random.nextGaussian());
        }
        return AssetReturnMatrix.of(dates(count), List.of("BTCUSDT", "ETHUSDT"), values);
    }

    public static List<Double> prices(double start, double[] simpleReturns) {
        List<Double> prices = new ArrayList<>(simpleReturns.length + 1);
        double price = start;
        prices.add(price);
        for (double r : simpleReturns) {
            price *= 1.0 + r;
            prices.add(price);
        }
        return prices;
    }
}
