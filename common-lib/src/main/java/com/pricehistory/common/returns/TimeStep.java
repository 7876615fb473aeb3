package com.pricehistory.common.returns;

import com.pricehistory.common.exception.InvalidArgumentException;
import com.pricehistory.common.model.Interval;
import com.pricehistory.common.model.Period;

/**
 * Length of one observation as a fraction of a year, used to annualise return statistics.
 *
 * <p>DAILY 1/365, WEEKLY 1/52, MONTHLY 1/12, INTRADAY {@code minutes / (24*60)}.
 */
public final class TimeStep {

    private static final double MINUTES_PER_DAY = 24.0 * 60.0;

    private TimeStep() {}

    public static double of(Period period, Interval interval) {
        if (period == null) {
            throw new InvalidArgumentException("period must be specified");
        }
        return switch (period) {
            case DAILY -> 1.0 / 365.0;
            case WEEKLY -> 1.0 / 52.0;
            case MONTHLY -> 1.0 / 12.0;
            case INTRADAY -> {
                if (interval == null) {
                    throw new InvalidArgumentException("Invalid interval for intraday period");
                }
                yield interval.minutes() / MINUTES_PER_DAY;
            }
        };
    }
}
