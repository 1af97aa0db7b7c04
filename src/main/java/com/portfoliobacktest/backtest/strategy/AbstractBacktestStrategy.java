package com.portfoliobacktest.backtest.strategy;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Base class holding a strategy's parameter map with typed lookups.
 * Parameters arrive from JSON, so numbers may be any {@link Number} or a numeric string.
 */
public abstract class AbstractBacktestStrategy implements BacktestStrategy {

    protected final Map<String, Object> params;

    protected AbstractBacktestStrategy(Map<String, Object> params) {
        this.params = params != null ? new HashMap<>(params) : new HashMap<>();
    }

    public Map<String, Object> getParams() {
        return Collections.unmodifiableMap(params);
    }

    protected int getInt(String name, int defaultValue) {
        Object value = params.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter '" + name + "' is not an integer: " + value, e);
        }
    }

    protected double getDouble(String name, double defaultValue) {
        Object value = params.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter '" + name + "' is not a number: " + value, e);
        }
    }

    protected String getString(String name, String defaultValue) {
        Object value = params.get(name);
        return value != null ? value.toString() : defaultValue;
    }
}
