package at.sv.boost;

public enum TemperatureUnit {
    METRIC(5.0, 25.0, "°C"),
    IMPERIAL(40.0, 80.0, "°F");

    private final double fallbackMin;
    private final double fallbackMax;
    private final String symbol;

    TemperatureUnit(double fallbackMin, double fallbackMax, String symbol) {
        this.fallbackMin = fallbackMin;
        this.fallbackMax = fallbackMax;
        this.symbol = symbol;
    }

    public double getFallbackMin() {
        return fallbackMin;
    }

    public double getFallbackMax() {
        return fallbackMax;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * @param unit the {@code unit_system.temperature} value reported by Home Assistant
     */
    public static TemperatureUnit fromHassUnit(String unit) {
        if (unit != null && unit.contains("F")) {
            return IMPERIAL;
        }
        return METRIC;
    }
}
