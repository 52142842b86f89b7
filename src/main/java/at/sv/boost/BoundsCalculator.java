package at.sv.boost;

/**
 * Derives the range a boost temperature may be selected from, based on the {@code min_temp} and {@code max_temp}
 * attributes of a thermostat. Missing or non-numeric attributes count as 0.
 */
public final class BoundsCalculator {

    private BoundsCalculator() {
    }

    public static TemperatureBounds calculate(Object rawMin, Object rawMax, TemperatureUnit unit) {
        double min = normalize(rawMin);
        double max = normalize(rawMax);
        if (min == 0 && max == 0) {
            return fallback(unit);
        }
        if (max == 0 && min > 0) {
            max = unit.getFallbackMax();
        }
        if (min > max) {
            return fallback(unit);
        }
        return new TemperatureBounds(min, max);
    }

    private static TemperatureBounds fallback(TemperatureUnit unit) {
        return new TemperatureBounds(unit.getFallbackMin(), unit.getFallbackMax());
    }

    private static double normalize(Object value) {
        double result;
        if (value instanceof Number number) {
            result = number.doubleValue();
        } else if (value instanceof String s) {
            try {
                result = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        } else {
            return 0;
        }
        return Double.isFinite(result) ? result : 0;
    }
}
