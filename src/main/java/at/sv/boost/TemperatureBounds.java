package at.sv.boost;

public record TemperatureBounds(double min, double max) {

    public double clamp(double value) {
        return Math.max(min, Math.min(max, value));
    }
}
