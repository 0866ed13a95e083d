package io.github.sachinnimbal.filmes.core.util;

public class TimeUtils {

    private TimeUtils() {}

    public static String formatExecutionTime(long milliseconds) {
        if (milliseconds < 1000) {
            return milliseconds + " ms";
        } else if (milliseconds < 60000) {
            double seconds = milliseconds / 1000.0;
            return String.format("%.2fs (%d ms)", seconds, milliseconds);
        } else {
            long minutes = milliseconds / 60000;
            long seconds = (milliseconds % 60000) / 1000;
            return String.format("%dm %ds (%d ms)", minutes, seconds, milliseconds);
        }
    }

    /**
     * Formats a running time given in minutes, e.g. 95 -> "1h 35m", 120 -> "2h", 45 -> "45m".
     */
    public static String formatRuntime(Integer minutes) {
        if (minutes == null) {
            return null;
        }
        int hours = minutes / 60;
        int rest = minutes % 60;
        if (hours == 0) {
            return rest + "m";
        } else if (rest == 0) {
            return hours + "h";
        }
        return String.format("%dh %dm", hours, rest);
    }
}
