package space.ketterling.marinedata.coops;

import java.time.Instant;

/**
 * One predicted high or low tide.
 *
 * @param height predicted height in the configured unit system, relative to
 *               {@code datum}
 */
public record TidePrediction(String stationId, Instant predictedAt, TideType type, double height, String datum) {

    /**
     * High or low water.
     */
    public enum TideType {
        HIGH("H"),
        LOW("L");

        private final String code;

        TideType(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }

        /**
         * Maps the CO-OPS {@code type} value ({@code H}, {@code L}, and the
         * mixed-tide {@code HH}/{@code LL} variants). Returns null for anything
         * else.
         */
        public static TideType fromCoops(String raw) {
            if (raw == null || raw.isBlank())
                return null;
            String t = raw.trim().toUpperCase();
            if (t.equals("H") || t.equals("HH"))
                return HIGH;
            if (t.equals("L") || t.equals("LL"))
                return LOW;
            return null;
        }
    }
}
