package org.pulsar.runtime.util;

import org.pulsar.runtime.model.Vector2;

/**
 * Unit conversions and angle helpers shared by the processors.
 */
public final class GameMath {

    private GameMath() {}

    /**
     * Kilometres in one astronomical unit.
     */
    public static final double KM_PER_AU = 149_597_870.7;

    public static final double TWO_PI = 2.0 * Math.PI;

    /**
     * Angle conversions and normalisation.
     */
    public static final class Angle {

        private Angle() {}

        public static double toRadians(double degrees) {
            return degrees * Math.PI / 180.0;
        }

        public static double toDegrees(double radians) {
            return radians * 180.0 / Math.PI;
        }

        /**
         * Normalises an angle to (-π, π].
         */
        public static double normaliseRadians(double radians) {
            double result = normaliseRadiansPositive(radians);
            return result > Math.PI ? result - TWO_PI : result;
        }

        /**
         * Normalises an angle to [0, 2π).
         */
        public static double normaliseRadiansPositive(double radians) {
            double result = radians % TWO_PI;
            if (result < 0) {
                result += TWO_PI;
            }
            // -epsilon % 2π + 2π can round to exactly 2π
            return result >= TWO_PI ? 0.0 : result;
        }

        /**
         * Normalises an angle to [0, 360).
         */
        public static double normaliseDegrees(double degrees) {
            return toDegrees(normaliseRadiansPositive(toRadians(degrees)));
        }
    }

    /**
     * Distance conversions.
     */
    public static final class Distance {

        private Distance() {}

        public static double auToKm(double au) {
            return au * KM_PER_AU;
        }

        public static double kmToAu(double km) {
            return km / KM_PER_AU;
        }

        public static double kmToM(double km) {
            return km * 1000.0;
        }

        public static double mToKm(double meters) {
            return meters / 1000.0;
        }

        public static double auToM(double au) {
            return kmToM(auToKm(au));
        }

        public static double mToAu(double meters) {
            return kmToAu(mToKm(meters));
        }

        /**
         * @return Euclidean distance between two positions, in the unit of the inputs.
         */
        public static double distanceBetween(Vector2 p1, Vector2 p2) {
            return p1.minus(p2).length();
        }
    }
}
