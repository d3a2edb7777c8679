package com.phillippitts.gesturelauncher.domain;

/**
 * One normalized hand landmark. x grows to the right and y grows downward in image space.
 *
 * @param x normalized horizontal coordinate
 * @param y normalized vertical coordinate
 * @param z relative depth (unused by finger counting)
 */
public record Landmark(double x, double y, double z) {

    public static Landmark of(double x, double y) {
        return new Landmark(x, y, 0.0);
    }

    /** @return true if both image-plane coordinates are finite numbers */
    public boolean isUsable() {
        return Double.isFinite(x) && Double.isFinite(y);
    }
}
