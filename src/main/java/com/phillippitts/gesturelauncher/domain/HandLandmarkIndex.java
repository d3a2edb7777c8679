package com.phillippitts.gesturelauncher.domain;

/**
 * Indices of the hand landmarks produced by MediaPipe-style hand trackers (21 points per hand).
 */
public final class HandLandmarkIndex {

    public static final int THUMB_IP = 3;
    public static final int THUMB_TIP = 4;
    public static final int INDEX_FINGER_PIP = 6;
    public static final int INDEX_FINGER_TIP = 8;
    public static final int MIDDLE_FINGER_PIP = 10;
    public static final int MIDDLE_FINGER_TIP = 12;
    public static final int RING_FINGER_PIP = 14;
    public static final int RING_FINGER_TIP = 16;
    public static final int PINKY_PIP = 18;
    public static final int PINKY_TIP = 20;

    // index, middle, ring, pinky
    private static final int[] FINGER_TIPS = {INDEX_FINGER_TIP, MIDDLE_FINGER_TIP, RING_FINGER_TIP, PINKY_TIP};
    private static final int[] FINGER_PIPS = {INDEX_FINGER_PIP, MIDDLE_FINGER_PIP, RING_FINGER_PIP, PINKY_PIP};

    private HandLandmarkIndex() {
    }

    /** @return tip index of finger {@code finger} (1 = index ... 4 = pinky) */
    public static int tipOf(int finger) {
        return FINGER_TIPS[checkFinger(finger) - 1];
    }

    /** @return PIP joint index of finger {@code finger} (1 = index ... 4 = pinky) */
    public static int pipOf(int finger) {
        return FINGER_PIPS[checkFinger(finger) - 1];
    }

    private static int checkFinger(int finger) {
        if (finger < 1 || finger > 4) {
            throw new IllegalArgumentException("finger must be 1..4, got: " + finger);
        }
        return finger;
    }
}
