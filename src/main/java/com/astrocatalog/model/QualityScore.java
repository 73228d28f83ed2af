package com.astrocatalog.model;

public final class QualityScore {

    private QualityScore() {}

    /** 0 con cero frames, lineal hasta 100 al llegar a {@code recommendedFrames}. */
    public static int of(int frameCount, int recommendedFrames) {
        if (frameCount <= 0) return 0;
        long score = Math.round(frameCount * 100.0 / recommendedFrames);
        return (int) Math.min(100, score);
    }
}
