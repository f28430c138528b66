package com.textmetrics.scoring;

/**
 * 分母为零时比值定义为 0。
 */
final class Ratios {
    private Ratios() {
    }

    static double safeDivide(double numerator, double denominator) {
        if (denominator == 0) {
            return 0.0;
        }
        return numerator / denominator;
    }
}
