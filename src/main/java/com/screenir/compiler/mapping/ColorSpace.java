package com.screenir.compiler.mapping;

/**
 * sRGB to CIE LAB conversion (D65 white point) and CIE76 color difference.
 */
public final class ColorSpace {

    private ColorSpace() {
    }

    // D65 white point
    private static final double XN = 0.95047;
    private static final double YN = 1.00000;
    private static final double ZN = 1.08883;

    /**
     * [L*, a*, b*] of an sRGB color.
     */
    public static double[] toLab(HexColor color) {
        double rl = gammaExpand(color.getRed() / 255.0);
        double gl = gammaExpand(color.getGreen() / 255.0);
        double bl = gammaExpand(color.getBlue() / 255.0);

        double x = 0.4124564 * rl + 0.3575761 * gl + 0.1804375 * bl;
        double y = 0.2126729 * rl + 0.7151522 * gl + 0.0721750 * bl;
        double z = 0.0193339 * rl + 0.1191920 * gl + 0.9503041 * bl;

        double fx = labF(x / XN);
        double fy = labF(y / YN);
        double fz = labF(z / ZN);

        return new double[]{116.0 * fy - 16.0, 500.0 * (fx - fy), 200.0 * (fy - fz)};
    }

    /**
     * Euclidean distance in LAB space.
     */
    public static double deltaE76(double[] lab1, double[] lab2) {
        double dL = lab1[0] - lab2[0];
        double da = lab1[1] - lab2[1];
        double db = lab1[2] - lab2[2];
        return Math.sqrt(dL * dL + da * da + db * db);
    }

    public static double deltaE76(HexColor a, HexColor b) {
        return deltaE76(toLab(a), toLab(b));
    }

    /**
     * Relative luminance in [0, 1].
     */
    public static double relativeLuminance(HexColor color) {
        return 0.2126 * gammaExpand(color.getRed() / 255.0)
             + 0.7152 * gammaExpand(color.getGreen() / 255.0)
             + 0.0722 * gammaExpand(color.getBlue() / 255.0);
    }

    private static double gammaExpand(double c) {
        return c <= 0.04045 ? c / 12.92 : Math.pow((c + 0.055) / 1.055, 2.4);
    }

    private static double labF(double t) {
        return t > 0.008856 ? Math.cbrt(t) : (903.3 * t + 16.0) / 116.0;
    }
}
