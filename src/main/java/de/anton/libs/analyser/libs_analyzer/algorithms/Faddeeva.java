package de.anton.libs.analyser.libs_analyzer.algorithms;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.FastMath;

/**
 * Faddeeva function {@code w(z) = exp(-z²) erfc(-iz)} using Weideman's rational approximation
 * (SIAM J. Numer. Anal. 31, 1994) with N = 32 terms. The expansion coefficients are computed once
 * with a 128-point FFT.
 */
public final class Faddeeva {

    private static final int N = 32;
    private static final int M = 2 * N;
    private static final int M2 = 2 * M;
    private static final double L = Math.sqrt(N / Math.sqrt(2.0));
    private static final double INV_SQRT_PI = 1.0 / Math.sqrt(Math.PI);

    /** Polynomial coefficients a_1..a_N (index 0 is a_1). */
    private static final double[] COEFFICIENTS = computeCoefficients();

    private Faddeeva() {
        throw new IllegalStateException("Utility class should not be instantiated.");
    }

    private static double[] computeCoefficients() {
        double[] f = new double[M2];
        // f[0] = 0, f[j] holds k = j - M for k = -M+1 .. M-1
        for (int k = -M + 1; k <= M - 1; k++) {
            double t = L * FastMath.tan(k * Math.PI / M / 2.0);
            f[k + M] = FastMath.exp(-t * t) * (L * L + t * t);
        }
        double[] shifted = new double[M2];
        for (int i = 0; i < M2; i++) {
            shifted[i] = f[(i + M2 / 2) % M2];
        }
        Complex[] spectrum = new FastFourierTransformer(DftNormalization.STANDARD).transform(shifted, TransformType.FORWARD);
        double[] coefficients = new double[N];
        for (int j = 1; j <= N; j++) {
            coefficients[j - 1] = spectrum[j].getReal() / M2;
        }
        return coefficients;
    }

    /**
     * Evaluates {@code w(z)}. Points in the lower half-plane use {@code w(z) = 2 exp(-z²) - w(-z)}.
     */
    public static Complex w(Complex z) {
        if (z.getImaginary() < 0) {
            Complex reflected = upperHalfPlane(z.negate());
            return z.multiply(z).negate().exp().multiply(2.0).subtract(reflected);
        }
        return upperHalfPlane(z);
    }

    /** Real part of {@code w(x + iy)}, the quantity a Voigt profile needs. */
    public static double realW(double x, double y) {
        return w(new Complex(x, y)).getReal();
    }

    private static Complex upperHalfPlane(Complex z) {
        Complex iz = Complex.I.multiply(z);
        Complex denominator = new Complex(L, 0.0).subtract(iz);   // L - iz
        Complex bigZ = new Complex(L, 0.0).add(iz).divide(denominator);
        // Horner: a_N Z^(N-1) + ... + a_1
        Complex p = Complex.ZERO;
        for (int j = N - 1; j >= 0; j--) {
            p = p.multiply(bigZ).add(COEFFICIENTS[j]);
        }
        return p.multiply(2.0).divide(denominator.multiply(denominator))
                .add(new Complex(INV_SQRT_PI, 0.0).divide(denominator));
    }
}
