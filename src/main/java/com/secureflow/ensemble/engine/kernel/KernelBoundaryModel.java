package com.secureflow.ensemble.engine.kernel;

/**
 * Trained RBF boundary: support points with uniform dual coefficients, the kernel width
 * and the bias separating the dense region from the rest of the space.
 */
public final class KernelBoundaryModel {

    private final double[][] supportVectors;
    private final double alpha;
    private final double gamma;
    private final double rho;

    KernelBoundaryModel(double[][] supportVectors, double gamma, double rho) {
        this.supportVectors = supportVectors;
        this.alpha = 1.0 / supportVectors.length;
        this.gamma = gamma;
        this.rho = rho;
    }

    /**
     * K(x) = sum of alpha * exp(-gamma * |x - sv|^2) over the support points.
     */
    public double kernelSum(double[] point) {
        double sum = 0.0;
        for (double[] sv : supportVectors) {
            double distance = 0.0;
            for (int i = 0; i < point.length; i++) {
                double diff = point[i] - sv[i];
                distance += diff * diff;
            }
            sum += alpha * Math.exp(-gamma * distance);
        }
        return sum;
    }

    /**
     * Signed distance to the boundary: positive inside the dense region, negative outside.
     */
    public double decisionValue(double[] point) {
        return kernelSum(point) - rho;
    }

    public int getSupportVectorCount() { return supportVectors.length; }
    public double getGamma() { return gamma; }
    public double getRho() { return rho; }
}
