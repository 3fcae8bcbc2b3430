package com.secureflow.ensemble.engine.kernel;

import com.secureflow.ensemble.engine.AbstractAnomalyDetector;
import com.secureflow.ensemble.model.AlgorithmResult;
import com.secureflow.ensemble.model.DetectorType;
import com.secureflow.ensemble.model.PerformanceProfile;

/**
 * Boundary-based detector over a trained {@link KernelBoundaryModel}.
 *
 * Scoring:
 *   decision = K(x) - rho, positive inside the boundary.
 *   score = rho / (rho + K(x)), the sigmoid of -ln(K(x) / rho): strictly decreasing in the
 *   decision value and exactly 0.5 on the boundary.
 *   The threshold is in decision units; a point is anomalous when decision < threshold.
 *   Confidence is |decision|, clamped to [0, 1].
 */
public class KernelBoundaryDetector extends AbstractAnomalyDetector {

    public static final double DEFAULT_THRESHOLD = 0.0;

    public static final PerformanceProfile BASELINE = PerformanceProfile.builder()
            .accuracy(0.91)
            .precision(0.89)
            .recall(0.93)
            .f1Score(0.91)
            .falsePositiveRate(0.038)
            .diversity(0.82)
            .build();

    private final KernelBoundaryModel model;

    public KernelBoundaryDetector(KernelBoundaryModel model, int dimension) {
        this(model, dimension, DEFAULT_THRESHOLD);
    }

    public KernelBoundaryDetector(KernelBoundaryModel model, int dimension, double threshold) {
        super(DetectorType.KERNEL_BOUNDARY, dimension, threshold, BASELINE);
        this.model = model;
    }

    @Override
    protected AlgorithmResult.AlgorithmResultBuilder evaluate(double[] point, double threshold) {
        double rho = model.getRho();
        double kernelSum = model.kernelSum(point);
        double decision = kernelSum - rho;
        double score = rho / (rho + kernelSum);

        return result(score, Math.abs(decision), decision < threshold)
                .diagnostic("decisionValue", decision)
                .diagnostic("kernelSum", kernelSum)
                .diagnostic("rho", rho)
                .diagnostic("supportVectors", (double) model.getSupportVectorCount());
    }

    public KernelBoundaryModel getModel() { return model; }
}
