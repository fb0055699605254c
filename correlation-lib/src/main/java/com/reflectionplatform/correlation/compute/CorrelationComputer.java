package com.reflectionplatform.correlation.compute;

import com.reflectionplatform.correlation.align.SeriesAligner;
import com.reflectionplatform.correlation.model.DataMetric;
import com.reflectionplatform.correlation.model.DataPoint;
import com.reflectionplatform.correlation.model.DateRange;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.TDistribution;

import java.util.List;
import java.util.Optional;

/**
 * Scores aligned samples and searches lag offsets for the strongest relationship.
 *
 * <h3>Score</h3>
 * <ul>
 *   <li>Fewer than {@code minimumSampleSize} samples: empty.</li>
 *   <li>Zero variance on either side: empty. Pearson is undefined there.</li>
 *   <li>Otherwise Pearson r over the mean-centred sums, and a confidence of
 *       {@code 1 - p} where p is the two-sided p-value of
 *       {@code t = r * sqrt((n - 2) / (1 - r^2))}. Student's t with {@code n - 2}
 *       degrees of freedom is used below {@code largeSampleThreshold}, the standard
 *       normal from there on.</li>
 * </ul>
 * Confidence grows with the sample size and with {@code |r|} and stays in [0, 1].
 *
 * <h3>Lag search</h3>
 * For an unordered pair {A, B} (A the smaller key) lag 0 is scored once as A to B;
 * each positive lag is scored in both orientations, A leading B and B leading A.
 * The candidate with the highest {@code |r|} wins. Ties (within 1e-12) go to the smaller lag, then
 * to the A-leads-B orientation. Candidates below the minimum sample size never win.
 *
 * <p>Stateless apart from its settings; safe to share across threads as long as the
 * catalog's providers are.
 */
public class CorrelationComputer {

    /** Coefficients closer than this are a tie in the lag search. */
    private static final double TIE_TOLERANCE = 1e-12;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0.0, 1.0);

    private final SeriesAligner aligner;
    private final int minimumSampleSize;
    private final int largeSampleThreshold;
    private final List<Integer> lagOffsets;

    public CorrelationComputer(SeriesAligner aligner, int minimumSampleSize,
                               int largeSampleThreshold, List<Integer> lagOffsets) {
        this.aligner = aligner;
        this.minimumSampleSize = minimumSampleSize;
        this.largeSampleThreshold = largeSampleThreshold;
        this.lagOffsets = List.copyOf(lagOffsets);
    }

    // ── score ───────────────────────────────────────────────────────────────

    public Optional<PairScore> score(List<DataPoint> points) {
        int n = points.size();
        if (n < minimumSampleSize || n < 3) return Optional.empty();

        double meanX = 0;
        double meanY = 0;
        for (DataPoint p : points) {
            meanX += p.valueX();
            meanY += p.valueY();
        }
        meanX /= n;
        meanY /= n;

        double sumXY = 0;
        double sumX2 = 0;
        double sumY2 = 0;
        for (DataPoint p : points) {
            double dx = p.valueX() - meanX;
            double dy = p.valueY() - meanY;
            sumXY += dx * dy;
            sumX2 += dx * dx;
            sumY2 += dy * dy;
        }
        if (sumX2 == 0 || sumY2 == 0) return Optional.empty();

        double r = sumXY / Math.sqrt(sumX2 * sumY2);
        if (Double.isNaN(r)) return Optional.empty();
        r = Math.max(-1.0, Math.min(1.0, r));

        return Optional.of(new PairScore(r, confidence(r, n), n));
    }

    /**
     * {@code 1 - p} for the hypothesis that the true correlation is zero.
     * Package-private for tests.
     */
    double confidence(double r, int n) {
        double magnitude = Math.abs(r);
        double residual = 1.0 - magnitude * magnitude;
        if (residual <= 0) return 1.0;

        int degreesOfFreedom = n - 2;
        double t = magnitude * Math.sqrt(degreesOfFreedom / residual);
        double upperTail = n >= largeSampleThreshold
            ? 1.0 - STANDARD_NORMAL.cumulativeProbability(t)
            : 1.0 - new TDistribution(null, degreesOfFreedom).cumulativeProbability(t);
        double p = Math.min(1.0, 2.0 * upperTail);
        return Math.max(0.0, Math.min(1.0, 1.0 - p));
    }

    // ── lag search ──────────────────────────────────────────────────────────

    /**
     * Best-scoring lag and orientation for the pair, or empty when no candidate has
     * enough samples and non-zero variance.
     */
    public Optional<LaggedScore> bestLag(DataMetric metricA, DataMetric metricB, DateRange range) {
        DataMetric first = metricA.key().compareTo(metricB.key()) <= 0 ? metricA : metricB;
        DataMetric second = first == metricA ? metricB : metricA;

        LaggedScore best = null;
        for (int lag : lagOffsets) {
            best = better(best, evaluate(first, second, range, lag));
            if (lag > 0) {
                best = better(best, evaluate(second, first, range, lag));
            }
        }
        return Optional.ofNullable(best);
    }

    /** Aligned samples and score for one fixed orientation and lag. */
    public LaggedScore evaluate(DataMetric leading, DataMetric following, DateRange range, int lag) {
        List<DataPoint> points = aligner.align(leading, following, range, lag);
        PairScore score = score(points).orElse(null);
        return new LaggedScore(leading, following, lag, points, score);
    }

    // lagOffsets is sorted and the canonical orientation is evaluated first,
    // so keeping the incumbent on equal |r| implements both tie-breaks.
    private static LaggedScore better(LaggedScore incumbent, LaggedScore candidate) {
        if (candidate.score() == null) return incumbent;
        if (incumbent == null) return candidate;
        double challenger = Math.abs(candidate.score().coefficient());
        double current = Math.abs(incumbent.score().coefficient());
        return challenger > current + TIE_TOLERANCE ? candidate : incumbent;
    }

    public int minimumSampleSize() {
        return minimumSampleSize;
    }

    public List<Integer> lagOffsets() {
        return lagOffsets;
    }
}
