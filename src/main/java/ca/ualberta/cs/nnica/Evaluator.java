package ca.ualberta.cs.nnica;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.util.FastMath;

import java.util.Arrays;

/**
 * Compares recovered sources with known ones. The order and scale of the recovered sources
 * are arbitrary, so sources are matched by absolute correlation.
 */
public class Evaluator {

    private static final int EXHAUSTIVE_LIMIT = 8;

    /**
     * Absolute Pearson correlation between every true source (rows) and every recovered source (columns).
     */
    public static RealMatrix computeCorrelations(RealMatrix trueSources, RealMatrix recovered) {
        if (trueSources.getColumnDimension() != recovered.getColumnDimension()) {
            throw new DimensionMismatchException(recovered.getColumnDimension(), trueSources.getColumnDimension());
        }
        PearsonsCorrelation pearson = new PearsonsCorrelation();
        RealMatrix correlations = MatrixUtils.createRealMatrix(trueSources.getRowDimension(), recovered.getRowDimension());
        for (int i = 0; i < trueSources.getRowDimension(); i++) {
            double[] s = trueSources.getRow(i);
            for (int j = 0; j < recovered.getRowDimension(); j++) {
                double r = pearson.correlation(s, recovered.getRow(j));
                correlations.setEntry(i, j, r == r ? FastMath.abs(r) : 0.);
            }
        }
        return correlations;
    }

    /**
     * One-to-one assignment of recovered sources to true sources maximising the summed absolute
     * correlation.
     *
     * @return for every true source the index of the recovered source assigned to it, -1 if none is left.
     */
    public static int[] matchSources(RealMatrix correlations) {
        int rows = correlations.getRowDimension();
        int cols = correlations.getColumnDimension();
        if (FastMath.max(rows, cols) <= EXHAUSTIVE_LIMIT) {
            return exhaustiveMatch(correlations);
        }
        return greedyMatch(correlations);
    }

    /**
     * @return the absolute correlation of every true source with its matched recovered source.
     */
    public static double[] matchedCorrelations(RealMatrix trueSources, RealMatrix recovered) {
        RealMatrix correlations = computeCorrelations(trueSources, recovered);
        int[] match = matchSources(correlations);
        double[] matched = new double[match.length];
        for (int i = 0; i < match.length; i++) {
            matched[i] = match[i] < 0 ? 0. : correlations.getEntry(i, match[i]);
        }
        return matched;
    }

    private static int[] exhaustiveMatch(RealMatrix correlations) {
        int rows = correlations.getRowDimension();
        int cols = correlations.getColumnDimension();
        int[] best = new int[rows];
        Arrays.fill(best, -1);
        double[] bestScore = {Double.NEGATIVE_INFINITY};
        int[] current = new int[rows];
        boolean[] used = new boolean[cols];
        search(correlations, 0, 0.0, current, used, best, bestScore);
        return best;
    }

    private static void search(RealMatrix correlations, int row, double score, int[] current,
                               boolean[] used, int[] best, double[] bestScore) {
        if (row == current.length) {
            if (score > bestScore[0]) {
                bestScore[0] = score;
                System.arraycopy(current, 0, best, 0, current.length);
            }
            return;
        }
        int free = 0;
        for (int j = 0; j < used.length; j++) {
            if (!used[j]) {
                free++;
                used[j] = true;
                current[row] = j;
                search(correlations, row + 1, score + correlations.getEntry(row, j), current, used, best, bestScore);
                used[j] = false;
            }
        }
        // more true sources left than recovered ones, so some row stays unmatched
        if (current.length - row > free) {
            current[row] = -1;
            search(correlations, row + 1, score, current, used, best, bestScore);
        }
    }

    private static int[] greedyMatch(RealMatrix correlations) {
        int rows = correlations.getRowDimension();
        int cols = correlations.getColumnDimension();
        int[] match = new int[rows];
        Arrays.fill(match, -1);
        boolean[] rowDone = new boolean[rows];
        boolean[] colUsed = new boolean[cols];
        for (int step = 0; step < FastMath.min(rows, cols); step++) {
            int bestRow = -1;
            int bestCol = -1;
            double best = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < rows; i++) {
                for (int j = 0; j < cols; j++) {
                    if (!rowDone[i] && !colUsed[j] && correlations.getEntry(i, j) > best) {
                        best = correlations.getEntry(i, j);
                        bestRow = i;
                        bestCol = j;
                    }
                }
            }
            match[bestRow] = bestCol;
            rowDone[bestRow] = true;
            colUsed[bestCol] = true;
        }
        return match;
    }
}
