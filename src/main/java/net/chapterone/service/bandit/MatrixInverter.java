package net.chapterone.service.bandit;

import net.chapterone.exception.NumericInstabilityException;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

/**
 * Inverts arm design matrices. A is symmetric positive-definite by construction, so a Cholesky
 * factorization is the primary path; the SVD pseudo-inverse covers matrices that lost that property.
 */
final class MatrixInverter {

    private MatrixInverter() {
    }

    /**
     * @throws NumericInstabilityException when A is not symmetric positive-definite or holds non-finite entries
     */
    static RealMatrix invertSpd(String armId, RealMatrix designMatrix) {
        if (!isFinite(designMatrix)) {
            throw new NumericInstabilityException(armId, "matrix has non-finite entries", null);
        }
        try {
            return new CholeskyDecomposition(designMatrix).getSolver().getInverse();
        } catch (MathIllegalArgumentException | MathArithmeticException ex) {
            throw new NumericInstabilityException(armId, ex.getMessage(), ex);
        }
    }

    /**
     * Moore-Penrose pseudo-inverse; non-finite entries are zeroed first so the SVD can run.
     */
    static RealMatrix pseudoInverse(RealMatrix designMatrix) {
        RealMatrix sanitized = designMatrix.copy();
        for (int i = 0; i < sanitized.getRowDimension(); i++) {
            for (int j = 0; j < sanitized.getColumnDimension(); j++) {
                double value = sanitized.getEntry(i, j);
                if (Double.isNaN(value) || Double.isInfinite(value)) {
                    sanitized.setEntry(i, j, 0.0);
                }
            }
        }
        return new SingularValueDecomposition(sanitized).getSolver().getInverse();
    }

    private static boolean isFinite(RealMatrix matrix) {
        for (int i = 0; i < matrix.getRowDimension(); i++) {
            for (int j = 0; j < matrix.getColumnDimension(); j++) {
                double value = matrix.getEntry(i, j);
                if (Double.isNaN(value) || Double.isInfinite(value)) {
                    return false;
                }
            }
        }
        return true;
    }
}
