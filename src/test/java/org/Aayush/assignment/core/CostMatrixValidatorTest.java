package org.Aayush.assignment.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("CostMatrixValidator Tests")
class CostMatrixValidatorTest {

    @Test
    @DisplayName("Valid matrix is deep-copied")
    void testValidMatrixIsCopied() {
        double[][] matrix = {{1, 2}, {3, 4}};

        double[][] copy = CostMatrixValidator.validatedCopy(2, matrix);

        assertNotSame(matrix, copy);
        assertNotSame(matrix[0], copy[0]);
        assertArrayEquals(matrix[1], copy[1]);
        matrix[1][1] = 99.0d;
        assertEquals(4.0d, copy[1][1], 0.0d);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, -42})
    @DisplayName("Non-positive dimension is rejected")
    void testNonPositiveDimension(int n) {
        AssignmentException ex = assertThrows(
                AssignmentException.class,
                () -> CostMatrixValidator.validatedCopy(n, new double[0][0])
        );
        assertEquals(CostMatrixValidator.REASON_INVALID_DIMENSION, ex.reasonCode());
        assertTrue(ex.getMessage().startsWith("[" + CostMatrixValidator.REASON_INVALID_DIMENSION + "]"));
    }

    @Test
    @DisplayName("Row count must equal the declared dimension")
    void testRowCountMismatch() {
        AssignmentException ex = assertThrows(
                AssignmentException.class,
                () -> CostMatrixValidator.validatedCopy(3, new double[][]{{1, 2, 3}, {4, 5, 6}})
        );
        assertEquals(CostMatrixValidator.REASON_INVALID_DIMENSION, ex.reasonCode());
    }

    @Test
    @DisplayName("Rectangular matrix is rejected")
    void testRectangularMatrix() {
        AssignmentException ex = assertThrows(
                AssignmentException.class,
                () -> CostMatrixValidator.validatedCopy(2, new double[][]{{1, 2, 3}, {4, 5, 6}})
        );
        assertEquals(CostMatrixValidator.REASON_INVALID_DIMENSION, ex.reasonCode());
        assertTrue(ex.getMessage().contains("row 0"));
    }

    @Test
    @DisplayName("Null matrix and null rows are rejected")
    void testNullMatrixAndRows() {
        AssignmentException nullMatrix = assertThrows(
                AssignmentException.class,
                () -> CostMatrixValidator.validatedCopy(2, null)
        );
        assertEquals(CostMatrixValidator.REASON_COST_MATRIX_REQUIRED, nullMatrix.reasonCode());

        AssignmentException nullRow = assertThrows(
                AssignmentException.class,
                () -> CostMatrixValidator.validatedCopy(2, new double[][]{{1, 2}, null})
        );
        assertEquals(CostMatrixValidator.REASON_COST_MATRIX_REQUIRED, nullRow.reasonCode());
    }

    @ParameterizedTest
    @ValueSource(doubles = {Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY})
    @DisplayName("Non-finite entries are rejected with their position")
    void testNonFiniteEntries(double value) {
        AssignmentException ex = assertThrows(
                AssignmentException.class,
                () -> CostMatrixValidator.validatedCopy(2, new double[][]{{1, 2}, {3, value}})
        );
        assertEquals(CostMatrixValidator.REASON_NON_FINITE_COST, ex.reasonCode());
        assertTrue(ex.getMessage().contains("cost[1][1]"));
    }
}
