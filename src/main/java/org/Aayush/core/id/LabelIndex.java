package org.Aayush.core.id;

import lombok.experimental.StandardException;

import java.util.List;

/**
 * Maps dense matrix indices back to the human-readable labels they were built from.
 */
public interface LabelIndex {

    /**
     * Converts a matrix index back to its label.
     *
     * @param index dense index.
     * @return label stored at that index.
     * @throws IndexOutOfBoundsException if the index is outside {@code [0, size)}.
     */
    String labelAt(int index);

    int size();

    /**
     * Thrown when the same label is indexed twice.
     */
    @StandardException
    class DuplicateLabelException extends IllegalArgumentException {
    }

    /**
     * Indexes labels by their position in {@code labels}.
     *
     * @param labels non-null, distinct labels.
     * @return an immutable index.
     */
    static LabelIndex ofOrdered(List<String> labels) {
        return new FastUtilLabelIndex(labels);
    }
}
