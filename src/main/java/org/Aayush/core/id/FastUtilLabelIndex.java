package org.Aayush.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;

/**
 * {@link LabelIndex} backed by a plain array; a fastutil open hash map detects
 * duplicate labels while indexing.
 *
 * <p>Immutable after construction and safe for concurrent reads.</p>
 */
public final class FastUtilLabelIndex implements LabelIndex {
    private static final int MISSING = -1;

    private final String[] reverse;

    /**
     * Indexes labels in list order.
     *
     * @param labels distinct, non-null labels.
     * @throws IllegalArgumentException when the list or one of its labels is null.
     * @throws DuplicateLabelException when a label occurs twice.
     */
    public FastUtilLabelIndex(List<String> labels) {
        if (labels == null) {
            throw new IllegalArgumentException("Labels cannot be null");
        }
        int size = labels.size();
        Object2IntOpenHashMap<String> seen = new Object2IntOpenHashMap<>(size);
        seen.defaultReturnValue(MISSING);
        this.reverse = new String[size];

        for (int index = 0; index < size; index++) {
            String label = labels.get(index);
            if (label == null) {
                throw new IllegalArgumentException("Label at index " + index + " is null");
            }
            int previous = seen.put(label, index);
            if (previous != MISSING) {
                throw new DuplicateLabelException(
                        "Duplicate label '" + label + "' at indices " + previous + " and " + index
                );
            }
            reverse[index] = label;
        }
    }

    @Override
    public String labelAt(int index) {
        if (index < 0 || index >= reverse.length) {
            throw new IndexOutOfBoundsException("Label index out of bounds: " + index);
        }
        return reverse[index];
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
