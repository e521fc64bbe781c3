package me.sunmisc.dynarray;

/**
 * State of the error latch of a {@link DynamicArray}.
 */
public enum ArrayError {
    OK,
    /**
     * Allocation, growth or shrink of the backing memory was refused.
     */
    OUT_OF_MEMORY,
    /**
     * An index was outside the range valid for the operation,
     * or a removal was attempted on an empty array.
     */
    OUT_OF_BOUNDS
}
