package com.raditha.leakage.model;

import com.raditha.leakage.util.Sequences;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * Compact set of testcase IDs, stored as a bit field.
 * <p>
 * Assumes that testcase IDs are small and don't have large gaps in between.
 * Copies share the underlying words until one of them is modified, so
 * {@link #copy()} is constant time regardless of the number of testcases.
 * <p>
 * This class is not thread-safe.
 */
public final class TestcaseIdSet {

    private static final int WORD_BITS = 64;

    private long[] words;

    /**
     * True while {@link #words} may be referenced by another set.
     */
    private boolean shared;

    public TestcaseIdSet() {
        this.words = new long[1];
    }

    private TestcaseIdSet(long[] words) {
        this.words = words;
        this.shared = true;
    }

    /**
     * Creates a new set holding the given IDs.
     */
    public static TestcaseIdSet of(int... testcaseIds) {
        TestcaseIdSet set = new TestcaseIdSet();
        for (int id : testcaseIds) {
            set.add(id);
        }
        return set;
    }

    /**
     * Adds the given testcase ID, if it is not yet included.
     *
     * @return true if the set changed
     */
    public boolean add(int id) {
        checkId(id);
        int word = id / WORD_BITS;
        long mask = 1L << (id % WORD_BITS);
        if (word < words.length && (words[word] & mask) != 0) {
            return false;
        }
        prepareWrite(word);
        words[word] |= mask;
        return true;
    }

    /**
     * Removes the given testcase ID, if it is included.
     *
     * @return true if the set changed
     */
    public boolean remove(int id) {
        checkId(id);
        if (!contains(id)) {
            return false;
        }
        int word = id / WORD_BITS;
        prepareWrite(word);
        words[word] &= ~(1L << (id % WORD_BITS));
        return true;
    }

    public boolean contains(int id) {
        if (id < 0) {
            return false;
        }
        int word = id / WORD_BITS;
        return word < words.length && (words[word] & (1L << (id % WORD_BITS))) != 0;
    }

    /**
     * Returns the number of IDs contained in this set.
     */
    public int size() {
        int count = 0;
        for (long w : words) {
            count += Long.bitCount(w);
        }
        return count;
    }

    public boolean isEmpty() {
        for (long w : words) {
            if (w != 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns a copy of this set. The copy shares storage with this set until
     * either of them is modified.
     */
    public TestcaseIdSet copy() {
        shared = true;
        return new TestcaseIdSet(words);
    }

    /**
     * Returns a copy of this set with the given ID removed.
     */
    public TestcaseIdSet without(int id) {
        TestcaseIdSet copy = copy();
        copy.remove(id);
        return copy;
    }

    /**
     * Returns a copy of this set without the IDs of the given one.
     */
    public TestcaseIdSet without(TestcaseIdSet other) {
        long[] result = words.clone();
        int n = Math.min(result.length, other.words.length);
        for (int i = 0; i < n; i++) {
            result[i] &= ~other.words[i];
        }
        TestcaseIdSet set = new TestcaseIdSet(result);
        set.shared = false;
        return set;
    }

    /**
     * Adds all IDs of the given set.
     */
    public void addAll(TestcaseIdSet other) {
        other.stream().forEach(this::add);
    }

    /**
     * Returns true if this set and the given one have no ID in common.
     */
    public boolean isDisjoint(TestcaseIdSet other) {
        int n = Math.min(words.length, other.words.length);
        for (int i = 0; i < n; i++) {
            if ((words[i] & other.words[i]) != 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns true if every ID of this set is also in the given one.
     */
    public boolean isSubsetOf(TestcaseIdSet other) {
        for (int i = 0; i < words.length; i++) {
            long otherWord = i < other.words.length ? other.words[i] : 0L;
            if ((words[i] & ~otherWord) != 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the contained IDs in ascending order.
     */
    public IntStream stream() {
        long[] snapshot = words;
        return IntStream.range(0, snapshot.length * WORD_BITS)
                .filter(i -> (snapshot[i / WORD_BITS] & (1L << (i % WORD_BITS))) != 0);
    }

    public int[] toArray() {
        return stream().toArray();
    }

    private void prepareWrite(int word) {
        if (word >= words.length) {
            int newSize = 2 * words.length;
            while (newSize <= word) {
                newSize *= 2;
            }
            words = Arrays.copyOf(words, newSize);
            shared = false;
        } else if (shared) {
            words = words.clone();
            shared = false;
        }
    }

    private static void checkId(int id) {
        if (id < 0) {
            throw new IllegalArgumentException("Testcase IDs must be non-negative, got: " + id);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TestcaseIdSet other)) {
            return false;
        }
        int n = Math.max(words.length, other.words.length);
        for (int i = 0; i < n; i++) {
            long a = i < words.length ? words[i] : 0L;
            long b = i < other.words.length ? other.words[i] : 0L;
            if (a != b) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        // Trailing zero words must not change the hash
        int last = words.length - 1;
        while (last >= 0 && words[last] == 0) {
            last--;
        }
        return Arrays.hashCode(Arrays.copyOf(words, last + 1));
    }

    @Override
    public String toString() {
        return Sequences.formatIntegerSequence(stream());
    }
}
