package ai.acsl.injector.inject;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Validated fragment sequence. Index 0 holds the predicate declarations; indices from 1 are consumed in
 * traversal order: each function's specification followed by one invariant block per loop.
 */
public final class FragmentList {

    private final List<String> predicates;
    private final List<String> slotFragments;

    private FragmentList(List<String> predicates, List<String> slotFragments) {
        this.predicates = List.copyOf(predicates);
        this.slotFragments = List.copyOf(slotFragments);
    }

    public static FragmentList of(List<String> predicates, String... slotFragments) {
        List<Object> raw = new ArrayList<>();
        raw.add(predicates);
        raw.addAll(Arrays.asList(slotFragments));
        return from(raw);
    }

    /**
     * Validates a raw sequence, typically decoded from JSON, before any traversal takes place.
     *
     * @throws MalformedFragmentListException when the shape is wrong anywhere in the sequence
     */
    public static FragmentList from(Object raw) {
        if (!(raw instanceof List<?> sequence)) {
            throw new MalformedFragmentListException("fragment sequence must be a list, got " + describe(raw));
        }
        if (sequence.isEmpty()) {
            throw new MalformedFragmentListException("fragment sequence must start with a list of predicates");
        }
        if (!(sequence.get(0) instanceof List<?> rawPredicates)) {
            throw new MalformedFragmentListException("fragment 0 must be a list of predicate strings, got "
                    + describe(sequence.get(0)));
        }
        List<String> predicates = new ArrayList<>(rawPredicates.size());
        for (int i = 0; i < rawPredicates.size(); i++) {
            if (!(rawPredicates.get(i) instanceof String predicate)) {
                throw new MalformedFragmentListException("predicate " + i + " of fragment 0 must be a string, got "
                        + describe(rawPredicates.get(i)));
            }
            predicates.add(predicate);
        }
        List<String> slots = new ArrayList<>(sequence.size() - 1);
        for (int i = 1; i < sequence.size(); i++) {
            if (!(sequence.get(i) instanceof String fragment)) {
                throw new MalformedFragmentListException("fragment " + i + " must be a string, got "
                        + describe(sequence.get(i)));
            }
            slots.add(fragment);
        }
        return new FragmentList(predicates, slots);
    }

    public List<String> predicates() {
        return predicates;
    }

    /**
     * Size of the whole sequence, predicate element included.
     */
    public int size() {
        return slotFragments.size() + 1;
    }

    /**
     * Fragment text at a sequence index; index 0 is the predicate list and has no text of its own.
     */
    public String fragment(int index) {
        if (index < 1 || index >= size()) {
            throw new IndexOutOfBoundsException("fragment index " + index + " outside 1.." + (size() - 1));
        }
        return slotFragments.get(index - 1);
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FragmentList that)) {
            return false;
        }
        return predicates.equals(that.predicates) && slotFragments.equals(that.slotFragments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(predicates, slotFragments);
    }

    @Override
    public String toString() {
        return "FragmentList{predicates=" + predicates.size() + ", slots=" + slotFragments.size() + '}';
    }
}
