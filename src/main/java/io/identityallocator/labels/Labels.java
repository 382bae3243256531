package io.identityallocator.labels;

import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Immutable label set keyed by label key. Iteration order is key order, which makes
 * {@link #sortedList()} independent of the order labels were supplied in.
 */
@EqualsAndHashCode
public final class Labels {

    static final String LIST_SEPARATOR = ";";

    private static final Labels EMPTY = new Labels(new TreeMap<>());

    private final SortedMap<String, Label> byKey;

    private Labels(SortedMap<String, Label> byKey) {
        this.byKey = Collections.unmodifiableSortedMap(byKey);
    }

    public static Labels empty() {
        return EMPTY;
    }

    public static Labels of(Label... labels) {
        return of(List.of(labels));
    }

    /**
     * Later labels with the same key replace earlier ones.
     */
    public static Labels of(Collection<Label> labels) {
        TreeMap<String, Label> map = new TreeMap<>();
        for (Label label : labels) {
            map.put(label.getKey(), label);
        }
        return new Labels(map);
    }

    public static Labels parse(String... raw) {
        return parse(List.of(raw));
    }

    public static Labels parse(Collection<String> raw) {
        List<Label> labels = new ArrayList<>(raw.size());
        for (String r : raw) {
            labels.add(Label.parse(r));
        }
        return of(labels);
    }

    /**
     * Inverse of {@link #sortedList()}.
     */
    public static Labels fromSortedList(String sortedList) {
        if (sortedList == null || sortedList.isEmpty()) {
            return EMPTY;
        }
        List<Label> labels = new ArrayList<>();
        for (String part : sortedList.split(LIST_SEPARATOR)) {
            if (!part.isEmpty()) {
                labels.add(Label.parse(part));
            }
        }
        return of(labels);
    }

    /**
     * Deterministic encoding {@code source:key=value;} per label in key order. This is the
     * canonical key under which the label set is allocated.
     */
    public String sortedList() {
        StringBuilder sb = new StringBuilder();
        for (Label label : byKey.values()) {
            sb.append(label.format()).append(LIST_SEPARATOR);
        }
        return sb.toString();
    }

    public Label get(String key) {
        return byKey.get(key);
    }

    public List<Label> toList() {
        return List.copyOf(byKey.values());
    }

    public Map<String, Label> asMap() {
        return byKey;
    }

    public int size() {
        return byKey.size();
    }

    public boolean isEmpty() {
        return byKey.isEmpty();
    }

    public List<String> toStrings() {
        return byKey.values().stream().map(Label::toString).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "[" + String.join(" ", toStrings()) + "]";
    }
}
