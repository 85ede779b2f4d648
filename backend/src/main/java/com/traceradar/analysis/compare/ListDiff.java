package com.traceradar.analysis.compare;

import java.util.List;

/**
 * Added, removed and common items between two ordered lists. Order follows the source list of each group.
 */
public record ListDiff(List<String> added, List<String> removed, List<String> common) {

    public ListDiff {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
        common = List.copyOf(common);
    }

    public static ListDiff between(List<String> before, List<String> after) {
        return new ListDiff(
                after.stream().filter(item -> !before.contains(item)).toList(),
                before.stream().filter(item -> !after.contains(item)).toList(),
                before.stream().filter(after::contains).toList());
    }
}
