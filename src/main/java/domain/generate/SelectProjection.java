package domain.generate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Ordered SELECT list of one source, plus the grouping columns of a pivot.
 *
 * <p>Grouping columns are kept sorted so GROUP BY text does not depend on column order.</p>
 */
final class SelectProjection {

    private final List<SelectItem> items = new ArrayList<>();
    private final SortedSet<String> groupBy = new TreeSet<>();

    void add(String expression, String alias) {
        items.add(new SelectItem(expression, alias));
    }

    void addGroupBy(String column) {
        groupBy.add(column);
    }

    List<SelectItem> items() {
        return Collections.unmodifiableList(items);
    }

    SortedSet<String> groupBy() {
        return Collections.unmodifiableSortedSet(groupBy);
    }

    String selectList() {
        List<String> parts = new ArrayList<>(items.size());
        for (SelectItem it : items) parts.add(it.render());
        return String.join(", ", parts);
    }
}
