package domain.mapping;

import java.util.List;

/** Immutable input of one generation run. */
public final class MappingDocument {

    private final List<TableMapping> mappings;

    public MappingDocument(List<TableMapping> mappings) {
        this.mappings = mappings == null ? List.of() : List.copyOf(mappings);
    }

    public List<TableMapping> getMappings() {
        return mappings;
    }

    public int size() {
        return mappings.size();
    }
}
