package me.christianrobert.vbs2js.transformer.catalog;

import java.util.List;

/**
 * Summary of one declared indexed container for the result catalog.
 * Scope is "global" or the name of the owning unit.
 */
public class ContainerCatalogEntry {

    public static final String GLOBAL_SCOPE = "global";

    private final String name;
    private final List<Integer> dimensions;
    private final String scope;

    public ContainerCatalogEntry(String name, List<Integer> dimensions, String scope) {
        this.name = name;
        this.dimensions = List.copyOf(dimensions);
        this.scope = scope;
    }

    public String getName() {
        return name;
    }

    /**
     * Upper bound of the first dimension, or null for a dynamic container.
     */
    public Integer getDeclaredSize() {
        return dimensions.isEmpty() ? null : dimensions.get(0);
    }

    public List<Integer> getDimensions() {
        return dimensions;
    }

    public String getScope() {
        return scope;
    }

    public boolean isDynamic() {
        return dimensions.isEmpty();
    }

    @Override
    public String toString() {
        return scope + ":" + name + dimensions;
    }
}
