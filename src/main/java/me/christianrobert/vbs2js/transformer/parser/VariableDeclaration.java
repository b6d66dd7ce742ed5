package me.christianrobert.vbs2js.transformer.parser;

import java.util.Collections;
import java.util.List;

/**
 * A declared variable, constant or indexed container.
 *
 * <p>For {@code Dim a(5)} the container size is 5 (the upper bound, so the container
 * holds six elements). For {@code Dim a()} the container is dynamic and has no size.
 * {@code ReDim} declarations keep their bounds as expressions in {@link #getSizeExpressions()}.</p>
 */
public class VariableDeclaration {

    private final String name;
    private final boolean indexedContainer;
    private final List<Integer> dimensions;
    private final List<String> sizeExpressions;
    private final String initializer;
    private final int line;

    private VariableDeclaration(String name, boolean indexedContainer, List<Integer> dimensions,
                                List<String> sizeExpressions, String initializer, int line) {
        this.name = name;
        this.indexedContainer = indexedContainer;
        this.dimensions = List.copyOf(dimensions);
        this.sizeExpressions = List.copyOf(sizeExpressions);
        this.initializer = initializer;
        this.line = line;
    }

    public static VariableDeclaration scalar(String name, int line) {
        return new VariableDeclaration(name, false, Collections.emptyList(), Collections.emptyList(), null, line);
    }

    public static VariableDeclaration constant(String name, String initializer, int line) {
        return new VariableDeclaration(name, false, Collections.emptyList(), Collections.emptyList(), initializer, line);
    }

    /**
     * Fixed-size container; dimensions are the declared upper bounds.
     */
    public static VariableDeclaration container(String name, List<Integer> dimensions, int line) {
        return new VariableDeclaration(name, true, dimensions, Collections.emptyList(), null, line);
    }

    public static VariableDeclaration dynamicContainer(String name, int line) {
        return new VariableDeclaration(name, true, Collections.emptyList(), Collections.emptyList(), null, line);
    }

    /**
     * Container resized at run time (ReDim); bounds are source expressions.
     */
    public static VariableDeclaration resizedContainer(String name, List<String> sizeExpressions, int line) {
        return new VariableDeclaration(name, true, Collections.emptyList(), sizeExpressions, null, line);
    }

    public String getName() {
        return name;
    }

    public boolean isIndexedContainer() {
        return indexedContainer;
    }

    /**
     * Gets the declared upper bound of the first dimension.
     *
     * @return the size, or null for scalars, dynamic and resized containers
     */
    public Integer getContainerSize() {
        return dimensions.isEmpty() ? null : dimensions.get(0);
    }

    public boolean hasContainerSize() {
        return !dimensions.isEmpty();
    }

    public List<Integer> getDimensions() {
        return dimensions;
    }

    public List<String> getSizeExpressions() {
        return sizeExpressions;
    }

    public boolean isConstant() {
        return initializer != null;
    }

    public String getInitializer() {
        return initializer;
    }

    public int getLine() {
        return line;
    }

    @Override
    public String toString() {
        if (!indexedContainer) {
            return isConstant() ? name + " = " + initializer : name;
        }
        if (!dimensions.isEmpty()) {
            return name + dimensions;
        }
        return name + "(" + String.join(", ", sizeExpressions) + ")";
    }
}
