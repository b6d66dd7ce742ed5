package me.christianrobert.vbs2js.transformer.context;

import me.christianrobert.vbs2js.core.tools.NameNormalizer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Program-wide name facts for the expression transpiler and the post-processor.
 *
 * <p>Built once by {@link KnowledgeBaseBuilder} from the whole parsed program, before any
 * expression is transpiled. Immutable after construction and passed explicitly to every
 * consumer.</p>
 *
 * <p>All lookups are case-insensitive; the canonical spelling (the one used at the
 * declaration) is what the generated code uses.</p>
 */
public class KnowledgeBase {

    // Lookup key (lowercase) -> declared spelling
    private final Map<String, String> containerNames;
    private final Map<String, String> callableNames;
    private final Map<String, String> canonicalNames;

    // Lookup key -> declared dimensions (empty for dynamic containers)
    private final Map<String, List<Integer>> containerDimensions;

    public KnowledgeBase(Map<String, String> containerNames,
                         Map<String, String> callableNames,
                         Map<String, String> canonicalNames,
                         Map<String, List<Integer>> containerDimensions) {
        this.containerNames = Collections.unmodifiableMap(new LinkedHashMap<>(containerNames));
        this.callableNames = Collections.unmodifiableMap(new LinkedHashMap<>(callableNames));
        this.canonicalNames = Collections.unmodifiableMap(new LinkedHashMap<>(canonicalNames));
        this.containerDimensions = Collections.unmodifiableMap(new LinkedHashMap<>(containerDimensions));
    }

    /**
     * An empty knowledge base (used for isolated expression transpilation in tests and tools).
     */
    public static KnowledgeBase empty() {
        return new KnowledgeBase(Map.of(), Map.of(), Map.of(), Map.of());
    }

    public boolean isContainer(String name) {
        return containerNames.containsKey(NameNormalizer.normalizeIdentifier(name));
    }

    /**
     * True for a unit name that is not also a container.
     */
    public boolean isCallable(String name) {
        String key = NameNormalizer.normalizeIdentifier(name);
        return callableNames.containsKey(key) && !containerNames.containsKey(key);
    }

    /**
     * Declared spelling of a known name, or the name itself when unknown.
     */
    public String canonical(String name) {
        String key = NameNormalizer.normalizeIdentifier(name);
        String declared = containerNames.get(key);
        if (declared == null) {
            declared = callableNames.get(key);
        }
        if (declared == null) {
            declared = canonicalNames.get(key);
        }
        return declared != null ? declared : name;
    }

    /**
     * Declared size of a container's first dimension, or null for dynamic or unknown containers.
     */
    public Integer getContainerSize(String name) {
        List<Integer> dimensions = containerDimensions.get(NameNormalizer.normalizeIdentifier(name));
        return dimensions == null || dimensions.isEmpty() ? null : dimensions.get(0);
    }

    public List<Integer> getContainerDimensions(String name) {
        List<Integer> dimensions = containerDimensions.get(NameNormalizer.normalizeIdentifier(name));
        return dimensions == null ? List.of() : dimensions;
    }

    /**
     * Declared spellings of all containers.
     */
    public Set<String> getContainerNames() {
        return Set.copyOf(containerNames.values());
    }

    /**
     * Declared spellings of all Function and Sub names.
     */
    public Set<String> getCallableNames() {
        return Set.copyOf(callableNames.values());
    }

    @Override
    public String toString() {
        return "KnowledgeBase{containers=" + containerNames.values() + ", callables=" + callableNames.values() + "}";
    }
}
