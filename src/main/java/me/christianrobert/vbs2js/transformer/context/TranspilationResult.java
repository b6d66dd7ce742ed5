package me.christianrobert.vbs2js.transformer.context;

import me.christianrobert.vbs2js.transformer.catalog.ContainerCatalogEntry;
import me.christianrobert.vbs2js.transformer.catalog.FunctionCatalogEntry;

import java.util.List;

/**
 * Result of a transpilation.
 * Contains either the generated JavaScript with its diagnostics and catalogs, or an error message.
 */
public class TranspilationResult {

    private final boolean success;
    private final String vbScript;
    private final String javaScript;
    private final String errorMessage;
    private final Diagnostics diagnostics;
    private final List<FunctionCatalogEntry> functionCatalog;
    private final List<ContainerCatalogEntry> containerCatalog;
    private final List<String> residualKeywords;

    private TranspilationResult(boolean success, String vbScript, String javaScript, String errorMessage,
                                Diagnostics diagnostics, List<FunctionCatalogEntry> functionCatalog,
                                List<ContainerCatalogEntry> containerCatalog, List<String> residualKeywords) {
        this.success = success;
        this.vbScript = vbScript;
        this.javaScript = javaScript;
        this.errorMessage = errorMessage;
        this.diagnostics = diagnostics;
        this.functionCatalog = functionCatalog;
        this.containerCatalog = containerCatalog;
        this.residualKeywords = residualKeywords;
    }

    /**
     * Creates a successful transpilation result.
     */
    public static TranspilationResult success(String vbScript, String javaScript, Diagnostics diagnostics,
                                              List<FunctionCatalogEntry> functionCatalog,
                                              List<ContainerCatalogEntry> containerCatalog,
                                              List<String> residualKeywords) {
        return new TranspilationResult(true, vbScript, javaScript, null, diagnostics,
                List.copyOf(functionCatalog), List.copyOf(containerCatalog), List.copyOf(residualKeywords));
    }

    /**
     * Creates a failed transpilation result.
     */
    public static TranspilationResult failure(String vbScript, String errorMessage) {
        return new TranspilationResult(false, vbScript, null, errorMessage, new Diagnostics(),
                List.of(), List.of(), List.of());
    }

    /**
     * Creates a failed transpilation result from an exception.
     */
    public static TranspilationResult failure(String vbScript, TransformationException exception) {
        return failure(vbScript, exception.getDetailedMessage());
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String getVbScript() {
        return vbScript;
    }

    public String getJavaScript() {
        return javaScript;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    public List<FunctionCatalogEntry> getFunctionCatalog() {
        return functionCatalog;
    }

    public List<ContainerCatalogEntry> getContainerCatalog() {
        return containerCatalog;
    }

    public List<String> getResidualKeywords() {
        return residualKeywords;
    }

    public boolean hasResidualKeywords() {
        return !residualKeywords.isEmpty();
    }

    @Override
    public String toString() {
        if (success) {
            return "TranspilationResult{success=true, units=" + functionCatalog.size()
                    + ", diagnostics=" + diagnostics.getTotal() + "}";
        } else {
            return "TranspilationResult{success=false, error='" + errorMessage + "'}";
        }
    }
}
