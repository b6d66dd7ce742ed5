package me.christianrobert.vbs2js.transformer.catalog;

import me.christianrobert.vbs2js.transformer.parser.FunctionUnit;
import me.christianrobert.vbs2js.transformer.parser.ParsedProgram;
import me.christianrobert.vbs2js.transformer.parser.VariableDeclaration;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the function and container catalogs reported with a successful transpilation.
 */
public class CatalogBuilder {

    public static List<FunctionCatalogEntry> buildFunctionCatalog(ParsedProgram program) {
        List<FunctionCatalogEntry> entries = new ArrayList<>();
        for (FunctionUnit unit : program.getUnits()) {
            entries.add(new FunctionCatalogEntry(
                    unit.getName(),
                    unit.getKind(),
                    unit.getParameters(),
                    unit.getLocalDeclarations().size(),
                    unit.getReturnAssignments().size(),
                    unit.getStartLine(),
                    unit.getEndLine()));
        }
        return entries;
    }

    /**
     * Global containers first, then each unit's local containers in source order.
     */
    public static List<ContainerCatalogEntry> buildContainerCatalog(ParsedProgram program) {
        List<ContainerCatalogEntry> entries = new ArrayList<>();
        addContainers(entries, program.getGlobalDeclarations(), ContainerCatalogEntry.GLOBAL_SCOPE);
        for (FunctionUnit unit : program.getUnits()) {
            addContainers(entries, unit.getLocalDeclarations(), unit.getName());
        }
        return entries;
    }

    private static void addContainers(List<ContainerCatalogEntry> entries, List<VariableDeclaration> declarations,
                                      String scope) {
        for (VariableDeclaration declaration : declarations) {
            if (declaration.isIndexedContainer()) {
                entries.add(new ContainerCatalogEntry(declaration.getName(), declaration.getDimensions(), scope));
            }
        }
    }
}
