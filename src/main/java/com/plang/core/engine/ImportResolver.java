package com.plang.core.engine;

import java.util.Optional;

/**
 * Supplies PLang source for {@code import} statements.
 */
@FunctionalInterface
public interface ImportResolver {

    /**
     * @param path     path as written in the import statement
     * @param importer id of the importing unit, or null for the root source
     * @return the imported unit, or empty if it cannot be found
     */
    Optional<ResolvedImport> resolve(String path, String importer);

    /**
     * @param id     stable identity of the unit; repeated ids are imported once
     * @param source PLang source text
     */
    record ResolvedImport(String id, String source) {}
}
