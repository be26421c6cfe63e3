package com.raditha.pyrewrite.model;

/**
 * One way a consuming file refers to the target module or one of its converted names.
 * <p>
 * For {@link ImportKind#QUALIFIED} bindings {@code originalName} is the imported name and
 * {@code localAlias} the identifier it is visible as. For {@link ImportKind#DIRECT} bindings
 * {@code originalName} is the imported module and {@code localAlias} the dotted access path that
 * reaches the target module, e.g. {@code cfg} or {@code pkg.sub.config}.
 *
 * @param originalName name as written in the import
 * @param localAlias   name (or dotted path) used in the file body
 * @param kind         qualified or direct
 * @param moduleName   module as written in the import statement
 * @param location     range of the import clause
 */
public record ImportBinding(
        String originalName,
        String localAlias,
        ImportKind kind,
        String moduleName,
        Range location) {

    /**
     * Renders the import the way it appears in a report.
     */
    public String describe() {
        if (kind == ImportKind.QUALIFIED) {
            String clause = originalName.equals(localAlias) ? originalName : originalName + " as " + localAlias;
            return "from " + moduleName + " import " + clause;
        }
        return "import " + moduleName;
    }
}
