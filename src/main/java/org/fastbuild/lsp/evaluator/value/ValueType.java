package org.fastbuild.lsp.evaluator.value;

/**
 * The kinds of values a BFF variable can hold, with the names used in error messages.
 */
public enum ValueType {
    BOOLEAN("Boolean", "a Boolean"),
    INTEGER("Integer", "an Integer"),
    STRING("String", "a String"),
    ARRAY("Array", "an Array"),
    STRUCT("Struct", "a Struct");

    private final String displayName;
    private final String withArticle;

    ValueType(String displayName, String withArticle) {
        this.displayName = displayName;
        this.withArticle = withArticle;
    }

    /**
     * @return The bare name, e.g. "Integer".
     */
    public String displayName() {
        return displayName;
    }

    /**
     * @return The name with its indefinite article, e.g. "an Integer".
     */
    public String withArticle() {
        return withArticle;
    }

    /**
     * @return The plural name, e.g. "Strings", as used in "Array of Strings".
     */
    public String plural() {
        return displayName + "s";
    }
}
