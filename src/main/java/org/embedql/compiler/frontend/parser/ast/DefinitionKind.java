package org.embedql.compiler.frontend.parser.ast;

/**
 * Kinds of executable definitions.
 */
public enum DefinitionKind {
    QUERY("query"),
    MUTATION("mutation"),
    SUBSCRIPTION("subscription"),
    FRAGMENT("fragment");

    private final String keyword;

    DefinitionKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * @return The keyword introducing this kind of definition.
     */
    public String keyword() {
        return keyword;
    }

    /**
     * @return {@code true} for query, mutation and subscription.
     */
    public boolean isOperation() {
        return this != FRAGMENT;
    }

    /**
     * Looks up an operation kind by its keyword.
     *
     * @param keyword {@code query}, {@code mutation} or {@code subscription}.
     * @return The kind, or {@code null} if the keyword does not start an operation.
     */
    public static DefinitionKind forOperationKeyword(String keyword) {
        for (DefinitionKind kind : values()) {
            if (kind.isOperation() && kind.keyword.equals(keyword)) {
                return kind;
            }
        }
        return null;
    }
}
