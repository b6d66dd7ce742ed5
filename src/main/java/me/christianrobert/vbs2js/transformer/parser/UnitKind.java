package me.christianrobert.vbs2js.transformer.parser;

/**
 * Kind of a callable unit.
 */
public enum UnitKind {
    /** Function: returns a value by assigning to its own name. */
    VALUE_RETURNING("Function"),
    /** Sub: performs actions only. */
    ACTION_ONLY("Sub");

    private final String keyword;

    UnitKind(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    public static UnitKind fromKeyword(String keyword) {
        return "function".equalsIgnoreCase(keyword) ? VALUE_RETURNING : ACTION_ONLY;
    }
}
