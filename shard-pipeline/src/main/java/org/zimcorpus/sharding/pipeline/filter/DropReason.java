package org.zimcorpus.sharding.pipeline.filter;

/**
 * Why an archive entry was not selected. Declared in the order the predicates are evaluated.
 */
public enum DropReason {
    WRONG_NAMESPACE("not in namespace"),
    DELETED("deleted"),
    REDIRECT("redirect"),
    EXCLUDED_TITLE("excluded title");

    private final String description;

    DropReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
