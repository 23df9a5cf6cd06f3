package work.agentflow.report;

/**
 * Classification of everything that can go wrong while loading or resolving.
 */
public enum IssueKind {
    PARSE_ERROR("ParseError"),
    DUPLICATE_NAME("DuplicateNameError"),
    NOT_FOUND("NotFoundError"),
    UNRESOLVED_CATEGORY("UnresolvedCategoryError"),
    CYCLE("CycleError"),
    IO_ERROR("IOError"),
    LOAD_TRUNCATED("LoadTruncated");

    private final String label;

    IssueKind(String label) {
        this.label = label;
    }

    /** Name used in JSON output and reports. */
    public String label() {
        return label;
    }
}
