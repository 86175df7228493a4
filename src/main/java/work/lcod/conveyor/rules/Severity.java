package work.lcod.conveyor.rules;

public enum Severity {
    ERROR("error"),
    WARNING("warning"),
    INFO("info");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /** Only errors block a successful result. */
    public boolean isBlocking() {
        return this == ERROR;
    }
}
