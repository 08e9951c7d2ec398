package dev.transput.engine;

public enum ValueMode {
    INT("INT"),
    LONG_INT("LONG INT"),
    REAL("REAL"),
    LONG_REAL("LONG REAL"),
    COMPLEX("COMPLEX"),
    LONG_COMPLEX("LONG COMPLEX"),
    BOOL("BOOL"),
    CHAR("CHAR"),
    STRING("STRING"),
    BITS("BITS"),
    LONG_BITS("LONG BITS");

    private final String displayName;

    ValueMode(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isLong() {
        return this == LONG_INT || this == LONG_REAL || this == LONG_COMPLEX || this == LONG_BITS;
    }
}
