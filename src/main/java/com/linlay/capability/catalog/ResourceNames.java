package com.linlay.capability.catalog;

/**
 * Name grammar shared by skills and subagents: 1-64 characters from {@code [a-z0-9-]},
 * no leading, trailing or doubled hyphen.
 * <p>
 * Every name coming from outside is checked here before it is joined onto a search root,
 * so {@code ..}, separators, drive letters and NUL never reach the filesystem.
 */
public final class ResourceNames {

    public static final int MAX_LENGTH = 64;

    private ResourceNames() {
    }

    public static void validate(String name) {
        if (name == null || name.isEmpty()) {
            throw new InvalidResourceNameException(InvalidResourceNameException.Reason.EMPTY);
        }
        if (name.length() > MAX_LENGTH) {
            throw new InvalidResourceNameException(InvalidResourceNameException.Reason.TOO_LONG);
        }
        if (name.charAt(0) == '-' || name.charAt(name.length() - 1) == '-') {
            throw new InvalidResourceNameException(InvalidResourceNameException.Reason.HYPHEN_PLACEMENT);
        }
        char previous = 0;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '-' && previous == '-') {
                throw new InvalidResourceNameException(InvalidResourceNameException.Reason.CONSECUTIVE_HYPHEN);
            }
            if ((c < 'a' || c > 'z') && (c < '0' || c > '9') && c != '-') {
                throw new InvalidResourceNameException(InvalidResourceNameException.Reason.INVALID_CHARACTER);
            }
            previous = c;
        }
    }
}
