package com.linlay.capability.catalog;

public class InvalidResourceNameException extends CatalogException {

    public enum Reason {
        EMPTY("name cannot be empty"),
        TOO_LONG("name must be " + ResourceNames.MAX_LENGTH + " characters or less"),
        HYPHEN_PLACEMENT("name cannot start or end with a hyphen"),
        CONSECUTIVE_HYPHEN("name cannot contain consecutive hyphens"),
        INVALID_CHARACTER("name must contain only lowercase letters, numbers, and hyphens");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    private final Reason reason;

    public InvalidResourceNameException(Reason reason) {
        super("invalid resource name: " + reason.description());
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
