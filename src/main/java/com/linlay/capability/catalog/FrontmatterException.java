package com.linlay.capability.catalog;

public class FrontmatterException extends CatalogException {

    public FrontmatterException(String message) {
        super(message);
    }

    public FrontmatterException(String message, Throwable cause) {
        super(message, cause);
    }
}
