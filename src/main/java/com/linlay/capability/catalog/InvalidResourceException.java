package com.linlay.capability.catalog;

public class InvalidResourceException extends CatalogException {

    public InvalidResourceException(String message) {
        super(message);
    }
}
