package com.linlay.capability.catalog;

public class ResourceNotFoundException extends CatalogException {

    public ResourceNotFoundException(String kind, String name) {
        super(kind + " not found: " + name);
    }
}
