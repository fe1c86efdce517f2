package com.linlay.capability.catalog;

public class ResourceAlreadyRegisteredException extends CatalogException {

    public ResourceAlreadyRegisteredException(String kind, String name) {
        super(kind + " is already registered: " + name);
    }
}
