package com.linlay.capability.catalog;

public class ResourceFileNotFoundException extends CatalogException {

    public ResourceFileNotFoundException(String definitionFileName, String name) {
        super(definitionFileName + " file not found for: " + name);
    }
}
