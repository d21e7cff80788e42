package com.baskettecase.datastore.resource;

/**
 * The platform's "describe resource by id" operation.
 */
@FunctionalInterface
public interface ResourceDescriber {

    ResourceDescriptor describe(String resourceId);
}
