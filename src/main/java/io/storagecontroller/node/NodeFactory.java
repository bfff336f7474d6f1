package io.storagecontroller.node;

/**
 * Creates node objects for the registry.
 */
@FunctionalInterface
public interface NodeFactory {

    Node create(String name);
}
