package com.cmlarchitect.core.model;

import java.util.List;

/**
 * Common view of the attribute-carrying domain objects whose names must be unique across
 * the whole model: entities, value objects, domain events and commands.
 */
public interface DomainObject {

    String id();

    String name();

    List<Attribute> attributes();

    /**
     * Returns the kind of this domain object.
     *
     * @return domain object kind
     */
    DomainObjectKind kind();
}
