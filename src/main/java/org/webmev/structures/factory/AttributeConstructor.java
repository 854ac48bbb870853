package org.webmev.structures.factory;

import org.webmev.structures.attribute.Attribute;
import org.webmev.structures.attribute.AttributeOptions;
import org.webmev.structures.attribute.AttributeParameters;

/**
 * Builds one attribute variant from its raw value and leftover parameters.
 */
@FunctionalInterface
public interface AttributeConstructor {
    Attribute create(Object value, AttributeOptions options, AttributeParameters params);
}
