package org.webmev.structures.catalog;

/**
 * One known resource type: the short key stored with resources (e.g. {@code I_MTX}) and its display label.
 */
public record ResourceType(String key, String label, String description) {}
