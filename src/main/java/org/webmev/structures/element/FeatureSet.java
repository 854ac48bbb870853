package org.webmev.structures.element;

import java.util.List;
import org.webmev.structures.attribute.AttributeOptions;
import org.webmev.structures.attribute.AttributeParameters;

/**
 * The measured variables attached to some data, e.g. the genes (rows) of an expression matrix.
 */
public final class FeatureSet extends ElementSet<Feature, FeatureSet> {
    public static final String TYPE = "FeatureSet";

    private static final ElementReader<Feature> READER =
        (raw, options) -> new Feature(raw, options, AttributeParameters.none());

    public FeatureSet(Object raw, AttributeOptions options, AttributeParameters params) {
        super(raw, options, params, READER);
    }

    private FeatureSet(List<Feature> elements, boolean singleton, boolean permitNullAttributes) {
        super(elements, singleton, permitNullAttributes, READER);
    }

    public static FeatureSet of(List<Feature> elements) {
        return new FeatureSet(elements, false, false);
    }

    public static FeatureSet of(List<Feature> elements, boolean singleton) {
        return new FeatureSet(elements, singleton, false);
    }

    @Override
    protected FeatureSet create(List<Feature> elements, boolean singleton, boolean permitNullAttributes) {
        return new FeatureSet(elements, singleton, permitNullAttributes);
    }

    @Override
    public String typeName() {
        return TYPE;
    }
}
