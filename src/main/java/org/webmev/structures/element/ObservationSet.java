package org.webmev.structures.element;

import java.util.List;
import org.webmev.structures.attribute.AttributeOptions;
import org.webmev.structures.attribute.AttributeParameters;

/**
 * The samples attached to some data, e.g. the columns of an expression matrix.
 */
public final class ObservationSet extends ElementSet<Observation, ObservationSet> {
    public static final String TYPE = "ObservationSet";

    private static final ElementReader<Observation> READER =
        (raw, options) -> new Observation(raw, options, AttributeParameters.none());

    public ObservationSet(Object raw, AttributeOptions options, AttributeParameters params) {
        super(raw, options, params, READER);
    }

    private ObservationSet(List<Observation> elements, boolean singleton, boolean permitNullAttributes) {
        super(elements, singleton, permitNullAttributes, READER);
    }

    public static ObservationSet of(List<Observation> elements) {
        return new ObservationSet(elements, false, false);
    }

    public static ObservationSet of(List<Observation> elements, boolean singleton) {
        return new ObservationSet(elements, singleton, false);
    }

    @Override
    protected ObservationSet create(List<Observation> elements, boolean singleton, boolean permitNullAttributes) {
        return new ObservationSet(elements, singleton, permitNullAttributes);
    }

    @Override
    public String typeName() {
        return TYPE;
    }
}
