package org.webmev.structures.factory;

import org.webmev.structures.attribute.BooleanAttribute;
import org.webmev.structures.attribute.BoundedFloatAttribute;
import org.webmev.structures.attribute.BoundedFloatListAttribute;
import org.webmev.structures.attribute.BoundedIntegerAttribute;
import org.webmev.structures.attribute.BoundedIntegerListAttribute;
import org.webmev.structures.attribute.DataResourceAttribute;
import org.webmev.structures.attribute.FloatAttribute;
import org.webmev.structures.attribute.IntegerAttribute;
import org.webmev.structures.attribute.NonNegativeFloatAttribute;
import org.webmev.structures.attribute.NonNegativeIntegerAttribute;
import org.webmev.structures.attribute.OperationDataResourceAttribute;
import org.webmev.structures.attribute.OptionStringAttribute;
import org.webmev.structures.attribute.PositiveFloatAttribute;
import org.webmev.structures.attribute.PositiveIntegerAttribute;
import org.webmev.structures.attribute.StringAttribute;
import org.webmev.structures.attribute.StringListAttribute;
import org.webmev.structures.attribute.UnrestrictedStringAttribute;
import org.webmev.structures.attribute.UnrestrictedStringListAttribute;
import org.webmev.structures.attribute.VariableDataResourceAttribute;
import org.webmev.structures.element.Feature;
import org.webmev.structures.element.FeatureSet;
import org.webmev.structures.element.Observation;
import org.webmev.structures.element.ObservationSet;

/**
 * The two process-wide registries, built once and read-only afterwards.
 * Element attributes are built from {@link #leaf()}, top-level values from {@link #standard()}.
 */
public final class AttributeRegistries {
    private static final AttributeRegistry LEAF = createLeaf().freeze();
    private static final AttributeRegistry STANDARD = createStandard().freeze();

    private AttributeRegistries() {}

    public static AttributeRegistry leaf() {
        return LEAF;
    }

    public static AttributeRegistry standard() {
        return STANDARD;
    }

    private static AttributeRegistry createLeaf() {
        return new AttributeRegistry()
            .register(IntegerAttribute.TYPE, IntegerAttribute::new)
            .register(PositiveIntegerAttribute.TYPE, PositiveIntegerAttribute::new)
            .register(NonNegativeIntegerAttribute.TYPE, NonNegativeIntegerAttribute::new)
            .register(BoundedIntegerAttribute.TYPE, BoundedIntegerAttribute::new)
            .register(FloatAttribute.TYPE, FloatAttribute::new)
            .register(PositiveFloatAttribute.TYPE, PositiveFloatAttribute::new)
            .register(NonNegativeFloatAttribute.TYPE, NonNegativeFloatAttribute::new)
            .register(BoundedFloatAttribute.TYPE, BoundedFloatAttribute::new)
            .register(StringAttribute.TYPE, StringAttribute::new)
            .register(UnrestrictedStringAttribute.TYPE, UnrestrictedStringAttribute::new)
            .register(OptionStringAttribute.TYPE, OptionStringAttribute::new)
            .register(BooleanAttribute.TYPE, BooleanAttribute::new)
            .register(DataResourceAttribute.TYPE, DataResourceAttribute::new)
            .register(OperationDataResourceAttribute.TYPE, OperationDataResourceAttribute::new)
            .register(VariableDataResourceAttribute.TYPE, VariableDataResourceAttribute::new)
            .register(StringListAttribute.TYPE, StringListAttribute::new)
            .register(UnrestrictedStringListAttribute.TYPE, UnrestrictedStringListAttribute::new)
            .register(BoundedIntegerListAttribute.TYPE, BoundedIntegerListAttribute::new)
            .register(BoundedFloatListAttribute.TYPE, BoundedFloatListAttribute::new);
    }

    private static AttributeRegistry createStandard() {
        return new AttributeRegistry()
            .registerAll(LEAF)
            .register(Observation.TYPE, Observation::new)
            .register(Feature.TYPE, Feature::new)
            .register(ObservationSet.TYPE, ObservationSet::new)
            .register(FeatureSet.TYPE, FeatureSet::new);
    }
}
