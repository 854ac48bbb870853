package org.webmev.structures.attribute;

import org.webmev.structures.error.DataStructureException;
import org.webmev.structures.shared.Values;

final class NumericValues {
    static final String MINIMUM_KEY = "min";
    static final String MAXIMUM_KEY = "max";

    private NumericValues() {}

    static long integral(Object raw, String expectation) {
        if (Values.isIntegral(raw)) {
            return Values.toLong(raw);
        }
        throw DataStructureException.invalidValue(
            expectation + " was expected, but " + Values.describe(raw) + " is not an integer.");
    }

    static FloatValue floating(Object raw, String expectation) {
        return FloatValue.parse(raw).orElseThrow(() -> DataStructureException.invalidValue(
            expectation + " was expected, but received " + Values.describe(raw) + "."));
    }

    static long integralBound(Object raw, String typeName, String key) {
        if (!Values.isIntegral(raw)) {
            throw DataStructureException.invalidParameter(
                "The " + key + " bound (" + raw + ") of a " + typeName + " attribute must be an integer.");
        }
        return Values.toLong(raw);
    }

    static double floatBound(Object raw, String typeName, String key) {
        if (!Values.isNumber(raw) || !Double.isFinite(Values.toDouble(raw))) {
            throw DataStructureException.invalidParameter(
                "The " + key + " bound (" + raw + ") of a " + typeName + " attribute must be a finite number.");
        }
        return Values.toDouble(raw);
    }

    static void checkOrder(double min, double max, String typeName) {
        if (min > max) {
            throw DataStructureException.invalidParameter(
                "The bounds [" + min + "," + max + "] of a " + typeName + " attribute are inverted.");
        }
    }
}
