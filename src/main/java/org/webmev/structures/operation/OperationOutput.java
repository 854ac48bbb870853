package org.webmev.structures.operation;

import java.util.Map;
import java.util.Set;

public final class OperationOutput extends OperationInputOutput {
    private OperationOutput(Map<String, Object> raw) {
        super(raw, Set.of());
    }

    public static OperationOutput fromMap(Object raw) {
        return new OperationOutput(requireMap(raw, "output"));
    }

    @Override
    public String toString() {
        return "OperationOutput. Spec: " + spec();
    }
}
