package org.molsel.selCompiler.method;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;

/** Owns all position calculations of a selection collection. */
public final class PositionCalculationCollection {
    private final List<PositionCalculation> calculations = new ArrayList<>();
    @Nullable
    private final Topology topology;

    public PositionCalculationCollection(@Nullable Topology topology) {
        this.topology = topology;
    }

    public PositionCalculation create(PositionType type, EnumSet<PositionFlag> flags) {
        PositionCalculation result = new PositionCalculation(type, flags, this.topology);
        this.calculations.add(result);
        return result;
    }

    public List<PositionCalculation> getCalculations() {
        return Collections.unmodifiableList(this.calculations);
    }
}
