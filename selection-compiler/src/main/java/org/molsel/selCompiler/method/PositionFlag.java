package org.molsel.selCompiler.method;

public enum PositionFlag {
    /** Complete blocks so that the maximal group is covered. */
    COMPLMAX,
    /** Always use whole residues or molecules. */
    COMPLWHOLE,
    /** Positions only mark which atoms are selected. */
    MASKONLY,
    /** The evaluation group changes between frames. */
    DYNAMIC,
    VELOCITIES,
    FORCES
}
