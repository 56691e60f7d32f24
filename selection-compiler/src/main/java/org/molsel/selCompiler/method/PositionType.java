package org.molsel.selCompiler.method;

import org.molsel.selCompiler.compiler.errors.CompilationError;

/** How positions are computed from atoms. */
public enum PositionType {
    ATOM("atom"),
    RES_COM("res_com"),
    RES_COG("res_cog"),
    MOL_COM("mol_com"),
    MOL_COG("mol_cog");

    public final String text;

    PositionType(String text) {
        this.text = text;
    }

    public static PositionType fromString(String text) {
        for (PositionType type: PositionType.values())
            if (type.text.equals(text))
                return type;
        throw new CompilationError("Unknown position type " + text);
    }

    public boolean usesMass() {
        return this == RES_COM || this == MOL_COM;
    }
}
