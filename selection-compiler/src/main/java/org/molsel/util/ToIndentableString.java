package org.molsel.util;

/** Objects that can render themselves on an {@link IIndentStream}. */
public interface ToIndentableString {
    IIndentStream toString(IIndentStream builder);

    default String toIndentedString() {
        StringBuilder builder = new StringBuilder();
        IndentStream stream = new IndentStream(builder);
        this.toString(stream);
        return builder.toString();
    }
}
