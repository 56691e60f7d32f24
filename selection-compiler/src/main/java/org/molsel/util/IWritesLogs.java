package org.molsel.util;

/** Marker interface for classes that write to the {@link Logger}.
 * Logging levels are set per implementing class. */
public interface IWritesLogs {
    default int getDebugLevel() {
        return Logger.INSTANCE.getLoggingLevel(this.getClass());
    }

    default IIndentStream getDebugStream(int level) {
        return Logger.INSTANCE.belowLevel(this, level);
    }
}
