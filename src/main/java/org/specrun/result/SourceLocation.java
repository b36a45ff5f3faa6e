package org.specrun.result;

import java.util.Objects;

/**
 * Position in a source file, attached to examples and failures.
 */
public record SourceLocation(String file, int line, int column) {
    public SourceLocation {
        Objects.requireNonNull(file, "file");
        if (file.isBlank()) {
            throw new IllegalArgumentException("file must not be blank");
        }
        if (line < 1 || column < 0) {
            throw new IllegalArgumentException("line must be >= 1 and column >= 0");
        }
    }

    public static SourceLocation of(String file, int line) {
        return new SourceLocation(file, line, 0);
    }

    /**
     * Location of the first stack frame outside of the given package prefix.
     */
    public static SourceLocation callerOutside(String packagePrefix) {
        for (StackTraceElement frame : Thread.currentThread().getStackTrace()) {
            String className = frame.getClassName();
            if (className.startsWith("java.")
                || className.startsWith("jdk.")
                || className.startsWith("sun.")
                || className.equals(SourceLocation.class.getName())
                || className.startsWith(packagePrefix)) {
                continue;
            }
            if (frame.getFileName() == null || frame.getLineNumber() < 1) {
                return null;
            }
            return new SourceLocation(frame.getFileName(), frame.getLineNumber(), 0);
        }
        return null;
    }

    @Override
    public String toString() {
        return column > 0 ? file + ":" + line + ":" + column : file + ":" + line;
    }
}
