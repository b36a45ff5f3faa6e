package org.specrun.engine;

final class Faults {
    private Faults() {
    }

    /**
     * Everything thrown by user code becomes a result, except errors the JVM cannot recover from.
     */
    static void rethrowIfFatal(Throwable thrown) {
        if (thrown instanceof VirtualMachineError error) {
            throw error;
        }
    }
}
