package com.conveyal.roofarea;

/**
 * Unchecked exception for problems detected by roof area operations themselves, as opposed to I/O failures which
 * propagate unchanged from the readers and writers. The type distinguishes bad configuration (which the user can fix
 * by changing parameters or input files), unmet preconditions of a particular operation, and paths through the
 * system that are known not to be implemented.
 */
public class RoofAreaException extends RuntimeException {

    public final Type type;

    public enum Type {
        /** Invalid parameters, missing CRS on a geometry source, missing grouping key... */
        CONFIGURATION,
        /** Inputs are well formed but do not satisfy what the selected operation needs, e.g. no footprints. */
        PRECONDITION,
        /** A permanent limitation, not a transient failure. Retrying will not help. */
        UNSUPPORTED;
    }

    public static RoofAreaException configuration (String message) {
        return new RoofAreaException(Type.CONFIGURATION, message);
    }

    public static RoofAreaException precondition (String message) {
        return new RoofAreaException(Type.PRECONDITION, message);
    }

    public static RoofAreaException unsupported (String message) {
        return new RoofAreaException(Type.UNSUPPORTED, message);
    }

    public RoofAreaException (Type type, String message) {
        super(message);
        this.type = type;
    }

    public RoofAreaException (Type type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    @Override
    public String toString () {
        return "RoofAreaException (" + type + "): " + getMessage();
    }

}
