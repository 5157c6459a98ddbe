package com.pulsesystems;

/**
 * Unchecked failure raised by the kernel.
 *
 * <p>Every kernel failure is attributed to one unit: a dependency node when resolution fails, an
 * event when a handler rejects it, or a handler when it overruns its time budget. The unit id lets
 * callers log or route the failure without parsing the message. Subclasses decide which id applies.
 */
public class KernelException extends RuntimeException {

    private final String unitId;

    /**
     * @param message human readable description
     * @param unitId  node, event or handler id the failure belongs to; may be null when no single
     *                unit is responsible
     */
    public KernelException(String message, String unitId) {
        super(message);
        this.unitId = unitId;
    }

    /**
     * @param message human readable description
     * @param cause   the failure raised inside the unit, typically by user code
     * @param unitId  node, event or handler id the failure belongs to; may be null
     */
    public KernelException(String message, Throwable cause, String unitId) {
        super(message, cause);
        this.unitId = unitId;
    }

    /**
     * Id of the node, event or handler this failure is attributed to, or null.
     */
    public String getUnitId() {
        return unitId;
    }
}
