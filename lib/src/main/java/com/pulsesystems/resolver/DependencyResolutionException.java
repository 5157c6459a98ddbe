package com.pulsesystems.resolver;

import com.pulsesystems.KernelException;
import com.pulsesystems.resolver.ResolutionFailure.CyclicDependency;
import com.pulsesystems.resolver.ResolutionFailure.UnknownDependency;

/**
 * Thrown when a caller chooses to abort on a failed resolution.
 */
public class DependencyResolutionException extends KernelException {

    private final transient ResolutionFailure failure;

    public DependencyResolutionException(ResolutionFailure failure) {
        super(failure.describe(), offendingId(failure));
        this.failure = failure;
    }

    public ResolutionFailure getFailure() {
        return failure;
    }

    private static String offendingId(ResolutionFailure failure) {
        if (failure instanceof UnknownDependency unknown) {
            return unknown.missingId();
        }
        return ((CyclicDependency) failure).path().get(0);
    }
}
