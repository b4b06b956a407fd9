package org.hexregion.core.util;

import java.util.concurrent.CancellationException;

public class OperationCancelledException extends CancellationException {

    public OperationCancelledException(String message) {
        super(message);
    }
}
