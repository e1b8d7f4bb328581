package com.scrapouille.dashboard.batch.service;

/**
 * Raised inside a run when the invoker breaks its contract by throwing or returning nothing.
 */
public class InvokerContractException extends BatchFaultException {

    public InvokerContractException(int index, String message, Throwable cause) {
        super(index, message, cause);
    }
}
