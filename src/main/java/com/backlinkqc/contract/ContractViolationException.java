package com.backlinkqc.contract;

/**
 * Thrown when an inbound order or validation request breaks its input contract.
 */
public class ContractViolationException extends PlanningException {

    public ContractViolationException(String message) {
        super(ErrorKind.CONTRACT_VIOLATION, message);
    }
}
