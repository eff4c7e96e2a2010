package com.dkr.optimizer.service;

/**
 * The overtake search reached a state that a correct option table cannot produce.
 */
public class PlanningDefectException extends IllegalStateException {
    public PlanningDefectException(String message) {
        super(message);
    }
}
