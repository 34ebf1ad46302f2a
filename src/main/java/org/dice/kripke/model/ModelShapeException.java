package org.dice.kripke.model;

/**
 * Raised when a model refers to a world it does not contain, either while it is being
 * built or when it is queried with an unknown world.
 */
public class ModelShapeException extends RuntimeException {

    public ModelShapeException(String message) {
        super(message);
    }
}
