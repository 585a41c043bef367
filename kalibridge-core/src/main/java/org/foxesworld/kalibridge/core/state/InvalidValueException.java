package org.foxesworld.kalibridge.core.state;

/** A property value (or value index) lies outside the property's domain. */
public final class InvalidValueException extends IllegalArgumentException {
    public InvalidValueException(String message) {
        super(message);
    }
}
