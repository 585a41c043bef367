package org.foxesworld.kalibridge.script;

/** A script failed to evaluate, or the isolate could not run it. */
public class ScriptException extends RuntimeException {

    public ScriptException(String message) {
        super(message);
    }

    public ScriptException(String message, Throwable cause) {
        super(message, cause);
    }
}
