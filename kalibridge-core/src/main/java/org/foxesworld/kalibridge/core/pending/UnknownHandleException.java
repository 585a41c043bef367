package org.foxesworld.kalibridge.core.pending;

public final class UnknownHandleException extends IllegalStateException {

    private final long handle;

    public UnknownHandleException(long handle) {
        super("No pending settings for handle " + handle);
        this.handle = handle;
    }

    public long handle() {
        return handle;
    }
}
