package org.foxesworld.kalibridge.core.pending;

public final class DuplicateHandleException extends IllegalStateException {

    private final long handle;

    public DuplicateHandleException(long handle) {
        super("Pending settings already stored for handle " + handle);
        this.handle = handle;
    }

    public long handle() {
        return handle;
    }
}
