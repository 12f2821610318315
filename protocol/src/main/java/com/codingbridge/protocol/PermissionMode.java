package com.codingbridge.protocol;

/** Tool permission policy requested for a command. */
public enum PermissionMode {
    DEFAULT            ("default"),
    PLAN               ("plan"),
    BYPASS_PERMISSIONS ("bypassPermissions");

    public final String wire;

    PermissionMode(String wire) { this.wire = wire; }

    public static PermissionMode fromWire(String wire) {
        for (PermissionMode m : values()) {
            if (m.wire.equals(wire)) return m;
        }
        throw new IllegalArgumentException("Unknown permission mode: " + wire);
    }
}
