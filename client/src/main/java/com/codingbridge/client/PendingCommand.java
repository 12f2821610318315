package com.codingbridge.client;

import com.codingbridge.protocol.PermissionMode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A user command waiting in the {@link OutboundQueue}.
 *
 * Everything but {@code attempts} is fixed at submission. When no explicit
 * {@code sessionId} is given the bound session is resolved at send time.
 */
public final class PendingCommand {

    private final String         id;
    private final String         command;
    private final String         projectPath;
    private final String         sessionId;
    private final PermissionMode permissionMode;
    private final List<byte[]>   images;
    private final String         model;
    private final long           createdAt;
    private int                  attempts;

    private PendingCommand(Builder b) {
        this.id             = UUID.randomUUID().toString();
        this.command        = b.command;
        this.projectPath    = b.projectPath;
        this.sessionId      = b.sessionId;
        this.permissionMode = b.permissionMode;
        this.images         = List.copyOf(b.images);
        this.model          = b.model;
        this.createdAt      = b.createdAt;
    }

    public static Builder builder(String command, String projectPath) {
        return new Builder(command, projectPath);
    }

    public String id()                      { return id; }
    public String command()                 { return command; }
    public String projectPath()             { return projectPath; }
    public String sessionId()               { return sessionId; }
    public PermissionMode permissionMode()  { return permissionMode; }
    public List<byte[]> images()            { return images; }
    public String model()                   { return model; }
    public long createdAt()                 { return createdAt; }
    public int attempts()                   { return attempts; }

    /** @return the attempt count after recording this failure */
    int recordFailedAttempt() {
        return ++attempts;
    }

    @Override
    public String toString() {
        return "PendingCommand{id=" + id + ", attempts=" + attempts + ", command=" + abbreviate(command) + '}';
    }

    private static String abbreviate(String s) {
        return s.length() > 40 ? s.substring(0, 40) + "..." : s;
    }

    public static final class Builder {
        private final String   command;
        private final String   projectPath;
        private String         sessionId;
        private PermissionMode permissionMode;
        private final List<byte[]> images = new ArrayList<>();
        private String         model;
        private long           createdAt = System.currentTimeMillis();

        private Builder(String command, String projectPath) {
            this.command     = Objects.requireNonNull(command, "command");
            this.projectPath = Objects.requireNonNull(projectPath, "projectPath");
        }

        /** Resume this session explicitly instead of the one currently bound. */
        public Builder sessionId(String sessionId)            { this.sessionId = sessionId; return this; }
        public Builder permissionMode(PermissionMode mode)    { this.permissionMode = mode; return this; }
        public Builder image(byte[] data)                     { this.images.add(data); return this; }
        public Builder model(String model)                    { this.model = model; return this; }
        public Builder createdAt(long epochMillis)            { this.createdAt = epochMillis; return this; }

        public PendingCommand build() {
            return new PendingCommand(this);
        }
    }
}
