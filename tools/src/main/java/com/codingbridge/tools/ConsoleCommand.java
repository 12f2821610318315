package com.codingbridge.tools;

/**
 * One line of console input. Lines starting with a known slash command map to
 * a control action; everything else (including unknown slash commands such as
 * {@code /compact}) is forwarded to the agent as a prompt.
 */
public record ConsoleCommand(Kind kind, String arg) {

    public enum Kind { PROMPT, APPROVE, ALWAYS, DENY, ABORT, CLEAR, MODEL, ATTACH, STATUS, QUIT, EMPTY }

    public static ConsoleCommand parse(String line) {
        if (line == null) return new ConsoleCommand(Kind.QUIT, null);
        String trimmed = line.strip();
        if (trimmed.isEmpty()) return new ConsoleCommand(Kind.EMPTY, null);
        if (!trimmed.startsWith("/")) return new ConsoleCommand(Kind.PROMPT, trimmed);

        int space = trimmed.indexOf(' ');
        String verb = space < 0 ? trimmed : trimmed.substring(0, space);
        String rest = space < 0 ? null : trimmed.substring(space + 1).strip();
        if (rest != null && rest.isEmpty()) rest = null;

        return switch (verb) {
            case "/approve" -> new ConsoleCommand(Kind.APPROVE, null);
            case "/always"  -> new ConsoleCommand(Kind.ALWAYS, null);
            case "/deny"    -> new ConsoleCommand(Kind.DENY, null);
            case "/abort"   -> new ConsoleCommand(Kind.ABORT, null);
            case "/clear"   -> new ConsoleCommand(Kind.CLEAR, null);
            case "/status"  -> new ConsoleCommand(Kind.STATUS, null);
            case "/quit", "/exit" -> new ConsoleCommand(Kind.QUIT, null);
            case "/model"   -> rest == null ? new ConsoleCommand(Kind.PROMPT, trimmed) : new ConsoleCommand(Kind.MODEL, rest);
            case "/attach"  -> rest == null ? new ConsoleCommand(Kind.PROMPT, trimmed) : new ConsoleCommand(Kind.ATTACH, rest);
            default         -> new ConsoleCommand(Kind.PROMPT, trimmed);
        };
    }
}
