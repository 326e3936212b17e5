package com.bankjob.loader;

/**
 * A diagnostic about a statement, produced by validation. {@code subject} names what the message is
 * about (an account, a transaction id) and may be empty.
 */
public final class LoaderMessage {

    public enum Level {
        INFO,
        WARNING,
        ERROR
    }

    private final Level level;
    private final String message;
    private final String subject;

    public LoaderMessage(Level level, String message, String subject) {
        this.level = level;
        this.message = message;
        this.subject = subject == null ? "" : subject;
    }

    public Level getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public String getSubject() {
        return subject;
    }

    @Override
    public String toString() {
        return level + ": " + message + (subject.isEmpty() ? "" : " (" + subject + ")");
    }
}
