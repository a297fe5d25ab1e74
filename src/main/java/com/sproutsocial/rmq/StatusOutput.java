package com.sproutsocial.rmq;

import java.io.PrintStream;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Status lines for the user, on standard error so they never mix with message output. Quiet suppresses
 * everything but errors.
 */
public class StatusOutput {

    static final String STATUS = "⛯";
    static final String SUCCESS = "✔";
    static final String WARNING = "⚠";
    static final String ERROR = "✗";

    private final PrintStream err;
    private final boolean quiet;

    public StatusOutput(PrintStream err, boolean quiet) {
        this.err = checkNotNull(err);
        this.quiet = quiet;
    }

    public StatusOutput(boolean quiet) {
        this(System.err, quiet);
    }

    public void status(String message) {
        print(STATUS, message);
    }

    public void success(String message) {
        print(SUCCESS, message);
    }

    public void warning(String message) {
        warning(message, false);
    }

    public void warning(String message, boolean blankLineBefore) {
        if (quiet) {
            return;
        }
        if (blankLineBefore) {
            err.println();
        }
        print(WARNING, message);
    }

    public void error(String message, ErrorInfo errorInfo) {
        err.println(ERROR + " " + message);
        if (errorInfo == null) {
            return;
        }
        err.println("  Error:      " + errorInfo.getError());
        if (errorInfo.getCategory() != null) {
            err.println("  Category:   " + errorInfo.getCategory());
        }
        if (errorInfo.getSuggestion() != null) {
            err.println("  Suggestion: " + errorInfo.getSuggestion());
        }
    }

    private void print(String symbol, String message) {
        if (!quiet) {
            err.println(symbol + " " + message);
        }
    }

    public boolean isQuiet() {
        return quiet;
    }

}
