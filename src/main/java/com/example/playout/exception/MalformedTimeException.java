package com.example.playout.exception;

/**
 * A template time string could not be turned into a timeline offset.
 */
public class MalformedTimeException extends ScheduleFillException {

    private final String input;

    public MalformedTimeException(String input, String reason) {
        super("MALFORMED_TIME", "Malformed time '" + input + "': " + reason, input);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
