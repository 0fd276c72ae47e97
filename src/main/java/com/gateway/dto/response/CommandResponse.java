package com.gateway.dto.response;

/**
 * The outcome of an operator shell command.
 *
 * @param success Whether the command did what was asked.
 * @param message A confirmation or an error explanation.
 */
public record CommandResponse(boolean success, String message) {

    /**
     * @return The message, green on success and red on failure.
     */
    public String toAnsiString() {
        String color = success ? "\u001B[32m" : "\u001B[31m";
        return color + message + "\u001B[0m";
    }
}
