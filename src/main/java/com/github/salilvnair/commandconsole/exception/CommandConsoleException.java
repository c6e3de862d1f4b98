package com.github.salilvnair.commandconsole.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class CommandConsoleException extends RuntimeException {

    private final CommandConsoleErrorCode code;
    private final String errorCode;
    private final boolean recoverable;
    private Map<String, Object> metaData;

    public CommandConsoleException(CommandConsoleErrorCode code) {
        super(code.defaultMessage());
        this.code = code;
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public CommandConsoleException(CommandConsoleErrorCode code, String overrideMessage) {
        super(overrideMessage);
        this.code = code;
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public CommandConsoleException(CommandConsoleErrorCode code, String overrideMessage, Throwable cause) {
        super(overrideMessage, cause);
        this.code = code;
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public CommandConsoleException withMetaData(Map<String, Object> metaData) {
        this.metaData = metaData;
        return this;
    }

    public boolean is(CommandConsoleErrorCode candidate) {
        return code == candidate;
    }
}
