package com.lmrunner.exception;

public class SinkClosedException extends LanguageModelException {

    public SinkClosedException() {
        super(ErrorKind.SINK_CLOSED, "Stream receiver is closed");
    }
}
