package com.hydralog.backend.logging.queue;

/** The live logging entry points, seen from the queue. */
public interface LoggingCommandExecutor {

    void replay(LoggingCommand command);
}
