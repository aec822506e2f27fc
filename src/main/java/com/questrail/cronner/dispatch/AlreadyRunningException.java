package com.questrail.cronner.dispatch;

/**
 * Thrown by {@link Dispatcher#start()} when the dispatcher is already running.
 */
public final class AlreadyRunningException extends IllegalStateException
{
    public AlreadyRunningException(String message) {
        super(message);
    }
}
