package com.questrail.cronner.dispatch;

/** How the dispatcher executes the action of a due job. */
public enum DispatchMode {
    /** On the tick thread; the tick blocks until the action returns. */
    INLINE,
    /** On an independent worker per invocation, so slow jobs never delay the tick. */
    THREADED
}
