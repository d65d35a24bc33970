package com.tradeexecutor.event;

public enum SystemEventType {

    /** Orchestrator finished startup: connections initiated and strategies reconciled. */
    EXECUTOR_READY,

    /** A crash marker was found and the last execution snapshot was loaded. */
    CRASH_RECOVERED,

    /** Startup reconciliation finished; details carry the source and strategy count. */
    STATE_RECONCILED,

    /** The dispatcher thread died with an unhandled error. */
    DISPATCHER_CRASHED,

    /** Repeated unhandled errors forced a shutdown. */
    FATAL_ERROR,

    SHUTTING_DOWN
}
