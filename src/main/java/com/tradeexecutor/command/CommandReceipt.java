package com.tradeexecutor.command;

import com.tradeexecutor.domain.enums.CommandStatus;

/** Immediate answer to a submission: where the command went, not how it finished. */
public record CommandReceipt(String commandId, CommandStatus status, String message) {

    public boolean accepted() {
        return status == CommandStatus.QUEUED || status == CommandStatus.PROCESSING || status == CommandStatus.COMPLETED;
    }
}
