package com.eainde.orchestrator.execution;

import lombok.extern.log4j.Log4j2;

@Log4j2
public class LoggingChatHistorySink implements ChatHistorySink {

    @Override
    public void append(ChatHistoryRecord record) {
        log.info("[{}] {} {}: {}", record.sessionId(), record.role(),
                record.agent().isEmpty() ? "-" : record.agent(), record.content());
    }
}
