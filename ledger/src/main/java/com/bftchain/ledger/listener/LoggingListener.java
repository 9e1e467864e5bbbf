package com.bftchain.ledger.listener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.bftchain.ledger.ChainEvent;
import com.bftchain.ledger.ChainListener;

public class LoggingListener implements ChainListener {

    private final Logger logger;

    public LoggingListener() {
        this(LoggerFactory.getLogger(LoggingListener.class));
    }

    // constructor with injectable logger for testing
    LoggingListener(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void onBlockAppended(ChainEvent event) {
        logger.info("Block appended at height: {}, id: {}, previous: {}, transactions: {}",
                event.getHeight(),
                event.getBlockId(),
                event.getPreviousBlockId(),
                event.getTransactionCount());
    }
}
