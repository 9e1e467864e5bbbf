package com.bftchain.ledger;

public interface ChainListener {
    /**
     * Called after a block was appended to the chain
     *
     * @param event the appended block's summary
     */
    void onBlockAppended(ChainEvent event);
}
