package com.cellbroker.handler.processor;

/**
 * A processor that can be linked to a following one.
 */
public interface ChainableProcessor extends Processor {

    /**
     * Sets the next processor and returns it, so calls can be chained.
     */
    ChainableProcessor withNext(ChainableProcessor next);
}
