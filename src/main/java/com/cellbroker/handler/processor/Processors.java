package com.cellbroker.handler.processor;

/**
 * Processor chain helpers.
 */
public final class Processors {

    private Processors() {
    }

    /**
     * Links the processors in the given order and returns the first one.
     */
    public static Processor chain(ChainableProcessor first, ChainableProcessor... rest) {
        ChainableProcessor current = first;
        for (ChainableProcessor p : rest) {
            current = current.withNext(p);
        }
        return first;
    }
}
