package com.cellbroker.handler.processor;

import com.cellbroker.dto.BrokerEvent;

/**
 * Holds the link to the next processor. When there is none, next() returns a
 * no-op so subclasses can always call {@code next().process(...)}.
 */
public abstract class BaseProcessor implements ChainableProcessor {

    static final Processor NO_OP = new Processor() {
        @Override
        public void process(EventContext ctx, BrokerEvent event) {
        }

        @Override
        public Processor next() {
            return this;
        }
    };

    private volatile ChainableProcessor next;

    @Override
    public Processor next() {
        ChainableProcessor n = next;
        return n == null ? NO_OP : n;
    }

    @Override
    public ChainableProcessor withNext(ChainableProcessor next) {
        this.next = next;
        return next;
    }
}
