package com.cellbroker.handler.processor;

import com.cellbroker.dto.BrokerEvent;
import com.cellbroker.exception.ProcessingException;

/**
 * One stage of the pipeline a handler drives each event through.
 *
 * A processor may stop the event (return without calling next()) or pass it on
 * with {@code next().process(ctx, event)}.
 */
public interface Processor {

    void process(EventContext ctx, BrokerEvent event) throws ProcessingException;

    /**
     * Never null; the end of a chain is a no-op processor.
     */
    Processor next();
}
