package com.cellbroker.handler.processor;

import com.cellbroker.config.TargetsCache;
import com.cellbroker.dto.BrokerEvent;
import com.cellbroker.exception.ProcessingException;
import com.cellbroker.model.Target;
import com.cellbroker.model.TargetKey;
import com.cellbroker.service.EventFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Passes the event on only if the target in the context wants it.
 */
@RequiredArgsConstructor
@Slf4j
public class FilterProcessor extends BaseProcessor {

    private final TargetsCache targets;
    private final EventFilter eventFilter;

    @Override
    public void process(EventContext ctx, BrokerEvent event) throws ProcessingException {
        TargetKey targetKey = ctx.target()
                .orElseThrow(() -> new ProcessingException("no target key in " + ctx));
        Optional<Target> target = targets.getTarget(targetKey);
        if (target.isEmpty()) {
            log.debug("Target no longer exists in the config: target={}", targetKey);
            return;
        }
        if (!eventFilter.matches(target.get().getFilterAttributes(), event)) {
            log.debug("Event filtered out: target={}, eventId={}", targetKey, event.getId());
            return;
        }
        next().process(ctx, event);
    }
}
