package com.cellbroker.controller;

import com.cellbroker.dto.BrokerEvent;
import com.cellbroker.event.HttpEventCodec;
import com.cellbroker.exception.EventFormatException;
import com.cellbroker.model.CellTenantKey;
import com.cellbroker.service.DecoupleRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * Accepts events for cell tenants in CloudEvents binary mode.
 *
 * POST /{namespace}/{name}          → broker tenant
 * POST /{type}/{namespace}/{name}   → tenant of another type, e.g. /CHANNEL/default/orders
 *
 *   ce-id: evt-123
 *   ce-source: /orders
 *   ce-type: order.placed
 *   ce-specversion: 1.0
 *   Content-Type: application/json
 *
 *   {"orderId": 42}
 *
 * 202 once the event is on the tenant's decouple queue. Error mapping lives in
 * IngressExceptionHandler.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class IngressController {

    private final DecoupleRouter router;

    @PostMapping("/{namespace}/{name}")
    public ResponseEntity<Void> publish(@PathVariable String namespace,
                                        @PathVariable String name,
                                        @RequestHeader HttpHeaders headers,
                                        @RequestBody(required = false) byte[] body) throws EventFormatException {
        return route("/" + namespace + "/" + name, headers, body);
    }

    @PostMapping("/{type}/{namespace}/{name}")
    public ResponseEntity<Void> publishTyped(@PathVariable String type,
                                             @PathVariable String namespace,
                                             @PathVariable String name,
                                             @RequestHeader HttpHeaders headers,
                                             @RequestBody(required = false) byte[] body) throws EventFormatException {
        return route("/" + type + "/" + namespace + "/" + name, headers, body);
    }

    private ResponseEntity<Void> route(String path, HttpHeaders headers, byte[] body) throws EventFormatException {
        CellTenantKey key = CellTenantKey.fromPersistenceString(path);
        BrokerEvent event = HttpEventCodec.fromHttp(headers, body);
        router.send(key, event);
        log.debug("Accepted event: tenant={}, eventId={}", key, event.getId());
        return ResponseEntity.accepted().build();
    }
}
