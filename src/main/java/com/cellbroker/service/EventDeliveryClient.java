package com.cellbroker.service;

import com.cellbroker.dto.BrokerEvent;
import com.cellbroker.event.HttpEventCodec;
import com.cellbroker.exception.DeliveryException;
import com.cellbroker.exception.EventFormatException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

/**
 * Sends events over HTTP in CloudEvents binary mode.
 *
 *   deliver() → POST to a target; a 2xx response carrying an event is its reply
 *   send()    → POST a reply back to a tenant address; the response body is ignored
 *
 * Anything other than a 2xx response is a DeliveryException. Timeouts are those of
 * the RestTemplate's request factory (cellbroker.handler.deliver-timeout).
 */
@RequiredArgsConstructor
@Slf4j
public class EventDeliveryClient {

    private final RestTemplate restTemplate;

    public Optional<BrokerEvent> deliver(String address, BrokerEvent event) throws DeliveryException {
        ResponseEntity<byte[]> response = post(address, event);
        if (!HttpEventCodec.isEvent(response.getHeaders())) {
            return Optional.empty();
        }
        try {
            return Optional.of(HttpEventCodec.fromHttp(response.getHeaders(), response.getBody()));
        } catch (EventFormatException e) {
            log.warn("Ignoring malformed reply from {} to event {}: {}", address, event.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    public void send(String address, BrokerEvent event) throws DeliveryException {
        post(address, event);
    }

    private ResponseEntity<byte[]> post(String address, BrokerEvent event) throws DeliveryException {
        if (address == null || address.isBlank()) {
            throw new DeliveryException("no address to deliver event " + event.getId() + " to");
        }
        HttpEntity<byte[]> request = new HttpEntity<>(event.getData(), HttpEventCodec.toHeaders(event));
        ResponseEntity<byte[]> response;
        try {
            response = restTemplate.exchange(address, HttpMethod.POST, request, byte[].class);
        } catch (RestClientException e) {
            throw new DeliveryException("delivery to " + address + " failed: " + e.getMessage(), e);
        }
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new DeliveryException("delivery to " + address + " returned " + response.getStatusCode());
        }
        log.debug("Delivered event {} to {}: status={}", event.getId(), address, response.getStatusCode());
        return response;
    }
}
