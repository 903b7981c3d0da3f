package com.cellbroker.handler.processor;

import com.cellbroker.config.TargetsCache;
import com.cellbroker.dto.BrokerEvent;
import com.cellbroker.event.RemainingHops;
import com.cellbroker.exception.ProcessingException;
import com.cellbroker.exception.PublishException;
import com.cellbroker.model.CellTenantKey;
import com.cellbroker.model.TargetKey;
import com.cellbroker.queue.PublishSettings;
import com.cellbroker.queue.QueuePublisher;
import com.cellbroker.service.EventDeliveryClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.Map;

import static com.cellbroker.Fixtures.config;
import static com.cellbroker.Fixtures.event;
import static com.cellbroker.Fixtures.target;
import static com.cellbroker.Fixtures.tenant;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.headerDoesNotExist;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Tests for DeliverProcessor: delivery, retry hand-off and reply forwarding.
 *
 * Verifies:
 *   - The target receives the event without the hop count
 *   - Failed deliveries go to the retry topic unchanged (or fail without retry)
 *   - Replies are forwarded with a decremented hop count, or dropped when the budget is used up
 *   - Config that disappeared in the meantime is a quiet no-op
 */
@ExtendWith(MockitoExtension.class)
class DeliverProcessorTest {

    private static final String TARGET_ADDRESS = "http://auditor.shop.svc/events";
    private static final String TENANT_ADDRESS = "http://ingress.svc/shop/default";
    private static final String RETRY_TOPIC = "retry-shop-default-auditor";

    @Mock private QueuePublisher publisher;
    @Mock private ChainableProcessor next;

    private MockRestServiceServer server;
    private EventDeliveryClient deliveryClient;
    private TargetsCache targets;
    private EventContext ctx;
    private BrokerEvent event;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        deliveryClient = new EventDeliveryClient(restTemplate);

        targets = new TargetsCache(config(tenant("shop", "default", TENANT_ADDRESS,
                target("shop", "default", "auditor", TARGET_ADDRESS, Map.of()))));
        ctx = EventContext.forTarget(new TargetKey(CellTenantKey.broker("shop", "default"), "auditor"));
        event = event("evt-1");
    }

    private DeliverProcessor processor(boolean retryOnFailure) {
        DeliverProcessor p = new DeliverProcessor(targets, deliveryClient, publisher, PublishSettings.DEFAULT,
                retryOnFailure);
        p.withNext(next);
        return p;
    }

    private static HttpHeaders replyHeaders(String id) {
        HttpHeaders headers = new HttpHeaders();
        headers.set("ce-id", id);
        headers.set("ce-source", "//auditor");
        headers.set("ce-type", "order.audited");
        headers.set("ce-specversion", "1.0");
        return headers;
    }

    @Nested
    @DisplayName("Delivery")
    class Delivery {

        @Test
        @DisplayName("2xx without a reply delivers once and continues the chain")
        void successWithoutReply() throws Exception {
            server.expect(requestTo(TARGET_ADDRESS))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(header("ce-id", "evt-1"))
                    .andRespond(withSuccess());

            processor(true).process(ctx, event);

            server.verify();
            verify(next).process(ctx, event);
            verifyNoInteractions(publisher);
        }

        @Test
        @DisplayName("The hop count is not sent to the target")
        void hopCountStripped() throws Exception {
            RemainingHops.set(event, 5);
            server.expect(requestTo(TARGET_ADDRESS))
                    .andExpect(headerDoesNotExist("ce-remaininghops"))
                    .andRespond(withSuccess());

            processor(true).process(ctx, event);

            server.verify();
            assertEquals("5", event.getExtension(RemainingHops.EXTENSION));
        }

        @Test
        @DisplayName("A context without a target key is a programming error")
        void missingTargetKey() {
            EventContext tenantOnly = EventContext.forTenant(CellTenantKey.broker("shop", "default"));
            assertThrows(ProcessingException.class, () -> processor(true).process(tenantOnly, event));
        }

        @Test
        @DisplayName("Nothing is sent once the deadline has passed")
        void deadlinePassed() {
            EventContext expired = ctx.withDeadline(Instant.now().minusSeconds(1));

            assertThrows(ProcessingException.class, () -> processor(true).process(expired, event));

            server.verify();
            verifyNoInteractions(next, publisher);
        }

        @Test
        @DisplayName("Tenant or target gone from the snapshot is a no-op")
        void configGone() throws Exception {
            EventContext unknownTarget = ctx.withTarget(new TargetKey(CellTenantKey.broker("shop", "default"), "gone"));
            EventContext unknownTenant = EventContext.forTarget(new TargetKey(CellTenantKey.broker("nobody", "x"), "t"));

            processor(true).process(unknownTarget, event);
            processor(true).process(unknownTenant, event);

            server.verify();
            verifyNoInteractions(next, publisher);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("With retry on, the original event goes to the retry topic exactly once")
        void retryHandOff() throws Exception {
            RemainingHops.set(event, 9);
            server.expect(requestTo(TARGET_ADDRESS)).andRespond(withServerError());

            processor(true).process(ctx, event);

            server.verify();
            verify(publisher, times(1)).publish(eq(RETRY_TOPIC), same(event), any(PublishSettings.class));
            assertEquals("9", event.getExtension(RemainingHops.EXTENSION));
            verifyNoInteractions(next);
        }

        @Test
        @DisplayName("With retry off, the failure is returned so the message is nacked")
        void noRetry() {
            server.expect(requestTo(TARGET_ADDRESS)).andRespond(withServerError());

            assertThrows(ProcessingException.class, () -> processor(false).process(ctx, event));

            verifyNoInteractions(publisher, next);
        }

        @Test
        @DisplayName("A failed retry publish fails processing")
        void retryPublishFails() {
            server.expect(requestTo(TARGET_ADDRESS)).andRespond(withServerError());
            doThrow(new PublishException("queue service down"))
                    .when(publisher).publish(eq(RETRY_TOPIC), same(event), any(PublishSettings.class));

            ProcessingException e = assertThrows(ProcessingException.class, () -> processor(true).process(ctx, event));
            assertEquals(PublishException.class, e.getCause().getClass());
        }
    }

    @Nested
    @DisplayName("Replies")
    class Replies {

        @Test
        @DisplayName("Hop count 1 forwards the reply with 0")
        void forwardsDecremented() throws Exception {
            RemainingHops.set(event, 1);
            server.expect(requestTo(TARGET_ADDRESS))
                    .andRespond(withSuccess("{\"ok\":true}", MediaType.APPLICATION_JSON).headers(replyHeaders("reply-1")));
            server.expect(requestTo(TENANT_ADDRESS))
                    .andExpect(header("ce-id", "reply-1"))
                    .andExpect(header("ce-remaininghops", "0"))
                    .andRespond(withSuccess());

            processor(true).process(ctx, event);

            server.verify();
            verify(next).process(ctx, event);
        }

        @Test
        @DisplayName("Hop count 0 drops the reply")
        void dropsExhausted() throws Exception {
            RemainingHops.set(event, 0);
            server.expect(requestTo(TARGET_ADDRESS))
                    .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON).headers(replyHeaders("reply-1")));

            processor(true).process(ctx, event);

            server.verify();
            verify(next).process(ctx, event);
        }

        @Test
        @DisplayName("No hop count gives the reply the default budget")
        void defaultBudget() throws Exception {
            server.expect(requestTo(TARGET_ADDRESS))
                    .andRespond(withSuccess().headers(replyHeaders("reply-1")));
            server.expect(requestTo(TENANT_ADDRESS))
                    .andExpect(header("ce-remaininghops", String.valueOf(RemainingHops.DEFAULT_LIMIT)))
                    .andRespond(withSuccess());

            processor(true).process(ctx, event);

            server.verify();
        }

        @Test
        @DisplayName("A hop count set by the target on its reply is overwritten")
        void replyHopCountOverwritten() throws Exception {
            RemainingHops.set(event, 3);
            HttpHeaders headers = replyHeaders("reply-1");
            headers.set("ce-remaininghops", "1000");
            server.expect(requestTo(TARGET_ADDRESS)).andRespond(withSuccess().headers(headers));
            server.expect(requestTo(TENANT_ADDRESS))
                    .andExpect(header("ce-remaininghops", "2"))
                    .andRespond(withSuccess());

            processor(true).process(ctx, event);

            server.verify();
        }

        @Test
        @DisplayName("A failed reply forward retries the original event, not the reply")
        void forwardFailureRetriesOriginal() throws Exception {
            server.expect(requestTo(TARGET_ADDRESS))
                    .andRespond(withSuccess().headers(replyHeaders("reply-1")));
            server.expect(requestTo(TENANT_ADDRESS)).andRespond(withServerError());

            processor(true).process(ctx, event);

            server.verify();
            verify(publisher).publish(eq(RETRY_TOPIC), same(event), any(PublishSettings.class));
            verifyNoInteractions(next);
        }
    }
}
