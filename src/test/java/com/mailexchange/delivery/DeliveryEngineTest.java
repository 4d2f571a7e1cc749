package com.mailexchange.delivery;

import com.mailexchange.pipeline.Attachment;
import com.mailexchange.pipeline.InboundMessage;
import com.mailexchange.rules.ForwardRule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryEngineTest {

    private final List<Long> sleeps = Collections.synchronizedList(new ArrayList<>());
    private DeliveryEngine engine;

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    private InboundMessage message() {
        return new InboundMessage.Builder()
                .setMessageId("<1@x.com>")
                .setSubject("Order photos [PHOTO]")
                .setFrom("Alice <alice@example.com>")
                .setFromAddress("alice@example.com")
                .setText("See attached.")
                .setHtml("<p>See attached.</p>")
                .addAttachment(new Attachment("photo.jpg", "jpeg".getBytes(StandardCharsets.UTF_8), "image/jpeg"))
                .build();
    }

    private DeliveryEngine engine(MailTransport transport, int maxAttempts, String prefix) {
        engine = new DeliveryEngine(transport, new RetryScheduler(maxAttempts, 1000L, sleeps::add), "relay@x.com", prefix);
        return engine;
    }

    @Test
    void allRecipientsSucceed() {
        FakeTransport transport = new FakeTransport(Set.of());
        ForwardRule rule = new ForwardRule("[PHOTO]", List.of("a@x.com", "b@x.com"));

        List<RecipientResult> results = engine(transport, 3, null).deliver(message(), rule);

        assertEquals(2, results.size());
        assertEquals("a@x.com", results.get(0).getRecipient());
        assertEquals("b@x.com", results.get(1).getRecipient());
        assertTrue(results.stream().allMatch(RecipientResult::isSuccess));
        assertTrue(results.stream().allMatch(r -> r.getAttempts() == 1));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void permanentFailureExhaustsAttemptsWithLinearBackoff() {
        FakeTransport transport = new FakeTransport(Set.of("b@x.com"));
        ForwardRule rule = new ForwardRule("[PHOTO]", List.of("b@x.com"));

        List<RecipientResult> results = engine(transport, 3, null).deliver(message(), rule);

        RecipientResult result = results.get(0);
        assertFalse(result.isSuccess());
        assertEquals(3, result.getAttempts());
        assertEquals("550 rejected b@x.com attempt 3", result.getError());
        assertEquals(3, transport.attempts("b@x.com"));
        assertEquals(List.of(1000L, 2000L), sleeps);
        assertTrue(sleeps.stream().mapToLong(Long::longValue).sum() >= 1000L * (1 + 2));
    }

    @Test
    void failingRecipientDoesNotAffectOthers() {
        FakeTransport transport = new FakeTransport(Set.of("b@x.com"));
        ForwardRule rule = new ForwardRule("[PHOTO]", List.of("a@x.com", "b@x.com"));

        List<RecipientResult> results = engine(transport, 3, null).deliver(message(), rule);

        assertEquals(2, results.size());
        assertTrue(results.get(0).isSuccess());
        assertEquals(1, results.get(0).getAttempts());
        assertNull(results.get(0).getError());
        assertEquals(1, transport.attempts("a@x.com"));

        assertFalse(results.get(1).isSuccess());
        assertEquals(3, results.get(1).getAttempts());
    }

    @Test
    void transientFailureRecovers() {
        AtomicInteger calls = new AtomicInteger();
        MailTransport flaky = email -> {
            if (calls.incrementAndGet() < 2) {
                throw new TransportException("421 try later");
            }
        };
        ForwardRule rule = new ForwardRule("[PHOTO]", List.of("a@x.com"));

        RecipientResult result = engine(flaky, 3, null).deliver(message(), rule).get(0);

        assertTrue(result.isSuccess());
        assertEquals(2, result.getAttempts());
        assertEquals(List.of(1000L), sleeps);
    }

    @Test
    void recipientsAreSentConcurrently() {
        // Each send blocks until both recipients are in flight, a serial engine would time out.
        CountDownLatch inFlight = new CountDownLatch(2);
        MailTransport transport = email -> {
            inFlight.countDown();
            try {
                if (!inFlight.await(5, TimeUnit.SECONDS)) {
                    throw new TransportException("not concurrent");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException("interrupted");
            }
        };
        ForwardRule rule = new ForwardRule("[PHOTO]", List.of("a@x.com", "b@x.com"));

        List<RecipientResult> results = engine(transport, 1, null).deliver(message(), rule);

        assertTrue(results.stream().allMatch(RecipientResult::isSuccess));
    }

    @Test
    void unexpectedRuntimeErrorIsRecorded() {
        MailTransport broken = email -> {
            throw new IllegalStateException("boom");
        };
        ForwardRule rule = new ForwardRule("[PHOTO]", List.of("a@x.com"));

        RecipientResult result = engine(broken, 2, null).deliver(message(), rule).get(0);

        assertFalse(result.isSuccess());
        assertEquals(2, result.getAttempts());
        assertEquals("boom", result.getError());
    }

    @Test
    void interruptedBackoffEndsRecipient() {
        MailTransport failing = email -> {
            throw new TransportException("down");
        };
        engine = new DeliveryEngine(failing, new RetryScheduler(3, 1000L, millis -> {
            throw new InterruptedException();
        }), "relay@x.com", null);

        RecipientResult result = engine.sendWithRetry(message(), "a@x.com");

        assertTrue(Thread.interrupted(), "interrupt flag should be restored");
        assertFalse(result.isSuccess());
        assertEquals(1, result.getAttempts());
        assertEquals("down", result.getError());
    }

    @Test
    void forwardKeepsBodyAndAddsPrefix() {
        OutboundEmail email = engine(new FakeTransport(Set.of()), 3, "[Fwd]").buildForward(message(), "a@x.com");

        assertEquals("relay@x.com", email.getEnvelopeFrom());
        assertEquals("a@x.com", email.getTo());
        assertEquals("[Fwd] Order photos [PHOTO]", email.getSubject());
        assertEquals("See attached.", email.getText());
        assertEquals("<p>See attached.</p>", email.getHtml());
        assertEquals(1, email.getAttachments().size());
        assertEquals("photo.jpg", email.getAttachments().get(0).getFilename());
    }

    @Test
    void forwardWithoutPrefixKeepsSubject() {
        OutboundEmail email = engine(new FakeTransport(Set.of()), 3, null).buildForward(message(), "a@x.com");

        assertEquals("Order photos [PHOTO]", email.getSubject());
    }

    /**
     * Transport failing permanently for a fixed set of recipients.
     */
    static class FakeTransport implements MailTransport {
        private final Set<String> failing;
        private final Map<String, AtomicInteger> attempts = new ConcurrentHashMap<>();

        FakeTransport(Set<String> failing) {
            this.failing = failing;
        }

        @Override
        public void send(OutboundEmail email) throws TransportException {
            int attempt = attempts.computeIfAbsent(email.getTo(), k -> new AtomicInteger()).incrementAndGet();
            if (failing.contains(email.getTo())) {
                throw new TransportException("550 rejected " + email.getTo() + " attempt " + attempt);
            }
        }

        int attempts(String recipient) {
            AtomicInteger count = attempts.get(recipient);
            return count != null ? count.get() : 0;
        }
    }
}
