package com.phoenixchannels;

import com.phoenixchannels.handler.Handler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(10)
class SupervisorTest {

    private ActorSystem system;

    @BeforeEach
    void setUp() {
        system = new ActorSystem();
    }

    @AfterEach
    void tearDown() {
        if (system != null) {
            system.shutdown();
        }
    }

    static class FailingHandler implements Handler<String> {
        final AtomicInteger processed = new AtomicInteger();
        final AtomicInteger errors = new AtomicInteger();
        final AtomicBoolean stopped = new AtomicBoolean();
        private final boolean handleErrors;

        FailingHandler(boolean handleErrors) {
            this.handleErrors = handleErrors;
        }

        @Override
        public void receive(String message, ActorContext context) {
            if (message.equals("boom")) {
                throw new IllegalStateException("boom");
            }
            processed.incrementAndGet();
        }

        @Override
        public boolean onError(String message, Throwable exception, ActorContext context) {
            errors.incrementAndGet();
            return handleErrors;
        }

        @Override
        public void postStop(ActorContext context) {
            stopped.set(true);
        }
    }

    @Test
    void resumeKeepsProcessingAfterAFailure() {
        FailingHandler handler = new FailingHandler(false);
        Pid pid = system.actorOf(handler).withSupervisionStrategy(SupervisionStrategy.RESUME).spawn();

        pid.tell("one");
        pid.tell("boom");
        pid.tell("two");

        AsyncAssertion.eventually(() -> handler.processed.get() == 2, Duration.ofSeconds(2));
        assertEquals(1, handler.errors.get());
        assertNotNull(system.getActor(pid));
    }

    @Test
    void stopEndsTheActor() {
        FailingHandler handler = new FailingHandler(false);
        Pid pid = system.actorOf(handler).withSupervisionStrategy(SupervisionStrategy.STOP).spawn();

        pid.tell("boom");

        AsyncAssertion.eventually(handler.stopped::get, Duration.ofSeconds(2));
        AsyncAssertion.eventually(() -> system.getActor(pid) == null, Duration.ofSeconds(2));
    }

    @Test
    void handledErrorsSkipTheStrategy() {
        FailingHandler handler = new FailingHandler(true);
        Pid pid = system.actorOf(handler).withSupervisionStrategy(SupervisionStrategy.STOP).spawn();

        pid.tell("boom");
        pid.tell("after");

        AsyncAssertion.eventually(() -> handler.processed.get() == 1, Duration.ofSeconds(2));
        assertFalse(handler.stopped.get());
    }

    @Test
    void resultWrapsCheckedFailures() {
        Result<String> failed = Result.failure(new java.io.IOException("disk"));

        assertFalse(failed.isSuccess());
        ActorException e = assertThrows(ActorException.class, failed::getOrThrow);
        assertInstanceOf(java.io.IOException.class, e.getCause());
        assertEquals("fallback", failed.getOrElse("fallback"));
        assertEquals(4, Result.success("four").map(String::length).getOrThrow());
    }
}
