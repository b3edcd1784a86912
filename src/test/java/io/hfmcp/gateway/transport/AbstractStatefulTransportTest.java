package io.hfmcp.gateway.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hfmcp.gateway.GatewayContext;
import io.hfmcp.gateway.MutableClock;
import io.hfmcp.gateway.config.GatewayProperties;
import io.hfmcp.gateway.model.SessionMetadata;
import io.hfmcp.gateway.model.TransportType;
import io.hfmcp.gateway.registry.ManagedSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;

class AbstractStatefulTransportTest {

    private GatewayContext context;
    private TestTransport transport;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        context = GatewayContext.create(TransportType.STREAMABLE_HTTP, clock);
        transport = new TestTransport(context);
    }

    @Test
    void cleanupClosesRemainingSessionsWhenOneCloseFails() {
        TestSession first = transport.open(false);
        TestSession broken = transport.open(true);
        TestSession last = transport.open(false);

        transport.cleanup();

        assertThat(List.of(first, broken, last)).allSatisfy(session -> assertThat(session.closeAttempts).isEqualTo(1));
        assertThat(first.closed).isTrue();
        assertThat(last.closed).isTrue();
        assertThat(broken.closed).isFalse();
        assertThat(broken.metadata().status()).isEqualTo(SessionMetadata.Status.CLOSED);
        assertThat(transport.getActiveConnectionCount()).isZero();
        assertThat(transport.getSessions()).isEmpty();
        assertThat(context.transportMetrics().snapshot().connections().active()).isZero();
        assertThat(transport.isAcceptingConnections()).isFalse();
    }

    @Test
    void secondCleanupAfterFailedCloseIsHarmless() {
        TestSession broken = transport.open(true);
        transport.cleanup();

        assertThatCode(transport::cleanup).doesNotThrowAnyException();
        assertThat(broken.closeAttempts).isEqualTo(1);
    }

    private static final class TestTransport extends AbstractStatefulTransport<TestSession> {

        TestTransport(GatewayContext context) {
            super(new RecordingServerFactory(), context, new ObjectMapper(), mock(TaskScheduler.class),
                new GatewayProperties.SessionConfig());
        }

        @Override
        public TransportType type() {
            return TransportType.STREAMABLE_HTTP;
        }

        TestSession open(boolean failOnClose) {
            TestSession session = new TestSession(newSessionMetadata(), failOnClose);
            registerSession(session);
            return session;
        }
    }

    private static final class TestSession implements ManagedSession {

        private final SessionMetadata metadata;
        private final boolean failOnClose;
        int closeAttempts;
        boolean closed;

        TestSession(SessionMetadata metadata, boolean failOnClose) {
            this.metadata = metadata;
            this.failOnClose = failOnClose;
        }

        @Override
        public SessionMetadata metadata() {
            return metadata;
        }

        @Override
        public void close() throws IOException {
            closeAttempts++;
            if (failOnClose) {
                throw new IOException("stream already broken");
            }
            closed = true;
        }
    }
}
