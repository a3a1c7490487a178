package com.devicehub.manager;

import com.devicehub.bus.IgnoreRequestMessage;
import com.devicehub.bus.Message;
import com.devicehub.manager.message.NotStartedMessage;
import com.devicehub.manager.message.StartedComponentInformation;

import java.util.Objects;

/**
 * Result of {@link ComponentManager#startComponent}.
 *
 * <pre>{@code
 * StartOutcome outcome = manager.startComponent(request);
 * switch (outcome.kind()) {
 *     case STARTED -> connect(((StartOutcome.Started) outcome).information());
 *     case FAILED -> report(((StartOutcome.Failed) outcome).cause());
 *     case IGNORED -> { }
 * }
 * }</pre>
 */
public interface StartOutcome {

    /**
     * Discriminator for switching over outcomes.
     */
    enum Kind {
        STARTED,
        FAILED,
        IGNORED
    }

    Kind kind();

    /**
     * Convert the outcome into the reply sent back over the bus.
     */
    Message toReply();

    static StartOutcome started(StartedComponentInformation information) {
        return new Started(information);
    }

    static StartOutcome failed(Throwable cause) {
        return new Failed(cause);
    }

    static StartOutcome ignored() {
        return Ignored.INSTANCE;
    }

    /**
     * The component is running (or was already running, for singletons).
     */
    record Started(StartedComponentInformation information) implements StartOutcome {
        public Started {
            Objects.requireNonNull(information, "information");
        }

        @Override
        public Kind kind() {
            return Kind.STARTED;
        }

        @Override
        public Message toReply() {
            return information;
        }
    }

    /**
     * The component could not be started.
     */
    record Failed(Throwable cause) implements StartOutcome {
        public Failed {
            Objects.requireNonNull(cause, "cause");
        }

        @Override
        public Kind kind() {
            return Kind.FAILED;
        }

        @Override
        public Message toReply() {
            return new NotStartedMessage(cause);
        }
    }

    /**
     * The manager does not serve the request.
     */
    final class Ignored implements StartOutcome {
        private static final Ignored INSTANCE = new Ignored();

        private Ignored() {}

        @Override
        public Kind kind() {
            return Kind.IGNORED;
        }

        @Override
        public Message toReply() {
            return new IgnoreRequestMessage();
        }

        @Override
        public String toString() {
            return "Ignored";
        }
    }
}
