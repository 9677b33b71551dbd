package awstempcreds.sts.auth;

import org.apache.log4j.AppenderSkeleton;
import org.apache.log4j.Logger;
import org.apache.log4j.spi.LoggingEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects rendered log4j messages so tests can assert on what was logged.
 */
class CapturingAppender extends AppenderSkeleton {

    private final List<String> messages = new ArrayList<>();

    static CapturingAppender attachTo(Logger logger) {
        CapturingAppender appender = new CapturingAppender();
        logger.addAppender(appender);
        return appender;
    }

    List<String> getMessages() {
        return messages;
    }

    boolean anyContains(String fragment) {
        for (String message : messages) {
            if (message.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected void append(LoggingEvent event) {
        messages.add(event.getRenderedMessage());
    }

    void clear() {
        messages.clear();
    }

    @Override
    public void close() {
        clear();
    }

    @Override
    public boolean requiresLayout() {
        return false;
    }
}
