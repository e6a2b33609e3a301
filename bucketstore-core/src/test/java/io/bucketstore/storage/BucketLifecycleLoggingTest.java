package io.bucketstore.storage;

import io.bucketstore.core.BucketStoreConfiguration;
import io.bucketstore.logging.RecordingSlf4jServiceProvider;
import io.bucketstore.logging.RecordingSlf4jServiceProvider.LogEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class BucketLifecycleLoggingTest {

    private static final String NAME = "logging-test";

    @BeforeEach
    void resetEvents() {
        RecordingSlf4jServiceProvider.reset();
    }

    @Test
    void logsBucketAllocation() {
        BucketStorage<Integer> storage = newStorage();

        storage.insert(1);
        storage.insert(2);
        storage.insert(3);

        assertThat(messages(Level.DEBUG))
                .filteredOn(message -> message.startsWith("Allocated bucket"))
                .containsExactly(
                        "Allocated bucket #0 for '" + NAME + "' (2 slots, 1 bucket(s) total)",
                        "Allocated bucket #1 for '" + NAME + "' (2 slots, 2 bucket(s) total)");
    }

    @Test
    void logsShrinkAndClear() {
        BucketStorage<Integer> storage = newStorage();
        for (int i = 0; i < 6; i++) {
            storage.insert(i);
        }
        storage.erase(storage.begin());
        storage.erase(storage.begin());

        storage.shrinkToFit();
        storage.clear();

        assertThat(messages(Level.DEBUG)).contains(
                "Shrunk '" + NAME + "': released 1 empty bucket(s), capacity now 4",
                "Cleared '" + NAME + "': released 2 bucket(s)");
    }

    @Test
    void noReleaseMessagesWhenNothingIsReleased() {
        BucketStorage<Integer> storage = newStorage();

        storage.shrinkToFit();
        storage.clear();

        assertThat(messages(Level.DEBUG)).isEmpty();
    }

    private static BucketStorage<Integer> newStorage() {
        return new BucketStorage<>(BucketStoreConfiguration.builder()
                .blockCapacity(2)
                .name(NAME)
                .build());
    }

    private static List<String> messages(Level level) {
        return RecordingSlf4jServiceProvider.events().stream()
                .filter(event -> event.level() == level)
                .filter(event -> event.loggerName().equals(BucketChain.class.getName()))
                .map(LogEvent::message)
                .filter(message -> message.contains("'" + NAME + "'"))
                .collect(Collectors.toList());
    }
}
