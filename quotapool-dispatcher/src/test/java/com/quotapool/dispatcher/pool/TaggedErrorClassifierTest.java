package com.quotapool.dispatcher.pool;

import com.quotapool.common.dto.FailureKind;
import com.quotapool.common.exception.ClassifiedFailureException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class TaggedErrorClassifierTest {

    private final TaggedErrorClassifier classifier = new TaggedErrorClassifier();

    @Test
    void readsTagDirectly() {
        assertEquals(FailureKind.QUOTA_EXCEEDED,
                classifier.classify(new ClassifiedFailureException(FailureKind.QUOTA_EXCEEDED, "quota")));
        assertEquals(FailureKind.CREDENTIAL_INVALID,
                classifier.classify(new ClassifiedFailureException(FailureKind.CREDENTIAL_INVALID, "bad key")));
    }

    @Test
    void readsTagThroughWrapper() {
        Throwable wrapped = new CompletionException(
                new RuntimeException(new ClassifiedFailureException(FailureKind.TRANSIENT, "503")));
        assertEquals(FailureKind.TRANSIENT, classifier.classify(wrapped));
    }

    @Test
    void untaggedIsNonRetryable() {
        assertEquals(FailureKind.NON_RETRYABLE, classifier.classify(new IOException("reset")));
        assertEquals(FailureKind.NON_RETRYABLE, classifier.classify(null));
    }

    @Test
    void stopsAtMaxDepth() {
        Throwable error = new ClassifiedFailureException(FailureKind.TRANSIENT, "deep");
        for (int i = 0; i < 10; i++) {
            error = new RuntimeException(error);
        }
        assertEquals(FailureKind.NON_RETRYABLE, classifier.classify(error));
    }
}
