package com.quotapool.config;

import com.quotapool.dispatcher.pool.KeyPoolManager;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ApiKeyInitializerTest {

    @Mock
    private KeyPoolManager keyPoolManager;

    @InjectMocks
    private ApiKeyInitializer initializer;

    @Test
    void parsesCommaSeparatedKeys() {
        assertEquals(List.of("k1", "k2", "k3"), ApiKeyInitializer.parseKeys(" k1, k2 ,,k3 "));
        assertEquals(List.of(), ApiKeyInitializer.parseKeys(""));
        assertEquals(List.of(), ApiKeyInitializer.parseKeys(null));
    }

    @Test
    void registersKeysInConfiguredOrder() {
        ReflectionTestUtils.setField(initializer, "apiKeysConfig", "alpha-key,beta-key");

        initializer.run();

        verify(keyPoolManager).registerCredentials(List.of("alpha-key", "beta-key"));
    }

    @Test
    void emptyConfigRegistersNothing() {
        ReflectionTestUtils.setField(initializer, "apiKeysConfig", "  ");

        initializer.run();

        verify(keyPoolManager, never()).registerCredentials(anyList());
    }
}
