package com.work.l2ingestion.core.support;

import com.work.l2ingestion.core.store.KeyValueBackend;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryKeyValueBackendTest {

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void scan_is_half_open_and_ordered() {
        InMemoryKeyValueBackend backend = new InMemoryKeyValueBackend();
        backend.batch(Arrays.asList(
                new KeyValueBackend.Put("a:03", b("3")),
                new KeyValueBackend.Put("a:01", b("1")),
                new KeyValueBackend.Put("a:02", b("2")),
                new KeyValueBackend.Put("b:01", b("x"))));

        List<byte[]> values = backend.scan("a:01", "a:03");
        assertEquals(2, values.size());
        assertArrayEquals(b("1"), values.get(0));
        assertArrayEquals(b("2"), values.get(1));
        assertTrue(backend.scan("a:03", "a:01").isEmpty());
        assertEquals(4, backend.size());
    }

    @Test
    public void stored_values_are_copied() {
        InMemoryKeyValueBackend backend = new InMemoryKeyValueBackend();
        byte[] value = b("abc");
        backend.put("k", value);
        value[0] = 'z';

        byte[] read = backend.get("k").orElseThrow(AssertionError::new);
        assertArrayEquals(b("abc"), read);
        read[0] = 'q';
        assertArrayEquals(b("abc"), backend.get("k").orElseThrow(AssertionError::new));
        assertFalse(backend.get("missing").isPresent());
    }
}
