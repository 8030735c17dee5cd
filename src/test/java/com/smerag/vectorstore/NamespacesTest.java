package com.smerag.vectorstore;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class NamespacesTest {

    @Test
    void shouldReplaceCharactersOutsideSafeSet() {
        assertEquals("BAAI_bge-base-en-v1_5", Namespaces.forModel("BAAI/bge-base-en-v1.5"));
        assertEquals("all-mpnet-base-v2", Namespaces.forModel("all-mpnet-base-v2"));
    }
}
