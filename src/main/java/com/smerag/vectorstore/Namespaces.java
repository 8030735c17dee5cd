package com.smerag.vectorstore;

import java.util.regex.Pattern;

public final class Namespaces {
    private static final Pattern UNSAFE = Pattern.compile("[^a-zA-Z0-9_-]");

    private Namespaces() {
    }

    /**
     * Vector store partition for an embedding model, e.g. {@code BAAI/bge-base-en-v1.5} becomes
     * {@code BAAI_bge-base-en-v1_5}.
     */
    public static String forModel(String modelName) {
        return UNSAFE.matcher(modelName).replaceAll("_");
    }
}
