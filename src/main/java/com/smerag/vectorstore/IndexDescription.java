package com.smerag.vectorstore;

public record IndexDescription(String name, int dimension, String metric) {
    public static final String DOT_PRODUCT = "dotproduct";
}
