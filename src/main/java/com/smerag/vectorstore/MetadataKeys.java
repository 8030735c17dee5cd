package com.smerag.vectorstore;

public final class MetadataKeys {
    public static final String TEXT = "text";
    public static final String SOURCE = "source";
    public static final String DOC_ID = "doc_id";
    public static final String CHUNK_SIZE = "chunk_size";
    public static final String CHUNK_INDEX = "chunk_index";
    public static final String PARENT_CHUNK_ID = "parent_chunk_id";
    public static final String PARENT_DOC_ID = "parent_doc_id";
    public static final String SUBJECT = "subject";
    public static final String FILE_PATH = "file_path";

    private MetadataKeys() {
    }
}
