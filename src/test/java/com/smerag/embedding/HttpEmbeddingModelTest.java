package com.smerag.embedding;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smerag.runtime.TransientServiceException;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

class HttpEmbeddingModelTest {

    @Test
    void shouldPostInputsAndParseOneVectorPerText() throws Exception {
        List<String> bodies = new ArrayList<>();
        List<String> urls = new ArrayList<>();
        OkHttpClient client = client(200, "[[0.1, 0.2, 0.3], [0.4, 0.5, 0.6]]", bodies, urls);
        HttpEmbeddingModel model = new HttpEmbeddingModel(client, "BAAI/bge-base-en-v1.5", "http://embed.test/", 3);

        List<float[]> vectors = model.embed(List.of("first text", "second text"));

        assertEquals(2, vectors.size());
        assertArrayEquals(new float[] { 0.4f, 0.5f, 0.6f }, vectors.get(1), 1e-6f);
        assertEquals("http://embed.test/embed", urls.get(0));
        JsonNode body = new ObjectMapper().readTree(bodies.get(0));
        assertEquals("second text", body.path("inputs").get(1).asText());
        assertTrue(body.path("normalize").asBoolean());
    }

    @Test
    void shouldRaiseTransientErrorOnHttpFailure() {
        OkHttpClient client = client(503, "{\"error\":\"overloaded\"}", new ArrayList<>(), new ArrayList<>());
        HttpEmbeddingModel model = new HttpEmbeddingModel(client, "m", "http://embed.test", 3);

        TransientServiceException error = assertThrows(TransientServiceException.class, () -> model.embed(List.of("x")));
        assertEquals("embedding:m", error.service());
    }

    @Test
    void shouldRaiseTransientErrorWhenVectorCountDiffers() {
        OkHttpClient client = client(200, "[[0.1, 0.2, 0.3]]", new ArrayList<>(), new ArrayList<>());
        HttpEmbeddingModel model = new HttpEmbeddingModel(client, "m", "http://embed.test", 3);

        assertThrows(TransientServiceException.class, () -> model.embed(List.of("a", "b")));
    }

    private static OkHttpClient client(int code, String json, List<String> bodies, List<String> urls) {
        return new OkHttpClient.Builder()
                .addInterceptor(chain -> {
                    Buffer buffer = new Buffer();
                    chain.request().body().writeTo(buffer);
                    bodies.add(buffer.readUtf8());
                    urls.add(chain.request().url().toString());
                    return new Response.Builder()
                            .request(chain.request())
                            .protocol(Protocol.HTTP_1_1)
                            .code(code)
                            .message("test")
                            .body(ResponseBody.create(json, MediaType.get("application/json")))
                            .build();
                })
                .build();
    }
}
