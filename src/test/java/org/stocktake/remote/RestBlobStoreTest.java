package org.stocktake.remote;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stocktake.exception.RemoteServiceException;
import org.stocktake.util.TraceIdUtil;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestBlobStoreTest {

    private static final String BASE_URL = "http://blobs.test";

    private MockRestServiceServer server;
    private RestBlobStore blobStore;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        blobStore = new RestBlobStore(builder.build());
    }

    @AfterEach
    void tearDown() {
        TraceIdUtil.clearTraceId();
    }

    @Test
    void uploadReturnsRemoteUrl() throws Exception {
        Path photo = Files.write(tempDir.resolve("shelf.jpg"), new byte[]{1, 2, 3});
        server.expect(requestTo(BASE_URL + "/photos"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("{\"url\": \"https://photos.test/shelf.jpg\"}", MediaType.APPLICATION_JSON));

        String url = blobStore.uploadPhoto(photo.toUri().toString());

        assertEquals("https://photos.test/shelf.jpg", url);
        server.verify();
    }

    @Test
    void responseWithoutUrlFails() throws Exception {
        Path photo = Files.write(tempDir.resolve("shelf.jpg"), new byte[]{1});
        server.expect(requestTo(BASE_URL + "/photos"))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        assertThrows(RemoteServiceException.class, () -> blobStore.uploadPhoto(photo.toString()));
    }

    @Test
    void unescapedFileUriWithSpacesIsUploaded() throws Exception {
        Path photo = Files.write(tempDir.resolve("my photo.jpg"), new byte[]{1});
        TraceIdUtil.setTraceId("trace-photo");
        server.expect(requestTo(BASE_URL + "/photos"))
                .andExpect(header("X-Trace-Id", "trace-photo"))
                .andRespond(withSuccess("{\"url\": \"https://photos.test/my-photo.jpg\"}", MediaType.APPLICATION_JSON));

        String url = blobStore.uploadPhoto("file:" + photo);

        assertEquals("https://photos.test/my-photo.jpg", url);
        server.verify();
    }

    @Test
    void unparseableLocationBecomesRemoteServiceException() {
        RemoteServiceException e = assertThrows(RemoteServiceException.class,
                () -> blobStore.uploadPhoto("file:/tmp/bad\u0000name.jpg"));

        assertTrue(e.getMessage().startsWith("照片路径无法解析"));
        server.verify();
    }

    @Test
    void unreadableFileIsRejectedBeforeUpload() {
        assertThrows(RemoteServiceException.class,
                () -> blobStore.uploadPhoto(tempDir.resolve("missing.jpg").toString()));
        server.verify();
    }
}
