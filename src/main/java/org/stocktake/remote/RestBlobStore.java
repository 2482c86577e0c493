package org.stocktake.remote;

import lombok.extern.slf4j.Slf4j;
import org.stocktake.exception.RemoteServiceException;
import org.stocktake.util.TraceIdUtil;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * 照片上传（multipart POST /photos，响应 {"url": "..."}）
 */
@Slf4j
public class RestBlobStore implements BlobStore {

    private static final String TRACE_ID_HEADER = "X-Trace-Id";
    private static final String FILE_SCHEME = "file:";

    private final RestClient restClient;

    public RestBlobStore(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public String uploadPhoto(String localUri) {
        Path path = resolvePath(localUri);
        if (!Files.isReadable(path)) {
            throw new RemoteServiceException("照片文件不可读，localUri=" + localUri);
        }

        MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
        parts.add("file", new FileSystemResource(path));

        try {
            Map<?, ?> response = restClient.post()
                    .uri("/photos")
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .headers(this::addTraceHeader)
                    .body(parts)
                    .retrieve()
                    .body(Map.class);
            Object url = response == null ? null : response.get("url");
            if (url == null || !StringUtils.hasText(url.toString())) {
                throw new RemoteServiceException("照片上传响应缺少 url，localUri=" + localUri);
            }
            log.info("[照片已上传] localUri={}, url={}", localUri, url);
            return url.toString();
        } catch (RestClientException e) {
            throw new RemoteServiceException("照片上传失败，localUri=" + localUri, e);
        }
    }

    private void addTraceHeader(HttpHeaders headers) {
        String traceId = TraceIdUtil.getTraceId();
        if (traceId != null) {
            headers.add(TRACE_ID_HEADER, traceId);
        }
    }

    /**
     * 设备给出的照片位置：file: URI 或本地路径
     * 无法解析时按上传失败处理
     */
    private static Path resolvePath(String localUri) {
        try {
            if (!localUri.startsWith(FILE_SCHEME)) {
                return Path.of(localUri);
            }
            try {
                return Path.of(URI.create(localUri));
            } catch (IllegalArgumentException e) {
                // 未转义的 file: 路径（例如含空格）
                String raw = localUri.substring(FILE_SCHEME.length());
                return Path.of(raw.startsWith("//") ? raw.substring(2) : raw);
            }
        } catch (IllegalArgumentException e) {
            throw new RemoteServiceException("照片路径无法解析，localUri=" + localUri, e);
        }
    }
}
