package com.loopfuzz.fuzzer.instrumentation;

import com.loopfuzz.fuzzer.exec.TargetExecutor;
import com.loopfuzz.fuzzer.exec.TargetFaultException;
import com.loopfuzz.fuzzer.exec.TargetInfo;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes fuzz inputs by POSTing them to an HTTP system under test. Each run is tagged with a
 * unique {@code X-Fuzzing-Request-Id} header so the coverage agent inside the target can attribute
 * coverage to it; pair with {@link GrpcCoverageReader}. Responses with a 5xx status are faults.
 */
public final class HttpTargetExecutor<I> implements TargetExecutor<I> {
    private static final Logger log = LoggerFactory.getLogger(HttpTargetExecutor.class);

    public static final String HEADER_NAME = "X-Fuzzing-Request-Id";

    /** Handle of one HTTP run. */
    public record Request(String runId, byte[] body) implements TargetInfo {}

    private final URI targetUri;
    private final Function<I, byte[]> encoder;
    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final Supplier<String> requestIdSupplier;

    public HttpTargetExecutor(
            URI targetUri,
            Function<I, byte[]> encoder,
            HttpClient httpClient,
            Duration requestTimeout,
            Supplier<String> requestIdSupplier) {
        this.targetUri = Objects.requireNonNull(targetUri, "targetUri");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.requestIdSupplier = Objects.requireNonNull(requestIdSupplier, "requestIdSupplier");
    }

    public static <I> HttpTargetExecutor<I> create(
            URI targetUri, Function<I, byte[]> encoder, Duration requestTimeout) {
        HttpClient client = HttpClient.newBuilder().connectTimeout(requestTimeout).build();
        return new HttpTargetExecutor<>(
                targetUri, encoder, client, requestTimeout, () -> UUID.randomUUID().toString());
    }

    @Override
    public void globalInitializer() {
        log.info("Fuzzing HTTP target {}", targetUri);
    }

    @Override
    public TargetInfo initialize(I input) {
        return new Request(requestIdSupplier.get(), encoder.apply(input));
    }

    @Override
    public void execute(TargetInfo targetInfo) throws Exception {
        if (!(targetInfo instanceof Request request)) {
            throw new IllegalArgumentException("Not an HTTP run handle: " + targetInfo);
        }
        HttpRequest httpRequest =
                HttpRequest.newBuilder(targetUri)
                        .timeout(requestTimeout)
                        .header(HEADER_NAME, request.runId())
                        .header("Content-Type", "application/octet-stream")
                        .POST(HttpRequest.BodyPublishers.ofByteArray(request.body()))
                        .build();
        HttpResponse<byte[]> response =
                httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
        log.trace("Request {} answered {}", request.runId(), response.statusCode());
        if (response.statusCode() >= 500) {
            byte[] body = response.body() != null ? response.body() : new byte[0];
            throw new TargetFaultException(
                    response.statusCode(), new String(body, StandardCharsets.UTF_8));
        }
    }
}
