package villagecompute.inspections.services;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import villagecompute.inspections.api.types.StoredObject;
import villagecompute.inspections.api.types.StoredObjectType;
import villagecompute.inspections.report.ReportFormat;

/**
 * Object storage for inspection photos and generated reports.
 *
 * <p>
 * All objects live in one bucket under an {@code inspections/{inspectionId}/} prefix. Every operation is traced and
 * timed, tagged with its {@link StoredObjectType}. Failures surface as {@link StorageException}.
 *
 * <pre>
 * StoredObject photo = storageGateway.download(StoredObjectType.IMAGE, image.storageKey);
 * storageGateway.upload(StoredObjectType.REPORT, StorageGateway.reportKey(inspectionId, reportId, ReportFormat.PDF),
 *         pdfBytes, ReportFormat.PDF.getContentType());
 * </pre>
 */
@ApplicationScoped
public class StorageGateway {

    private static final Logger LOG = Logger.getLogger(StorageGateway.class);

    @Inject
    S3Client s3Client;

    @Inject
    S3Presigner s3Presigner;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @ConfigProperty(
            name = "inspections.storage.bucket")
    String bucket;

    /**
     * Object key of a generated report: {@code inspections/{inspectionId}/reports/{reportId}.{ext}}.
     */
    public static String reportKey(UUID inspectionId, UUID reportId, ReportFormat format) {
        return String.format("inspections/%s/reports/%s.%s", inspectionId, reportId, format.getValue());
    }

    /**
     * Uploads an object, overwriting any existing object with the same key.
     *
     * @throws StorageException
     *             if the upload fails
     */
    public void upload(StoredObjectType type, String objectKey, byte[] data, String contentType) {
        Span span = tracer.spanBuilder("storage.upload").setAttribute("object_type", type.tag())
                .setAttribute("object_key", objectKey).setAttribute("size_bytes", data.length).startSpan();
        long startTime = System.currentTimeMillis();

        try (Scope scope = span.makeCurrent()) {
            PutObjectRequest putRequest = PutObjectRequest.builder().bucket(bucket).key(objectKey)
                    .contentType(contentType)
                    .metadata(Map.of("uploaded-at", Instant.now().toString(), "service", "inspections")).build();
            s3Client.putObject(putRequest, RequestBody.fromBytes(data));

            long latencyMs = System.currentTimeMillis() - startTime;
            LOG.infof("Uploaded %s/%s (%d bytes, %dms)", bucket, objectKey, data.length, latencyMs);
            recordMetrics("upload", type, data.length, latencyMs, true);

        } catch (RuntimeException e) {
            recordMetrics("upload", type, 0, System.currentTimeMillis() - startTime, false);
            span.recordException(e);
            LOG.errorf(e, "Failed to upload %s: %s", objectKey, e.getMessage());
            throw new StorageException("Storage upload failed for " + objectKey + ": " + e.getMessage(), e);

        } finally {
            span.end();
        }
    }

    /**
     * Downloads an object's bytes together with its stored content type.
     *
     * @throws StorageException
     *             if the object is missing or the download fails
     */
    public StoredObject download(StoredObjectType type, String objectKey) {
        Span span = tracer.spanBuilder("storage.download").setAttribute("object_type", type.tag())
                .setAttribute("object_key", objectKey).startSpan();
        long startTime = System.currentTimeMillis();

        try (Scope scope = span.makeCurrent()) {
            GetObjectRequest getRequest = GetObjectRequest.builder().bucket(bucket).key(objectKey).build();
            ResponseBytes<GetObjectResponse> response = s3Client.getObjectAsBytes(getRequest);
            byte[] bytes = response.asByteArray();
            String contentType = response.response().contentType();

            long latencyMs = System.currentTimeMillis() - startTime;
            LOG.debugf("Downloaded %s/%s (%d bytes, %s, %dms)", bucket, objectKey, bytes.length, contentType,
                    latencyMs);
            recordMetrics("download", type, bytes.length, latencyMs, true);
            span.setAttribute("size_bytes", bytes.length);
            return new StoredObject(bytes, contentType);

        } catch (RuntimeException e) {
            recordMetrics("download", type, 0, System.currentTimeMillis() - startTime, false);
            span.recordException(e);
            LOG.errorf(e, "Failed to download %s: %s", objectKey, e.getMessage());
            throw new StorageException("Storage download failed for " + objectKey + ": " + e.getMessage(), e);

        } finally {
            span.end();
        }
    }

    /**
     * Pre-signed GET URL for temporary direct access, e.g. thumbnails embedded in reports.
     *
     * @throws StorageException
     *             if signing fails
     */
    public String signedUrl(StoredObjectType type, String objectKey, Duration ttl) {
        try {
            GetObjectRequest getRequest = GetObjectRequest.builder().bucket(bucket).key(objectKey).build();
            GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder().signatureDuration(ttl)
                    .getObjectRequest(getRequest).build();
            String url = s3Presigner.presignGetObject(presignRequest).url().toString();

            Counter.builder("storage.signed_urls.total").tag("type", type.tag()).tag("status", "success")
                    .register(meterRegistry).increment();
            return url;

        } catch (RuntimeException e) {
            Counter.builder("storage.signed_urls.total").tag("type", type.tag()).tag("status", "failure")
                    .register(meterRegistry).increment();
            LOG.errorf(e, "Failed to generate signed URL for %s", objectKey);
            throw new StorageException("Failed to generate signed URL for " + objectKey, e);
        }
    }

    private void recordMetrics(String operation, StoredObjectType type, long bytes, long latencyMs,
            boolean success) {
        String status = success ? "success" : "failure";

        Counter.builder("storage." + operation + "s.total").tag("type", type.tag()).tag("status", status)
                .register(meterRegistry).increment();
        if (success) {
            Counter.builder("storage.bytes." + operation + "ed").tag("type", type.tag()).register(meterRegistry)
                    .increment(bytes);
        }
        Timer.builder("storage." + operation + ".duration").tag("type", type.tag()).tag("status", status)
                .register(meterRegistry).record(Duration.ofMillis(latencyMs));
    }

    /**
     * Exception thrown when an object storage operation fails.
     */
    public static class StorageException extends RuntimeException {

        public StorageException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
