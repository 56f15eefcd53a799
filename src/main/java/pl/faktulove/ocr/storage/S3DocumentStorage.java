package pl.faktulove.ocr.storage;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.http.apache.ProxyConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.ByteArrayOutputStream;
import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;

@JBossLog
@ApplicationScoped
public class S3DocumentStorage implements DocumentStorage {

    @ConfigProperty(name = "bucket.documents")
    String bucketName;

    @ConfigProperty(name = "bucket.region", defaultValue = "eu-central-1")
    String regionName;

    @Inject
    Clock clock;

    private S3Client s3;

    @PostConstruct
    void init() {
        ProxyConfiguration.Builder proxyConfig = ProxyConfiguration.builder();
        ApacheHttpClient.Builder httpClientBuilder = ApacheHttpClient.builder()
                .proxyConfiguration(proxyConfig.build());

        this.s3 = S3Client.builder()
                .region(Region.of(regionName))
                .httpClientBuilder(httpClientBuilder)
                .build();
    }

    String buildKey() {
        LocalDate today = LocalDate.now(clock);
        return String.format("ocr-uploads/%d/%02d/%s", today.getYear(), today.getMonthValue(), UUID.randomUUID());
    }

    @Override
    public String save(byte[] content, String mimeType) {
        String key = buildKey();
        log.infof("Uploading document to S3: %s (%d bytes)", key, content.length);
        try {
            s3.putObject(
                    PutObjectRequest.builder()
                            .bucket(bucketName)
                            .key(key)
                            .contentType(mimeType)
                            .build(),
                    RequestBody.fromBytes(content));
        } catch (SdkException e) {
            log.errorf("Failed to upload document to S3: %s - %s", key, e.getMessage());
            throw new StorageException("Could not store document " + key, false, e);
        }
        return key;
    }

    @Override
    public byte[] load(String storageRef) {
        log.debugf("Downloading document from S3: %s", storageRef);
        try {
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            s3.getObject(
                    GetObjectRequest.builder()
                            .bucket(bucketName)
                            .key(storageRef)
                            .build(),
                    ResponseTransformer.toOutputStream(baos));
            byte[] bytes = baos.toByteArray();
            log.debugf("Document downloaded from S3: %s (%d bytes)", storageRef, bytes.length);
            return bytes;
        } catch (NoSuchKeyException e) {
            throw new StorageException("Document " + storageRef + " does not exist", true, e);
        } catch (S3Exception e) {
            log.errorf("Failed to download document from S3: %s - %s", storageRef,
                    e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage());
            throw new StorageException("Could not read document " + storageRef, false, e);
        } catch (SdkException e) {
            throw new StorageException("Could not read document " + storageRef, false, e);
        }
    }

    @Override
    public void delete(String storageRef) {
        log.infof("Deleting document from S3: %s", storageRef);
        try {
            s3.deleteObject(DeleteObjectRequest.builder().bucket(bucketName).key(storageRef).build());
        } catch (SdkException e) {
            throw new StorageException("Could not delete document " + storageRef, false, e);
        }
    }
}
