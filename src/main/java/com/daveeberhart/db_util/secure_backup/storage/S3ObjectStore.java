package com.daveeberhart.db_util.secure_backup.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazonaws.AmazonClientException;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.client.builder.AwsClientBuilder.EndpointConfiguration;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.amazonaws.services.s3.model.AmazonS3Exception;
import com.amazonaws.services.s3.model.GetObjectRequest;
import com.amazonaws.services.s3.model.ObjectListing;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.PutObjectRequest;
import com.amazonaws.services.s3.model.S3ObjectSummary;
import com.amazonaws.services.s3.transfer.TransferManager;
import com.amazonaws.services.s3.transfer.TransferManagerBuilder;
import com.amazonaws.services.s3.transfer.TransferManagerConfiguration;
import com.daveeberhart.db_util.secure_backup.config.BackupConfig;
import com.daveeberhart.db_util.secure_backup.error.BackupFailedException;
import com.daveeberhart.db_util.secure_backup.error.BackupFailedException.TransportException;
import com.daveeberhart.db_util.secure_backup.progress.TransferProgressListener;

/**
 * {@link RemoteObjectStore} on Amazon S3 or any S3-compatible service (MinIO).
 * <p>
 * The integrity tag is the S3 ETag.  Because TransferManager splits large files into parts, the
 * expected ETag is computed with the part size TransferManager will pick for the file (see
 * {@link MultipartEtag}).
 */
public class S3ObjectStore extends AbstractObjectStore {
  private static final Logger log = LoggerFactory.getLogger(S3ObjectStore.class);

  /** S3 allows at most this many parts per upload; TransferManager grows the part size to fit. */
  private static final int MAXIMUM_UPLOAD_PARTS = 10_000;
  /** 16MB */
  private static final long PART_SIZE = 16L * 1024 * 1024;

  private final AmazonS3 s3;
  private final TransferManager tm;
  private final String bucket;

  public S3ObjectStore(AmazonS3 p_s3, TransferManager p_tm, String p_bucket) {
    s3 = p_s3;
    tm = p_tm;
    bucket = p_bucket;
  }

  /**
   * Build an S3 client and transfer manager from the settings.  The caller owns the result and
   * must close it.
   */
  public static S3ObjectStore fromConfig(BackupConfig p_config) {
    String region = p_config.get(BackupConfig.AWS_REGION, "us-east-1");
    AmazonS3ClientBuilder builder = AmazonS3ClientBuilder.standard()
        .withCredentials(new AWSStaticCredentialsProvider(new BasicAWSCredentials(
            p_config.getRequired(BackupConfig.AWS_ACCESS_KEY),
            p_config.getRequired(BackupConfig.AWS_SECRET_KEY))));

    String endpoint = p_config.get(BackupConfig.S3_ENDPOINT);
    if (endpoint != null) {
      builder.withEndpointConfiguration(new EndpointConfiguration(endpoint, region))
          .withPathStyleAccessEnabled(true);
    } else {
      builder.withRegion(region);
    }
    AmazonS3 s3 = builder.build();

    TransferManager tm = TransferManagerBuilder.standard()
        .withS3Client(s3)
        .withMinimumUploadPartSize(PART_SIZE)
        .withMultipartUploadThreshold(PART_SIZE)
        .build();

    return new S3ObjectStore(s3, tm, p_config.getBucket());
  }

  public String getBucket() {
    return bucket;
  }

  @Override
  public void ensureBucket() {
    try {
      if (!s3.doesBucketExistV2(bucket)) {
        s3.createBucket(bucket);
        log.info("Created backup bucket: {}", bucket);
      }
    } catch (AmazonClientException e) {
      throw new TransportException("Could not check or create bucket " + bucket, e);
    }
  }

  @Override
  protected String localIntegrityTag(Path p_localPath) throws IOException {
    return MultipartEtag.compute(p_localPath, expectedPartSize(Files.size(p_localPath)));
  }

  /**
   * Mirror TransferManager's choice: single part up to the threshold, otherwise the larger of
   * the configured minimum and {@code size / 10000}.
   *
   * @return the part size, or 0 for a single-part upload
   */
  long expectedPartSize(long p_size) {
    TransferManagerConfiguration conf = tm.getConfiguration();
    if (conf == null) {
      conf = new TransferManagerConfiguration();
    }
    if (p_size <= conf.getMultipartUploadThreshold()) {
      return 0;
    }
    long optimal = (long) Math.ceil((double) p_size / MAXIMUM_UPLOAD_PARTS);
    return Math.max(optimal, conf.getMinimumUploadPartSize());
  }

  @Override
  protected void transfer(Path p_localPath, String p_key) {
    try {
      PutObjectRequest req = new PutObjectRequest(bucket, p_key, p_localPath.toFile());
      TransferProgressListener progress = new TransferProgressListener(p_key, "Upload", Files.size(p_localPath));
      tm.upload(req, progress).waitForUploadResult();
      progress.done();
    } catch (IOException e) {
      throw new BackupFailedException("Could not read " + p_localPath, e);
    } catch (AmazonClientException e) {
      throw new TransportException("Upload of " + p_key + " failed", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BackupFailedException("Thread interrupted while waiting for upload", e);
    }
  }

  @Override
  public void download(String p_key, Path p_localPath) {
    try {
      long length = getMetadata(p_key).map(BackupArtifact::getSize).orElse(0L);
      TransferProgressListener progress = new TransferProgressListener(p_key, "Download", length);
      tm.download(new GetObjectRequest(bucket, p_key), p_localPath.toFile(), progress).waitForCompletion();
      progress.done();
      log.info("Downloaded backup: {}", p_key);
    } catch (AmazonClientException e) {
      throw new TransportException("Download of " + p_key + " failed", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BackupFailedException("Thread interrupted while waiting for download", e);
    }
  }

  @Override
  public List<BackupArtifact> list() {
    List<BackupArtifact> artifacts = new ArrayList<>();
    try {
      ObjectListing listing = s3.listObjects(bucket);
      listing.getObjectSummaries().stream().map(this::toArtifact).forEach(artifacts::add);
      while (listing.isTruncated()) {
        listing = s3.listNextBatchOfObjects(listing);
        listing.getObjectSummaries().stream().map(this::toArtifact).forEach(artifacts::add);
      }
    } catch (AmazonClientException e) {
      throw new TransportException("Listing bucket " + bucket + " failed", e);
    }
    artifacts.sort(Comparator.comparing(BackupArtifact::getCreatedAt).reversed());
    return artifacts;
  }

  private BackupArtifact toArtifact(S3ObjectSummary p_summary) {
    return new BackupArtifact(p_summary.getKey(), p_summary.getSize(),
        p_summary.getLastModified().toInstant(), normalizeEtag(p_summary.getETag()));
  }

  @Override
  public void delete(String p_key) {
    try {
      s3.deleteObject(bucket, p_key);
      log.info("Deleted backup: {}", p_key);
    } catch (AmazonS3Exception e) {
      if (e.getStatusCode() != 404) {
        throw new TransportException("Delete of " + p_key + " failed", e);
      }
    } catch (AmazonClientException e) {
      throw new TransportException("Delete of " + p_key + " failed", e);
    }
  }

  @Override
  public Optional<BackupArtifact> getMetadata(String p_key) {
    try {
      ObjectMetadata mdata = s3.getObjectMetadata(bucket, p_key);
      Instant created = mdata.getLastModified() == null ? Instant.EPOCH : mdata.getLastModified().toInstant();
      return Optional.of(new BackupArtifact(p_key, mdata.getContentLength(), created, normalizeEtag(mdata.getETag())));
    } catch (AmazonS3Exception e) {
      if (e.getStatusCode() == 404) {
        return Optional.empty();
      }
      throw new TransportException("Metadata lookup of " + p_key + " failed", e);
    } catch (AmazonClientException e) {
      throw new TransportException("Metadata lookup of " + p_key + " failed", e);
    }
  }

  @Override
  public boolean isReachable() {
    try {
      s3.doesBucketExistV2(bucket);
      return true;
    } catch (RuntimeException e) {
      log.warn("Object store is not reachable: {}", e.toString());
      return false;
    }
  }

  private static String normalizeEtag(String p_etag) {
    return p_etag == null ? null : p_etag.replace("\"", "").toLowerCase();
  }

  @Override
  public void close() {
    // Also shuts down the S3 client.
    tm.shutdownNow(true);
  }

}
